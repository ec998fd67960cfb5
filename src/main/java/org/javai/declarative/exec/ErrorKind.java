package org.javai.declarative.exec;

/**
 * Category of a change-level failure.
 * VALIDATION      - the change itself is malformed; no network call was made.
 * PROTECTION      - a protected resource refused the operation.
 * NOT_IMPLEMENTED - no executor handles this resource type and action.
 * API             - the remote API rejected or failed the call.
 * REFERENCE       - a referenced identifier could not be resolved.
 * EXTERNAL_TOOL   - the external subprocess step failed.
 * UNEXPECTED      - anything else.
 */
public enum ErrorKind {
	VALIDATION,
	PROTECTION,
	NOT_IMPLEMENTED,
	API,
	REFERENCE,
	EXTERNAL_TOOL,
	UNEXPECTED
}
