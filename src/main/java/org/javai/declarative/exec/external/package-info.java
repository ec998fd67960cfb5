/**
 * The external-tool change kind: running the configuration-sync tool mid-plan and
 * feeding the identifiers it produces back into later changes.
 */
package org.javai.declarative.exec.external;
