/**
 * The plan executor: sequential application of planned changes with
 * continue-on-error semantics, dry-run validation and progress reporting.
 */
package org.javai.declarative.exec;
