/**
 * The plan handed to the executor: planned changes, references between them,
 * and the order in which they apply.
 */
package org.javai.declarative.plan;
