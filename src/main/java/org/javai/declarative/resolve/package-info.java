/**
 * Runtime resolution of the identifiers that changes refer to.
 */
package org.javai.declarative.resolve;
