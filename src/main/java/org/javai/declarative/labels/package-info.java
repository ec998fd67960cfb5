/**
 * Bookkeeping labels and the protection rules derived from them.
 */
package org.javai.declarative.labels;
