/**
 * Generic per-resource executors and the contract resource adapters implement.
 */
package org.javai.declarative.exec.resource;
