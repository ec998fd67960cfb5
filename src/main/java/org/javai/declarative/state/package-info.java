/**
 * Contract of the remote resource-management API, as seen by the executor.
 */
package org.javai.declarative.state;
