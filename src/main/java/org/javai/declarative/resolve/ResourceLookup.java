package org.javai.declarative.resolve;

/**
 * Runtime lookup of a resource identifier by name.
 */
@FunctionalInterface
public interface ResourceLookup {

	/**
	 * @return the identifier, or {@code null} when no resource of that type has this name
	 */
	String findIdByName(String resourceType, String name);
}
