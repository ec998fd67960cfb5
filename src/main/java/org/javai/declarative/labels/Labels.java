package org.javai.declarative.labels;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.javai.declarative.plan.Protection;

/**
 * Bookkeeping labels written on every managed resource, and the rules for combining
 * them with user labels.
 * <p>
 * All keys starting with {@link #PREFIX} are reserved. User input never sets them;
 * they are recomputed on every create and update.
 */
public final class Labels {

	public static final String PREFIX = "KONGCTL-";
	public static final String NAMESPACE_KEY = PREFIX + "namespace";
	public static final String PROTECTED_KEY = PREFIX + "protected";
	public static final String MANAGED_KEY = PREFIX + "managed";

	public static final String DEFAULT_NAMESPACE = "default";
	public static final String TRUE = "true";
	public static final String FALSE = "false";

	static final int MAX_KEY_LENGTH = 63;
	private static final List<String> FORBIDDEN_KEY_PREFIXES = List.of("kong", "konnect", "mesh", "kic", "_");

	private Labels() {
	}

	/**
	 * Labels for a new resource: the user's labels minus any reserved key, plus
	 * namespace, protection and managed markers.
	 */
	public static Map<String, String> buildCreateLabels(Map<String, String> userLabels, String namespace,
			Protection protection) {
		Map<String, String> result = userLabels(userLabels);
		result.put(NAMESPACE_KEY, namespaceOrDefault(namespace));
		result.put(PROTECTED_KEY, protection != null && protection.desired() ? TRUE : FALSE);
		result.put(MANAGED_KEY, TRUE);
		return result;
	}

	/**
	 * Labels for an existing resource.
	 * <p>
	 * The user portion of the result is exactly the user portion of {@code desired}: keys
	 * found only in {@code current} are dropped. Bookkeeping keys are always written;
	 * when {@code protection} is {@code null} the current protection state is kept, and
	 * when {@code namespace} is blank the current namespace is kept.
	 *
	 * @param desired the labels from configuration, or {@code null} for none
	 * @param current the labels on the live resource, or {@code null}
	 */
	public static Map<String, String> buildUpdateLabels(Map<String, String> desired, Map<String, String> current,
			String namespace, Protection protection) {
		Map<String, String> result = userLabels(desired);

		String effectiveNamespace = namespace;
		if (StringUtils.isBlank(effectiveNamespace) && current != null) {
			effectiveNamespace = current.get(NAMESPACE_KEY);
		}
		result.put(NAMESPACE_KEY, namespaceOrDefault(effectiveNamespace));

		boolean isProtected = protection != null ? protection.desired() : isProtected(current);
		result.put(PROTECTED_KEY, isProtected ? TRUE : FALSE);
		result.put(MANAGED_KEY, TRUE);
		return result;
	}

	/**
	 * User label keys present on the live resource but absent from the desired labels.
	 * For APIs that need removals spelled out instead of a full replacement.
	 */
	public static List<String> removedLabelKeys(Map<String, String> desired, Map<String, String> current) {
		List<String> removed = new ArrayList<>();
		Map<String, String> wanted = userLabels(desired);
		for (String key : userLabels(current).keySet()) {
			if (!wanted.containsKey(key)) {
				removed.add(key);
			}
		}
		return removed;
	}

	/**
	 * Whether the tool owns the resource: the managed marker is set, or it carries a namespace.
	 */
	public static boolean isManaged(Map<String, String> labels) {
		if (labels == null) {
			return false;
		}
		return TRUE.equals(labels.get(MANAGED_KEY)) || StringUtils.isNotBlank(labels.get(NAMESPACE_KEY));
	}

	public static boolean isProtected(Map<String, String> labels) {
		return labels != null && TRUE.equals(labels.get(PROTECTED_KEY));
	}

	public static boolean isReservedKey(String key) {
		return key != null && key.startsWith(PREFIX);
	}

	/**
	 * Copy of the labels without reserved keys or null values. Never null.
	 */
	public static Map<String, String> userLabels(Map<String, String> labels) {
		Map<String, String> result = new LinkedHashMap<>();
		if (labels == null) {
			return result;
		}
		labels.forEach((key, value) -> {
			if (key != null && value != null && !isReservedKey(key)) {
				result.put(key, value);
			}
		});
		return result;
	}

	/**
	 * Copy of the labels without null values. Never null.
	 */
	public static Map<String, String> normalize(Map<String, String> labels) {
		Map<String, String> result = new LinkedHashMap<>();
		if (labels != null) {
			labels.forEach((key, value) -> {
				if (key != null && value != null) {
					result.put(key, value);
				}
			});
		}
		return result;
	}

	/**
	 * Read labels from a JSON-decoded field value.
	 *
	 * @return the labels, or {@code null} when the value is absent
	 * @throws IllegalArgumentException when the value is not a map
	 */
	public static Map<String, String> extractLabels(Object raw) {
		if (raw == null) {
			return null;
		}
		if (!(raw instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("labels must be a map, got " + raw.getClass().getSimpleName());
		}
		Map<String, String> result = new LinkedHashMap<>();
		map.forEach((key, value) -> {
			if (key != null && value != null) {
				result.put(String.valueOf(key), String.valueOf(value));
			}
		});
		return result;
	}

	/**
	 * Check a user label key.
	 *
	 * @throws IllegalArgumentException when the key is empty, too long or uses a reserved prefix
	 */
	public static void validateKey(String key) {
		if (StringUtils.isEmpty(key)) {
			throw new IllegalArgumentException("label key must not be empty");
		}
		if (key.length() > MAX_KEY_LENGTH) {
			throw new IllegalArgumentException(
					"label key '%s' exceeds %d characters".formatted(key, MAX_KEY_LENGTH));
		}
		if (isReservedKey(key)) {
			throw new IllegalArgumentException("label key '%s' uses the reserved prefix %s".formatted(key, PREFIX));
		}
		String lower = key.toLowerCase(Locale.ROOT);
		for (String prefix : FORBIDDEN_KEY_PREFIXES) {
			if (lower.startsWith(prefix)) {
				throw new IllegalArgumentException(
						"label key '%s' must not start with '%s'".formatted(key, prefix));
			}
		}
	}

	private static String namespaceOrDefault(String namespace) {
		return StringUtils.isBlank(namespace) ? DEFAULT_NAMESPACE : namespace;
	}
}
