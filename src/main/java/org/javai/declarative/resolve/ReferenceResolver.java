package org.javai.declarative.resolve;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.declarative.exec.ChangeExecutionException;
import org.javai.declarative.exec.ReferenceResolutionException;
import org.javai.declarative.plan.Identifiers;
import org.javai.declarative.plan.ParentInfo;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.plan.RefPlaceholder;
import org.javai.declarative.plan.ReferenceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the identifiers a change depends on.
 * <p>
 * Sources are tried in order:
 * <ol>
 *   <li>the change's reference entry when it carries a concrete id, or the id recorded
 *       for that ref by an earlier change of this run</li>
 *   <li>the change's parent pointer</li>
 *   <li>a literal field value that already is an identifier</li>
 *   <li>a lookup by name against the remote API</li>
 * </ol>
 * Successful lookups are recorded so later changes do not repeat them. A reference that
 * cannot be resolved fails the change with a {@link ReferenceResolutionException}.
 */
public class ReferenceResolver {

	private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

	private static final String ID_SUFFIX = "_id";

	private final ResolvedReferences table;
	private final ResourceLookup lookup;

	public ReferenceResolver(ResolvedReferences table, ResourceLookup lookup) {
		this.table = Objects.requireNonNull(table, "table must not be null");
		this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
	}

	public ResolvedReferences table() {
		return table;
	}

	/**
	 * Resolve every reference of the change plus the declared reference fields present
	 * in its fields.
	 *
	 * @param referenceFields field key to referenced resource type
	 * @return resolved identifiers keyed by reference key
	 */
	public Map<String, String> resolveAll(PlannedChange change, Map<String, String> referenceFields) {
		Map<String, String> resolved = new LinkedHashMap<>();
		for (String key : change.references().keySet()) {
			String type = referenceFields.getOrDefault(key, typeForKey(key));
			resolved.put(key, resolve(change, key, type));
		}
		for (Map.Entry<String, String> entry : referenceFields.entrySet()) {
			String key = entry.getKey();
			if (!resolved.containsKey(key) && change.fields().get(key) instanceof String value && !value.isBlank()) {
				resolved.put(key, resolve(change, key, entry.getValue()));
			}
		}
		return resolved;
	}

	/**
	 * Resolve one reference of a change.
	 *
	 * @throws ReferenceResolutionException when no source yields an identifier
	 */
	public String resolve(PlannedChange change, String refKey, String resourceType) {
		String id = find(change, refKey, resourceType);
		if (id == null) {
			throw unresolved(change, refKey, resourceType);
		}
		return id;
	}

	/**
	 * Resolve the parent of a child change: the parent's id, the id recorded for its ref in
	 * this run, a literal {@code <parentType>_id} field, or a lookup of the ref by name.
	 *
	 * @return the parent id, or {@code null} when the change has no parent and no parent id field
	 */
	public String resolveParent(PlannedChange change, String parentType) {
		if (!declaresParent(change, parentType)) {
			return null;
		}
		String id = findParent(change, parentType);
		if (id != null) {
			return id;
		}
		ParentInfo parent = change.parent();
		if (parent == null) {
			throw unresolved(change, parentType + ID_SUFFIX, parentType);
		}
		throw new ReferenceResolutionException("failed to resolve parent %s '%s' for %s '%s'".formatted(
				parentType, parent.ref(), change.resourceType(), change.displayName()));
	}

	/**
	 * Like {@link #resolveParent}, but a declared parent that cannot be found yields {@code null}.
	 *
	 * @throws ReferenceResolutionException when the change declares no parent at all
	 */
	public String findParent(PlannedChange change, String parentType) {
		String key = parentType + ID_SUFFIX;
		if (!declaresParent(change, parentType)) {
			throw new ReferenceResolutionException("no parent %s declared for %s '%s'".formatted(
					parentType, change.resourceType(), change.displayName()));
		}
		ParentInfo parent = change.parent();
		if (parent == null) {
			return find(change, key, parentType);
		}
		String id = parentFromPlan(parent, parentType);
		if (id != null) {
			return id;
		}
		String literal = literal(change, key);
		if (Identifiers.isUuid(literal)) {
			return literal;
		}
		if (parent.ref() != null && !parent.ref().isBlank()) {
			return lookupByName(parentType, parent.ref());
		}
		return null;
	}

	/**
	 * Resolve a ref of the given type that is not attached to a change: the id recorded in
	 * this run, else a lookup by name.
	 *
	 * @throws ReferenceResolutionException when the ref cannot be resolved
	 */
	public String resolveRef(String resourceType, String ref) {
		if (Identifiers.isUuid(ref)) {
			return ref;
		}
		String id = lookupByName(resourceType, ref);
		if (id == null) {
			throw new ReferenceResolutionException("failed to resolve %s reference '%s'".formatted(resourceType, ref));
		}
		return id;
	}

	private String find(PlannedChange change, String refKey, String resourceType) {
		ReferenceInfo reference = change.references().get(refKey);

		if (reference != null) {
			if (reference.hasResolvedId()) {
				return reference.id();
			}
			String known = table.find(resourceType, reference.ref());
			if (known != null) {
				return known;
			}
		}

		ParentInfo parent = change.parent();
		if (reference == null && parent != null && refKey.equals(resourceType + ID_SUFFIX)) {
			String parentId = parentFromPlan(parent, resourceType);
			if (parentId != null) {
				return parentId;
			}
		}

		String literal = literal(change, refKey);
		if (Identifiers.isUuid(literal)) {
			return literal;
		}
		Optional<RefPlaceholder> placeholder = RefPlaceholder.parse(literal);
		if (placeholder.isPresent()) {
			String known = table.find(resourceType, placeholder.get().ref());
			if (known != null) {
				return known;
			}
		}

		String name = lookupName(reference, literal);
		return name != null ? lookupByName(resourceType, name) : null;
	}

	private static ReferenceResolutionException unresolved(PlannedChange change, String refKey, String resourceType) {
		String name = lookupName(change.references().get(refKey), literal(change, refKey));
		return new ReferenceResolutionException("failed to resolve %s reference '%s' for %s '%s'".formatted(
				resourceType, name != null ? name : refKey, change.resourceType(), change.displayName()));
	}

	private static boolean declaresParent(PlannedChange change, String parentType) {
		String key = parentType + ID_SUFFIX;
		return change.parent() != null || change.references().containsKey(key)
				|| change.fields().get(key) instanceof String;
	}

	private static String literal(PlannedChange change, String key) {
		return change.fields().get(key) instanceof String value ? value : null;
	}

	private String parentFromPlan(ParentInfo parent, String parentType) {
		if (parent.hasResolvedId()) {
			return parent.id();
		}
		return table.find(parentType, parent.ref());
	}

	private static String lookupName(ReferenceInfo reference, String literal) {
		if (reference != null) {
			return reference.lookupName();
		}
		if (literal == null || literal.isBlank() || Identifiers.UNKNOWN.equals(literal)) {
			return null;
		}
		return RefPlaceholder.parse(literal).map(RefPlaceholder::ref).orElse(literal);
	}

	private String lookupByName(String resourceType, String name) {
		String cached = table.find(resourceType, name);
		if (cached != null) {
			return cached;
		}
		String id;
		try {
			id = lookup.findIdByName(resourceType, name);
		} catch (ChangeExecutionException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new ReferenceResolutionException(
					"lookup of %s '%s' failed: %s".formatted(resourceType, name, e.getMessage()), e);
		}
		if (id != null && !id.isBlank()) {
			logger.debug("Resolved {} '{}' to {} by name", resourceType, name, id);
			table.record(resourceType, name, id);
			return id;
		}
		return null;
	}

	private static String typeForKey(String key) {
		return key.endsWith(ID_SUFFIX) ? key.substring(0, key.length() - ID_SUFFIX.length()) : key;
	}
}
