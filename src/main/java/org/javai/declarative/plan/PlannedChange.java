package org.javai.declarative.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One planned create, update, delete or external-tool operation against a single resource.
 * <p>
 * A change is read-only once built, with one exception: {@link #patchField(String, Object)}
 * is used by the external-tool step to fill in an identifier that only becomes known
 * after the tool has run.
 */
public final class PlannedChange {

	private final String id;
	private final ActionType action;
	private final String resourceType;
	private final String resourceRef;
	private final String resourceId;
	private final Map<String, Object> fields;
	private final Map<String, ReferenceInfo> references;
	private final ParentInfo parent;
	private final String namespace;
	private final Protection protection;
	private final String configHash;
	private final List<String> dependsOn;

	private PlannedChange(Builder builder) {
		this.id = Objects.requireNonNull(builder.id, "id must not be null");
		this.action = Objects.requireNonNull(builder.action, "action must not be null");
		this.resourceType = Objects.requireNonNull(builder.resourceType, "resourceType must not be null");
		this.resourceRef = builder.resourceRef;
		this.resourceId = builder.resourceId;
		this.fields = new LinkedHashMap<>(builder.fields);
		this.references = Collections.unmodifiableMap(new LinkedHashMap<>(builder.references));
		this.parent = builder.parent;
		this.namespace = builder.namespace;
		this.protection = builder.protection;
		this.configHash = builder.configHash;
		this.dependsOn = List.copyOf(builder.dependsOn);
	}

	public static Builder builder(String id, ActionType action, String resourceType) {
		return new Builder(id, action, resourceType);
	}

	public String id() {
		return id;
	}

	public ActionType action() {
		return action;
	}

	public String resourceType() {
		return resourceType;
	}

	public String resourceRef() {
		return resourceRef;
	}

	public String resourceId() {
		return resourceId;
	}

	/**
	 * Read-only view of the change's fields.
	 */
	public Map<String, Object> fields() {
		return Collections.unmodifiableMap(fields);
	}

	public Map<String, ReferenceInfo> references() {
		return references;
	}

	public ParentInfo parent() {
		return parent;
	}

	public String namespace() {
		return namespace;
	}

	public Protection protection() {
		return protection;
	}

	public String configHash() {
		return configHash;
	}

	public List<String> dependsOn() {
		return dependsOn;
	}

	public boolean hasResourceId() {
		return resourceId != null && !resourceId.isBlank();
	}

	/**
	 * The {@code name} field, or {@link Identifiers#UNKNOWN}.
	 */
	public String resourceName() {
		return Fields.resourceName(fields);
	}

	/**
	 * Name used to find the live resource: the {@code name} field, falling back to the ref.
	 */
	public String lookupName() {
		String name = resourceName();
		if (!Identifiers.UNKNOWN.equals(name)) {
			return name;
		}
		return resourceRef != null && !resourceRef.isBlank() ? resourceRef : name;
	}

	/**
	 * Human-friendly label for progress output: the ref, then the name, then {@code type/id}.
	 */
	public String displayName() {
		if (resourceRef != null && !resourceRef.isBlank() && !Identifiers.UNKNOWN.equals(resourceRef)) {
			return resourceRef;
		}
		String name = resourceName();
		if (!Identifiers.UNKNOWN.equals(name)) {
			return name;
		}
		return resourceType + "/" + id;
	}

	/**
	 * Replace a single top-level field. Reserved for the post-external-tool identifier
	 * patch-back; nothing else may modify a change during execution.
	 */
	public void patchField(String key, Object value) {
		fields.put(Objects.requireNonNull(key, "key must not be null"), value);
	}

	@Override
	public String toString() {
		return "PlannedChange[" + id + " " + action + " " + resourceType + " " + displayName() + "]";
	}

	public static final class Builder {

		private final String id;
		private final ActionType action;
		private final String resourceType;
		private String resourceRef;
		private String resourceId;
		private final Map<String, Object> fields = new LinkedHashMap<>();
		private final Map<String, ReferenceInfo> references = new LinkedHashMap<>();
		private ParentInfo parent;
		private String namespace;
		private Protection protection;
		private String configHash;
		private List<String> dependsOn = List.of();

		private Builder(String id, ActionType action, String resourceType) {
			this.id = id;
			this.action = action;
			this.resourceType = resourceType;
		}

		public Builder resourceRef(String resourceRef) {
			this.resourceRef = resourceRef;
			return this;
		}

		public Builder resourceId(String resourceId) {
			this.resourceId = resourceId;
			return this;
		}

		public Builder field(String key, Object value) {
			this.fields.put(key, value);
			return this;
		}

		public Builder fields(Map<String, ?> fields) {
			if (fields != null) {
				this.fields.putAll(fields);
			}
			return this;
		}

		public Builder reference(String key, ReferenceInfo reference) {
			this.references.put(key, reference);
			return this;
		}

		public Builder parent(ParentInfo parent) {
			this.parent = parent;
			return this;
		}

		public Builder namespace(String namespace) {
			this.namespace = namespace;
			return this;
		}

		public Builder protection(Protection protection) {
			this.protection = protection;
			return this;
		}

		public Builder configHash(String configHash) {
			this.configHash = configHash;
			return this;
		}

		public Builder dependsOn(List<String> dependsOn) {
			this.dependsOn = dependsOn != null ? dependsOn : List.of();
			return this;
		}

		public PlannedChange build() {
			return new PlannedChange(this);
		}
	}
}
