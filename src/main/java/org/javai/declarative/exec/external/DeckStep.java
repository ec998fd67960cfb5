package org.javai.declarative.exec.external;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.javai.declarative.adapter.ControlPlaneAdapter;
import org.javai.declarative.exec.ChangeValidationException;
import org.javai.declarative.exec.ExecutorOptions;
import org.javai.declarative.exec.ExternalToolException;
import org.javai.declarative.exec.ResourceApiException;
import org.javai.declarative.plan.Fields;
import org.javai.declarative.plan.Identifiers;
import org.javai.declarative.plan.Plan;
import org.javai.declarative.plan.PlanMode;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.resolve.ReferenceResolver;
import org.javai.declarative.state.ControlPlane;
import org.javai.declarative.state.GatewayService;
import org.javai.declarative.state.StateClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the external configuration-sync tool for one control plane, then resolves the
 * gateway service it produced so later API implementation changes can use its id.
 *
 * <p>Recognised fields:</p>
 * <ul>
 *   <li>{@code selector_name} or {@code selector.matchFields.name}: name of the gateway service</li>
 *   <li>{@code gateway_service_ref}: ref later changes use for the service (defaults to the change's ref)</li>
 *   <li>{@code control_plane_id}, {@code control_plane_ref}, {@code control_plane_name}</li>
 *   <li>{@code files}: configuration files, required</li>
 *   <li>{@code flags}: extra tool flags</li>
 *   <li>{@code deck_base_dir}: working directory, relative to the plan base directory</li>
 * </ul>
 */
public class DeckStep {

	private static final Logger logger = LoggerFactory.getLogger(DeckStep.class);

	public static final String RESOURCE_TYPE = "_deck";
	public static final String GATEWAY_SERVICE_TYPE = "gateway_service";

	static final String JSON_OUTPUT_FLAG = "--json-output";
	static final String NO_COLOR_FLAG = "--no-color";

	private final ExternalToolRunner runner;
	private final StateClient client;
	private final ExecutorOptions options;

	/**
	 * @param runner the tool runner, or {@code null} when none is configured
	 * @param client the API client, or {@code null}
	 */
	public DeckStep(ExternalToolRunner runner, StateClient client, ExecutorOptions options) {
		this.runner = runner;
		this.client = client;
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Validate and, unless {@code dryRun}, run the step.
	 *
	 * @return the resolved gateway service id, or {@code null} when no later change needs it
	 */
	public String execute(PlannedChange change, Plan plan, ReferenceResolver resolver, boolean dryRun) {
		Map<String, Object> fields = change.fields();
		String gatewayRef = StringUtils.defaultIfBlank(trimmed(fields, "gateway_service_ref"), change.resourceRef());

		String selectorName = selectorName(fields);
		if (selectorName == null) {
			throw new ChangeValidationException(
					"deck step %s: selector.matchFields.name is required".formatted(gatewayRef));
		}

		String controlPlaneRef = trimmed(fields, "control_plane_ref");
		String controlPlaneId = resolveControlPlaneId(trimmed(fields, "control_plane_id"), controlPlaneRef, resolver);
		String controlPlaneName = trimmed(fields, "control_plane_name");
		if (controlPlaneName == null) {
			controlPlaneName = resolveControlPlaneName(controlPlaneId, controlPlaneRef, plan);
		}

		String mode = resolveMode(plan).value();
		List<String> files = parseFiles(fields.get("files"), gatewayRef);
		List<String> flags = withOutputFlags(parseFlags(fields.get("flags"), gatewayRef));
		Path workDir = resolveWorkDir(trimmed(fields, "deck_base_dir"));

		List<String> args = new ArrayList<>();
		args.add(ProcessExternalToolRunner.GATEWAY_COMMAND);
		args.add(mode);
		args.addAll(flags);
		args.addAll(files);

		if (dryRun) {
			logger.debug("Dry-run: would run {} {} for gateway service {}", options.deckExecutable(), args,
					gatewayRef);
			return null;
		}
		if (runner == null) {
			throw new ExternalToolException("deck runner not configured");
		}

		logger.debug("Executing deck gateway for {} with {} file(s)", gatewayRef, files.size());
		RunResult result;
		try {
			result = runner.run(new RunOptions(args, mode, options.konnectToken(), controlPlaneName,
					options.konnectAddress(), workDir));
		} catch (ExternalToolException e) {
			throw new ExternalToolException(
					"deck gateway for gateway_service %s failed: %s".formatted(gatewayRef, e.getMessage()), e);
		}
		if (!result.stderr().isBlank()) {
			logger.debug("deck stderr for {}: {}", gatewayRef, result.stderr().strip());
		}
		DeckSummary.parse(result.stdout()).ifPresent(summary -> logger.info(
				"deck gateway {} for {}: {} created, {} updated, {} deleted",
				mode, gatewayRef, summary.created(), summary.updated(), summary.deleted()));

		if (!GatewayServicePatcher.isNeeded(plan, change.id(), gatewayRef)) {
			logger.debug("Skipping gateway service resolution for {}; no dependent changes", gatewayRef);
			return null;
		}

		String serviceId = resolveGatewayServiceByName(controlPlaneId, selectorName);
		resolver.table().record(GATEWAY_SERVICE_TYPE, gatewayRef, serviceId);
		int patched = GatewayServicePatcher.patch(plan, change.id(), gatewayRef, serviceId, controlPlaneId);
		logger.debug("Resolved gateway service {} to {} in control plane {}; patched {} change(s)",
				gatewayRef, serviceId, controlPlaneId, patched);
		return serviceId;
	}

	private String resolveControlPlaneId(String controlPlaneId, String controlPlaneRef, ReferenceResolver resolver) {
		if (controlPlaneId != null) {
			return controlPlaneId;
		}
		if (controlPlaneRef == null) {
			throw new ChangeValidationException("deck step requires control_plane_ref or control_plane_id");
		}
		return resolver.resolveRef(ControlPlaneAdapter.TYPE, controlPlaneRef);
	}

	private String resolveControlPlaneName(String controlPlaneId, String controlPlaneRef, Plan plan) {
		if (controlPlaneRef != null) {
			for (PlannedChange candidate : plan.changes()) {
				if (ControlPlaneAdapter.TYPE.equals(candidate.resourceType())
						&& controlPlaneRef.equals(candidate.resourceRef())
						&& !Identifiers.UNKNOWN.equals(candidate.resourceName())) {
					return candidate.resourceName();
				}
			}
		}
		if (client == null) {
			throw new ResourceApiException("state client is required to resolve control plane name");
		}
		ControlPlane controlPlane;
		try {
			controlPlane = client.getControlPlaneById(controlPlaneId);
		} catch (RuntimeException e) {
			throw new ResourceApiException("failed to resolve control plane name: " + e.getMessage(), e);
		}
		if (controlPlane == null || StringUtils.isBlank(controlPlane.name())) {
			throw new ResourceApiException("control plane %s not found for deck execution".formatted(controlPlaneId));
		}
		return controlPlane.name();
	}

	private PlanMode resolveMode(Plan plan) {
		return options.modeOverride() != null ? options.modeOverride() : plan.mode();
	}

	private Path resolveWorkDir(String baseDir) {
		if (baseDir == null) {
			return null;
		}
		Path path = Path.of(baseDir);
		if (path.isAbsolute()) {
			return path.normalize();
		}
		return options.planBaseDir().resolve(path).toAbsolutePath().normalize();
	}

	String resolveGatewayServiceByName(String controlPlaneId, String selectorName) {
		if (client == null) {
			throw new ResourceApiException("state client is required to resolve gateway services");
		}
		List<GatewayService> services;
		try {
			services = client.listGatewayServices(controlPlaneId);
		} catch (RuntimeException e) {
			throw new ResourceApiException("failed to list gateway services: " + e.getMessage(), e);
		}
		String match = null;
		for (GatewayService service : services) {
			if (!selectorName.equals(service.name())) {
				continue;
			}
			if (match != null) {
				throw new ExternalToolException(
						"gateway_service selector matched multiple services for name '%s'".formatted(selectorName));
			}
			match = service.id();
		}
		if (match == null) {
			throw new ExternalToolException("gateway_service not found with name '%s' in control plane %s".formatted(
					selectorName, controlPlaneId));
		}
		return match;
	}

	static String selectorName(Map<String, Object> fields) {
		String name = trimmed(fields, "selector_name");
		if (name != null) {
			return name;
		}
		Map<String, Object> selector = Fields.map(fields, "selector");
		if (selector == null) {
			return null;
		}
		Map<String, Object> matchFields = Fields.map(selector, "matchFields");
		if (matchFields == null) {
			matchFields = Fields.map(selector, "match_fields");
		}
		return trimmed(matchFields, "name");
	}

	static List<String> parseFiles(Object raw, String gatewayRef) {
		List<String> files = stringList(raw, "files", gatewayRef);
		if (files.isEmpty()) {
			throw new ChangeValidationException("deck step %s: files are required".formatted(gatewayRef));
		}
		for (int i = 0; i < files.size(); i++) {
			if (files.get(i).isEmpty()) {
				throw new ChangeValidationException("deck step %s: files[%d] cannot be empty".formatted(gatewayRef, i));
			}
			if (files.get(i).startsWith("-")) {
				throw new ChangeValidationException(
						"deck step %s: files[%d] must be a file path, not a flag".formatted(gatewayRef, i));
			}
		}
		return files;
	}

	static List<String> parseFlags(Object raw, String gatewayRef) {
		List<String> flags = stringList(raw, "flags", gatewayRef);
		for (int i = 0; i < flags.size(); i++) {
			if (flags.get(i).isEmpty()) {
				throw new ChangeValidationException("deck step %s: flags[%d] cannot be empty".formatted(gatewayRef, i));
			}
			if (!flags.get(i).startsWith("-")) {
				throw new ChangeValidationException(
						"deck step %s: flags[%d] must be a flag".formatted(gatewayRef, i));
			}
		}
		return flags;
	}

	static List<String> withOutputFlags(List<String> flags) {
		List<String> result = new ArrayList<>(flags);
		if (!ProcessExternalToolRunner.containsFlag(result, JSON_OUTPUT_FLAG)) {
			result.add(JSON_OUTPUT_FLAG);
		}
		if (!ProcessExternalToolRunner.containsFlag(result, NO_COLOR_FLAG)) {
			result.add(NO_COLOR_FLAG);
		}
		return result;
	}

	private static List<String> stringList(Object raw, String key, String gatewayRef) {
		if (raw == null) {
			return List.of();
		}
		if (!(raw instanceof List<?> items)) {
			throw new ChangeValidationException(
					"deck step %s: %s must be an array of strings".formatted(gatewayRef, key));
		}
		List<String> values = new ArrayList<>(items.size());
		for (Object item : items) {
			if (!(item instanceof String text)) {
				throw new ChangeValidationException(
						"deck step %s: %s must be an array of strings".formatted(gatewayRef, key));
			}
			values.add(text.strip());
		}
		return values;
	}

	private static String trimmed(Map<String, ?> fields, String key) {
		String value = Fields.string(fields, key);
		return StringUtils.isBlank(value) ? null : value.strip();
	}
}
