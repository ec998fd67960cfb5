package org.javai.declarative.exec;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.javai.declarative.plan.PlanMode;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link ExecutorOptions} from YAML.
 *
 * <pre>
 * dry_run: false
 * mode: sync
 * plan_base_dir: ./config
 * konnect_address: https://eu.api.konghq.com
 * konnect_token_env: KONNECT_TOKEN
 * deck_executable: /usr/local/bin/deck
 * </pre>
 *
 * The token itself is never read from the file, only the name of the environment
 * variable holding it.
 */
public class ExecutorOptionsParser {

	public static final String DEFAULT_TOKEN_ENV = "KONNECT_TOKEN";

	private final Yaml yaml = new Yaml();
	private final UnaryOperator<String> environment;

	public ExecutorOptionsParser() {
		this(System::getenv);
	}

	public ExecutorOptionsParser(UnaryOperator<String> environment) {
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	public ExecutorOptions parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read executor options from path: " + path, e);
		}
	}

	public ExecutorOptions parse(InputStream inputStream) {
		return build(yaml.load(inputStream));
	}

	public ExecutorOptions parse(Reader reader) {
		return build(yaml.load(reader));
	}

	public ExecutorOptions parseString(String yamlContent) {
		return build(yaml.load(yamlContent));
	}

	private ExecutorOptions build(Object loaded) {
		if (loaded == null) {
			return ExecutorOptions.defaults();
		}
		if (!(loaded instanceof Map<?, ?> data)) {
			throw new IllegalArgumentException("executor options must be a YAML mapping");
		}
		ExecutorOptions.Builder builder = ExecutorOptions.builder();
		Object dryRun = data.get("dry_run");
		if (dryRun != null) {
			builder.dryRun(Boolean.parseBoolean(String.valueOf(dryRun)));
		}
		Object mode = data.get("mode");
		if (mode != null) {
			builder.modeOverride(PlanMode.parse(String.valueOf(mode)));
		}
		Object baseDir = data.get("plan_base_dir");
		if (baseDir != null) {
			builder.planBaseDir(Path.of(String.valueOf(baseDir)));
		}
		Object address = data.get("konnect_address");
		if (address != null) {
			builder.konnectAddress(String.valueOf(address));
		}
		Object executable = data.get("deck_executable");
		if (executable != null) {
			builder.deckExecutable(String.valueOf(executable));
		}
		Object tokenEnv = data.get("konnect_token_env");
		String variable = tokenEnv != null ? String.valueOf(tokenEnv) : DEFAULT_TOKEN_ENV;
		builder.konnectToken(environment.apply(variable));
		return builder.build();
	}
}
