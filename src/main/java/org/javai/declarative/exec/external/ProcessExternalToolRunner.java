package org.javai.declarative.exec.external;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.javai.declarative.exec.ExternalToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the external tool as a child process.
 * <p>
 * For {@code gateway} commands the Konnect token, control plane name and address are
 * injected after the sub-command and mode; callers may not pass those flags themselves.
 */
public class ProcessExternalToolRunner implements ExternalToolRunner {

	private static final Logger logger = LoggerFactory.getLogger(ProcessExternalToolRunner.class);

	static final String GATEWAY_COMMAND = "gateway";
	static final String TOKEN_FLAG = "--konnect-token";
	static final String CONTROL_PLANE_FLAG = "--konnect-control-plane-name";
	static final String ADDRESS_FLAG = "--konnect-addr";

	private final String executable;

	public ProcessExternalToolRunner(String executable) {
		this.executable = Objects.requireNonNull(executable, "executable must not be null");
	}

	@Override
	public RunResult run(RunOptions options) {
		List<String> command = new ArrayList<>();
		command.add(executable);
		command.addAll(buildArgs(options));

		Path stdoutFile = null;
		Path stderrFile = null;
		try {
			stdoutFile = Files.createTempFile("deck-stdout", ".log");
			stderrFile = Files.createTempFile("deck-stderr", ".log");
			ProcessBuilder processBuilder = new ProcessBuilder(command)
					.redirectOutput(stdoutFile.toFile())
					.redirectError(stderrFile.toFile());
			if (options.workDir() != null) {
				processBuilder.directory(options.workDir().toFile());
			}

			logger.debug("Running {} {} in {}", executable, options.args(), options.workDir());
			Process process = processBuilder.start();
			int exitCode;
			try {
				exitCode = process.waitFor();
			} catch (InterruptedException e) {
				process.destroyForcibly();
				Thread.currentThread().interrupt();
				throw new ExternalToolException(executable + " was interrupted", e);
			}

			RunResult result = new RunResult(Files.readString(stdoutFile, StandardCharsets.UTF_8),
					Files.readString(stderrFile, StandardCharsets.UTF_8), exitCode);
			if (!result.succeeded()) {
				throw new ExternalToolException("%s exited with status %d%s".formatted(
						executable, exitCode, stderrSuffix(result.stderr())));
			}
			return result;
		} catch (IOException e) {
			throw new ExternalToolException("failed to run " + executable + ": " + e.getMessage(), e);
		} finally {
			deleteQuietly(stdoutFile);
			deleteQuietly(stderrFile);
		}
	}

	/**
	 * The argument list passed to the tool, with Konnect flags injected for gateway commands.
	 *
	 * @throws ExternalToolException when the arguments are empty, Konnect settings are missing
	 * or the caller already passed one of the injected flags
	 */
	static List<String> buildArgs(RunOptions options) {
		List<String> args = new ArrayList<>(options.args());
		if (args.isEmpty()) {
			throw new ExternalToolException("args cannot be empty");
		}
		if (!GATEWAY_COMMAND.equals(args.get(0))) {
			return args;
		}

		requireSetting(options.konnectToken(), "konnect token is required for gateway steps");
		requireSetting(options.konnectControlPlaneName(),
				"konnect control plane name is required for gateway steps");
		requireSetting(options.konnectAddress(), "konnect address is required for gateway steps");
		for (String flag : List.of(TOKEN_FLAG, CONTROL_PLANE_FLAG, ADDRESS_FLAG)) {
			if (containsFlag(args, flag)) {
				throw new ExternalToolException("flag " + flag + " is set by the executor and cannot be passed");
			}
		}

		List<String> injected = List.of(
				TOKEN_FLAG, options.konnectToken(),
				CONTROL_PLANE_FLAG, options.konnectControlPlaneName(),
				ADDRESS_FLAG, options.konnectAddress());
		args.addAll(Math.min(2, args.size()), injected);
		return args;
	}

	static boolean containsFlag(List<String> args, String flag) {
		for (String arg : args) {
			if (arg.equals(flag) || arg.startsWith(flag + "=")) {
				return true;
			}
		}
		return false;
	}

	private static void requireSetting(String value, String message) {
		if (StringUtils.isBlank(value)) {
			throw new ExternalToolException(message);
		}
	}

	private static String stderrSuffix(String stderr) {
		String trimmed = stderr.strip();
		return trimmed.isEmpty() ? "" : ": " + trimmed;
	}

	private static void deleteQuietly(Path file) {
		if (file == null) {
			return;
		}
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			logger.debug("Could not delete temporary file {}", file, e);
		}
	}
}
