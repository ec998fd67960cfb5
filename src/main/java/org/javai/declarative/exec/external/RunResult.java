package org.javai.declarative.exec.external;

/**
 * Captured output of an external tool run.
 */
public record RunResult(String stdout, String stderr, int exitCode) {

	public RunResult {
		stdout = stdout != null ? stdout : "";
		stderr = stderr != null ? stderr : "";
	}

	public boolean succeeded() {
		return exitCode == 0;
	}
}
