package org.javai.declarative.exec.external;

import java.nio.file.Path;
import java.util.List;

/**
 * One invocation of the external tool.
 *
 * @param args arguments, starting with the sub-command
 * @param mode "apply" or "sync"
 * @param konnectToken token injected for gateway commands
 * @param konnectControlPlaneName control plane name injected for gateway commands
 * @param konnectAddress API address injected for gateway commands
 * @param workDir working directory, or {@code null} for the current one
 */
public record RunOptions(
		List<String> args,
		String mode,
		String konnectToken,
		String konnectControlPlaneName,
		String konnectAddress,
		Path workDir) {

	public RunOptions {
		args = args != null ? List.copyOf(args) : List.of();
	}

	@Override
	public String toString() {
		return "RunOptions[args=" + args + ", mode=" + mode + ", konnectControlPlaneName=" + konnectControlPlaneName
				+ ", konnectAddress=" + konnectAddress + ", workDir=" + workDir + "]";
	}
}
