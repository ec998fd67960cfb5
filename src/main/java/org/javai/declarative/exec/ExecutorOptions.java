package org.javai.declarative.exec;

import java.nio.file.Path;
import org.javai.declarative.plan.PlanMode;

/**
 * Settings for a {@link DefaultPlanExecutor}.
 *
 * @param dryRun validate every change without issuing mutating calls
 * @param modeOverride mode passed to the external tool instead of the plan's own mode, or {@code null}
 * @param planBaseDir directory that relative external-tool paths are resolved against
 * @param konnectAddress base URL of the remote API, forwarded to the external tool
 * @param konnectToken access token forwarded to the external tool
 * @param deckExecutable executable of the external tool
 */
public record ExecutorOptions(
		boolean dryRun,
		PlanMode modeOverride,
		Path planBaseDir,
		String konnectAddress,
		String konnectToken,
		String deckExecutable
) {

	public static final String DEFAULT_KONNECT_ADDRESS = "https://us.api.konghq.com";
	public static final String DEFAULT_DECK_EXECUTABLE = "deck";

	public ExecutorOptions {
		planBaseDir = planBaseDir != null ? planBaseDir : Path.of(".");
		konnectAddress = konnectAddress != null && !konnectAddress.isBlank() ? konnectAddress : DEFAULT_KONNECT_ADDRESS;
		deckExecutable = deckExecutable != null && !deckExecutable.isBlank() ? deckExecutable : DEFAULT_DECK_EXECUTABLE;
	}

	public static ExecutorOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.dryRun(dryRun)
				.modeOverride(modeOverride)
				.planBaseDir(planBaseDir)
				.konnectAddress(konnectAddress)
				.konnectToken(konnectToken)
				.deckExecutable(deckExecutable);
	}

	@Override
	public String toString() {
		return "ExecutorOptions[dryRun=" + dryRun + ", modeOverride=" + modeOverride + ", planBaseDir=" + planBaseDir
				+ ", konnectAddress=" + konnectAddress + ", konnectToken=" + (konnectToken == null ? "null" : "****")
				+ ", deckExecutable=" + deckExecutable + "]";
	}

	public static final class Builder {
		private boolean dryRun;
		private PlanMode modeOverride;
		private Path planBaseDir;
		private String konnectAddress;
		private String konnectToken;
		private String deckExecutable;

		private Builder() {
		}

		public Builder dryRun(boolean dryRun) {
			this.dryRun = dryRun;
			return this;
		}

		public Builder modeOverride(PlanMode modeOverride) {
			this.modeOverride = modeOverride;
			return this;
		}

		public Builder planBaseDir(Path planBaseDir) {
			this.planBaseDir = planBaseDir;
			return this;
		}

		public Builder konnectAddress(String konnectAddress) {
			this.konnectAddress = konnectAddress;
			return this;
		}

		public Builder konnectToken(String konnectToken) {
			this.konnectToken = konnectToken;
			return this;
		}

		public Builder deckExecutable(String deckExecutable) {
			this.deckExecutable = deckExecutable;
			return this;
		}

		public ExecutorOptions build() {
			return new ExecutorOptions(dryRun, modeOverride, planBaseDir, konnectAddress, konnectToken,
					deckExecutable);
		}
	}
}
