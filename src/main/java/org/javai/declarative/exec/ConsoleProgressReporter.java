package org.javai.declarative.exec;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.apache.commons.lang3.StringUtils;
import org.javai.declarative.labels.Labels;
import org.javai.declarative.plan.Plan;
import org.javai.declarative.plan.PlannedChange;

/**
 * Writes one progress line per change and a closing summary.
 *
 * <pre>
 * Applying changes:
 * [1/2] [namespace: default] Creating portal: dev-portal... ✓
 * [2/2] [namespace: default] Deleting portal: old-portal... ✗ Error: boom
 * </pre>
 */
public class ConsoleProgressReporter implements ProgressReporter {

	private final PrintStream out;
	private final boolean dryRun;
	private int totalChanges;
	private int currentIndex;
	private final Map<String, NamespaceStats> namespaceStats = new TreeMap<>();

	public ConsoleProgressReporter(PrintStream out, boolean dryRun) {
		this.out = Objects.requireNonNull(out, "out must not be null");
		this.dryRun = dryRun;
	}

	@Override
	public void startExecution(Plan plan) {
		totalChanges = plan.executionOrder().size();
		currentIndex = 0;
		namespaceStats.clear();
		if (totalChanges == 0) {
			out.println("No changes to execute.");
			return;
		}
		out.println(dryRun ? "Validating changes:" : "Applying changes:");
	}

	@Override
	public void startChange(PlannedChange change) {
		currentIndex++;
		String namespace = namespaceOf(change);
		namespaceStats.computeIfAbsent(namespace, ns -> new NamespaceStats());
		String prefix = totalChanges > 0 ? "[%d/%d]".formatted(currentIndex, totalChanges) : "•";
		out.printf("%s [namespace: %s] %s %s: %s... ", prefix, namespace, change.action().progressVerb(),
				change.resourceType(), change.displayName());
	}

	@Override
	public void completeChange(PlannedChange change, Throwable error) {
		NamespaceStats stats = namespaceStats.computeIfAbsent(namespaceOf(change), ns -> new NamespaceStats());
		if (error != null) {
			out.printf("✗ Error: %s%n", error.getMessage());
			stats.failed++;
		} else {
			out.println("✓");
			stats.succeeded++;
		}
	}

	@Override
	public void skipChange(PlannedChange change, String reason) {
		namespaceStats.computeIfAbsent(namespaceOf(change), ns -> new NamespaceStats()).skipped++;
		out.printf("⚠ Skipped: %s%n", reason);
	}

	@Override
	public void finishExecution(ExecutionResult result) {
		out.println();
		if (namespaceStats.size() > 1) {
			out.println("Namespace Summary:");
			namespaceStats.forEach((namespace, stats) -> {
				List<String> parts = new ArrayList<>();
				if (stats.succeeded > 0) {
					parts.add(stats.succeeded + " succeeded");
				}
				if (stats.failed > 0) {
					parts.add(stats.failed + " failed");
				}
				if (stats.skipped > 0 && dryRun) {
					parts.add(stats.skipped + " validated");
				}
				if (!parts.isEmpty()) {
					out.printf("  %s: %s%n", namespace, String.join(", ", parts));
				}
			});
			out.println();
		}

		if (result.dryRun()) {
			out.println("Dry run complete.");
			if (result.skippedCount() > 0) {
				out.printf("%d changes would be applied.%n", result.skippedCount());
			}
			if (result.failureCount() > 0) {
				out.println();
				out.println("Validation errors:");
				printErrors(result);
			}
		} else {
			out.println("Complete.");
			if (result.successCount() > 0) {
				out.printf("Applied %d changes.%n", result.successCount());
			}
			if (result.failureCount() > 0 && !result.errors().isEmpty()) {
				out.println();
				out.println("Errors:");
				printErrors(result);
			}
		}
		out.flush();
	}

	private void printErrors(ExecutionResult result) {
		for (ExecutionResult.ExecutionError error : result.errors()) {
			out.printf("  • %s %s: %s%n", StringUtils.defaultIfBlank(error.resourceType(), "change"),
					StringUtils.defaultIfBlank(error.resourceName(), error.changeId()), error.error());
		}
	}

	private static String namespaceOf(PlannedChange change) {
		return StringUtils.isBlank(change.namespace()) ? Labels.DEFAULT_NAMESPACE : change.namespace();
	}

	private static final class NamespaceStats {
		int succeeded;
		int failed;
		int skipped;
	}
}
