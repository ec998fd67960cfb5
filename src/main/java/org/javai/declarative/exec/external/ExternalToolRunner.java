package org.javai.declarative.exec.external;

import org.javai.declarative.exec.ExternalToolException;

/**
 * Runs the external configuration-sync tool.
 */
public interface ExternalToolRunner {

	/**
	 * Run the tool and wait for it to finish.
	 *
	 * @return the captured output of a successful run
	 * @throws ExternalToolException when the arguments are invalid, the tool cannot be
	 * started, exits with a non-zero status, or the calling thread is interrupted
	 */
	RunResult run(RunOptions options);
}
