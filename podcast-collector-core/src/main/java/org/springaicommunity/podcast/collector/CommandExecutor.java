package org.springaicommunity.podcast.collector;

import java.util.List;

/**
 * Runs external commands. Separated from the callers so that tests can observe command
 * lines without starting processes.
 */
@FunctionalInterface
public interface CommandExecutor {

	/**
	 * Run a command to completion. Output is discarded.
	 * @param command executable followed by its arguments
	 * @return the exit code
	 * @throws PostProcessingException if the process cannot be started or is interrupted
	 */
	int execute(List<String> command);

}
