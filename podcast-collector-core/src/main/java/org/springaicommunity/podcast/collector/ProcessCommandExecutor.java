package org.springaicommunity.podcast.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link CommandExecutor} starting operating system processes.
 */
public class ProcessCommandExecutor implements CommandExecutor {

	private static final Logger logger = LoggerFactory.getLogger(ProcessCommandExecutor.class);

	private final Path workingDirectory;

	public ProcessCommandExecutor(Path workingDirectory) {
		this.workingDirectory = workingDirectory;
	}

	@Override
	public int execute(List<String> command) {
		logger.debug("Running: {}", String.join(" ", command));
		ProcessBuilder builder = new ProcessBuilder(command).directory(workingDirectory.toFile())
			.redirectOutput(ProcessBuilder.Redirect.DISCARD)
			.redirectError(ProcessBuilder.Redirect.DISCARD);
		try {
			Process process = builder.start();
			process.getOutputStream().close();
			int exitCode = process.waitFor();
			logger.debug("{} exited with {}", command.get(0), exitCode);
			return exitCode;
		}
		catch (IOException e) {
			throw new PostProcessingException("Unable to run " + command.get(0) + ": " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PostProcessingException("Interrupted while running " + command.get(0), e);
		}
	}

}
