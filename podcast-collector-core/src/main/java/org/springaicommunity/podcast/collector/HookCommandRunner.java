package org.springaicommunity.podcast.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the user-supplied command after an episode is downloaded.
 *
 * <p>
 * {@code {}} is replaced with the quoted output path and {@code {filenameBase}} with the
 * quoted file name without extension. The command runs through {@code sh -c}, or
 * {@code cmd /c} on Windows.
 *
 * <p>
 * Substituted values come from feed content and are quoted so that the shell treats them
 * as literal text: single quotes for {@code sh}, double quotes with {@code %} escaped for
 * {@code cmd}.
 */
public class HookCommandRunner {

	private static final Logger logger = LoggerFactory.getLogger(HookCommandRunner.class);

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{}|\\{filenameBase}");

	private final CommandExecutor executor;

	private final boolean windows;

	public HookCommandRunner(CommandExecutor executor) {
		this(executor, System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
	}

	HookCommandRunner(CommandExecutor executor, boolean windows) {
		this.executor = executor;
		this.windows = windows;
	}

	/**
	 * Substitute the placeholders of a hook command.
	 * @param template command with {@code {}} and {@code {filenameBase}} placeholders
	 * @param outputPath downloaded file
	 * @param episodeFilename file name of the download, with extension
	 * @param windows quote for {@code cmd} instead of {@code sh}
	 * @return the command line
	 */
	public static String expand(String template, Path outputPath, String episodeFilename, boolean windows) {
		String filenameBase = FilenameTemplate.baseName(episodeFilename);
		String quotedPath = windows ? quoteForCmd(outputPath.toString()) : quoteForSh(outputPath.toString());
		String quotedBase = windows ? quoteForCmd(filenameBase) : quoteForSh(filenameBase);
		// Single pass, so substituted values are never scanned for placeholders again.
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder command = new StringBuilder();
		while (matcher.find()) {
			matcher.appendReplacement(command,
					Matcher.quoteReplacement("{}".equals(matcher.group()) ? quotedPath : quotedBase));
		}
		matcher.appendTail(command);
		return command.toString();
	}

	/**
	 * Quote a value as a single literal {@code sh} word.
	 * @param value raw value
	 * @return the value in single quotes, embedded single quotes written as {@code '\''}
	 */
	static String quoteForSh(String value) {
		return "'" + value.replace("'", "'\\''") + "'";
	}

	/**
	 * Quote a value for {@code cmd /c}. Double quotes are dropped and {@code %} is escaped
	 * outside the quotes to prevent variable expansion.
	 * @param value raw value
	 * @return the quoted value
	 */
	static String quoteForCmd(String value) {
		return "\"" + value.replace("\"", "").replace("%", "\"^%\"") + "\"";
	}

	/**
	 * Run the hook for one episode.
	 * @param marker log prefix identifying the entry
	 * @param template the user command
	 * @param outputPath downloaded file
	 * @param episodeFilename file name of the download
	 * @throws PostProcessingException if the command cannot be run or exits non-zero
	 */
	public void run(String marker, String template, Path outputPath, String episodeFilename) {
		String commandLine = expand(template, outputPath, episodeFilename, windows);
		List<String> command = windows ? List.of("cmd", "/c", commandLine) : List.of("sh", "-c", commandLine);
		logger.info("{} | Running command: {}", marker, commandLine);
		int exitCode = executor.execute(command);
		if (exitCode != 0) {
			throw new PostProcessingException("Command exited with code " + exitCode + ": " + commandLine);
		}
		logger.info("{} | Command complete", marker);
	}

}
