package org.springaicommunity.podcast.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/**
 * Re-encodes or tags a downloaded mp3 with ffmpeg.
 *
 * <p>
 * ffmpeg writes to {@code <file>.tmp.mp3}; the original is replaced only when ffmpeg
 * exits successfully, otherwise the temporary file is removed.
 */
public class AudioPostProcessor {

	private static final Logger logger = LoggerFactory.getLogger(AudioPostProcessor.class);

	static final String TEMP_SUFFIX = ".tmp.mp3";

	private final CommandExecutor executor;

	private final FfmpegCommandBuilder commandBuilder;

	public AudioPostProcessor(CommandExecutor executor, FfmpegCommandBuilder commandBuilder) {
		this.executor = executor;
		this.commandBuilder = commandBuilder;
	}

	/**
	 * Check whether ffmpeg can be started.
	 * @return true if {@code ffmpeg -version} exits with 0
	 */
	public boolean isFfmpegAvailable() {
		try {
			return executor.execute(commandBuilder.buildVersionCommand()) == 0;
		}
		catch (PostProcessingException e) {
			logger.debug("ffmpeg check failed: {}", e.getMessage());
			return false;
		}
	}

	/**
	 * Apply the requested adjustments to a downloaded file. Does nothing if the file does
	 * not exist.
	 * @param marker log prefix identifying the entry
	 * @param audioFile the downloaded file
	 * @param feed the feed
	 * @param entry the episode
	 * @param originalIndex position of the episode in the feed
	 * @param options requested adjustments
	 * @throws PostProcessingException if the file is not an mp3 or ffmpeg fails
	 */
	public void process(String marker, Path audioFile, Feed feed, Entry entry, int originalIndex,
			FfmpegCommandBuilder.AudioOptions options) {
		if (!Files.exists(audioFile)) {
			return;
		}
		if (!audioFile.getFileName().toString().endsWith(".mp3")) {
			throw new PostProcessingException("Not an .mp3 file. Unable to run ffmpeg.");
		}

		Path tempFile = audioFile.resolveSibling(audioFile.getFileName() + TEMP_SUFFIX);
		Map<String, String> tags = options.addMetadata() ? commandBuilder.buildTags(feed, entry, originalIndex)
				: Map.of();
		List<String> command = commandBuilder.buildPostProcessCommand(audioFile, tempFile, options, tags);

		logger.info("{} | Running ffmpeg", marker);
		AssetDownloader.deleteQuietly(tempFile);
		int exitCode;
		try {
			exitCode = executor.execute(command);
		}
		catch (PostProcessingException e) {
			AssetDownloader.deleteQuietly(tempFile);
			throw e;
		}
		if (exitCode != 0) {
			AssetDownloader.deleteQuietly(tempFile);
			throw new PostProcessingException("ffmpeg exited with code " + exitCode);
		}

		try {
			Files.move(tempFile, audioFile, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (IOException e) {
			AssetDownloader.deleteQuietly(tempFile);
			throw new PostProcessingException("Unable to replace " + audioFile + ": " + e.getMessage(), e);
		}
		logger.info("{} | ffmpeg complete", marker);
	}

}
