package org.springaicommunity.podcast.collector.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.podcast.collector.*;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Podcast Collector CLI Application
 *
 * Plain Java command-line application that downloads podcast episodes from an RSS or
 * Atom feed. Uses PodcastCollectorBuilder for service wiring.
 *
 * Usage: java -jar podcast-collector-cli.jar --url URL [OPTIONS]
 *
 * Environment Variables: FFMPEG_PATH - ffmpeg executable used for post-processing
 *
 * Examples: java -jar podcast-collector-cli.jar --url https://example.com/feed.xml
 * --archive java -jar podcast-collector-cli.jar --url https://example.com/feed.xml --limit
 * 5 --include-episode-meta java -jar podcast-collector-cli.jar --url
 * https://example.com/feed.xml --list json
 */
public class PodcastCollectorCli {

	private static final Logger logger = LoggerFactory.getLogger(PodcastCollectorCli.class);

	public static void main(String[] args) {
		int exitCode;
		try {
			exitCode = run(args);
		}
		catch (Exception e) {
			logger.error("Collection failed: {}", e.getMessage());
			exitCode = ExitStatus.GENERAL_ERROR.code();
		}
		System.exit(exitCode);
	}

	public static int run(String[] args) {
		return run(args, PodcastCollectorBuilder.create(), Paths.get("").toAbsolutePath());
	}

	static int run(String[] args, PodcastCollectorBuilder builder, Path workingDirectory) {
		// Create argument parser with default properties
		DownloadProperties properties = new DownloadProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return ExitStatus.SUCCESS.code();
		}

		ParsedConfiguration config;
		DownloadRequest request;
		try {
			config = argumentParser.parseAndValidate(args);
			request = config.toRequest(workingDirectory);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			return ExitStatus.GENERAL_ERROR.code();
		}

		if (config.verbose) {
			enableDebugLogging();
		}

		logConfiguration(config);

		try {
			CollectionResult result = builder.properties(properties).build().collect(request);
			logResults(result, config.verbose);
			return result.exitStatus().code();
		}
		catch (CollectionAbortedException e) {
			logger.error(e.getMessage());
			if (config.verbose && e.getCause() != null) {
				logger.error("Stack trace:", e.getCause());
			}
			return e.getExitStatus().code();
		}
		catch (ArchiveLedgerException e) {
			logger.error(e.getMessage());
			return ExitStatus.GENERAL_ERROR.code();
		}
	}

	private static void enableDebugLogging() {
		Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
			logbackRoot.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.debug("Configuration:");
		logger.debug("  URL: {}", config.url);
		logger.debug("  Output directory: {}", config.outDir);
		logger.debug("  Episode template: {}", config.episodeTemplate);
		logger.debug("  Archive: {}", config.archive ? (config.archivePath != null ? config.archivePath : "(default)")
				: "(disabled)");
		logger.debug("  Feed metadata rules: {}", config.feedMetaRules != null ? config.feedMetaRules : "(disabled)");
		logger.debug("  Episode metadata rules: {}",
				config.episodeMetaRules != null ? config.episodeMetaRules : "(disabled)");
		logger.debug("  Metadata format: {}", config.metadataFormat);
		logger.debug("  Episode images: {}", config.includeEpisodeImages);
		logger.debug("  Offset: {}", config.offset);
		logger.debug("  Limit: {}", config.limit != null ? config.limit : "unlimited");
		logger.debug("  Episode regex: {}", config.episodeRegex != null ? config.episodeRegex : "(not set)");
		logger.debug("  After: {}", config.after != null ? config.after : "(not set)");
		logger.debug("  Before: {}", config.before != null ? config.before : "(not set)");
		logger.debug("  Reverse: {}", config.reverse);
		logger.debug("  Add mp3 metadata: {}", config.addMp3Metadata);
		logger.debug("  Bitrate: {}", config.bitrate != null ? config.bitrate : "(unchanged)");
		logger.debug("  Mono: {}", config.mono);
		logger.debug("  Override: {}", config.override);
		logger.debug("  Exec: {}", config.exec != null ? config.exec : "(not set)");
		logger.debug("  Threads: {}", config.threads);
		logger.debug("  Filter URL tracking: {}", config.filterUrlTracking);
	}

	private static void logResults(CollectionResult result, boolean verbose) {
		if (verbose) {
			logger.debug("Output directory: {}", result.basePath());
			logger.debug("Exit status: {}", result.exitStatus());
		}
	}

}
