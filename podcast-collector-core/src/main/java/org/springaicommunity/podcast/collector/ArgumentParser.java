package org.springaicommunity.podcast.collector;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.jspecify.annotations.Nullable;

/**
 * Command-line argument parser for the podcast collector. Pure Java implementation with
 * no framework dependencies for maximum testability.
 */
public class ArgumentParser {

	private final DownloadProperties defaultProperties;

	public ArgumentParser(DownloadProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			String optional;

			switch (arg) {
				case "--url":
					config.url = getRequiredValue(args, i, "url");
					i++; // Skip next argument since we consumed it
					break;

				case "--out-dir":
					config.outDir = getRequiredValue(args, i, "out-dir");
					i++;
					break;

				case "--archive":
					config.archive = true;
					optional = getOptionalValue(args, i);
					if (optional != null) {
						config.archivePath = optional;
						i++;
					}
					break;

				case "--episode-template":
					config.episodeTemplate = getRequiredValue(args, i, "episode-template");
					i++;
					break;

				case "--include-meta":
					if (config.feedMetaRules == null) {
						config.feedMetaRules = new ArrayList<>();
					}
					optional = getOptionalValue(args, i);
					if (optional != null) {
						config.feedMetaRules.add(optional);
						i++;
					}
					break;

				case "--include-episode-meta":
					if (config.episodeMetaRules == null) {
						config.episodeMetaRules = new ArrayList<>();
					}
					optional = getOptionalValue(args, i);
					if (optional != null) {
						config.episodeMetaRules.add(optional);
						i++;
					}
					break;

				case "--metadata-format":
					config.metadataFormat = MetadataFormat.fromString(getRequiredValue(args, i, "metadata-format"));
					i++;
					break;

				case "--include-episode-images":
					config.includeEpisodeImages = true;
					break;

				case "--offset":
					String offsetStr = getRequiredValue(args, i, "offset");
					config.offset = parseInteger(offsetStr, "offset");
					if (config.offset < 0) {
						throw new IllegalArgumentException(
								"Invalid offset '" + offsetStr + "': must be zero or a positive integer");
					}
					i++;
					break;

				case "--limit":
					String limitStr = getRequiredValue(args, i, "limit");
					config.limit = parseInteger(limitStr, "limit");
					if (config.limit <= 0) {
						throw new IllegalArgumentException(
								"Invalid limit '" + limitStr + "': must be a positive integer");
					}
					i++;
					break;

				case "--episode-regex":
					config.episodeRegex = getRequiredValue(args, i, "episode-regex");
					try {
						Pattern.compile(config.episodeRegex);
					}
					catch (PatternSyntaxException e) {
						throw new IllegalArgumentException(
								"Invalid episode regex '" + config.episodeRegex + "': " + e.getDescription());
					}
					i++;
					break;

				case "--after":
					config.after = parseDate(getRequiredValue(args, i, "after"));
					i++;
					break;

				case "--before":
					config.before = parseDate(getRequiredValue(args, i, "before"));
					i++;
					break;

				case "--add-mp3-metadata":
					config.addMp3Metadata = true;
					break;

				case "--adjust-bitrate":
					config.bitrate = getRequiredValue(args, i, "adjust-bitrate");
					i++;
					break;

				case "--mono":
					config.mono = true;
					break;

				case "--override":
					config.override = true;
					break;

				case "--reverse":
					config.reverse = true;
					break;

				case "--info":
					config.info = true;
					break;

				case "--list":
					optional = getOptionalValue(args, i);
					if (optional != null) {
						config.listFormat = ListFormat.fromString(optional);
						i++;
					}
					else {
						config.listFormat = ListFormat.TABLE;
					}
					break;

				case "--exec":
					config.exec = getRequiredValue(args, i, "exec");
					i++;
					break;

				case "--threads":
					String threadsStr = getRequiredValue(args, i, "threads");
					config.threads = parseInteger(threadsStr, "threads");
					i++;
					break;

				case "--filter-url-tracking":
					config.filterUrlTracking = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					break;
			}
		}

		// Validate configuration
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: podcast-collector --url URL [OPTIONS]\n");
		help.append("\n");
		help.append("Download podcast episodes from an RSS or Atom feed.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                    Show this help message\n");
		help.append("    -v, --verbose                 Enable verbose logging\n");
		help.append("    --url URL                     URL of the podcast feed (required)\n");
		help.append("    --out-dir TEMPLATE            Output directory (default: ")
			.append(defaultProperties.getOutDirTemplate())
			.append(")\n");
		help.append("    --archive [PATH]              Record downloads in an archive file and skip them later\n");
		help.append("                                  (default: ")
			.append(defaultProperties.getDefaultArchiveTemplate())
			.append(")\n");
		help.append("    --episode-template TEMPLATE   Episode file name template (default: ")
			.append(defaultProperties.getEpisodeTemplate())
			.append(")\n");
		help.append("    --override                    Overwrite files that already exist\n");
		help.append("    --threads N                   Number of concurrent downloads, 1-")
			.append(DownloadScheduler.MAX_THREADS)
			.append(" (default: ")
			.append(defaultProperties.getThreads())
			.append(")\n");
		help.append("    --filter-url-tracking         Try to strip tracking redirects from media URLs\n");
		help.append("\n");
		help.append("METADATA OPTIONS:\n");
		help.append("    --include-meta [RULE]         Write podcast metadata next to the episodes (repeatable)\n");
		help.append("    --include-episode-meta [RULE] Write metadata for each episode (repeatable)\n");
		help.append("    --metadata-format FORMAT      Metadata file format: json, xml (default: json)\n");
		help.append("    --include-episode-images      Download the image of each episode\n");
		help.append("                                  Rules are globs such as 'itunes.*' or '!content'\n");
		help.append("\n");
		help.append("SELECTION OPTIONS:\n");
		help.append("    --offset N                    Skip the first N episodes (default: 0)\n");
		help.append("    --limit N                     Download at most N episodes\n");
		help.append("    --episode-regex REGEX         Only episodes whose title matches REGEX\n");
		help.append("    --after DATE                  Only episodes released on or after DATE (YYYY-MM-DD)\n");
		help.append("    --before DATE                 Only episodes released on or before DATE (YYYY-MM-DD)\n");
		help.append("    --reverse                     Start from the oldest episode\n");
		help.append("\n");
		help.append("POST-PROCESSING OPTIONS (require ffmpeg):\n");
		help.append("    --add-mp3-metadata            Write feed details into the ID3 tags\n");
		help.append("    --adjust-bitrate BITRATE      Re-encode to BITRATE, e.g. 48k\n");
		help.append("    --mono                        Downmix to a single channel\n");
		help.append("    --exec COMMAND                Run COMMAND after each download; {} is the file path,\n");
		help.append("                                  {filenameBase} the file name without extension\n");
		help.append("\n");
		help.append("INFORMATION OPTIONS:\n");
		help.append("    --info                        Print the podcast title and description\n");
		help.append("    --list [FORMAT]               List matching episodes: table, json (default: table)\n");
		help.append("\n");
		help.append("TEMPLATE TOKENS:\n");
		help.append("    Directory: {{podcast_title}} {{podcast_link}}\n");
		help.append("    Episode:   {{title}} {{release_date}} {{release_year}} {{release_month}} {{release_day}}\n");
		help.append("               {{episode_num}} {{url}} {{duration}} {{guid}} {{podcast_title}} {{podcast_link}}\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ").append(EnvironmentSupport.FFMPEG_PATH).append("                   ffmpeg executable (default: ")
			.append(defaultProperties.getFfmpegExecutable())
			.append(")\n");
		help.append("\n");
		help.append("EXIT STATUS:\n");
		help.append("    0  success, 1  error, 2  nothing downloaded, 3  completed with errors\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    # Download everything, remembering what was fetched\n");
		help.append("    podcast-collector --url https://example.com/feed.xml --archive\n");
		help.append("\n");
		help.append("    # Latest three episodes with metadata\n");
		help.append("    podcast-collector --url https://example.com/feed.xml --limit 3 --include-episode-meta\n");
		help.append("\n");
		help.append("    # What would be downloaded\n");
		help.append("    podcast-collector --url https://example.com/feed.xml --after 2024-01-01 --list json\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private @Nullable String getOptionalValue(String[] args, int currentIndex) {
		if (currentIndex + 1 >= args.length || args[currentIndex + 1].startsWith("-")) {
			return null;
		}
		return args[currentIndex + 1];
	}

	private int parseInteger(String value, String optionName) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be an integer");
		}
	}

	private LocalDate parseDate(String value) {
		try {
			return LocalDate.parse(value);
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid date '" + value + "': must be YYYY-MM-DD format");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		if (config.url == null || config.url.trim().isEmpty()) {
			errors.add("No URL provided");
		}

		if (config.threads < DownloadScheduler.MIN_THREADS || config.threads > DownloadScheduler.MAX_THREADS) {
			errors.add("Threads must be between " + DownloadScheduler.MIN_THREADS + " and "
					+ DownloadScheduler.MAX_THREADS + " (got: " + config.threads + ")");
		}

		if (config.after != null && config.before != null && config.after.isAfter(config.before)) {
			errors.add("--after " + config.after + " is later than --before " + config.before);
		}

		if (config.bitrate != null && config.bitrate.trim().isEmpty()) {
			errors.add("Bitrate cannot be empty");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
