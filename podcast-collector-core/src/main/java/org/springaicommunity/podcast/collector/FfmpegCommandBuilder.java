package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds ffmpeg command lines for re-encoding and tagging downloaded mp3 files.
 */
public class FfmpegCommandBuilder {

	private static final Logger logger = LoggerFactory.getLogger(FfmpegCommandBuilder.class);

	private static final DateTimeFormatter TAG_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

	private final String executable;

	private final ZoneId zone;

	public FfmpegCommandBuilder(String executable, ZoneId zone) {
		this.executable = executable;
		this.zone = zone;
	}

	/**
	 * Command printing the ffmpeg version, used to check that ffmpeg is installed.
	 * @return ffmpeg command arguments
	 */
	public List<String> buildVersionCommand() {
		return List.of(executable, "-version");
	}

	/**
	 * Build the post-processing command.
	 * @param inputFile downloaded mp3
	 * @param outputFile temporary output file
	 * @param options requested adjustments
	 * @param tags metadata tags to embed when {@link AudioOptions#addMetadata()} is set
	 * @return ffmpeg command arguments
	 */
	public List<String> buildPostProcessCommand(Path inputFile, Path outputFile, AudioOptions options,
			Map<String, String> tags) {
		List<String> command = new ArrayList<>();
		command.add(executable);
		command.add("-loglevel");
		command.add("quiet");
		command.add("-i");
		command.add(inputFile.toString());

		if (options.bitrate() != null) {
			command.add("-b:a");
			command.add(options.bitrate());
		}
		if (options.mono()) {
			command.add("-ac");
			command.add("1");
		}
		if (options.addMetadata()) {
			command.add("-map_metadata");
			command.add("0");
			for (Map.Entry<String, String> tag : tags.entrySet()) {
				if (!tag.getValue().isEmpty()) {
					command.add("-metadata");
					command.add(tag.getKey() + "=" + tag.getValue());
				}
			}
			command.add("-codec");
			command.add("copy");
		}
		command.add(outputFile.toString());

		logger.debug("Built post-process command: {}", String.join(" ", command));
		return command;
	}

	/**
	 * Tags embedded into an episode file: album, artist, title, track, date and
	 * album_artist. Values are empty when unknown.
	 * @param feed the feed
	 * @param entry the episode
	 * @param originalIndex position of the episode in the feed
	 * @return tag names to values, in ffmpeg argument order
	 */
	public Map<String, String> buildTags(Feed feed, Entry entry, int originalIndex) {
		String album = orEmpty(feed.title());
		String artist = entry.itunes().author() != null ? entry.itunes().author() : orEmpty(entry.creator());
		String track = entry.itunes().episode() != null ? entry.itunes().episode()
				: String.valueOf(feed.items().size() - originalIndex);
		Instant published = entry.publishedAt();

		Map<String, String> tags = new LinkedHashMap<>();
		tags.put("album", album);
		tags.put("artist", artist);
		tags.put("title", orEmpty(entry.title()));
		tags.put("track", track);
		tags.put("date", published != null ? TAG_DATE.format(published.atZone(zone)) : "");
		tags.put("album_artist", album);
		return tags;
	}

	private static String orEmpty(@Nullable String value) {
		return value != null ? value : "";
	}

	/**
	 * Requested audio adjustments.
	 *
	 * @param bitrate target bitrate such as {@code 64k}, or null to keep it
	 * @param mono downmix to one channel
	 * @param addMetadata embed feed and episode tags
	 */
	public record AudioOptions(@Nullable String bitrate, boolean mono, boolean addMetadata) {

		public static final AudioOptions NONE = new AudioOptions(null, false, false);

		public boolean isRequested() {
			return bitrate != null || mono || addMetadata;
		}

	}

}
