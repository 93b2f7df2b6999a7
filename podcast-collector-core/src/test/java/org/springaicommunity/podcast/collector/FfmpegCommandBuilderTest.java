package org.springaicommunity.podcast.collector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FfmpegCommandBuilder}.
 */
@DisplayName("FfmpegCommandBuilder Tests")
class FfmpegCommandBuilderTest {

	private final FfmpegCommandBuilder builder = new FfmpegCommandBuilder("/opt/ffmpeg/bin/ffmpeg", ZoneOffset.UTC);

	private final Path input = Path.of("show", "ep.mp3");

	private final Path output = Path.of("show", "ep.mp3.tmp.mp3");

	@Test
	@DisplayName("Version command uses the configured executable")
	void versionCommand() {
		assertThat(builder.buildVersionCommand()).containsExactly("/opt/ffmpeg/bin/ffmpeg", "-version");
	}

	@Test
	@DisplayName("Bitrate and mono are added in order")
	void bitrateAndMono() {
		List<String> command = builder.buildPostProcessCommand(input, output,
				new FfmpegCommandBuilder.AudioOptions("48k", true, false), Map.of());

		assertThat(command).containsExactly("/opt/ffmpeg/bin/ffmpeg", "-loglevel", "quiet", "-i", input.toString(),
				"-b:a", "48k", "-ac", "1", output.toString());
	}

	@Test
	@DisplayName("Metadata tags are mapped and empty values skipped")
	void metadataTags() {
		Map<String, String> tags = new LinkedHashMap<>();
		tags.put("album", "Show");
		tags.put("artist", "");
		tags.put("track", "7");

		List<String> command = builder.buildPostProcessCommand(input, output,
				new FfmpegCommandBuilder.AudioOptions(null, false, true), tags);

		assertThat(command).containsExactly("/opt/ffmpeg/bin/ffmpeg", "-loglevel", "quiet", "-i", input.toString(),
				"-map_metadata", "0", "-metadata", "album=Show", "-metadata", "track=7", "-codec", "copy",
				output.toString());
	}

	@Test
	@DisplayName("Tags prefer iTunes values")
	void tagsPreferItunes() {
		Feed feed = TestFeeds.feedWithEntries(4);
		Entry entry = new Entry("Pilot", null, null, "2024-03-05T23:30:00Z", null, "Creator", null, null, null, null,
				new ItunesInfo("iTunes Author", "42", null, null, null, null), Map.of());

		Map<String, String> tags = builder.buildTags(feed, entry, 1);

		assertThat(tags).containsExactly(entry("album", "Test Show"), entry("artist", "iTunes Author"),
				entry("title", "Pilot"), entry("track", "42"), entry("date", "2024-03-05"),
				entry("album_artist", "Test Show"));
	}

	@Test
	@DisplayName("Tags fall back to creator and feed position")
	void tagsFallBack() {
		Feed feed = TestFeeds.feedWithEntries(4);
		Entry entry = TestFeeds.entryWithoutDate("Untitled", "https://cdn.example.com/u.mp3");
		Entry withCreator = new Entry(entry.title(), null, null, null, null, "Creator", null, null, null, null,
				ItunesInfo.EMPTY, Map.of());

		Map<String, String> tags = builder.buildTags(feed, withCreator, 1);

		assertThat(tags).containsEntry("artist", "Creator").containsEntry("track", "3").containsEntry("date", "");
	}

	@Test
	@DisplayName("No options means nothing is requested")
	void noneRequested() {
		assertThat(FfmpegCommandBuilder.AudioOptions.NONE.isRequested()).isFalse();
		assertThat(new FfmpegCommandBuilder.AudioOptions("64k", false, false).isRequested()).isTrue();
	}

}
