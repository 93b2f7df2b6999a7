package org.springaicommunity.podcast.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link EpisodeDownloadPipeline}.
 */
@DisplayName("EpisodeDownloadPipeline Tests")
class EpisodeDownloadPipelineTest {

	private static final String MEDIA_URL = "https://cdn.example.com/episodes/ep3.mp3";

	private static final String PRIMARY_KEY = TestFeeds.PREFIX + "-20240310-Episode 3.mp3";

	private static final String MARKER = "Episode 3";

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private FakeMediaClient mediaClient;

	private FileSystemArchiveLedger ledger;

	private Feed feed;

	private SelectionContext context;

	private final List<List<String>> commands = new CopyOnWriteArrayList<>();

	private int commandExitCode;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		mediaClient = new FakeMediaClient().serve(MEDIA_URL, "episode-3-audio");
		ledger = new FileSystemArchiveLedger(tempDir.resolve("archive.json"), objectMapper);
		feed = TestFeeds.feedWithEntries(3);
		context = new SelectionContext(TestFeeds.PREFIX, tempDir, "{{release_date}}-{{title}}", ledger);
		commandExitCode = 0;
	}

	private CommandExecutor recordingExecutor() {
		return command -> {
			commands.add(command);
			if (command.contains("-loglevel") && commandExitCode == 0) {
				// Behave like ffmpeg: write the last argument
				try {
					Files.writeString(Path.of(command.get(command.size() - 1)), "processed");
				}
				catch (IOException e) {
					throw new UncheckedIOException(e);
				}
			}
			return commandExitCode;
		};
	}

	private EpisodeDownloadPipeline pipeline(EpisodeDownloadPipeline.Options options) {
		CommandExecutor executor = recordingExecutor();
		return new EpisodeDownloadPipeline(feed, context, options, new AssetDownloader(mediaClient, ledger),
				new FilenameTemplate(ZoneOffset.UTC), new TrackingUrlResolver(mediaClient, Duration.ofSeconds(1)),
				new FieldProjector(objectMapper), new SidecarMetadataWriter(objectMapper),
				new AudioPostProcessor(executor, new FfmpegCommandBuilder("ffmpeg", ZoneOffset.UTC)),
				new HookCommandRunner(executor, false));
	}

	private static EpisodeDownloadPipeline.Options options() {
		return new EpisodeDownloadPipeline.Options(false, null, MetadataFormat.JSON,
				FfmpegCommandBuilder.AudioOptions.NONE, null, false);
	}

	private SelectedEntry selected() {
		return new SelectedEntry(feed.items().get(0), 0, new MediaAsset(MEDIA_URL, ".mp3"), PRIMARY_KEY);
	}

	@Nested
	@DisplayName("Primary download")
	class PrimaryTest {

		@Test
		@DisplayName("Successful download records the archive key")
		void successRecordsKey() throws Exception {
			DownloadOutcome outcome = pipeline(options()).process(selected(), MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
			assertThat(outcome.hasErrors()).isFalse();
			assertThat(Files.readString(tempDir.resolve("20240310-Episode 3.mp3"))).isEqualTo("episode-3-audio");
			assertThat(ledger.keys()).containsExactly(PRIMARY_KEY);
		}

		@Test
		@DisplayName("Entries without media fail")
		void unresolvedMediaFails() {
			SelectedEntry noMedia = new SelectedEntry(feed.items().get(0), 0, MediaAsset.NONE, PRIMARY_KEY);

			DownloadOutcome outcome = pipeline(options()).process(noMedia, MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
			assertThat(outcome.error()).isEqualTo("Unable to find episode download URL");
			assertThat(mediaClient.requests()).isEmpty();
		}

		@Test
		@DisplayName("Entries archived after selection are skipped")
		void archivedAfterSelection() {
			ledger.insert(PRIMARY_KEY);

			DownloadOutcome outcome = pipeline(options()).process(selected(), MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.SKIPPED_ARCHIVED);
			assertThat(outcome.status().isSuccess()).isFalse();
			assertThat(mediaClient.requests()).isEmpty();
		}

		@Test
		@DisplayName("Failed downloads fail the entry and record nothing")
		void failedDownload() {
			SelectedEntry missing = new SelectedEntry(feed.items().get(0), 0,
					new MediaAsset("https://cdn.example.com/missing.mp3", ".mp3"), PRIMARY_KEY);

			DownloadOutcome outcome = pipeline(options()).process(missing, MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
			assertThat(outcome.error()).contains("404");
			assertThat(ledger.keys()).isEmpty();
		}

		@Test
		@DisplayName("Existing files count as success and are recorded")
		void existingFileRecorded() throws Exception {
			Files.writeString(tempDir.resolve("20240310-Episode 3.mp3"), "local");

			DownloadOutcome outcome = pipeline(options()).process(selected(), MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.SKIPPED_EXISTS);
			assertThat(outcome.status().isSuccess()).isTrue();
			assertThat(mediaClient.requests()).isEmpty();
			assertThat(ledger.keys()).containsExactly(PRIMARY_KEY);
		}

		@Test
		@DisplayName("Tracking prefixes are stripped when requested")
		void trackingUrlFiltered() {
			String tracked = "https://tracker.example/p/cdn.example.com/episodes/ep3.mp3";
			SelectedEntry trackedEntry = new SelectedEntry(feed.items().get(0), 0, new MediaAsset(tracked, ".mp3"),
					PRIMARY_KEY);
			EpisodeDownloadPipeline.Options filtering = new EpisodeDownloadPipeline.Options(false, null,
					MetadataFormat.JSON, FfmpegCommandBuilder.AudioOptions.NONE, null, true);

			DownloadOutcome outcome = pipeline(filtering).process(trackedEntry, MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
			assertThat(mediaClient.requests()).containsExactly(MEDIA_URL);
		}

	}

	@Nested
	@DisplayName("Secondary steps")
	class SecondaryStepsTest {

		@Test
		@DisplayName("Episode metadata is written next to the episode and recorded")
		void episodeMetadata() throws Exception {
			EpisodeDownloadPipeline.Options withMeta = new EpisodeDownloadPipeline.Options(false,
					List.of("title", "creator"), MetadataFormat.JSON, FfmpegCommandBuilder.AudioOptions.NONE, null,
					false);

			DownloadOutcome outcome = pipeline(withMeta).process(selected(), MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
			Path metaFile = tempDir.resolve("20240310-Episode 3.meta.json");
			assertThat(objectMapper.readValue(metaFile.toFile(), Map.class))
				.isEqualTo(Map.of("title", "Episode 3", "creator", "Host"));
			assertThat(ledger.keys()).containsExactly(PRIMARY_KEY, TestFeeds.PREFIX + "-20240310-Episode 3.meta.json");
		}

		@Test
		@DisplayName("Failed episode images mark a partial failure only")
		void failedImageIsPartial() {
			SelectedEntry withImage = selected();
			withImage.addSecondaryDownload(new SecondaryDownload("https://cdn.example.com/missing.jpg",
					tempDir.resolve("img.jpg"), TestFeeds.PREFIX + "-20240310-Episode 3.jpg"));

			DownloadOutcome outcome = pipeline(options()).process(withImage, MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
			assertThat(outcome.partialFailure()).isTrue();
			assertThat(outcome.hasErrors()).isTrue();
			assertThat(ledger.keys()).containsExactly(PRIMARY_KEY);
		}

		@Test
		@DisplayName("Downloaded episode images are recorded")
		void imageRecorded() {
			mediaClient.serve("https://cdn.example.com/ep3.jpg", "jpeg");
			SelectedEntry withImage = selected();
			withImage.addSecondaryDownload(new SecondaryDownload("https://cdn.example.com/ep3.jpg",
					tempDir.resolve("guid").resolve("20240310-Episode 3.jpg"),
					TestFeeds.PREFIX + "-20240310-Episode 3.jpg"));

			DownloadOutcome outcome = pipeline(options()).process(withImage, MARKER);

			assertThat(outcome.hasErrors()).isFalse();
			assertThat(tempDir.resolve("guid").resolve("20240310-Episode 3.jpg")).exists();
			assertThat(ledger.keys()).contains(TestFeeds.PREFIX + "-20240310-Episode 3.jpg");
		}

		@Test
		@DisplayName("Hook command receives the quoted output path")
		void hookCommand() {
			EpisodeDownloadPipeline.Options withExec = new EpisodeDownloadPipeline.Options(false, null,
					MetadataFormat.JSON, FfmpegCommandBuilder.AudioOptions.NONE, "touch {}.done {filenameBase}", false);

			DownloadOutcome outcome = pipeline(withExec).process(selected(), MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
			Path output = tempDir.resolve("20240310-Episode 3.mp3");
			assertThat(commands).containsExactly(
					List.of("sh", "-c", "touch '" + output + "'.done '20240310-Episode 3'"));
		}

		@Test
		@DisplayName("Failing hook fails the entry and records nothing")
		void failingHook() {
			commandExitCode = 1;
			EpisodeDownloadPipeline.Options withExec = new EpisodeDownloadPipeline.Options(false, null,
					MetadataFormat.JSON, FfmpegCommandBuilder.AudioOptions.NONE, "false", false);

			DownloadOutcome outcome = pipeline(withExec).process(selected(), MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
			assertThat(outcome.error()).startsWith("Command exited with code 1");
			assertThat(ledger.keys()).isEmpty();
		}

		@Test
		@DisplayName("ffmpeg output replaces the download")
		void ffmpegReplacesDownload() throws Exception {
			EpisodeDownloadPipeline.Options mono = new EpisodeDownloadPipeline.Options(false, null,
					MetadataFormat.JSON, new FfmpegCommandBuilder.AudioOptions(null, true, false), null, false);

			DownloadOutcome outcome = pipeline(mono).process(selected(), MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
			assertThat(Files.readString(tempDir.resolve("20240310-Episode 3.mp3"))).isEqualTo("processed");
			assertThat(commands.get(0)).contains("-ac", "1");
		}

		@Test
		@DisplayName("Failing ffmpeg fails the entry")
		void failingFfmpeg() {
			commandExitCode = 1;
			EpisodeDownloadPipeline.Options mono = new EpisodeDownloadPipeline.Options(false, null,
					MetadataFormat.JSON, new FfmpegCommandBuilder.AudioOptions(null, true, false), null, false);

			DownloadOutcome outcome = pipeline(mono).process(selected(), MARKER);

			assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
			assertThat(outcome.error()).isEqualTo("ffmpeg exited with code 1");
			assertThat(ledger.keys()).isEmpty();
		}

	}

}
