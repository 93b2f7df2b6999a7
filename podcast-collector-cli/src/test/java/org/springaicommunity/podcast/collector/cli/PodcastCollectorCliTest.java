package org.springaicommunity.podcast.collector.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.springaicommunity.podcast.collector.Enclosure;
import org.springaicommunity.podcast.collector.Entry;
import org.springaicommunity.podcast.collector.Feed;
import org.springaicommunity.podcast.collector.ItunesInfo;
import org.springaicommunity.podcast.collector.MediaClient;
import org.springaicommunity.podcast.collector.PodcastCollectorBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the command-line entry point. Network and processes are replaced with
 * in-memory collaborators.
 */
@DisplayName("PodcastCollectorCli Tests")
class PodcastCollectorCliTest {

	private static final String FEED_URL = "https://example.com/feed.xml";

	private static final String MEDIA_URL = "https://cdn.example.com/ep1.mp3";

	@TempDir
	Path tempDir;

	private static Feed feed() {
		Entry entry = new Entry("Pilot", null, "Mon, 01 Jan 2024 00:00:00 GMT", "2024-01-01T00:00:00Z", "pilot",
				null, null, null, new Enclosure(MEDIA_URL, "audio/mpeg", 5), null, ItunesInfo.EMPTY, Map.of());
		return new Feed("Cli Show", "Shows from the command line", "https://example.com", null, null, null,
				ItunesInfo.EMPTY, List.of(entry), Map.of());
	}

	private static PodcastCollectorBuilder builder(MediaClient mediaClient) {
		return PodcastCollectorBuilder.create()
			.mediaClient(mediaClient)
			.feedSource(url -> feed())
			.commandExecutor(command -> 1);
	}

	@Nested
	@DisplayName("Argument Handling Tests")
	class ArgumentHandlingTest {

		@Test
		@DisplayName("Help exits with 0")
		void helpExitsWithZero() {
			assertThat(PodcastCollectorCli.run(new String[] { "--help" })).isZero();
		}

		@Test
		@DisplayName("Missing URL exits with 1")
		void missingUrl() {
			assertThat(PodcastCollectorCli.run(new String[] { "--limit", "2" })).isEqualTo(1);
		}

		@Test
		@DisplayName("Unknown option exits with 1")
		void unknownOption() {
			assertThat(PodcastCollectorCli.run(new String[] { "--url", FEED_URL, "--frobnicate" })).isEqualTo(1);
		}

		@Test
		@DisplayName("Invalid date exits with 1")
		void invalidDate() {
			assertThat(PodcastCollectorCli.run(new String[] { "--url", FEED_URL, "--after", "01/02/2024" }))
				.isEqualTo(1);
		}

	}

	@Nested
	@DisplayName("Collection Tests")
	class CollectionTest {

		@Test
		@DisplayName("A successful run downloads into the working directory and exits with 0")
		void successfulRun() {
			InMemoryMediaClient client = new InMemoryMediaClient(Map.of(MEDIA_URL, "pilot audio"));

			int exitCode = PodcastCollectorCli.run(new String[] { "--url", FEED_URL, "--archive" }, builder(client),
					tempDir);

			assertThat(exitCode).isZero();
			assertThat(tempDir.resolve("Cli Show/20240101-Pilot.mp3")).hasContent("pilot audio");
			assertThat(tempDir.resolve("Cli Show/archive.json")).exists();
		}

		@Test
		@DisplayName("A run where every download fails exits with 2")
		void nothingDownloaded() {
			int exitCode = PodcastCollectorCli.run(new String[] { "--url", FEED_URL },
					builder(new InMemoryMediaClient(Map.of())), tempDir);

			assertThat(exitCode).isEqualTo(2);
		}

		@Test
		@DisplayName("An aborted run exits with 1")
		void abortedRun() {
			InMemoryMediaClient client = new InMemoryMediaClient(Map.of(MEDIA_URL, "pilot audio"));

			int exitCode = PodcastCollectorCli.run(new String[] { "--url", FEED_URL, "--offset", "5" },
					builder(client), tempDir);

			assertThat(exitCode).isEqualTo(1);
		}

		@Test
		@DisplayName("A corrupt archive exits with 1")
		void corruptArchive() throws IOException {
			Files.createDirectories(tempDir.resolve("Cli Show"));
			Files.writeString(tempDir.resolve("Cli Show/archive.json"), "nope");
			InMemoryMediaClient client = new InMemoryMediaClient(Map.of(MEDIA_URL, "pilot audio"));

			Logger cliLogger = (Logger) LoggerFactory.getLogger(PodcastCollectorCli.class);
			ListAppender<ILoggingEvent> appender = new ListAppender<>();
			appender.start();
			cliLogger.addAppender(appender);
			int exitCode;
			try {
				exitCode = PodcastCollectorCli.run(new String[] { "--url", FEED_URL, "--archive" }, builder(client),
						tempDir);
			}
			finally {
				cliLogger.detachAppender(appender);
			}

			assertThat(exitCode).isEqualTo(1);
			String archivePath = tempDir.resolve("Cli Show/archive.json").toAbsolutePath().normalize().toString();
			assertThat(appender.list).filteredOn(event -> event.getLevel() == Level.ERROR)
				.singleElement()
				.satisfies(event -> {
					String message = event.getFormattedMessage();
					assertThat(message).contains(archivePath);
					assertThat(message.indexOf(archivePath)).isEqualTo(message.lastIndexOf(archivePath));
				});
		}

		@Test
		@DisplayName("Listing does not download")
		void listing() {
			InMemoryMediaClient client = new InMemoryMediaClient(Map.of(MEDIA_URL, "pilot audio"));

			int exitCode = PodcastCollectorCli.run(new String[] { "--url", FEED_URL, "--list", "json" },
					builder(client), tempDir);

			assertThat(exitCode).isZero();
			assertThat(tempDir.resolve("Cli Show")).doesNotExist();
		}

	}

	/**
	 * Serves fixed bodies; unknown URLs answer 404.
	 */
	private static final class InMemoryMediaClient implements MediaClient {

		private final Map<String, String> bodies;

		InMemoryMediaClient(Map<String, String> bodies) {
			this.bodies = bodies;
		}

		@Override
		public byte[] fetch(String url) {
			String body = bodies.get(url);
			if (body == null) {
				throw new MediaClientException("Not found: " + url, 404);
			}
			return body.getBytes(StandardCharsets.UTF_8);
		}

		@Override
		public long download(String url, Path target) {
			byte[] body = fetch(url);
			try {
				Files.write(target, body);
			}
			catch (IOException e) {
				throw new UncheckedIOException(e);
			}
			return body.length;
		}

		@Override
		public boolean exists(String url, Duration timeout) {
			return bodies.containsKey(url);
		}

	}

}
