package org.springaicommunity.podcast.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Builder for creating the podcast collection service without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: HTTP client with retries, ROME feed parsing, ffmpeg from FFMPEG_PATH or PATH
 * PodcastCollectionService collector = PodcastCollectorBuilder.create().build();
 *
 * CollectionResult result = collector.collect(DownloadRequest.builder("https://example.com/feed.xml")
 *     .archive(null)
 *     .limit(5)
 *     .build());
 *
 * // For testing with a mock HTTP client
 * MediaClient mockClient = mock(MediaClient.class);
 * PodcastCollectionService testCollector = PodcastCollectorBuilder.create()
 *     .mediaClient(mockClient)
 *     .build();
 * }
 * </pre>
 */
public class PodcastCollectorBuilder {

	private DownloadProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private MediaClient mediaClient;

	@Nullable
	private FeedSource feedSource;

	@Nullable
	private CommandExecutor commandExecutor;

	private ZoneId zone = ZoneOffset.UTC;

	private PrintStream out = System.out;

	private PodcastCollectorBuilder() {
		this.properties = new DownloadProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new PodcastCollectorBuilder
	 */
	public static PodcastCollectorBuilder create() {
		return new PodcastCollectorBuilder();
	}

	/**
	 * Set download properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public PodcastCollectorBuilder properties(@Nullable DownloadProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public PodcastCollectorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom MediaClient implementation. Used as is, without the retry decorator.
	 * @param mediaClient custom MediaClient implementation (null to use default)
	 * @return this builder
	 */
	public PodcastCollectorBuilder mediaClient(@Nullable MediaClient mediaClient) {
		this.mediaClient = mediaClient;
		return this;
	}

	/**
	 * Set a custom FeedSource implementation.
	 * @param feedSource custom FeedSource (null to parse feeds with ROME through the media
	 * client)
	 * @return this builder
	 */
	public PodcastCollectorBuilder feedSource(@Nullable FeedSource feedSource) {
		this.feedSource = feedSource;
		return this;
	}

	/**
	 * Set a custom CommandExecutor used for ffmpeg and hook commands.
	 * @param commandExecutor custom CommandExecutor (null to start real processes)
	 * @return this builder
	 */
	public PodcastCollectorBuilder commandExecutor(@Nullable CommandExecutor commandExecutor) {
		this.commandExecutor = commandExecutor;
		return this;
	}

	/**
	 * Set the zone in which publish dates are turned into calendar days.
	 * @param zone the zone (default: UTC)
	 * @return this builder
	 */
	public PodcastCollectorBuilder zone(ZoneId zone) {
		this.zone = zone;
		return this;
	}

	/**
	 * Set the stream episode listings are printed to.
	 * @param out the stream (default: {@code System.out})
	 * @return this builder
	 */
	public PodcastCollectorBuilder output(PrintStream out) {
		this.out = out;
		return this;
	}

	/**
	 * Build the PodcastCollectionService.
	 * @return configured service
	 */
	public PodcastCollectionService build() {
		Components components = buildComponents();
		return new PodcastCollectionService(components.feedSource, components.mediaClient,
				components.commandExecutor, components.objectMapper, properties, zone, out);
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		MediaClient client = this.mediaClient != null ? this.mediaClient : createDefaultMediaClient();
		FeedSource source = this.feedSource != null ? this.feedSource : new RomeFeedSource(client);
		CommandExecutor executor = this.commandExecutor != null ? this.commandExecutor
				: new ProcessCommandExecutor(Path.of("").toAbsolutePath());
		properties.setFfmpegExecutable(
				EnvironmentSupport.getOrDefault(EnvironmentSupport.FFMPEG_PATH, properties.getFfmpegExecutable()));
		return new Components(client, source, executor, mapper);
	}

	private MediaClient createDefaultMediaClient() {
		HttpMediaClient http = new HttpMediaClient(Duration.ofSeconds(properties.getConnectTimeoutSeconds()),
				properties.getUserAgent());
		return RetryingMediaClient.builder()
			.wrapping(http)
			.maxRetries(properties.getMaxRetries())
			.initialDelay(Duration.ofMillis(properties.getRetryDelayMillis()))
			.build();
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(MediaClient mediaClient, FeedSource feedSource, CommandExecutor commandExecutor,
			ObjectMapper objectMapper) {
	}

}
