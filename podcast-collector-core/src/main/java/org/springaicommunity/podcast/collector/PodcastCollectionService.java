package org.springaicommunity.podcast.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs a complete collection for one feed: fetch, optional info or listing, feed
 * metadata, selection and the concurrent episode downloads.
 *
 * <p>
 * Fatal conditions are raised as {@link CollectionAbortedException} before any episode
 * is processed; an unreadable archive surfaces as {@link ArchiveLedgerException}.
 * Everything that goes wrong for a single episode ends up in the returned summary.
 */
public class PodcastCollectionService {

	private static final Logger logger = LoggerFactory.getLogger(PodcastCollectionService.class);

	private final FeedSource feedSource;

	private final MediaClient mediaClient;

	private final CommandExecutor commandExecutor;

	private final ObjectMapper objectMapper;

	private final DownloadProperties properties;

	private final PrintStream out;

	private final MediaUrlResolver mediaUrlResolver = new MediaUrlResolver();

	private final FilenameTemplate filenameTemplate;

	private final EntrySelector entrySelector;

	private final FieldProjector fieldProjector;

	private final SidecarMetadataWriter metadataWriter;

	private final AudioPostProcessor audioPostProcessor;

	public PodcastCollectionService(FeedSource feedSource, MediaClient mediaClient, CommandExecutor commandExecutor,
			ObjectMapper objectMapper, DownloadProperties properties, ZoneId zone, PrintStream out) {
		this.feedSource = feedSource;
		this.mediaClient = mediaClient;
		this.commandExecutor = commandExecutor;
		this.objectMapper = objectMapper;
		this.properties = properties;
		this.out = out;
		this.filenameTemplate = new FilenameTemplate(zone);
		this.entrySelector = new EntrySelector(mediaUrlResolver, filenameTemplate, zone);
		this.fieldProjector = new FieldProjector(objectMapper);
		this.metadataWriter = new SidecarMetadataWriter(objectMapper);
		this.audioPostProcessor = new AudioPostProcessor(commandExecutor,
				new FfmpegCommandBuilder(properties.getFfmpegExecutable(), zone));
	}

	/**
	 * Run a collection.
	 * @param request run parameters
	 * @return the result
	 * @throws CollectionAbortedException on fatal conditions
	 * @throws ArchiveLedgerException if the archive exists but cannot be read
	 */
	public CollectionResult collect(DownloadRequest request) {
		validate(request);
		String archivePrefix = feedIdentity(request.url());
		Feed feed = feedSource.fetch(request.url());
		Path basePath = resolve(request.workingDirectory(), filenameTemplate.folderName(feed,
				orDefault(request.outDirTemplate(), properties.getOutDirTemplate())));
		String episodeTemplate = orDefault(request.episodeTemplate(), properties.getEpisodeTemplate());

		logger.info("{}", orDefault(feed.title(), ""));
		logger.info("{}", orDefault(feed.description(), ""));

		if (request.listFormat() != null) {
			listEpisodes(feed, request, new SelectionContext(archivePrefix, basePath, episodeTemplate,
					ArchiveLedger.disabled()));
			return CollectionResult.informational(basePath);
		}
		if (request.info()) {
			return CollectionResult.informational(basePath);
		}

		createDirectory(basePath);
		ArchiveLedger ledger = openLedger(request, feed);
		AssetDownloader downloader = new AssetDownloader(mediaClient, ledger);

		if (request.feedMetaRules() != null) {
			List<String> rules = request.feedMetaRules().isEmpty() ? properties.getFeedMetaRules()
					: request.feedMetaRules();
			downloadPodcastImage(feed, basePath, archivePrefix, downloader, ledger, request.override());
			writeFeedMeta(feed, basePath, archivePrefix, ledger, rules, request);
		}

		if (feed.items().isEmpty()) {
			throw new CollectionAbortedException("No episodes found to download");
		}
		if (request.offset() >= feed.items().size()) {
			throw new CollectionAbortedException("--offset too large. No episodes to download.");
		}

		SelectionContext context = new SelectionContext(archivePrefix, basePath, episodeTemplate, ledger);
		List<SelectedEntry> selected = entrySelector.select(feed, request.toCriteria(), context);
		if (selected.isEmpty()) {
			throw new CollectionAbortedException("No episodes found with provided criteria to download");
		}

		logger.info("Starting download of {}", DownloadSummary.episodes(selected.size()));
		EpisodeDownloadPipeline pipeline = createPipeline(feed, context, request, downloader);
		DownloadSummary summary = new DownloadScheduler(pipeline).runAll(selected, request.threads());
		logger.info("{}", summary.summaryLine());
		return new CollectionResult(summary.exitStatus(), summary, basePath);
	}

	private void validate(DownloadRequest request) {
		if (request.url() == null || request.url().isBlank()) {
			throw new CollectionAbortedException("No URL provided");
		}
		if (request.threads() < DownloadScheduler.MIN_THREADS || request.threads() > DownloadScheduler.MAX_THREADS) {
			throw new CollectionAbortedException("--threads must be between " + DownloadScheduler.MIN_THREADS
					+ " and " + DownloadScheduler.MAX_THREADS);
		}
		if (request.audioOptions().isRequested() && !audioPostProcessor.isFfmpegAvailable()) {
			throw new CollectionAbortedException(
					"ffmpeg is required for --add-mp3-metadata, --adjust-bitrate and --mono but could not be run");
		}
	}

	private static String feedIdentity(String url) {
		try {
			return ArchiveKeys.feedIdentity(url);
		}
		catch (IllegalArgumentException e) {
			throw new CollectionAbortedException(e.getMessage(), ExitStatus.GENERAL_ERROR, e);
		}
	}

	private void listEpisodes(Feed feed, DownloadRequest request, SelectionContext context) {
		if (feed.items().isEmpty()) {
			throw new CollectionAbortedException("No episodes found to list");
		}
		SelectionCriteria criteria = new SelectionCriteria(request.offset(), request.limit(), request.reverse(),
				request.episodeRegex(), request.before(), request.after(), false);
		List<SelectedEntry> selected = entrySelector.select(feed, criteria, context);
		if (selected.isEmpty()) {
			throw new CollectionAbortedException("No episodes found with provided criteria to list");
		}
		EpisodeListing listing = new EpisodeListing(objectMapper);
		listing.print(listing.rows(feed, selected), request.listFormat(), out);
	}

	private ArchiveLedger openLedger(DownloadRequest request, Feed feed) {
		if (!request.archiveEnabled()) {
			return ArchiveLedger.disabled();
		}
		String template = orDefault(request.archiveTemplate(), properties.getDefaultArchiveTemplate());
		Path path = resolve(request.workingDirectory(), filenameTemplate.folderName(feed, template));
		FileSystemArchiveLedger ledger = new FileSystemArchiveLedger(path, objectMapper);
		// Read now so an unreadable archive stops the run before anything is downloaded.
		Set<String> keys = ledger.load();
		logger.debug("Using archive {} ({} keys)", ledger.path(), keys.size());
		return ledger;
	}

	private void downloadPodcastImage(Feed feed, Path basePath, String archivePrefix, AssetDownloader downloader,
			ArchiveLedger ledger, boolean override) {
		String imageUrl = mediaUrlResolver.imageUrl(feed);
		if (imageUrl == null) {
			return;
		}
		String imageName = (feed.title() != null ? feed.title() + ".image" : "image")
				+ mediaUrlResolver.urlExtension(imageUrl);
		String key = ArchiveKeys.key(archivePrefix, imageName);
		try {
			logger.info("Downloading podcast image...");
			AssetDownloadStatus status = downloader.download(imageUrl, imageUrl,
					basePath.resolve(FilenameTemplate.safeName(imageName)), key, override);
			if (status != AssetDownloadStatus.SKIPPED_ARCHIVED) {
				ledger.insert(key);
			}
		}
		catch (ArchiveLedgerException e) {
			throw e;
		}
		catch (RuntimeException e) {
			logger.error("Unable to download podcast image: {}", e.getMessage());
		}
	}

	private void writeFeedMeta(Feed feed, Path basePath, String archivePrefix, ArchiveLedger ledger,
			List<String> rules, DownloadRequest request) {
		String metaName = (feed.title() != null ? feed.title() + ".meta" : "meta") + "."
				+ request.metadataFormat().extension();
		String key = ArchiveKeys.key(archivePrefix, metaName);
		try {
			logger.info("Saving podcast metadata...");
			if (ledger.contains(key)) {
				logger.info("Feed metadata exists in archive. Skipping...");
				return;
			}
			Path metaPath = basePath.resolve(FilenameTemplate.safeName(metaName));
			if (request.override() || !Files.exists(metaPath)) {
				Map<String, Object> metadata = fieldProjector.project(feed, rules);
				metadata.remove("items");
				metadataWriter.write(metaPath, metadata);
			}
			else {
				logger.info("Feed metadata exists locally. Skipping...");
			}
			ledger.insert(key);
		}
		catch (ArchiveLedgerException e) {
			throw e;
		}
		catch (IOException | RuntimeException e) {
			logger.error("Unable to save podcast metadata: {}", e.getMessage());
		}
	}

	private EpisodeDownloadPipeline createPipeline(Feed feed, SelectionContext context, DownloadRequest request,
			AssetDownloader downloader) {
		List<String> episodeMetaRules = request.episodeMetaRules();
		if (episodeMetaRules != null && episodeMetaRules.isEmpty()) {
			episodeMetaRules = properties.getEpisodeMetaRules();
		}
		EpisodeDownloadPipeline.Options options = new EpisodeDownloadPipeline.Options(request.override(),
				episodeMetaRules, request.metadataFormat(), request.audioOptions(), request.exec(),
				request.filterUrlTracking());
		TrackingUrlResolver trackingUrlResolver = new TrackingUrlResolver(mediaClient,
				Duration.ofMillis(properties.getProbeTimeoutMillis()));
		return new EpisodeDownloadPipeline(feed, context, options, downloader, filenameTemplate, trackingUrlResolver,
				fieldProjector, metadataWriter, audioPostProcessor, new HookCommandRunner(commandExecutor));
	}

	private static void createDirectory(Path basePath) {
		if (Files.isDirectory(basePath)) {
			return;
		}
		logger.info("{} does not exist. Creating...", basePath);
		try {
			Files.createDirectories(basePath);
		}
		catch (IOException e) {
			throw new CollectionAbortedException("Unable to create " + basePath + ": " + e.getMessage(),
					ExitStatus.GENERAL_ERROR, e);
		}
	}

	private static Path resolve(Path workingDirectory, String path) {
		return workingDirectory.resolve(path).toAbsolutePath().normalize();
	}

	private static String orDefault(@Nullable String value, String defaultValue) {
		return value != null ? value : defaultValue;
	}

}
