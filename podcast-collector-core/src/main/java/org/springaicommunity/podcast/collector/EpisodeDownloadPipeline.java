package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs every step for one selected entry: primary download, secondary downloads,
 * episode metadata, ffmpeg post-processing, the user hook and finally the ledger update.
 *
 * <p>
 * Exceptions never leave {@link #process(SelectedEntry, String)}. A failing primary
 * download, metadata write, post-processing or hook fails the entry; failing secondary
 * downloads only mark it as partially failed. Archive keys are recorded only when the
 * entry did not fail.
 */
public class EpisodeDownloadPipeline implements EpisodeProcessor {

	private static final Logger logger = LoggerFactory.getLogger(EpisodeDownloadPipeline.class);

	private final Feed feed;

	private final SelectionContext context;

	private final Options options;

	private final AssetDownloader downloader;

	private final FilenameTemplate filenameTemplate;

	private final TrackingUrlResolver trackingUrlResolver;

	private final FieldProjector fieldProjector;

	private final SidecarMetadataWriter metadataWriter;

	private final AudioPostProcessor audioPostProcessor;

	private final HookCommandRunner hookCommandRunner;

	public EpisodeDownloadPipeline(Feed feed, SelectionContext context, Options options, AssetDownloader downloader,
			FilenameTemplate filenameTemplate, TrackingUrlResolver trackingUrlResolver, FieldProjector fieldProjector,
			SidecarMetadataWriter metadataWriter, AudioPostProcessor audioPostProcessor,
			HookCommandRunner hookCommandRunner) {
		this.feed = feed;
		this.context = context;
		this.options = options;
		this.downloader = downloader;
		this.filenameTemplate = filenameTemplate;
		this.trackingUrlResolver = trackingUrlResolver;
		this.fieldProjector = fieldProjector;
		this.metadataWriter = metadataWriter;
		this.audioPostProcessor = audioPostProcessor;
		this.hookCommandRunner = hookCommandRunner;
	}

	@Override
	public DownloadOutcome process(SelectedEntry selected, String marker) {
		try {
			return runSteps(selected, marker);
		}
		catch (RuntimeException e) {
			logger.error("{} | Unexpected error: {}", marker, e.getMessage());
			logger.debug("{} | Stack trace", marker, e);
			return DownloadOutcome.failed(marker, e.getMessage() != null ? e.getMessage() : e.toString());
		}
	}

	private DownloadOutcome runSteps(SelectedEntry selected, String marker) {
		Entry entry = selected.entry();
		MediaAsset media = selected.media();
		ArchiveLedger ledger = context.ledger();

		if (!media.isResolved()) {
			logger.error("{} | Unable to find episode download URL", marker);
			return DownloadOutcome.failed(marker, "Unable to find episode download URL");
		}
		if (ledger.contains(selected.archiveKey())) {
			logger.info("{} | Episode exists in archive. Skipping...", marker);
			return new DownloadOutcome(marker, OutcomeStatus.SKIPPED_ARCHIVED, false, null);
		}

		String episodeFilename = filenameTemplate.episodeFilename(entry, feed, selected.originalIndex(), media.url(),
				media.extensionOrEmpty(), context.episodeTemplate());
		Path outputPath = context.basePath().resolve(episodeFilename);

		AssetDownloadStatus primary;
		try {
			String url = options.filterUrlTracking() ? trackingUrlResolver.resolve(media.url()) : media.url();
			primary = downloader.download(marker, url, outputPath, selected.archiveKey(), options.override());
		}
		catch (DownloadException | MediaClient.MediaClientException e) {
			logger.error("{} | Unable to download episode: {}", marker, e.getMessage());
			return DownloadOutcome.failed(marker, e.getMessage());
		}
		if (primary == AssetDownloadStatus.SKIPPED_ARCHIVED) {
			return new DownloadOutcome(marker, OutcomeStatus.SKIPPED_ARCHIVED, false, null);
		}

		List<String> keysToRecord = new ArrayList<>();
		keysToRecord.add(selected.archiveKey());

		boolean partialFailure = downloadSecondaries(selected, marker, keysToRecord);

		if (options.episodeMetaRules() != null) {
			try {
				writeEpisodeMeta(selected, marker, episodeFilename, keysToRecord);
			}
			catch (IOException | RuntimeException e) {
				logger.error("{} | Unable to save meta file for episode: {}", marker, e.getMessage());
				return new DownloadOutcome(marker, OutcomeStatus.FAILED, partialFailure,
						"Unable to save meta file for episode: " + e.getMessage());
			}
		}

		if (options.audio().isRequested()) {
			try {
				audioPostProcessor.process(marker, outputPath, feed, entry, selected.originalIndex(), options.audio());
			}
			catch (PostProcessingException e) {
				logger.error("{} | Error running ffmpeg: {}", marker, e.getMessage());
				return new DownloadOutcome(marker, OutcomeStatus.FAILED, partialFailure, e.getMessage());
			}
		}

		if (options.exec() != null) {
			try {
				hookCommandRunner.run(marker, options.exec(), outputPath, episodeFilename);
			}
			catch (PostProcessingException e) {
				logger.error("{} | Error running command: {}", marker, e.getMessage());
				return new DownloadOutcome(marker, OutcomeStatus.FAILED, partialFailure, e.getMessage());
			}
		}

		for (String key : keysToRecord) {
			ledger.insert(key);
		}

		OutcomeStatus status = primary == AssetDownloadStatus.SKIPPED_EXISTS ? OutcomeStatus.SKIPPED_EXISTS
				: OutcomeStatus.SUCCEEDED;
		return new DownloadOutcome(marker, status, partialFailure, null);
	}

	private boolean downloadSecondaries(SelectedEntry selected, String marker, List<String> keysToRecord) {
		boolean partialFailure = false;
		for (SecondaryDownload secondary : selected.secondaryDownloads()) {
			try {
				AssetDownloadStatus status = downloader.download(marker, secondary.url(), secondary.outputPath(),
						secondary.archiveKey(), options.override());
				if (status != AssetDownloadStatus.SKIPPED_ARCHIVED) {
					keysToRecord.add(secondary.archiveKey());
				}
			}
			catch (RuntimeException e) {
				logger.error("{} | Unable to download episode image {}: {}", marker, secondary.url(), e.getMessage());
				partialFailure = true;
			}
		}
		return partialFailure;
	}

	private void writeEpisodeMeta(SelectedEntry selected, String marker, String episodeFilename,
			List<String> keysToRecord) throws IOException {
		Entry entry = selected.entry();
		String extension = ".meta." + options.metadataFormat().extension();
		String metaKey = ArchiveKeys.key(context.archivePrefix(),
				filenameTemplate.archiveFilename(entry.publishedAt(), entry.title(), extension));
		if (context.ledger().contains(metaKey)) {
			logger.info("{} | Episode metadata exists in archive. Skipping...", marker);
			return;
		}
		Path metaPath = context.basePath().resolve(FilenameTemplate.baseName(episodeFilename) + extension);
		if (options.override() || !Files.exists(metaPath)) {
			Map<String, Object> metadata = fieldProjector.project(entry, options.episodeMetaRules());
			metadataWriter.write(metaPath, metadata);
			logger.info("{} | Saved episode metadata", marker);
		}
		else {
			logger.info("{} | Episode metadata exists locally. Skipping...", marker);
		}
		keysToRecord.add(metaKey);
	}

	/**
	 * Per-run pipeline settings.
	 *
	 * @param override replace existing local files
	 * @param episodeMetaRules field rules for episode metadata, or null to skip writing it
	 * @param metadataFormat sidecar format
	 * @param audio ffmpeg adjustments
	 * @param exec hook command, or null
	 * @param filterUrlTracking resolve tracking redirect URLs before downloading
	 */
	public record Options(boolean override, @Nullable List<String> episodeMetaRules, MetadataFormat metadataFormat,
			FfmpegCommandBuilder.AudioOptions audio, @Nullable String exec, boolean filterUrlTracking) {

	}

}
