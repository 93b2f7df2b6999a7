package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Downloads a single asset to a file.
 *
 * <p>
 * The body is written to {@code <output>.tmp} first and moved into place only after a
 * non-empty body was received, so an interrupted transfer never leaves a partial file
 * at the final path. Recording the archive key is left to the caller.
 */
public class AssetDownloader {

	private static final Logger logger = LoggerFactory.getLogger(AssetDownloader.class);

	static final String TEMP_SUFFIX = ".tmp";

	private final MediaClient mediaClient;

	private final ArchiveLedger ledger;

	public AssetDownloader(MediaClient mediaClient, ArchiveLedger ledger) {
		this.mediaClient = mediaClient;
		this.ledger = ledger;
	}

	/**
	 * Download an asset unless it is archived or already present.
	 * @param marker log prefix identifying the entry
	 * @param url asset URL
	 * @param outputPath final file location
	 * @param archiveKey key checked against the ledger, or null to skip the check
	 * @param override whether an existing file is replaced
	 * @return what happened
	 * @throws DownloadException if the transfer fails or the body is empty
	 */
	public AssetDownloadStatus download(String marker, String url, Path outputPath, @Nullable String archiveKey,
			boolean override) {
		if (archiveKey != null && ledger.contains(archiveKey)) {
			logger.info("{} | Download exists in archive", marker);
			return AssetDownloadStatus.SKIPPED_ARCHIVED;
		}
		if (!override && Files.exists(outputPath)) {
			logger.info("{} | File already exists. Skipping download", marker);
			return AssetDownloadStatus.SKIPPED_EXISTS;
		}

		Path tempPath = outputPath.resolveSibling(outputPath.getFileName() + TEMP_SUFFIX);
		try {
			Path parent = outputPath.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			logger.info("{} | Starting download of {}", marker, url);
			long bytes = mediaClient.download(url, tempPath);
			if (bytes <= 0) {
				throw new DownloadException("Unable to download file. Empty response from " + url);
			}
			moveIntoPlace(tempPath, outputPath);
			logger.info("{} | Download complete ({} bytes)", marker, bytes);
			return AssetDownloadStatus.DOWNLOADED;
		}
		catch (IOException e) {
			deleteQuietly(tempPath);
			throw new DownloadException("Unable to write " + outputPath + ": " + e.getMessage(), e);
		}
		catch (RuntimeException e) {
			deleteQuietly(tempPath);
			throw e;
		}
	}

	private static void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	static void deleteQuietly(Path path) {
		try {
			Files.deleteIfExists(path);
		}
		catch (IOException e) {
			logger.warn("Unable to delete temporary file {}: {}", path, e.getMessage());
		}
	}

}
