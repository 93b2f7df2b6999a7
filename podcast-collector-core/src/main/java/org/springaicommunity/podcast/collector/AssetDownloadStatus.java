package org.springaicommunity.podcast.collector;

/**
 * Result of a single {@link AssetDownloader} call.
 */
public enum AssetDownloadStatus {

	/**
	 * The asset was fetched and stored.
	 */
	DOWNLOADED,

	/**
	 * The archive key was already recorded; nothing was fetched.
	 */
	SKIPPED_ARCHIVED,

	/**
	 * A file already exists at the output path and overriding is off.
	 */
	SKIPPED_EXISTS;

	public boolean isSkipped() {
		return this != DOWNLOADED;
	}

}
