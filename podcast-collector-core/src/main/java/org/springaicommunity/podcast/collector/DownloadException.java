package org.springaicommunity.podcast.collector;

/**
 * Failure to download or store an asset.
 */
public class DownloadException extends RuntimeException {

	public DownloadException(String message) {
		super(message);
	}

	public DownloadException(String message, Throwable cause) {
		super(message, cause);
	}

}
