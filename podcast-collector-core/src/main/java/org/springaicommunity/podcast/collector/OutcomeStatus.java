package org.springaicommunity.podcast.collector;

/**
 * Final state of one entry after the download pipeline ran.
 */
public enum OutcomeStatus {

	/**
	 * The media archive key was already in the ledger; nothing was done.
	 */
	SKIPPED_ARCHIVED,

	/**
	 * The media file already existed locally; the remaining steps ran and succeeded.
	 */
	SKIPPED_EXISTS,

	SUCCEEDED,

	FAILED;

	/**
	 * Whether the entry counts towards the number of downloaded episodes.
	 * @return true for {@link #SUCCEEDED} and {@link #SKIPPED_EXISTS}
	 */
	public boolean isSuccess() {
		return this == SUCCEEDED || this == SKIPPED_EXISTS;
	}

}
