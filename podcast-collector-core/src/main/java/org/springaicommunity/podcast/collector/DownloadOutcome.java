package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

/**
 * Result of running the download pipeline for one entry.
 *
 * @param marker log prefix of the entry
 * @param status final state
 * @param partialFailure whether a non-essential step such as an image download failed
 * @param error message of the failure that decided a {@link OutcomeStatus#FAILED} status
 */
public record DownloadOutcome(String marker, OutcomeStatus status, boolean partialFailure,
		@Nullable String error) {

	public static DownloadOutcome failed(String marker, String error) {
		return new DownloadOutcome(marker, OutcomeStatus.FAILED, false, error);
	}

	/**
	 * Whether the outcome should flip the run's error flag.
	 * @return true for failures and partial failures
	 */
	public boolean hasErrors() {
		return status == OutcomeStatus.FAILED || partialFailure;
	}

}
