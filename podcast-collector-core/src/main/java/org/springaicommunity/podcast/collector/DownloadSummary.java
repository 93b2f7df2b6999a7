package org.springaicommunity.podcast.collector;

/**
 * Aggregate of all entry outcomes of a run.
 *
 * @param succeeded number of entries that count as downloaded
 * @param total number of entries submitted
 * @param hadErrors whether any entry failed or partially failed
 */
public record DownloadSummary(int succeeded, int total, boolean hadErrors) {

	/**
	 * Exit status for this summary.
	 * @return {@link ExitStatus#NOTHING_DOWNLOADED} when nothing succeeded,
	 * {@link ExitStatus#COMPLETED_WITH_ERRORS} when errors occurred, otherwise
	 * {@link ExitStatus#SUCCESS}
	 */
	public ExitStatus exitStatus() {
		if (succeeded == 0) {
			return ExitStatus.NOTHING_DOWNLOADED;
		}
		if (hadErrors) {
			return ExitStatus.COMPLETED_WITH_ERRORS;
		}
		return ExitStatus.SUCCESS;
	}

	/**
	 * Human-readable result line.
	 * @return e.g. {@code 3 of 5 episodes downloaded} or
	 * {@code Successfully downloaded 5 episodes}
	 */
	public String summaryLine() {
		if (hadErrors && succeeded != total) {
			return succeeded + " of " + episodes(total) + " downloaded";
		}
		return "Successfully downloaded " + episodes(succeeded);
	}

	static String episodes(int count) {
		return count + (count == 1 ? " episode" : " episodes");
	}

}
