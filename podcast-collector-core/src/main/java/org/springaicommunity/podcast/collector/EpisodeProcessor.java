package org.springaicommunity.podcast.collector;

/**
 * Processes a single selected entry. Implementations report failures through the
 * returned outcome.
 */
@FunctionalInterface
public interface EpisodeProcessor {

	/**
	 * Process one entry.
	 * @param entry the selected entry
	 * @param marker log prefix identifying the entry
	 * @return the outcome
	 */
	DownloadOutcome process(SelectedEntry entry, String marker);

}
