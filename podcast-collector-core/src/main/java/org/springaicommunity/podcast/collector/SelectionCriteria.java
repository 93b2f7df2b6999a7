package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * Filters applied by {@link EntrySelector}. All filters are conjunctive.
 *
 * @param offset number of entries skipped at the start of the visitation order
 * @param limit maximum number of selected entries, applied after filtering; null for no
 * limit
 * @param reverse visit entries from the end of the feed (oldest first)
 * @param episodePattern pattern an entry title must contain a match for; entries without a
 * title are not filtered
 * @param before latest publish day, inclusive
 * @param after earliest publish day, inclusive
 * @param includeEpisodeImages whether episode images are attached as secondary downloads
 */
public record SelectionCriteria(int offset, @Nullable Integer limit, boolean reverse,
		@Nullable Pattern episodePattern, @Nullable LocalDate before, @Nullable LocalDate after,
		boolean includeEpisodeImages) {

	public SelectionCriteria {
		if (offset < 0) {
			throw new IllegalArgumentException("offset must be >= 0");
		}
		if (limit != null && limit < 1) {
			throw new IllegalArgumentException("limit must be >= 1");
		}
	}

	/**
	 * Criteria selecting every entry in feed order.
	 * @return unfiltered criteria
	 */
	public static SelectionCriteria all() {
		return new SelectionCriteria(0, null, false, null, null, null, false);
	}

}
