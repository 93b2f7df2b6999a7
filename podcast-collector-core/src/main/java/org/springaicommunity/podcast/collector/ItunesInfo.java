package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

/**
 * Values from the iTunes podcast namespace.
 *
 * @param author the author
 * @param episode the episode number
 * @param image the image href
 * @param duration the duration as written in the feed
 * @param summary the summary
 * @param explicit the explicit flag as written in the feed
 */
public record ItunesInfo(@Nullable String author, @Nullable String episode, @Nullable String image,
		@Nullable String duration, @Nullable String summary, @Nullable String explicit) {

	/**
	 * An instance without any values.
	 */
	public static final ItunesInfo EMPTY = new ItunesInfo(null, null, null, null, null, null);

}
