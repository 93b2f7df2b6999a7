package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A parsed podcast feed.
 *
 * <p>
 * Immutable after fetch. Entries keep the document order of the feed, which is
 * newest-first by convention.
 *
 * @param title the channel title
 * @param description the channel description
 * @param link the channel website link
 * @param feedUrl the self link the feed advertises, if any
 * @param managingEditor the managing editor or feed author
 * @param image the channel image reference
 * @param itunes iTunes namespace values of the channel
 * @param items the feed entries in document order
 * @param raw the channel element as a map graph ({@code $} attributes, {@code _} text),
 * without its items
 */
public record Feed(@Nullable String title, @Nullable String description, @Nullable String link,
		@Nullable String feedUrl, @Nullable String managingEditor, @Nullable ImageRef image, ItunesInfo itunes,
		List<Entry> items, Map<String, Object> raw) {

	public Feed {
		items = List.copyOf(items);
	}

	/**
	 * Returns a copy of this feed with the given raw element graph attached.
	 * @param raw the raw channel graph
	 * @return the augmented feed
	 */
	public Feed withRaw(Map<String, Object> raw) {
		return new Feed(title, description, link, feedUrl, managingEditor, image, itunes, items, raw);
	}

}
