package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * One feed item (an episode).
 *
 * @param title the episode title
 * @param link the item link
 * @param pubDate the publish date as written in the feed
 * @param isoDate the publish date as an ISO-8601 instant
 * @param guid the unique identifier of the item
 * @param creator the item author
 * @param content the full item content or description
 * @param contentSnippet the content with markup removed
 * @param enclosure the media enclosure
 * @param image an item-level image reference
 * @param itunes iTunes namespace values of the item
 * @param raw the item element as a map graph ({@code $} attributes, {@code _} text)
 */
public record Entry(@Nullable String title, @Nullable String link, @Nullable String pubDate,
		@Nullable String isoDate, @Nullable String guid, @Nullable String creator, @Nullable String content,
		@Nullable String contentSnippet, @Nullable Enclosure enclosure, @Nullable ImageRef image, ItunesInfo itunes,
		Map<String, Object> raw) {

	/**
	 * Returns the publish instant, or null if the entry has no parseable date.
	 * @return the publish instant
	 */
	@Nullable
	public Instant publishedAt() {
		if (isoDate == null) {
			return null;
		}
		try {
			return Instant.parse(isoDate);
		}
		catch (DateTimeParseException e) {
			return null;
		}
	}

	/**
	 * Returns a copy of this entry with the given raw element graph attached.
	 * @param raw the raw item graph
	 * @return the augmented entry
	 */
	public Entry withRaw(Map<String, Object> raw) {
		return new Entry(title, link, pubDate, isoDate, guid, creator, content, contentSnippet, enclosure, image,
				itunes, raw);
	}

}
