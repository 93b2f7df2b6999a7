package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

/**
 * Media enclosure of a feed item.
 *
 * @param url the enclosure URL
 * @param type the declared MIME type
 * @param length the declared length in bytes, or 0 if not declared
 */
public record Enclosure(String url, @Nullable String type, long length) {
}
