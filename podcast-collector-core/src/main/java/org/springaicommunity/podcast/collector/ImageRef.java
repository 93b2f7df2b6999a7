package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

/**
 * Image reference of a feed or an item.
 *
 * @param url the image URL
 * @param link the link the image points to, used as a fallback image location
 */
public record ImageRef(@Nullable String url, @Nullable String link) {
}
