package org.springaicommunity.podcast.collector;

/**
 * Supplies parsed feeds.
 */
public interface FeedSource {

	/**
	 * Fetch and parse a feed.
	 * @param url absolute feed URL
	 * @return the parsed feed
	 * @throws CollectionAbortedException if the feed cannot be fetched or parsed
	 */
	Feed fetch(String url);

}
