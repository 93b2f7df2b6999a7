package org.springaicommunity.podcast.collector;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Builds archive keys of the form {@code {feedIdentity}-{artifactFilename}}.
 *
 * <p>
 * Keys depend only on the feed URL and the artifact name, so the same feed and entry
 * always produce the same key regardless of run order or concurrency.
 */
public final class ArchiveKeys {

	private ArchiveKeys() {
	}

	/**
	 * Build an archive key.
	 * @param prefix the feed identity
	 * @param name the artifact filename
	 * @return the archive key
	 */
	public static String key(String prefix, String name) {
		return prefix + "-" + name;
	}

	/**
	 * Derive the feed identity (host followed by path) from a feed URL.
	 * @param feedUrl the feed URL
	 * @return the feed identity, e.g. {@code example.com/feed.xml}
	 * @throws IllegalArgumentException if the URL is not absolute
	 */
	public static String feedIdentity(String feedUrl) {
		try {
			URI uri = MediaUrls.toUri(feedUrl);
			if (uri.getHost() == null) {
				throw new IllegalArgumentException("Feed URL must be absolute: " + feedUrl);
			}
			String path = uri.getRawPath() != null ? uri.getRawPath() : "";
			return uri.getHost() + path;
		}
		catch (URISyntaxException e) {
			throw new IllegalArgumentException("Invalid feed URL: " + feedUrl, e);
		}
	}

}
