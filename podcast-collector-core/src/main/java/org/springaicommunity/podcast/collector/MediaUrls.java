package org.springaicommunity.podcast.collector;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

/**
 * Parses URLs as they appear in real feeds, which often carry unencoded spaces or other
 * characters that {@link URI} rejects.
 */
public final class MediaUrls {

	private MediaUrls() {
	}

	/**
	 * Parse a URL, percent-encoding characters that are not legal in a URI.
	 * @param url the URL, possibly with surrounding whitespace
	 * @return the parsed URI
	 * @throws URISyntaxException if the value is not a URL even after encoding
	 */
	public static URI toUri(String url) throws URISyntaxException {
		String trimmed = url.trim();
		try {
			return new URI(trimmed);
		}
		catch (URISyntaxException e) {
			try {
				URL parsed = new URL(trimmed);
				// The multi-argument constructor quotes illegal characters and keeps existing escapes.
				return new URI(parsed.getProtocol(), parsed.getUserInfo(), parsed.getHost(), parsed.getPort(),
						parsed.getPath(), parsed.getQuery(), parsed.getRef());
			}
			catch (MalformedURLException | URISyntaxException retry) {
				e.addSuppressed(retry);
				throw e;
			}
		}
	}

}
