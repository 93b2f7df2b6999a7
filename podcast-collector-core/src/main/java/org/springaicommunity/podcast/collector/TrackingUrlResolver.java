package org.springaicommunity.podcast.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Strips analytics redirect prefixes from media URLs.
 *
 * <p>
 * Tracking services commonly embed the real media URL in their own path, as in
 * {@code https://tracker.example/p/cdn.example/show/ep1.mp3}. Every path suffix
 * following a {@code /} is a candidate for the embedded URL; the most specific
 * candidates are probed first and the first one answering a HEAD request wins.
 */
public class TrackingUrlResolver {

	private static final Logger logger = LoggerFactory.getLogger(TrackingUrlResolver.class);

	static final int MAX_CANDIDATES = 5;

	private final MediaClient mediaClient;

	private final Duration probeTimeout;

	public TrackingUrlResolver(MediaClient mediaClient, Duration probeTimeout) {
		this.mediaClient = mediaClient;
		this.probeTimeout = probeTimeout;
	}

	/**
	 * Resolve the embedded URL, falling back to the given one.
	 * @param url the media URL
	 * @return the first reachable embedded URL, or {@code url}
	 */
	public String resolve(String url) {
		for (String candidate : candidates(url, MAX_CANDIDATES)) {
			try {
				if (mediaClient.exists(candidate, probeTimeout)) {
					logger.debug("Resolved tracking URL {} to {}", url, candidate);
					return candidate;
				}
			}
			catch (RuntimeException e) {
				logger.debug("Probe of {} failed: {}", candidate, e.getMessage());
			}
		}
		return url;
	}

	/**
	 * Candidate embedded URLs, most specific first.
	 * @param url the media URL
	 * @param max maximum number of candidates
	 * @return candidate URLs, empty if the URL cannot be parsed
	 */
	public static List<String> candidates(String url, int max) {
		String path;
		try {
			path = MediaUrls.toUri(url).getRawPath();
		}
		catch (URISyntaxException e) {
			return List.of();
		}
		if (path == null) {
			return List.of();
		}
		List<String> choices = new ArrayList<>();
		for (int i = 0; i < path.length(); i++) {
			if (path.charAt(i) != '/') {
				continue;
			}
			String embed = path.substring(i + 1);
			if (!embed.startsWith("http")) {
				embed = "https://" + embed;
			}
			choices.add(decode(embed));
		}
		List<String> last = new ArrayList<>(choices.subList(Math.max(choices.size() - max, 0), choices.size()));
		Collections.reverse(last);
		return last;
	}

	private static String decode(String value) {
		try {
			return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
		}
		catch (IllegalArgumentException e) {
			return value;
		}
	}

}
