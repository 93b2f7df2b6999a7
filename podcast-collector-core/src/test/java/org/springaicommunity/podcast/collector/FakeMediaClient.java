package org.springaicommunity.podcast.collector;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link MediaClient} serving fixed bodies by URL. Unknown URLs answer 404.
 */
class FakeMediaClient implements MediaClient {

	private final Map<String, byte[]> bodies = new ConcurrentHashMap<>();

	private final List<String> requests = new CopyOnWriteArrayList<>();

	FakeMediaClient serve(String url, String body) {
		bodies.put(url, body.getBytes(StandardCharsets.UTF_8));
		return this;
	}

	FakeMediaClient serve(String url, byte[] body) {
		bodies.put(url, body);
		return this;
	}

	List<String> requests() {
		return requests;
	}

	@Override
	public byte[] fetch(String url) {
		requests.add(url);
		byte[] body = bodies.get(url);
		if (body == null) {
			throw new MediaClientException("GET " + url + " failed with status 404", 404);
		}
		return body;
	}

	@Override
	public long download(String url, Path target) {
		byte[] body = fetch(url);
		try {
			Files.write(target, body);
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return body.length;
	}

	@Override
	public boolean exists(String url, Duration timeout) {
		return bodies.containsKey(url);
	}

}
