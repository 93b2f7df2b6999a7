package org.springaicommunity.podcast.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * {@link MediaClient} backed by the JDK {@link HttpClient}. Follows redirects.
 */
public class HttpMediaClient implements MediaClient {

	private static final Logger logger = LoggerFactory.getLogger(HttpMediaClient.class);

	/**
	 * User agent sent when none is configured.
	 */
	public static final String DEFAULT_USER_AGENT = "podcast-collector";

	private final HttpClient httpClient;

	private final String userAgent;

	public HttpMediaClient() {
		this(Duration.ofSeconds(30), DEFAULT_USER_AGENT);
	}

	public HttpMediaClient(Duration connectTimeout, String userAgent) {
		this.userAgent = userAgent;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public byte[] fetch(String url) {
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();
		HttpResponse<byte[]> response = send(newRequest(url).GET().build(), HttpResponse.BodyHandlers.ofByteArray());
		checkStatus(url, response.statusCode());
		logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
				response.body().length);
		return response.body();
	}

	@Override
	public long download(String url, Path target) {
		logger.debug("GET {} -> {}", url, target);
		long start = System.currentTimeMillis();
		HttpResponse<InputStream> response = send(newRequest(url).GET().build(),
				HttpResponse.BodyHandlers.ofInputStream());
		try (InputStream body = response.body()) {
			checkStatus(url, response.statusCode());
			long written = Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start, written);
			return written;
		}
		catch (IOException e) {
			throw new MediaClientException("Download failed: " + e.getMessage(), e);
		}
	}

	@Override
	public boolean exists(String url, Duration timeout) {
		HttpRequest request = newRequest(url).timeout(timeout)
			.method("HEAD", HttpRequest.BodyPublishers.noBody())
			.build();
		HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());
		logger.debug("HEAD {} returned {}", url, response.statusCode());
		return response.statusCode() >= 200 && response.statusCode() < 300;
	}

	private HttpRequest.Builder newRequest(String url) {
		try {
			return HttpRequest.newBuilder().uri(MediaUrls.toUri(url)).header("User-Agent", userAgent);
		}
		catch (URISyntaxException | IllegalArgumentException e) {
			throw new MediaClientException("Invalid URL: " + url, MediaClientException.INVALID_REQUEST, e);
		}
	}

	private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
		try {
			return httpClient.send(request, handler);
		}
		catch (IOException e) {
			throw new MediaClientException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new MediaClientException("HTTP request interrupted", e);
		}
	}

	private static void checkStatus(String url, int statusCode) {
		if (statusCode >= 200 && statusCode < 300) {
			return;
		}
		if (statusCode == 404) {
			throw new MediaClientException("Not found: " + url, statusCode);
		}
		if (statusCode == 429) {
			throw new MediaClientException("Too Many Requests (429): " + url, statusCode);
		}
		throw new MediaClientException("HTTP error " + statusCode + ": " + url, statusCode);
	}

}
