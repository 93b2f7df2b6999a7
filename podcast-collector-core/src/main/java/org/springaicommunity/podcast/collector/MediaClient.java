package org.springaicommunity.podcast.collector;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Interface for HTTP access to feeds and media assets.
 *
 * <p>
 * Provides abstraction over the transport, enabling testability and decorator
 * implementations such as {@link RetryingMediaClient}.
 */
public interface MediaClient {

	/**
	 * Execute a GET request and return the whole body.
	 * @param url absolute URL
	 * @return the response body
	 * @throws MediaClientException if the request fails or returns a non-2xx status
	 */
	byte[] fetch(String url);

	/**
	 * Execute a GET request and stream the body into a file, replacing it if present.
	 * @param url absolute URL
	 * @param target file to write
	 * @return number of bytes written
	 * @throws MediaClientException if the request fails or returns a non-2xx status
	 */
	long download(String url, Path target);

	/**
	 * Probe a URL with a HEAD request.
	 * @param url absolute URL
	 * @param timeout request timeout
	 * @return true if the server answered with a 2xx status
	 * @throws MediaClientException if the request could not be completed
	 */
	boolean exists(String url, Duration timeout);

	/**
	 * Exception thrown when an HTTP request fails.
	 */
	class MediaClientException extends RuntimeException {

		/**
		 * Status used when no request could be built from the URL.
		 */
		public static final int INVALID_REQUEST = 0;

		private final int statusCode;

		public MediaClientException(String message, int statusCode) {
			super(message);
			this.statusCode = statusCode;
		}

		public MediaClientException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
		}

		public MediaClientException(String message, int statusCode, Throwable cause) {
			super(message, cause);
			this.statusCode = statusCode;
		}

		/**
		 * HTTP status of the failed response.
		 * @return the status code, -1 for transport failures, or {@link #INVALID_REQUEST}
		 */
		public int getStatusCode() {
			return statusCode;
		}

		/**
		 * Whether retrying the same request may succeed.
		 * @return true for transport failures, 429 and 5xx responses
		 */
		public boolean isTransient() {
			return statusCode == -1 || statusCode == 429 || statusCode >= 500;
		}

	}

}
