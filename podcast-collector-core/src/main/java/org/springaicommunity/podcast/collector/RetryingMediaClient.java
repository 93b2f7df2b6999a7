package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Decorator that adds retry with exponential backoff to a {@link MediaClient}.
 *
 * <p>
 * Transport failures, 429 and 5xx responses are retried; other 4xx responses fail
 * immediately. {@link #exists(String, Duration)} is a best-effort probe and is passed
 * through without retry.
 *
 * <pre>
 * {@code
 * MediaClient client = RetryingMediaClient.builder()
 *     .wrapping(new HttpMediaClient())
 *     .maxRetries(2)
 *     .initialDelay(Duration.ofMillis(500))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingMediaClient implements MediaClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingMediaClient.class);

	private final MediaClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingMediaClient(Builder builder) {
		this.delegate = Objects.requireNonNull(builder.delegate);
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public byte[] fetch(String url) {
		return executeWithRetry(() -> delegate.fetch(url), "GET " + url);
	}

	@Override
	public long download(String url, Path target) {
		return executeWithRetry(() -> delegate.download(url, target), "GET " + url);
	}

	@Override
	public boolean exists(String url, Duration timeout) {
		return delegate.exists(url, timeout);
	}

	private <T> T executeWithRetry(RequestSupplier<T> supplier, String description) {
		long delay = initialDelayMs;
		for (int attempt = 0;; attempt++) {
			try {
				return supplier.get();
			}
			catch (MediaClientException e) {
				if (!e.isTransient() || attempt >= maxRetries) {
					if (attempt > 0) {
						logger.debug("{} failed after {} attempts", description, attempt + 1);
					}
					throw e;
				}
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
						maxRetries + 1, e.getMessage(), delay);
				sleep(delay);
				delay *= 2;
			}
		}
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new MediaClientException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface RequestSupplier<T> {

		T get();

	}

	/**
	 * Builder for {@link RetryingMediaClient}. Defaults: 2 retries, 1 second initial
	 * delay.
	 */
	public static class Builder {

		@Nullable
		private MediaClient delegate;

		private int maxRetries = 2;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the client to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(MediaClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay, doubled on each retry
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Build the RetryingMediaClient.
		 * @return configured client
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingMediaClient build() {
			if (delegate == null) {
				throw new IllegalStateException("delegate client is required - call wrapping()");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be >= 0");
			}
			if (initialDelayMs < 0) {
				throw new IllegalStateException("initialDelay must be >= 0");
			}
			return new RetryingMediaClient(this);
		}

	}

}
