package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an {@link EpisodeProcessor} over selected entries with a bounded number of
 * concurrent workers.
 *
 * <p>
 * Entries are submitted in selection order; outcomes are collected in completion
 * order. A worker that throws is counted as a failed entry and never aborts its
 * siblings.
 */
public class DownloadScheduler {

	private static final Logger logger = LoggerFactory.getLogger(DownloadScheduler.class);

	public static final int MIN_THREADS = 1;

	public static final int MAX_THREADS = 32;

	private final EpisodeProcessor processor;

	public DownloadScheduler(EpisodeProcessor processor) {
		this.processor = processor;
	}

	/**
	 * Process all entries and wait for completion.
	 * @param entries selected entries in selection order
	 * @param concurrency number of workers, 1 to 32
	 * @return aggregated summary
	 * @throws IllegalArgumentException if concurrency is out of range
	 */
	public DownloadSummary runAll(List<SelectedEntry> entries, int concurrency) {
		if (concurrency < MIN_THREADS || concurrency > MAX_THREADS) {
			throw new IllegalArgumentException(
					"threads must be between " + MIN_THREADS + " and " + MAX_THREADS + ": " + concurrency);
		}
		if (entries.isEmpty()) {
			return new DownloadSummary(0, 0, false);
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(concurrency, entries.size()),
				new WorkerThreadFactory());
		try {
			CompletionService<DownloadOutcome> completion = new ExecutorCompletionService<>(executor);
			for (int i = 0; i < entries.size(); i++) {
				SelectedEntry entry = entries.get(i);
				String marker = marker(entry, i, concurrency);
				completion.submit(() -> processor.process(entry, marker));
			}

			int succeeded = 0;
			boolean hadErrors = false;
			for (int i = 0; i < entries.size(); i++) {
				DownloadOutcome outcome = await(completion);
				if (outcome == null) {
					hadErrors = true;
					continue;
				}
				logger.debug("{} | Finished with {}", outcome.marker(), outcome.status());
				if (outcome.status().isSuccess()) {
					succeeded++;
				}
				if (outcome.hasErrors()) {
					hadErrors = true;
				}
			}
			return new DownloadSummary(succeeded, entries.size(), hadErrors);
		}
		finally {
			executor.shutdownNow();
		}
	}

	/**
	 * Log prefix of an entry: its title, preceded by the worker slot when more than one
	 * worker runs.
	 * @param entry the entry
	 * @param index submission index
	 * @param concurrency number of workers
	 * @return the marker
	 */
	static String marker(SelectedEntry entry, int index, int concurrency) {
		String title = entry.entry().title() != null ? entry.entry().title() : "Episode " + (index + 1);
		return concurrency > 1 ? "[" + (index % concurrency) + "] " + title : title;
	}

	@Nullable
	private static DownloadOutcome await(CompletionService<DownloadOutcome> completion) {
		try {
			return completion.take().get();
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			logger.error("Worker failed: {}", cause.getMessage(), cause);
			return null;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for downloads", e);
		}
	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "download-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
