package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Result of a collection run that was not aborted.
 *
 * @param exitStatus status the process should exit with
 * @param summary download summary, or null when only information was printed
 * @param basePath output directory of the run
 */
public record CollectionResult(ExitStatus exitStatus, @Nullable DownloadSummary summary, Path basePath) {

	public static CollectionResult informational(Path basePath) {
		return new CollectionResult(ExitStatus.SUCCESS, null, basePath);
	}

}
