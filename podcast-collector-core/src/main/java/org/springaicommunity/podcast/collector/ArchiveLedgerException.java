package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Thrown when the archive ledger cannot be read or written.
 *
 * <p>
 * A ledger that exists but cannot be parsed aborts the run: treating it as empty would
 * re-download everything and lose the recorded provenance.
 */
public class ArchiveLedgerException extends RuntimeException {

	private final Path path;

	public ArchiveLedgerException(String message, Path path, @Nullable Throwable cause) {
		super(message + ": " + path, cause);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

}
