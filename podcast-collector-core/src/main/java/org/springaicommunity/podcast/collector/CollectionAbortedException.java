package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

/**
 * Fatal condition that stops a run before any episode is processed, such as an
 * unreachable feed or a selection without entries.
 */
public class CollectionAbortedException extends RuntimeException {

	private final ExitStatus exitStatus;

	public CollectionAbortedException(String message) {
		this(message, ExitStatus.GENERAL_ERROR, null);
	}

	public CollectionAbortedException(String message, ExitStatus exitStatus, @Nullable Throwable cause) {
		super(message, cause);
		this.exitStatus = exitStatus;
	}

	public ExitStatus getExitStatus() {
		return exitStatus;
	}

}
