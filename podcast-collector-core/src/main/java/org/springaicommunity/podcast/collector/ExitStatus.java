package org.springaicommunity.podcast.collector;

/**
 * Process exit codes reported by the collector.
 */
public enum ExitStatus {

	SUCCESS(0),

	/**
	 * The run was aborted before or while starting work.
	 */
	GENERAL_ERROR(1),

	/**
	 * Work ran but no episode was downloaded.
	 */
	NOTHING_DOWNLOADED(2),

	/**
	 * Some episodes were downloaded, others failed.
	 */
	COMPLETED_WITH_ERRORS(3);

	private final int code;

	ExitStatus(int code) {
		this.code = code;
	}

	public int code() {
		return code;
	}

}
