package org.springaicommunity.podcast.collector;

/**
 * Failure of an external command run after a download (ffmpeg or the user hook).
 */
public class PostProcessingException extends RuntimeException {

	public PostProcessingException(String message) {
		super(message);
	}

	public PostProcessingException(String message, Throwable cause) {
		super(message, cause);
	}

}
