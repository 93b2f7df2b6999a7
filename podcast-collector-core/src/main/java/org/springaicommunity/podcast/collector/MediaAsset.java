package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

/**
 * Resolved primary media location of an entry.
 *
 * @param url the media URL, or null if none could be resolved
 * @param extension the file extension including the leading dot, or null
 */
public record MediaAsset(@Nullable String url, @Nullable String extension) {

	/**
	 * Marker for an entry without a downloadable media asset.
	 */
	public static final MediaAsset NONE = new MediaAsset(null, null);

	public boolean isResolved() {
		return url != null;
	}

	/**
	 * Returns the extension, or an empty string when unresolved.
	 * @return the extension
	 */
	public String extensionOrEmpty() {
		return extension != null ? extension : "";
	}

}
