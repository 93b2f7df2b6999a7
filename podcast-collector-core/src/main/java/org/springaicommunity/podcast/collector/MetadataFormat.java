package org.springaicommunity.podcast.collector;

import java.util.Locale;

/**
 * File formats for metadata sidecar files.
 */
public enum MetadataFormat {

	JSON, XML;

	/**
	 * File extension without the dot.
	 * @return {@code json} or {@code xml}
	 */
	public String extension() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Parse a format name, ignoring case.
	 * @param value {@code json} or {@code xml}
	 * @return the format
	 * @throws IllegalArgumentException for any other value
	 */
	public static MetadataFormat fromString(String value) {
		for (MetadataFormat format : values()) {
			if (format.extension().equalsIgnoreCase(value)) {
				return format;
			}
		}
		throw new IllegalArgumentException(value + " is an invalid format for --metadata-format. Use \"json\" or \"xml\"");
	}

}
