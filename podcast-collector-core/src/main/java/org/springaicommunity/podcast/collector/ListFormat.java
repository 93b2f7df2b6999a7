package org.springaicommunity.podcast.collector;

import java.util.Locale;

/**
 * Output formats of the episode listing.
 */
public enum ListFormat {

	TABLE, JSON;

	/**
	 * Parse a format name, ignoring case.
	 * @param value {@code table} or {@code json}
	 * @return the format
	 * @throws IllegalArgumentException for any other value
	 */
	public static ListFormat fromString(String value) {
		for (ListFormat format : values()) {
			if (format.name().equalsIgnoreCase(value)) {
				return format;
			}
		}
		throw new IllegalArgumentException(value + " is an invalid format for --list. Use \"table\" or \"json\"");
	}

	@Override
	public String toString() {
		return name().toLowerCase(Locale.ROOT);
	}

}
