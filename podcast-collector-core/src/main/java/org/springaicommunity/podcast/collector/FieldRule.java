package org.springaicommunity.podcast.collector;

import java.util.regex.Pattern;

/**
 * A single include or exclude rule matched against dotted key paths such as
 * {@code enclosure.url}.
 *
 * <p>
 * Rule syntax:
 * <ul>
 * <li>{@code !pattern} excludes matching paths</li>
 * <li>{@code \!pattern} includes paths matching a pattern that starts with {@code !}</li>
 * <li>{@code **} matches one or more characters across segments</li>
 * <li>{@code *} matches one or more characters within a segment (no dots)</li>
 * </ul>
 *
 * @param include whether matching paths are kept
 * @param pattern the anchored pattern compiled from the glob
 */
public record FieldRule(boolean include, Pattern pattern) {

	/**
	 * Parse a rule string.
	 * @param rule the rule, e.g. {@code title}, {@code !raw.**}, {@code itunes.*}
	 * @return the compiled rule
	 */
	public static FieldRule parse(String rule) {
		boolean include = true;
		String glob = rule;
		if (glob.startsWith("!")) {
			include = false;
			glob = glob.substring(1);
		}
		else if (glob.startsWith("\\!")) {
			glob = glob.substring(1);
		}
		return new FieldRule(include, globToPattern(glob));
	}

	/**
	 * Whether this rule applies to the given key path.
	 * @param keyPath dotted key path
	 * @return true if the pattern matches the whole path
	 */
	public boolean matches(String keyPath) {
		return pattern.matcher(keyPath).matches();
	}

	static Pattern globToPattern(String glob) {
		StringBuilder regex = new StringBuilder();
		StringBuilder literal = new StringBuilder();
		int i = 0;
		while (i < glob.length()) {
			char c = glob.charAt(i);
			if (c == '*') {
				flushLiteral(literal, regex);
				if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
					regex.append(".+");
					i += 2;
				}
				else {
					regex.append("[^.]+");
					i++;
				}
			}
			else {
				literal.append(c);
				i++;
			}
		}
		flushLiteral(literal, regex);
		return Pattern.compile("^" + regex + "$");
	}

	private static void flushLiteral(StringBuilder literal, StringBuilder regex) {
		if (literal.length() > 0) {
			regex.append(Pattern.quote(literal.toString()));
			literal.setLength(0);
		}
	}

	@Override
	public String toString() {
		return (include ? "+" : "-") + pattern.pattern();
	}

}
