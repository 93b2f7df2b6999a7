package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{token}}} templates into file and folder names.
 *
 * <p>
 * Episode templates support {@code title}, {@code release_date} ({@code yyyyMMdd}),
 * {@code release_year}, {@code release_month}, {@code release_day}, {@code episode_num},
 * {@code url}, {@code podcast_title}, {@code podcast_link}, {@code duration} and
 * {@code guid}. Folder templates support {@code podcast_title} and {@code podcast_link}.
 * Unknown tokens are left untouched.
 */
public class FilenameTemplate {

	private static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*([a-z_]+)\\s*}}");

	private static final Pattern ILLEGAL_CHARACTERS = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

	static final int MAX_NAME_LENGTH = 255;

	private final ZoneId zone;

	public FilenameTemplate() {
		this(ZoneOffset.UTC);
	}

	/**
	 * Create a template renderer.
	 * @param zone zone in which publish instants are turned into calendar dates
	 */
	public FilenameTemplate(ZoneId zone) {
		this.zone = zone;
	}

	/**
	 * Remove characters that are not allowed in file names.
	 * @param name the raw name
	 * @return the sanitized name, at most 255 characters
	 */
	public static String safeName(String name) {
		String cleaned = ILLEGAL_CHARACTERS.matcher(name).replaceAll("");
		cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
		if (cleaned.length() > MAX_NAME_LENGTH) {
			cleaned = cleaned.substring(0, MAX_NAME_LENGTH);
		}
		int end = cleaned.length();
		while (end > 0 && (cleaned.charAt(end - 1) == '.' || cleaned.charAt(end - 1) == ' ')) {
			end--;
		}
		return cleaned.substring(0, end);
	}

	/**
	 * Render an output folder template. Path separators in the template are kept; only
	 * the substituted values are sanitized.
	 * @param feed the feed
	 * @param template e.g. {@code ./{{podcast_title}}}
	 * @return the rendered path
	 */
	public String folderName(Feed feed, String template) {
		Map<String, String> values = new LinkedHashMap<>();
		values.put("podcast_title", safeName(nullToEmpty(feed.title())));
		values.put("podcast_link", safeName(nullToEmpty(feed.link())));
		return render(template, values);
	}

	/**
	 * Render an episode file name.
	 * @param entry the entry
	 * @param feed the feed the entry belongs to
	 * @param originalIndex position of the entry in the feed
	 * @param url the media URL, if any
	 * @param extension extension appended after sanitizing, including the dot
	 * @param template e.g. {@code {{release_date}}-{{title}}}
	 * @return the file name
	 */
	public String episodeFilename(Entry entry, Feed feed, int originalIndex, @Nullable String url, String extension,
			String template) {
		Instant published = entry.publishedAt();
		ZonedDateTime date = published != null ? published.atZone(zone) : null;
		int feedSize = feed.items().size();
		int width = String.valueOf(feedSize).length();

		Map<String, String> values = new LinkedHashMap<>();
		values.put("title", nullToEmpty(entry.title()));
		values.put("release_date", date != null ? DATE.format(date) : "");
		values.put("release_year", date != null ? String.valueOf(date.getYear()) : "");
		values.put("release_month", date != null ? String.format("%02d", date.getMonthValue()) : "");
		values.put("release_day", date != null ? String.format("%02d", date.getDayOfMonth()) : "");
		values.put("episode_num", String.format("%0" + width + "d", feedSize - originalIndex));
		values.put("url", nullToEmpty(url));
		values.put("podcast_title", nullToEmpty(feed.title()));
		values.put("podcast_link", nullToEmpty(feed.link()));
		values.put("duration", nullToEmpty(entry.itunes().duration()));
		values.put("guid", nullToEmpty(entry.guid()));
		return safeName(render(template, values)) + extension;
	}

	/**
	 * Name used to build archive keys: {@code yyyyMMdd-{name}{ext}}, or
	 * {@code {name}{ext}} when there is no publish date.
	 * @param publishedAt publish instant, if known
	 * @param name usually the entry title
	 * @param extension extension including the dot, if any
	 * @return the archive file name
	 */
	public String archiveFilename(@Nullable Instant publishedAt, @Nullable String name, @Nullable String extension) {
		String base = nullToEmpty(name) + nullToEmpty(extension);
		if (publishedAt == null) {
			return base;
		}
		return DATE.format(publishedAt.atZone(zone)) + "-" + base;
	}

	/**
	 * Strip the last extension of a file name.
	 * @param filename e.g. {@code episode.mp3}
	 * @return e.g. {@code episode}
	 */
	public static String baseName(String filename) {
		int dot = filename.lastIndexOf('.');
		return dot > 0 ? filename.substring(0, dot) : filename;
	}

	private static String render(String template, Map<String, String> values) {
		Matcher matcher = TOKEN.matcher(template);
		StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			String value = values.get(matcher.group(1));
			matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	private static String nullToEmpty(@Nullable String value) {
		return value != null ? value : "";
	}

}
