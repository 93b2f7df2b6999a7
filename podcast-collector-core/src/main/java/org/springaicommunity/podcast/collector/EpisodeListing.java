package org.springaicommunity.podcast.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints selected episodes instead of downloading them.
 */
public class EpisodeListing {

	private static final String[] HEADERS = { "episodeNum", "title", "pubDate" };

	private final ObjectMapper objectMapper;

	public EpisodeListing(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Build listing rows.
	 * @param feed the feed the entries were selected from
	 * @param selected selected entries
	 * @return one row per entry, numbered from the oldest episode
	 */
	public List<Row> rows(Feed feed, List<SelectedEntry> selected) {
		List<Row> rows = new ArrayList<>(selected.size());
		for (SelectedEntry entry : selected) {
			rows.add(new Row(entry.episodeNumber(feed.items().size()), entry.entry().title(), entry.entry().pubDate()));
		}
		return rows;
	}

	/**
	 * Print rows in the requested format.
	 * @param rows listing rows
	 * @param format output format
	 * @param out destination
	 */
	public void print(List<Row> rows, ListFormat format, PrintStream out) {
		if (format == ListFormat.JSON) {
			try {
				out.println(objectMapper.writeValueAsString(rows));
			}
			catch (JsonProcessingException e) {
				throw new IllegalStateException("Unable to serialize episode listing", e);
			}
		}
		else {
			out.print(renderTable(rows));
		}
	}

	/**
	 * Render rows as a text table with aligned columns.
	 * @param rows listing rows
	 * @return the table, one line per row plus header and separator
	 */
	static String renderTable(List<Row> rows) {
		List<String[]> cells = new ArrayList<>();
		cells.add(HEADERS);
		for (Row row : rows) {
			cells.add(new String[] { String.valueOf(row.episodeNum()), nullToEmpty(row.title()),
					nullToEmpty(row.pubDate()) });
		}
		int[] widths = new int[HEADERS.length];
		for (String[] line : cells) {
			for (int i = 0; i < line.length; i++) {
				widths[i] = Math.max(widths[i], line[i].length());
			}
		}

		StringBuilder table = new StringBuilder();
		appendLine(table, cells.get(0), widths);
		for (int i = 0; i < widths.length; i++) {
			table.append(i == 0 ? "" : "-+-").append("-".repeat(widths[i]));
		}
		table.append('\n');
		for (int i = 1; i < cells.size(); i++) {
			appendLine(table, cells.get(i), widths);
		}
		return table.toString();
	}

	private static void appendLine(StringBuilder table, String[] line, int[] widths) {
		StringBuilder text = new StringBuilder();
		for (int i = 0; i < line.length; i++) {
			if (i > 0) {
				text.append(" | ");
			}
			text.append(line[i]).append(" ".repeat(widths[i] - line[i].length()));
		}
		table.append(text.toString().stripTrailing()).append('\n');
	}

	private static String nullToEmpty(@Nullable String value) {
		return value != null ? value : "";
	}

	/**
	 * One listed episode.
	 *
	 * @param episodeNum episode number counted from the oldest entry
	 * @param title episode title
	 * @param pubDate publish date as written in the feed
	 */
	public record Row(int episodeNum, @Nullable String title, @Nullable String pubDate) {

	}

}
