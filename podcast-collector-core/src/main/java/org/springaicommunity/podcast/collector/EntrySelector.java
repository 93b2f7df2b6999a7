package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides which feed entries a run acts on.
 *
 * <p>
 * Entries are visited from {@code offset} to the end of the feed, or in reverse from
 * {@code size - 1 - offset} down to the first entry. Visited entries pass when they
 * satisfy every configured filter and their archive key is not in the ledger. The
 * result keeps visitation order and is truncated to the limit after filtering.
 */
public class EntrySelector {

	private static final Logger logger = LoggerFactory.getLogger(EntrySelector.class);

	private final MediaUrlResolver mediaUrlResolver;

	private final FilenameTemplate filenameTemplate;

	private final ZoneId zone;

	public EntrySelector(MediaUrlResolver mediaUrlResolver, FilenameTemplate filenameTemplate, ZoneId zone) {
		this.mediaUrlResolver = mediaUrlResolver;
		this.filenameTemplate = filenameTemplate;
		this.zone = zone;
	}

	/**
	 * Select entries of a feed.
	 * @param feed the feed
	 * @param criteria filters to apply
	 * @param context run-scoped values
	 * @return selected entries in visitation order
	 */
	public List<SelectedEntry> select(Feed feed, SelectionCriteria criteria, SelectionContext context) {
		List<Entry> items = feed.items();
		int size = items.size();
		Set<String> archived = context.ledger().keys();
		List<SelectedEntry> selected = new ArrayList<>();

		int start = criteria.reverse() ? size - 1 - criteria.offset() : criteria.offset();
		int step = criteria.reverse() ? -1 : 1;
		for (int i = start; i >= 0 && i < size; i += step) {
			Entry entry = items.get(i);
			if (!matchesFilters(entry, criteria)) {
				continue;
			}
			MediaAsset media = mediaUrlResolver.resolveMedia(entry);
			String key = ArchiveKeys.key(context.archivePrefix(),
					filenameTemplate.archiveFilename(entry.publishedAt(), entry.title(), media.extension()));
			if (archived.contains(key)) {
				logger.debug("Skipping archived entry '{}' ({})", entry.title(), key);
				continue;
			}

			SelectedEntry candidate = new SelectedEntry(entry, i, media, key);
			if (criteria.includeEpisodeImages()) {
				addEpisodeImage(candidate, feed, context);
			}
			selected.add(candidate);
		}

		if (criteria.limit() != null && selected.size() > criteria.limit()) {
			return new ArrayList<>(selected.subList(0, criteria.limit()));
		}
		return selected;
	}

	private boolean matchesFilters(Entry entry, SelectionCriteria criteria) {
		String title = entry.title();
		if (criteria.episodePattern() != null && title != null
				&& !criteria.episodePattern().matcher(title).find()) {
			return false;
		}
		if (criteria.before() == null && criteria.after() == null) {
			return true;
		}
		LocalDate day = publishedDay(entry);
		if (day == null) {
			return false;
		}
		if (criteria.before() != null && day.isAfter(criteria.before())) {
			return false;
		}
		return criteria.after() == null || !day.isBefore(criteria.after());
	}

	@Nullable
	private LocalDate publishedDay(Entry entry) {
		Instant published = entry.publishedAt();
		return published != null ? published.atZone(zone).toLocalDate() : null;
	}

	private void addEpisodeImage(SelectedEntry candidate, Feed feed, SelectionContext context) {
		Entry entry = candidate.entry();
		String imageUrl = mediaUrlResolver.imageUrl(entry);
		if (imageUrl == null) {
			return;
		}
		String extension = mediaUrlResolver.urlExtension(imageUrl);
		String key = ArchiveKeys.key(context.archivePrefix(),
				filenameTemplate.archiveFilename(entry.publishedAt(), entry.title(), extension));
		String imageName = filenameTemplate.episodeFilename(entry, feed, candidate.originalIndex(),
				candidate.media().url(), extension, context.episodeTemplate());
		Path directory = context.basePath();
		if (entry.guid() != null && !FilenameTemplate.safeName(entry.guid()).isEmpty()) {
			directory = directory.resolve(FilenameTemplate.safeName(entry.guid()));
		}
		candidate.addSecondaryDownload(new SecondaryDownload(imageUrl, directory.resolve(imageName), key));
	}

}
