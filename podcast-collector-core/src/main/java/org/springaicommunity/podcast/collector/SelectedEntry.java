package org.springaicommunity.podcast.collector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An entry chosen by {@link EntrySelector}, annotated with selection-time data that is not
 * part of the feed document itself.
 */
public final class SelectedEntry {

	private final Entry entry;

	private final int originalIndex;

	private final MediaAsset media;

	private final String archiveKey;

	private final List<SecondaryDownload> secondaryDownloads = new ArrayList<>();

	public SelectedEntry(Entry entry, int originalIndex, MediaAsset media, String archiveKey) {
		this.entry = entry;
		this.originalIndex = originalIndex;
		this.media = media;
		this.archiveKey = archiveKey;
	}

	public Entry entry() {
		return entry;
	}

	/**
	 * Position of the entry in the untouched feed item list.
	 * @return the original index
	 */
	public int originalIndex() {
		return originalIndex;
	}

	public MediaAsset media() {
		return media;
	}

	/**
	 * Archive key of the primary media asset.
	 * @return the archive key
	 */
	public String archiveKey() {
		return archiveKey;
	}

	public List<SecondaryDownload> secondaryDownloads() {
		return Collections.unmodifiableList(secondaryDownloads);
	}

	void addSecondaryDownload(SecondaryDownload download) {
		secondaryDownloads.add(download);
	}

	/**
	 * Episode number counted from the oldest entry, e.g. 1 for the last item of the feed.
	 * @param feedSize number of items in the feed
	 * @return the episode number
	 */
	public int episodeNumber(int feedSize) {
		return feedSize - originalIndex;
	}

	@Override
	public String toString() {
		return "SelectedEntry{" + "title='" + entry.title() + '\'' + ", originalIndex=" + originalIndex
				+ ", archiveKey='" + archiveKey + '\'' + ", secondaryDownloads=" + secondaryDownloads.size() + '}';
	}

}
