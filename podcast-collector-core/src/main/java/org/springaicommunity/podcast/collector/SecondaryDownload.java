package org.springaicommunity.podcast.collector;

import java.nio.file.Path;

/**
 * A non-primary artifact of an entry, such as the episode image.
 *
 * @param url the source URL
 * @param outputPath where the artifact is written
 * @param archiveKey the key recorded in the archive ledger once downloaded
 */
public record SecondaryDownload(String url, Path outputPath, String archiveKey) {
}
