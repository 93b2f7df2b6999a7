package org.springaicommunity.podcast.collector;

import java.nio.file.Path;

/**
 * Run-scoped values the selector needs besides the criteria.
 *
 * @param archivePrefix feed identity used as archive key prefix
 * @param basePath output directory of the run
 * @param episodeTemplate episode file name template
 * @param ledger archive ledger consulted to exclude handled entries
 */
public record SelectionContext(String archivePrefix, Path basePath, String episodeTemplate, ArchiveLedger ledger) {

}
