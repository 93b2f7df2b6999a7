package org.springaicommunity.podcast.collector;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Feed and output locations
	public String url;

	public String outDir;

	public String episodeTemplate;

	public boolean archive = false;

	public String archivePath = null; // null = default archive location

	// Metadata: null = not requested, empty = default rules
	public List<String> feedMetaRules = null;

	public List<String> episodeMetaRules = null;

	public MetadataFormat metadataFormat = MetadataFormat.JSON;

	public boolean includeEpisodeImages = false;

	// Selection
	public int offset = 0;

	public Integer limit = null; // null = unlimited

	public String episodeRegex = null;

	public LocalDate after = null;

	public LocalDate before = null;

	public boolean reverse = false;

	// ffmpeg post-processing
	public boolean addMp3Metadata = false;

	public String bitrate = null;

	public boolean mono = false;

	// Mode flags
	public boolean override = false;

	public boolean info = false;

	public ListFormat listFormat = null; // null = download instead of listing

	public String exec = null;

	public int threads;

	public boolean filterUrlTracking = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(DownloadProperties defaultProperties) {
		this.outDir = defaultProperties.getOutDirTemplate();
		this.episodeTemplate = defaultProperties.getEpisodeTemplate();
		this.threads = defaultProperties.getThreads();
	}

	/**
	 * Convert to a request for {@link PodcastCollectionService}.
	 * @param workingDirectory directory relative paths are resolved against
	 * @return the request
	 */
	public DownloadRequest toRequest(Path workingDirectory) {
		DownloadRequest.Builder builder = DownloadRequest.builder(url)
			.workingDirectory(workingDirectory)
			.outDirTemplate(outDir)
			.episodeTemplate(episodeTemplate)
			.feedMetaRules(feedMetaRules)
			.episodeMetaRules(episodeMetaRules)
			.metadataFormat(metadataFormat)
			.includeEpisodeImages(includeEpisodeImages)
			.offset(offset)
			.limit(limit)
			.episodeRegex(episodeRegex != null ? Pattern.compile(episodeRegex) : null)
			.after(after)
			.before(before)
			.addMp3Metadata(addMp3Metadata)
			.bitrate(bitrate)
			.mono(mono)
			.override(override)
			.reverse(reverse)
			.info(info)
			.listFormat(listFormat)
			.exec(exec)
			.threads(threads)
			.filterUrlTracking(filterUrlTracking);
		if (archive) {
			builder.archive(archivePath);
		}
		return builder.build();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "url='" + url + '\'' + ", outDir='" + outDir + '\'' + ", episodeTemplate='"
				+ episodeTemplate + '\'' + ", archive=" + archive + ", archivePath='" + archivePath + '\''
				+ ", feedMetaRules=" + feedMetaRules + ", episodeMetaRules=" + episodeMetaRules + ", metadataFormat="
				+ metadataFormat + ", includeEpisodeImages=" + includeEpisodeImages + ", offset=" + offset + ", limit="
				+ limit + ", episodeRegex='" + episodeRegex + '\'' + ", after=" + after + ", before=" + before
				+ ", reverse=" + reverse + ", addMp3Metadata=" + addMp3Metadata + ", bitrate='" + bitrate + '\''
				+ ", mono=" + mono + ", override=" + override + ", info=" + info + ", listFormat=" + listFormat
				+ ", exec='" + exec + '\'' + ", threads=" + threads + ", filterUrlTracking=" + filterUrlTracking
				+ ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
