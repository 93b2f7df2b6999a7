package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parameters of one collection run.
 *
 * <p>
 * Template values left null fall back to {@link DownloadProperties}. A null rule list
 * disables the corresponding metadata file; an empty list selects the default rules.
 *
 * @param url feed URL
 * @param workingDirectory directory relative paths are resolved against
 * @param outDirTemplate output directory template
 * @param archiveEnabled whether an archive ledger is used
 * @param archiveTemplate archive path template; null selects the default location
 * @param episodeTemplate episode file name template
 * @param feedMetaRules field rules of the feed metadata file
 * @param episodeMetaRules field rules of episode metadata files
 * @param metadataFormat format of metadata files
 * @param includeEpisodeImages download episode images
 * @param offset entries skipped at the start
 * @param limit maximum number of entries, or null
 * @param episodeRegex title filter, or null
 * @param after earliest publish day, inclusive
 * @param before latest publish day, inclusive
 * @param addMp3Metadata embed tags with ffmpeg
 * @param bitrate ffmpeg target bitrate, or null
 * @param mono downmix to mono with ffmpeg
 * @param override replace existing local files
 * @param reverse process the oldest entries first
 * @param info only print feed information
 * @param listFormat print the selected episodes in this format instead of downloading
 * @param exec command run after each episode, or null
 * @param threads number of concurrent downloads
 * @param filterUrlTracking resolve tracking redirect URLs
 */
public record DownloadRequest(String url, Path workingDirectory, @Nullable String outDirTemplate,
		boolean archiveEnabled, @Nullable String archiveTemplate, @Nullable String episodeTemplate,
		@Nullable List<String> feedMetaRules, @Nullable List<String> episodeMetaRules, MetadataFormat metadataFormat,
		boolean includeEpisodeImages, int offset, @Nullable Integer limit, @Nullable Pattern episodeRegex,
		@Nullable LocalDate after, @Nullable LocalDate before, boolean addMp3Metadata, @Nullable String bitrate,
		boolean mono, boolean override, boolean reverse, boolean info, @Nullable ListFormat listFormat,
		@Nullable String exec, int threads, boolean filterUrlTracking) {

	public static Builder builder(String url) {
		return new Builder(url);
	}

	/**
	 * Selection criteria described by this request.
	 * @return the criteria
	 */
	public SelectionCriteria toCriteria() {
		return new SelectionCriteria(offset, limit, reverse, episodeRegex, before, after, includeEpisodeImages);
	}

	/**
	 * Requested ffmpeg adjustments.
	 * @return the audio options
	 */
	public FfmpegCommandBuilder.AudioOptions audioOptions() {
		return new FfmpegCommandBuilder.AudioOptions(bitrate, mono, addMp3Metadata);
	}

	/**
	 * Builder for {@link DownloadRequest}; every option defaults to off.
	 */
	public static final class Builder {

		private final String url;

		private Path workingDirectory = Path.of("").toAbsolutePath();

		@Nullable
		private String outDirTemplate;

		private boolean archiveEnabled;

		@Nullable
		private String archiveTemplate;

		@Nullable
		private String episodeTemplate;

		@Nullable
		private List<String> feedMetaRules;

		@Nullable
		private List<String> episodeMetaRules;

		private MetadataFormat metadataFormat = MetadataFormat.JSON;

		private boolean includeEpisodeImages;

		private int offset;

		@Nullable
		private Integer limit;

		@Nullable
		private Pattern episodeRegex;

		@Nullable
		private LocalDate after;

		@Nullable
		private LocalDate before;

		private boolean addMp3Metadata;

		@Nullable
		private String bitrate;

		private boolean mono;

		private boolean override;

		private boolean reverse;

		private boolean info;

		@Nullable
		private ListFormat listFormat;

		@Nullable
		private String exec;

		private int threads = 1;

		private boolean filterUrlTracking;

		private Builder(String url) {
			this.url = url;
		}

		public Builder workingDirectory(Path workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		public Builder outDirTemplate(@Nullable String outDirTemplate) {
			this.outDirTemplate = outDirTemplate;
			return this;
		}

		/**
		 * Enable the archive ledger.
		 * @param archiveTemplate path template, or null for the default location
		 * @return this builder
		 */
		public Builder archive(@Nullable String archiveTemplate) {
			this.archiveEnabled = true;
			this.archiveTemplate = archiveTemplate;
			return this;
		}

		public Builder episodeTemplate(@Nullable String episodeTemplate) {
			this.episodeTemplate = episodeTemplate;
			return this;
		}

		public Builder feedMetaRules(@Nullable List<String> feedMetaRules) {
			this.feedMetaRules = feedMetaRules;
			return this;
		}

		public Builder episodeMetaRules(@Nullable List<String> episodeMetaRules) {
			this.episodeMetaRules = episodeMetaRules;
			return this;
		}

		public Builder metadataFormat(MetadataFormat metadataFormat) {
			this.metadataFormat = metadataFormat;
			return this;
		}

		public Builder includeEpisodeImages(boolean includeEpisodeImages) {
			this.includeEpisodeImages = includeEpisodeImages;
			return this;
		}

		public Builder offset(int offset) {
			this.offset = offset;
			return this;
		}

		public Builder limit(@Nullable Integer limit) {
			this.limit = limit;
			return this;
		}

		public Builder episodeRegex(@Nullable Pattern episodeRegex) {
			this.episodeRegex = episodeRegex;
			return this;
		}

		public Builder after(@Nullable LocalDate after) {
			this.after = after;
			return this;
		}

		public Builder before(@Nullable LocalDate before) {
			this.before = before;
			return this;
		}

		public Builder addMp3Metadata(boolean addMp3Metadata) {
			this.addMp3Metadata = addMp3Metadata;
			return this;
		}

		public Builder bitrate(@Nullable String bitrate) {
			this.bitrate = bitrate;
			return this;
		}

		public Builder mono(boolean mono) {
			this.mono = mono;
			return this;
		}

		public Builder override(boolean override) {
			this.override = override;
			return this;
		}

		public Builder reverse(boolean reverse) {
			this.reverse = reverse;
			return this;
		}

		public Builder info(boolean info) {
			this.info = info;
			return this;
		}

		public Builder listFormat(@Nullable ListFormat listFormat) {
			this.listFormat = listFormat;
			return this;
		}

		public Builder exec(@Nullable String exec) {
			this.exec = exec;
			return this;
		}

		public Builder threads(int threads) {
			this.threads = threads;
			return this;
		}

		public Builder filterUrlTracking(boolean filterUrlTracking) {
			this.filterUrlTracking = filterUrlTracking;
			return this;
		}

		public DownloadRequest build() {
			return new DownloadRequest(url, workingDirectory, outDirTemplate, archiveEnabled, archiveTemplate,
					episodeTemplate, feedMetaRules, episodeMetaRules, metadataFormat, includeEpisodeImages, offset,
					limit, episodeRegex, after, before, addMp3Metadata, bitrate, mono, override, reverse, info,
					listFormat, exec, threads, filterUrlTracking);
		}

	}

}
