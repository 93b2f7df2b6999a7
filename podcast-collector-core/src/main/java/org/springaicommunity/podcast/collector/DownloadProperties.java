package org.springaicommunity.podcast.collector;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for podcast collection.
 *
 * <p>
 * Holds the defaults applied when a {@link DownloadRequest} leaves a value unset, and the
 * transport settings used by {@link PodcastCollectorBuilder}. Properties can be set
 * directly via setters.
 */
public class DownloadProperties {

	/**
	 * Template of the output directory, relative to the working directory.
	 */
	private String outDirTemplate = "./{{podcast_title}}";

	/**
	 * Template of episode file names, without extension.
	 */
	private String episodeTemplate = "{{release_date}}-{{title}}";

	/**
	 * Archive location used when {@code --archive} is given without a path.
	 */
	private String defaultArchiveTemplate = "./{{podcast_title}}/archive.json";

	/**
	 * Number of concurrent downloads.
	 */
	private int threads = 1;

	/**
	 * HTTP connect timeout in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * Timeout in milliseconds of the HEAD probes used to resolve tracking URLs.
	 */
	private int probeTimeoutMillis = 3000;

	/**
	 * Maximum number of retries for failed feed and media requests.
	 */
	private int maxRetries = 2;

	/**
	 * Delay in milliseconds before the first retry, doubled for each further retry.
	 */
	private long retryDelayMillis = 1000;

	/**
	 * User agent sent with every request.
	 */
	private String userAgent = HttpMediaClient.DEFAULT_USER_AGENT;

	/**
	 * ffmpeg executable, overridden by the {@code FFMPEG_PATH} environment variable.
	 */
	private String ffmpegExecutable = "ffmpeg";

	/**
	 * Field rules for feed metadata when {@code --include-meta} has no rule.
	 */
	private List<String> feedMetaRules = new ArrayList<>(
			List.of("title", "description", "link", "feedUrl", "managingEditor"));

	/**
	 * Field rules for episode metadata when {@code --include-episode-meta} has no rule.
	 */
	private List<String> episodeMetaRules = new ArrayList<>(List.of("title", "contentSnippet", "pubDate", "creator"));

	public String getOutDirTemplate() {
		return outDirTemplate;
	}

	public void setOutDirTemplate(String outDirTemplate) {
		this.outDirTemplate = outDirTemplate;
	}

	public String getEpisodeTemplate() {
		return episodeTemplate;
	}

	public void setEpisodeTemplate(String episodeTemplate) {
		this.episodeTemplate = episodeTemplate;
	}

	public String getDefaultArchiveTemplate() {
		return defaultArchiveTemplate;
	}

	public void setDefaultArchiveTemplate(String defaultArchiveTemplate) {
		this.defaultArchiveTemplate = defaultArchiveTemplate;
	}

	public int getThreads() {
		return threads;
	}

	public void setThreads(int threads) {
		this.threads = threads;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public int getProbeTimeoutMillis() {
		return probeTimeoutMillis;
	}

	public void setProbeTimeoutMillis(int probeTimeoutMillis) {
		this.probeTimeoutMillis = probeTimeoutMillis;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryDelayMillis() {
		return retryDelayMillis;
	}

	public void setRetryDelayMillis(long retryDelayMillis) {
		this.retryDelayMillis = retryDelayMillis;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public String getFfmpegExecutable() {
		return ffmpegExecutable;
	}

	public void setFfmpegExecutable(String ffmpegExecutable) {
		this.ffmpegExecutable = ffmpegExecutable;
	}

	public List<String> getFeedMetaRules() {
		return feedMetaRules;
	}

	public void setFeedMetaRules(List<String> feedMetaRules) {
		this.feedMetaRules = feedMetaRules;
	}

	public List<String> getEpisodeMetaRules() {
		return episodeMetaRules;
	}

	public void setEpisodeMetaRules(List<String> episodeMetaRules) {
		this.episodeMetaRules = episodeMetaRules;
	}

}
