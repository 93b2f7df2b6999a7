package org.springaicommunity.podcast.collector;

import org.jspecify.annotations.Nullable;

import java.net.URISyntaxException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Determines which URL of an entry points at its audio, and with which file extension it
 * is stored.
 */
public class MediaUrlResolver {

	private static final Map<String, String> AUDIO_TYPES_TO_EXTENSIONS = Map.of("audio/mpeg", ".mp3", "audio/mp3",
			".mp3", "audio/flac", ".flac", "audio/ogg", ".ogg", "audio/vorbis", ".ogg", "audio/mp4", ".m4a",
			"audio/wav", ".wav", "audio/x-wav", ".wav", "audio/aac", ".aac");

	private static final Set<String> AUDIO_EXTENSIONS = new LinkedHashSet<>(AUDIO_TYPES_TO_EXTENSIONS.values());

	/**
	 * Resolve the primary media asset of an entry.
	 *
	 * <p>
	 * Checked in order: the item link when it has a known audio extension, the enclosure
	 * URL when it has a known audio extension, then the enclosure URL when its MIME type
	 * is a known audio type.
	 * @param entry the feed entry
	 * @return the media asset, or {@link MediaAsset#NONE}
	 */
	public MediaAsset resolveMedia(Entry entry) {
		String link = entry.link();
		if (link != null && isAudioUrl(link)) {
			return new MediaAsset(link, urlExtension(link));
		}
		Enclosure enclosure = entry.enclosure();
		if (enclosure != null && isAudioUrl(enclosure.url())) {
			return new MediaAsset(enclosure.url(), urlExtension(enclosure.url()));
		}
		if (enclosure != null && !enclosure.url().isEmpty()) {
			String extension = extensionForType(enclosure.type());
			if (extension != null) {
				return new MediaAsset(enclosure.url(), extension);
			}
		}
		return MediaAsset.NONE;
	}

	/**
	 * Extension of the last path segment of a URL, including the dot.
	 * @param url absolute URL
	 * @return the extension, or an empty string if there is none or the URL is invalid
	 */
	public String urlExtension(String url) {
		String path;
		try {
			path = MediaUrls.toUri(url).getPath();
		}
		catch (URISyntaxException e) {
			return "";
		}
		if (path == null || path.isEmpty()) {
			return "";
		}
		String name = path.substring(path.lastIndexOf('/') + 1);
		int dot = name.lastIndexOf('.');
		if (dot <= 0) {
			return "";
		}
		return name.substring(dot);
	}

	public boolean isAudioUrl(String url) {
		String extension = urlExtension(url);
		return !extension.isEmpty() && AUDIO_EXTENSIONS.contains(extension);
	}

	/**
	 * Map an audio MIME type to a file extension.
	 * @param mimeType the MIME type, possibly with parameters
	 * @return the extension, or null for unknown types
	 */
	@Nullable
	public String extensionForType(@Nullable String mimeType) {
		if (mimeType == null) {
			return null;
		}
		String base = mimeType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
		return AUDIO_TYPES_TO_EXTENSIONS.get(base);
	}

	/**
	 * Image URL of an entry: image url, then image link, then the iTunes image.
	 * @param entry the feed entry
	 * @return the image URL, or null
	 */
	@Nullable
	public String imageUrl(Entry entry) {
		return imageUrl(entry.image(), entry.itunes());
	}

	/**
	 * Image URL of a feed, resolved the same way as for entries.
	 * @param feed the feed
	 * @return the image URL, or null
	 */
	@Nullable
	public String imageUrl(Feed feed) {
		return imageUrl(feed.image(), feed.itunes());
	}

	@Nullable
	private static String imageUrl(@Nullable ImageRef image, ItunesInfo itunes) {
		if (image != null && hasText(image.url())) {
			return image.url();
		}
		if (image != null && hasText(image.link())) {
			return image.link();
		}
		if (hasText(itunes.image())) {
			return itunes.image();
		}
		return null;
	}

	private static boolean hasText(@Nullable String value) {
		return value != null && !value.isBlank();
	}

}
