package org.springaicommunity.podcast.collector;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndImage;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.Namespace;
import org.jdom2.input.SAXBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link FeedSource} that downloads a feed with a {@link MediaClient} and parses it with
 * ROME.
 *
 * <p>
 * The document is parsed once with JDOM; ROME builds the typed feed from it and
 * {@link RawElementAdapter} attaches the untyped element graph of the channel and of
 * every item, so metadata export can reach any element, including ones ROME has no
 * model for. iTunes values are read from the elements directly.
 */
public class RomeFeedSource implements FeedSource {

	private static final Logger logger = LoggerFactory.getLogger(RomeFeedSource.class);

	static final Namespace ITUNES = Namespace.getNamespace("itunes", "http://www.itunes.com/dtds/podcast-1.0.dtd");

	static final Namespace DUBLIN_CORE = Namespace.getNamespace("dc", "http://purl.org/dc/elements/1.1/");

	private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final MediaClient mediaClient;

	public RomeFeedSource(MediaClient mediaClient) {
		this.mediaClient = mediaClient;
	}

	@Override
	public Feed fetch(String url) {
		logger.debug("Fetching feed {}", url);
		byte[] body;
		try {
			body = mediaClient.fetch(url);
		}
		catch (MediaClient.MediaClientException e) {
			throw new CollectionAbortedException("Unable to parse RSS URL: " + e.getMessage(), ExitStatus.GENERAL_ERROR,
					e);
		}
		return parse(body);
	}

	/**
	 * Parse feed XML.
	 * @param xml the document bytes
	 * @return the parsed feed
	 * @throws CollectionAbortedException if the document is not a feed
	 */
	public Feed parse(byte[] xml) {
		Document document;
		SyndFeed syndFeed;
		try {
			document = newSaxBuilder().build(new ByteArrayInputStream(xml));
			syndFeed = new SyndFeedInput().build(document.clone());
		}
		catch (JDOMException | IOException | FeedException | IllegalArgumentException e) {
			throw new CollectionAbortedException("Unable to parse RSS URL: " + e.getMessage(), ExitStatus.GENERAL_ERROR,
					e);
		}

		Element channel = RawElementAdapter.channelElement(document);
		List<Element> itemElements = RawElementAdapter.itemElements(document);
		List<SyndEntry> syndEntries = syndFeed.getEntries();
		if (itemElements.size() != syndEntries.size()) {
			logger.warn("Feed has {} item elements but {} parsed entries; raw item data is not attached",
					itemElements.size(), syndEntries.size());
		}

		List<Entry> entries = new ArrayList<>(syndEntries.size());
		for (int i = 0; i < syndEntries.size(); i++) {
			Element element = itemElements.size() == syndEntries.size() ? itemElements.get(i) : null;
			entries.add(toEntry(syndEntries.get(i), element));
		}

		Map<String, Object> raw = RawElementAdapter.toMap(channel, Set.of("item", "entry"));
		Feed feed = new Feed(syndFeed.getTitle(), syndFeed.getDescription(), syndFeed.getLink(), selfLink(channel),
				managingEditor(syndFeed, channel), image(syndFeed.getImage()), itunes(channel), entries, Map.of());
		logger.debug("Parsed feed '{}' with {} entries", feed.title(), entries.size());
		return feed.withRaw(raw);
	}

	private static SAXBuilder newSaxBuilder() {
		SAXBuilder builder = new SAXBuilder();
		builder.setExpandEntities(false);
		builder.setFeature("http://xml.org/sax/features/external-general-entities", false);
		builder.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
		builder.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		return builder;
	}

	private Entry toEntry(SyndEntry syndEntry, @Nullable Element element) {
		Date published = syndEntry.getPublishedDate() != null ? syndEntry.getPublishedDate()
				: syndEntry.getUpdatedDate();
		String content = content(syndEntry);
		Map<String, Object> raw = element != null ? RawElementAdapter.toMap(element) : Map.of();

		return new Entry(syndEntry.getTitle(), syndEntry.getLink(), pubDateText(element, published),
				published != null ? published.toInstant().toString() : null, guid(syndEntry, element),
				creator(syndEntry, element), content, snippet(content), enclosure(syndEntry), null,
				element != null ? itunes(element) : ItunesInfo.EMPTY, raw);
	}

	@Nullable
	private static String content(SyndEntry syndEntry) {
		SyndContent description = syndEntry.getDescription();
		if (description != null && description.getValue() != null) {
			return description.getValue();
		}
		for (SyndContent content : syndEntry.getContents()) {
			if (content.getValue() != null) {
				return content.getValue();
			}
		}
		return null;
	}

	/**
	 * Text of HTML content with tags removed and whitespace collapsed.
	 * @param content HTML content
	 * @return the snippet, or null without content
	 */
	@Nullable
	static String snippet(@Nullable String content) {
		if (content == null) {
			return null;
		}
		String text = HTML_TAG.matcher(content).replaceAll(" ");
		text = text.replace("&nbsp;", " ")
			.replace("&lt;", "<")
			.replace("&gt;", ">")
			.replace("&quot;", "\"")
			.replace("&#39;", "'")
			.replace("&amp;", "&");
		return WHITESPACE.matcher(text).replaceAll(" ").trim();
	}

	@Nullable
	private static String pubDateText(@Nullable Element element, @Nullable Date published) {
		if (element != null) {
			for (String name : List.of("pubDate", "published", "updated")) {
				String text = element.getChildTextTrim(name, element.getNamespace());
				if (text != null && !text.isEmpty()) {
					return text;
				}
			}
			String dcDate = element.getChildTextTrim("date", DUBLIN_CORE);
			if (dcDate != null && !dcDate.isEmpty()) {
				return dcDate;
			}
		}
		return published != null ? published.toInstant().toString() : null;
	}

	@Nullable
	private static String guid(SyndEntry syndEntry, @Nullable Element element) {
		if (element != null) {
			String guid = element.getChildTextTrim("guid", element.getNamespace());
			if (guid == null) {
				guid = element.getChildTextTrim("id", element.getNamespace());
			}
			if (guid != null && !guid.isEmpty()) {
				return guid;
			}
		}
		return syndEntry.getUri();
	}

	@Nullable
	private static String creator(SyndEntry syndEntry, @Nullable Element element) {
		if (element != null) {
			String creator = element.getChildTextTrim("creator", DUBLIN_CORE);
			if (creator != null && !creator.isEmpty()) {
				return creator;
			}
		}
		String author = syndEntry.getAuthor();
		return author != null && !author.isEmpty() ? author : null;
	}

	@Nullable
	private static Enclosure enclosure(SyndEntry syndEntry) {
		for (SyndEnclosure enclosure : syndEntry.getEnclosures()) {
			if (enclosure.getUrl() != null && !enclosure.getUrl().isEmpty()) {
				return new Enclosure(enclosure.getUrl(), enclosure.getType(), enclosure.getLength());
			}
		}
		return null;
	}

	@Nullable
	private static String selfLink(Element channel) {
		for (Element link : channel.getChildren("link", RawElementAdapter.ATOM_NAMESPACE)) {
			if ("self".equals(link.getAttributeValue("rel"))) {
				return link.getAttributeValue("href");
			}
		}
		return null;
	}

	@Nullable
	private static String managingEditor(SyndFeed syndFeed, Element channel) {
		String editor = channel.getChildTextTrim("managingEditor", channel.getNamespace());
		if (editor != null && !editor.isEmpty()) {
			return editor;
		}
		String author = syndFeed.getAuthor();
		return author != null && !author.isEmpty() ? author : null;
	}

	@Nullable
	private static ImageRef image(@Nullable SyndImage image) {
		if (image == null) {
			return null;
		}
		return new ImageRef(image.getUrl(), image.getLink());
	}

	private static ItunesInfo itunes(Element element) {
		Element image = element.getChild("image", ITUNES);
		return new ItunesInfo(itunesText(element, "author"), itunesText(element, "episode"),
				image != null ? image.getAttributeValue("href") : null, itunesText(element, "duration"),
				itunesText(element, "summary"), itunesText(element, "explicit"));
	}

	@Nullable
	private static String itunesText(Element element, String name) {
		String value = element.getChildTextTrim(name, ITUNES);
		return value != null && !value.isEmpty() ? value : null;
	}

}
