package org.springaicommunity.podcast.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RomeFeedSource} and {@link RawElementAdapter}.
 */
@DisplayName("RomeFeedSource Tests")
class RomeFeedSourceTest {

	private static final String FEED_URL = "https://sample.example.com/feed.xml";

	private FakeMediaClient mediaClient;

	private RomeFeedSource feedSource;

	static byte[] sampleFeed() throws IOException {
		try (InputStream in = RomeFeedSourceTest.class.getResourceAsStream("/feeds/sample-feed.xml")) {
			assertThat(in).as("sample feed fixture").isNotNull();
			return in.readAllBytes();
		}
	}

	@BeforeEach
	void setUp() throws IOException {
		mediaClient = new FakeMediaClient().serve(FEED_URL, sampleFeed());
		feedSource = new RomeFeedSource(mediaClient);
	}

	@Nested
	@DisplayName("RSS 2.0")
	class RssTest {

		private Feed feed;

		@BeforeEach
		void fetchFeed() {
			feed = feedSource.fetch(FEED_URL);
		}

		@Test
		@DisplayName("Channel fields are mapped")
		void channelFields() {
			assertThat(feed.title()).isEqualTo("The Sample Show");
			assertThat(feed.description()).isEqualTo("Weekly conversations about sample data.");
			assertThat(feed.link()).isEqualTo("https://sample.example.com");
			assertThat(feed.feedUrl()).isEqualTo("https://sample.example.com/feed.xml");
			assertThat(feed.managingEditor()).isEqualTo("editor@sample.example.com (Sam Editor)");
			assertThat(feed.image()).isNotNull();
			assertThat(feed.image().url()).isEqualTo("https://cdn.sample.example.com/show.jpg");
			assertThat(feed.itunes().author()).isEqualTo("Sam Host");
			assertThat(feed.itunes().image()).isEqualTo("https://cdn.sample.example.com/show-itunes.jpg");
			assertThat(feed.itunes().explicit()).isEqualTo("false");
		}

		@Test
		@DisplayName("Entries keep document order")
		void entryOrder() {
			assertThat(feed.items()).extracting(Entry::title)
				.containsExactly("Episode 3: The Finale", "Episode 2", "Episode 1");
		}

		@Test
		@DisplayName("Entry fields are mapped")
		void entryFields() {
			Entry latest = feed.items().get(0);

			assertThat(latest.pubDate()).isEqualTo("Sun, 10 Mar 2024 12:00:00 GMT");
			assertThat(latest.isoDate()).isEqualTo("2024-03-10T12:00:00Z");
			assertThat(latest.guid()).isEqualTo("ep-3");
			assertThat(latest.creator()).isEqualTo("Jane Host");
			assertThat(latest.content()).contains("<b>last</b>");
			assertThat(latest.contentSnippet()).isEqualTo("The last one & the best.");
			assertThat(latest.enclosure())
				.isEqualTo(new Enclosure("https://cdn.sample.example.com/episodes/ep3.mp3", "audio/mpeg", 12345L));
			assertThat(latest.itunes().episode()).isEqualTo("3");
			assertThat(latest.itunes().duration()).isEqualTo("42:00");
		}

		@Test
		@DisplayName("Entries without enclosure have none")
		void entryWithoutEnclosure() {
			Entry pilot = feed.items().get(2);

			assertThat(pilot.enclosure()).isNull();
			assertThat(pilot.link()).isEqualTo("https://sample.example.com/episodes/1");
		}

		@Test
		@DisplayName("Item-level iTunes image is read")
		void itemItunesImage() {
			assertThat(feed.items().get(1).itunes().image()).isEqualTo("https://cdn.sample.example.com/ep2.png");
		}

		@Test
		@DisplayName("Raw item graph keeps attributes and repeated elements")
		void rawItemGraph() {
			Map<String, Object> latest = feed.items().get(0).raw();
			Map<String, Object> pilot = feed.items().get(2).raw();

			assertThat(latest).containsKeys("title", "enclosure", "itunes:episode", "dc:creator");
			assertThat((Map<Object, Object>) latest.get("enclosure")).containsKey(FieldProjector.ATTRIBUTES_KEY);
			assertThat((Map<Object, Object>) ((Map<Object, Object>) latest.get("enclosure")).get(FieldProjector.ATTRIBUTES_KEY))
				.containsEntry("url", "https://cdn.sample.example.com/episodes/ep3.mp3");
			assertThat((Map<Object, Object>) latest.get("guid")).containsEntry(FieldProjector.TEXT_KEY, "ep-3");
			assertThat(pilot.get("category")).isEqualTo(List.of("Technology", "Education"));
		}

		@Test
		@DisplayName("Raw channel graph leaves out the items")
		void rawChannelGraph() {
			assertThat(feed.raw()).containsKeys("title", "language", "atom:link", "itunes:author", "image")
				.doesNotContainKey("item");
		}

		@Test
		@DisplayName("Parsed entries drive media resolution")
		void mediaResolution() {
			MediaUrlResolver resolver = new MediaUrlResolver();

			assertThat(resolver.resolveMedia(feed.items().get(0)))
				.isEqualTo(new MediaAsset("https://cdn.sample.example.com/episodes/ep3.mp3", ".mp3"));
			assertThat(resolver.resolveMedia(feed.items().get(1)))
				.isEqualTo(new MediaAsset("https://cdn.sample.example.com/download?id=2", ".mp3"));
			assertThat(resolver.resolveMedia(feed.items().get(2)).isResolved()).isFalse();
		}

	}

	@Nested
	@DisplayName("Atom")
	class AtomTest {

		@Test
		@DisplayName("Atom entries with enclosure links are parsed")
		void atomFeed() {
			String atom = """
					<?xml version="1.0" encoding="utf-8"?>
					<feed xmlns="http://www.w3.org/2005/Atom">
					  <title>Atom Show</title>
					  <id>urn:uuid:show</id>
					  <updated>2024-03-10T12:00:00Z</updated>
					  <link rel="self" href="https://atom.example.com/feed"/>
					  <entry>
					    <title>Atom Episode</title>
					    <id>urn:uuid:episode-1</id>
					    <published>2024-03-09T10:00:00Z</published>
					    <updated>2024-03-09T10:00:00Z</updated>
					    <link rel="enclosure" type="audio/mpeg" length="10" href="https://atom.example.com/ep1.mp3"/>
					    <summary>Short summary</summary>
					  </entry>
					</feed>
					""";

			Feed feed = feedSource.parse(atom.getBytes(StandardCharsets.UTF_8));

			assertThat(feed.title()).isEqualTo("Atom Show");
			assertThat(feed.feedUrl()).isEqualTo("https://atom.example.com/feed");
			assertThat(feed.items()).hasSize(1);
			Entry entry = feed.items().get(0);
			assertThat(entry.guid()).isEqualTo("urn:uuid:episode-1");
			assertThat(entry.isoDate()).isEqualTo("2024-03-09T10:00:00Z");
			assertThat(entry.pubDate()).isEqualTo("2024-03-09T10:00:00Z");
			assertThat(entry.enclosure()).isNotNull();
			assertThat(entry.enclosure().url()).isEqualTo("https://atom.example.com/ep1.mp3");
		}

	}

	@Nested
	@DisplayName("Failures")
	class FailureTest {

		@Test
		@DisplayName("HTTP errors abort the collection")
		void httpError() {
			assertThatThrownBy(() -> feedSource.fetch("https://sample.example.com/missing.xml"))
				.isInstanceOf(CollectionAbortedException.class)
				.hasMessageStartingWith("Unable to parse RSS URL");
		}

		@Test
		@DisplayName("Documents that are not feeds abort the collection")
		void notAFeed() {
			assertThatThrownBy(() -> feedSource.parse("<html><body>nope</body></html>".getBytes(StandardCharsets.UTF_8)))
				.isInstanceOf(CollectionAbortedException.class)
				.satisfies(e -> assertThat(((CollectionAbortedException) e).getExitStatus())
					.isEqualTo(ExitStatus.GENERAL_ERROR));
		}

		@Test
		@DisplayName("Malformed XML aborts the collection")
		void malformedXml() {
			assertThatThrownBy(() -> feedSource.parse("<rss><channel>".getBytes(StandardCharsets.UTF_8)))
				.isInstanceOf(CollectionAbortedException.class);
		}

	}

	@Test
	@DisplayName("Snippets strip markup and entities")
	void snippet() {
		assertThat(RomeFeedSource.snippet("<p>Hello&nbsp;<i>world</i></p>\n\n")).isEqualTo("Hello world");
		assertThat(RomeFeedSource.snippet(null)).isNull();
	}

}
