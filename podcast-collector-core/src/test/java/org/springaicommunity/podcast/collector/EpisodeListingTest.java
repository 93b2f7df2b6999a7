package org.springaicommunity.podcast.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EpisodeListing Tests")
class EpisodeListingTest {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private final EpisodeListing listing = new EpisodeListing(objectMapper);

	private final List<EpisodeListing.Row> rows = List.of(
			new EpisodeListing.Row(12, "A longer episode title", "Sun, 10 Mar 2024 12:00:00 GMT"),
			new EpisodeListing.Row(3, "Short", null));

	@Test
	@DisplayName("Table columns are aligned to the widest cell")
	void tableAlignment() {
		String table = EpisodeListing.renderTable(rows);

		assertThat(table).isEqualTo("""
				episodeNum | title                  | pubDate
				-----------+------------------------+------------------------------
				12         | A longer episode title | Sun, 10 Mar 2024 12:00:00 GMT
				3          | Short                  |
				""");
	}

	@Test
	@DisplayName("Table of no rows has only the header")
	void emptyTable() {
		assertThat(EpisodeListing.renderTable(List.of())).isEqualTo("""
				episodeNum | title | pubDate
				-----------+-------+--------
				""");
	}

	@Test
	@DisplayName("JSON listing is an array of rows")
	void jsonListing() throws Exception {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();

		listing.print(rows, ListFormat.JSON, new PrintStream(buffer, true, StandardCharsets.UTF_8));

		JsonNode json = objectMapper.readTree(buffer.toString(StandardCharsets.UTF_8));
		assertThat(json.isArray()).isTrue();
		assertThat(json.get(0).path("episodeNum").asInt()).isEqualTo(12);
		assertThat(json.get(0).path("pubDate").asText()).isEqualTo("Sun, 10 Mar 2024 12:00:00 GMT");
		assertThat(json.get(1).has("pubDate")).isFalse();
	}

}
