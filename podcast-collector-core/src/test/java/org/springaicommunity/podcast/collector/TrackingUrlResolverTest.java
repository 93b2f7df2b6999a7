package org.springaicommunity.podcast.collector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link TrackingUrlResolver}.
 */
@DisplayName("TrackingUrlResolver Tests")
@ExtendWith(MockitoExtension.class)
class TrackingUrlResolverTest {

	private static final String TRACKED = "https://tracker.example/p/track.example/cdn.example.com/show/ep1.mp3";

	@Mock
	private MediaClient mediaClient;

	@Test
	@DisplayName("Candidates are the path suffixes, most specific first")
	void candidates() {
		List<String> candidates = TrackingUrlResolver.candidates(TRACKED, TrackingUrlResolver.MAX_CANDIDATES);

		assertThat(candidates).containsExactly("https://ep1.mp3", "https://show/ep1.mp3",
				"https://cdn.example.com/show/ep1.mp3", "https://track.example/cdn.example.com/show/ep1.mp3",
				"https://p/track.example/cdn.example.com/show/ep1.mp3");
	}

	@Test
	@DisplayName("Embedded absolute URLs are decoded and kept as-is")
	void embeddedAbsoluteUrl() {
		List<String> candidates = TrackingUrlResolver.candidates(
				"https://tracker.example/redirect/https%3A%2F%2Fcdn.example.com%2Fep1.mp3", 5);

		assertThat(candidates).contains("https://cdn.example.com/ep1.mp3");
	}

	@Test
	@DisplayName("Tracked URLs with unencoded spaces still yield candidates")
	void unencodedSpaces() {
		List<String> candidates = TrackingUrlResolver.candidates("https://tracker.example/p/cdn.example.com/my episode.mp3",
				2);

		assertThat(candidates).containsExactly("https://my episode.mp3", "https://cdn.example.com/my episode.mp3");
	}

	@Test
	@DisplayName("Unparseable URLs have no candidates")
	void unparseableUrl() {
		assertThat(TrackingUrlResolver.candidates("not a url", 5)).isEmpty();
	}

	@Test
	@DisplayName("First reachable candidate wins")
	void firstReachableWins() {
		Duration timeout = Duration.ofSeconds(3);
		TrackingUrlResolver resolver = new TrackingUrlResolver(mediaClient, timeout);
		when(mediaClient.exists(anyString(), eq(timeout))).thenReturn(false);
		when(mediaClient.exists("https://cdn.example.com/show/ep1.mp3", timeout)).thenReturn(true);

		assertThat(resolver.resolve(TRACKED)).isEqualTo("https://cdn.example.com/show/ep1.mp3");
		verify(mediaClient, never()).exists(eq("https://track.example/cdn.example.com/show/ep1.mp3"), any());
	}

	@Test
	@DisplayName("Failed probes fall back to the original URL")
	void fallsBackToOriginal() {
		TrackingUrlResolver resolver = new TrackingUrlResolver(mediaClient, Duration.ofMillis(10));
		when(mediaClient.exists(anyString(), any()))
			.thenThrow(new MediaClient.MediaClientException("timeout", new java.io.IOException("timed out")));

		assertThat(resolver.resolve(TRACKED)).isEqualTo(TRACKED);
		verify(mediaClient, times(5)).exists(anyString(), any());
	}

}
