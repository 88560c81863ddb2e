package fr.lapetina.veebot.infrastructure.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlBuilderTest {

    @Test
    @DisplayName("should append encoded path segments to the base")
    void shouldAppendSegments() {
        URI uri = UrlBuilder.base("https://www.googleapis.com/youtube/v3/")
                .segments("search")
                .segments("a b", "c/d")
                .build();

        assertThat(uri.toString()).isEqualTo("https://www.googleapis.com/youtube/v3/search/a%20b/c%2Fd");
    }

    @Test
    @DisplayName("should reject a relative base")
    void shouldRejectRelativeBase() {
        assertThatThrownBy(() -> UrlBuilder.base("youtube/v3"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should append query parameters in order")
    void shouldAppendQuery() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("q", "café & crème");
        query.put("part", "snippet");

        URI uri = UrlBuilder.withQuery(URI.create("https://example.com/search"), query);

        assertThat(uri.toString()).isEqualTo("https://example.com/search?q=caf%C3%A9+%26+cr%C3%A8me&part=snippet");
    }

    @Test
    @DisplayName("should keep the existing query and fragment")
    void shouldKeepExistingQuery() {
        URI uri = UrlBuilder.withQuery(URI.create("https://example.com/watch?v=abc#t=10"), Map.of("list", "x"));

        assertThat(uri.toString()).isEqualTo("https://example.com/watch?v=abc&list=x#t=10");
    }

    @Test
    @DisplayName("should leave the URL untouched without parameters")
    void shouldLeaveUrlWithoutParameters() {
        URI original = URI.create("https://example.com/a?b=c");

        assertThat(UrlBuilder.withQuery(original, Map.of())).isSameAs(original);
        assertThat(UrlBuilder.withQuery(original, null)).isSameAs(original);
    }
}
