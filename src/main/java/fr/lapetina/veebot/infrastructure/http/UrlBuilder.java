package fr.lapetina.veebot.infrastructure.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds request URLs from a fixed base URL, path segments and query parameters.
 * Immutable: every call returns a new builder.
 */
public final class UrlBuilder {

    private final String base;
    private final List<String> segments;

    private UrlBuilder(String base, List<String> segments) {
        this.base = base;
        this.segments = segments;
    }

    /**
     * Starts from a fixed base URL such as {@code https://www.googleapis.com/youtube/v3}.
     *
     * @throws IllegalArgumentException if the base is not an absolute URL
     */
    public static UrlBuilder base(String baseUrl) {
        Objects.requireNonNull(baseUrl, "Base URL is required");
        URI uri = URI.create(baseUrl);
        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("Base URL must be absolute: " + baseUrl);
        }
        String normalized = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return new UrlBuilder(normalized, List.of());
    }

    /**
     * Appends path segments, each one percent-encoded.
     */
    public UrlBuilder segments(String... more) {
        List<String> all = new ArrayList<>(segments);
        for (String segment : more) {
            all.add(Objects.requireNonNull(segment, "Path segment is required"));
        }
        return new UrlBuilder(base, List.copyOf(all));
    }

    public URI build() {
        StringBuilder url = new StringBuilder(base);
        for (String segment : segments) {
            url.append('/').append(encodePathSegment(segment));
        }
        return URI.create(url.toString());
    }

    /**
     * Appends form-encoded query parameters to a URL, keeping its existing query and
     * fragment. Parameters are written in the map's iteration order.
     */
    public static URI withQuery(URI url, Map<String, String> query) {
        Objects.requireNonNull(url, "URL is required");
        if (query == null || query.isEmpty()) {
            return url;
        }

        StringJoiner params = new StringJoiner("&");
        query.forEach((name, value) -> params.add(encode(name) + "=" + encode(value != null ? value : "")));

        String existing = url.getRawQuery();
        String combined = existing == null || existing.isEmpty()
                ? params.toString()
                : existing + "&" + params;

        StringBuilder result = new StringBuilder();
        if (url.getScheme() != null) {
            result.append(url.getScheme()).append(':');
        }
        if (url.getRawAuthority() != null) {
            result.append("//").append(url.getRawAuthority());
        }
        if (url.getRawPath() != null) {
            result.append(url.getRawPath());
        }
        result.append('?').append(combined);
        if (url.getRawFragment() != null) {
            result.append('#').append(url.getRawFragment());
        }
        return URI.create(result.toString());
    }

    private static String encodePathSegment(String segment) {
        return encode(segment).replace("+", "%20");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
