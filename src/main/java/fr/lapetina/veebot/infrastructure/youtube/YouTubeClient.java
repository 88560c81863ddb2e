package fr.lapetina.veebot.infrastructure.youtube;

import fr.lapetina.veebot.domain.error.ErrorKind;
import fr.lapetina.veebot.domain.error.VeebotException;
import fr.lapetina.veebot.infrastructure.config.VeebotConfig;
import fr.lapetina.veebot.infrastructure.http.HttpJsonClient;
import fr.lapetina.veebot.infrastructure.http.UrlBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YouTube lookups needed to queue tracks: video search and video id extraction from URLs.
 */
public final class YouTubeClient {

    private static final Logger log = LoggerFactory.getLogger(YouTubeClient.class);

    private static final Pattern VIDEO_ID = Pattern.compile("[A-Za-z0-9_-]{11}");
    private static final Pattern VIDEO_PATH =
            Pattern.compile("^/(?:shorts|embed|live|v)/([A-Za-z0-9_-]{11})/?$");
    private static final Pattern SHORT_LINK_PATH = Pattern.compile("^/([A-Za-z0-9_-]{11})/?$");

    private final HttpJsonClient httpClient;
    private final URI searchUrl;
    private final String apiKey;

    public YouTubeClient(HttpJsonClient httpClient, VeebotConfig.YouTubeConfig config) {
        this.httpClient = httpClient;
        this.searchUrl = UrlBuilder.base(config.getApiBaseUrl()).segments("search").build();
        this.apiKey = config.getApiKey();
    }

    /**
     * Finds the most relevant video for a free text query.
     *
     * @return CompletableFuture with the first result, failed with
     *         {@link ErrorKind.YtVidNotFound} when the search has no video result
     */
    public CompletableFuture<YouTubeVideo> findVideo(String query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part", "snippet");
        params.put("type", "video");
        params.put("maxResults", "1");
        params.put("q", query);
        if (apiKey != null && !apiKey.isBlank()) {
            params.put("key", apiKey);
        }

        log.debug("Searching YouTube video: query={}", query);

        return httpClient.getJson(searchUrl, params, SearchResponse.class)
                .thenApply(response -> firstVideo(response)
                        .orElseThrow(() -> VeebotException.of(new ErrorKind.YtVidNotFound(query))));
    }

    private static Optional<YouTubeVideo> firstVideo(SearchResponse response) {
        return response.items().stream()
                .filter(item -> item.id() != null && item.id().videoId() != null)
                .findFirst()
                .map(item -> new YouTubeVideo(
                        item.id().videoId(),
                        item.snippet() != null ? item.snippet().title() : null,
                        item.snippet() != null ? item.snippet().channelTitle() : null
                ));
    }

    /**
     * Extracts the video id from a YouTube URL.
     *
     * Supported forms:
     * - https://www.youtube.com/watch?v=ID (also m. and music. hosts)
     * - https://youtu.be/ID
     * - https://www.youtube.com/shorts/ID, /embed/ID, /live/ID, /v/ID
     *
     * @throws VeebotException with {@link ErrorKind.YtInferVideoId} if no id can be found
     */
    public static String inferVideoId(URI url) {
        return findVideoId(url)
                .orElseThrow(() -> VeebotException.of(new ErrorKind.YtInferVideoId(url)));
    }

    private static Optional<String> findVideoId(URI url) {
        String host = url.getHost();
        String path = url.getPath() != null ? url.getPath() : "";
        if (host == null) {
            return Optional.empty();
        }
        host = host.toLowerCase(Locale.ROOT);

        if (host.equals("youtu.be")) {
            return group(SHORT_LINK_PATH.matcher(path));
        }

        if (!host.equals("youtube.com") && !host.endsWith(".youtube.com")) {
            return Optional.empty();
        }

        if (path.equals("/watch") || path.equals("/watch/")) {
            return queryParam(url, "v").filter(id -> VIDEO_ID.matcher(id).matches());
        }
        return group(VIDEO_PATH.matcher(path));
    }

    private static Optional<String> group(Matcher matcher) {
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<String> queryParam(URI url, String name) {
        String query = url.getRawQuery();
        if (query == null) {
            return Optional.empty();
        }
        try {
            for (String pair : query.split("&")) {
                int eq = pair.indexOf('=');
                String key = eq >= 0 ? pair.substring(0, eq) : pair;
                if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
                    return Optional.of(eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "");
                }
            }
        } catch (IllegalArgumentException e) {
            // Malformed percent-encoding
            return Optional.empty();
        }
        return Optional.empty();
    }
}
