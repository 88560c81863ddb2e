package fr.lapetina.veebot.infrastructure.youtube;

import java.net.URI;
import java.util.Objects;

/**
 * A video found on YouTube.
 * Immutable and thread-safe.
 */
public record YouTubeVideo(String id, String title, String channelTitle) {
    public YouTubeVideo {
        Objects.requireNonNull(id, "Video ID is required");
    }

    public URI url() {
        return URI.create("https://www.youtube.com/watch?v=" + id);
    }
}
