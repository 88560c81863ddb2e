package fr.lapetina.veebot.infrastructure.youtube;

import java.util.List;

/**
 * Subset of the YouTube Data API {@code search.list} response used by the bot.
 */
public record SearchResponse(List<Item> items) {

    public SearchResponse {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public record Item(ItemId id, Snippet snippet) {
    }

    public record ItemId(String videoId) {
    }

    public record Snippet(String title, String channelTitle) {
    }
}
