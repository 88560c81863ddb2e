package fr.lapetina.veebot.domain.error;

import java.util.Objects;

/**
 * Rendered error to be posted back to the chat the failing command came from.
 */
public record ErrorMessage(String title, String body) {
    public ErrorMessage {
        Objects.requireNonNull(title, "Title is required");
        Objects.requireNonNull(body, "Body is required");
    }
}
