package fr.lapetina.veebot.command;

import fr.lapetina.veebot.domain.error.VeebotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Runs command handlers and turns their {@link VeebotException} failures into a reply
 * posted back to the chat.
 *
 * Failures that are not {@link VeebotException} are not ours to render and are
 * propagated unchanged.
 */
public final class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    /**
     * Invokes the handler.
     *
     * @param command Command name, for logging
     * @param handler Handler of the command, may throw or return a failed future
     * @param sink    Where to send the error reply
     * @return CompletableFuture with true if the handler succeeded, false if an error reply was sent
     */
    public <T> CompletableFuture<Boolean> run(
            String command,
            Supplier<CompletableFuture<T>> handler,
            ReplySink sink
    ) {
        CompletableFuture<T> invocation;
        try {
            invocation = handler.get();
        } catch (RuntimeException e) {
            invocation = CompletableFuture.failedFuture(e);
        }

        return invocation.handle((value, failure) -> {
            if (failure == null) {
                log.debug("Command completed: command={}", command);
                return true;
            }

            Throwable cause = unwrap(failure);
            if (!(cause instanceof VeebotException error)) {
                throw failure instanceof CompletionException completion
                        ? completion
                        : new CompletionException(failure);
            }

            log.debug("Replying with error: command={}, errorId={}", command, error.id());
            sink.send(error.renderMessage());
            return false;
        });
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
