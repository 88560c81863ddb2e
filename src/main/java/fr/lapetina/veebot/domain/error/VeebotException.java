package fr.lapetina.veebot.domain.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Objects;

/**
 * Application error: a classified {@link ErrorKind} with a short correlation id.
 *
 * <p>Instances are only created through {@link #of(ErrorKind)} (or the shortcuts built
 * on it), which logs the error exactly once at the failure site. Internal errors capture
 * the call stack and log it; user errors skip the stack walk entirely and are logged
 * without it.
 *
 * <p>The id is shown to the user in {@link #renderMessage()} so that a report from the
 * chat can be matched with the log event.
 */
public final class VeebotException extends RuntimeException {

    private static final Logger log = LoggerFactory.getLogger(VeebotException.class);

    /** MDC key holding the correlation id while the error is being logged. */
    public static final String ERROR_ID_KEY = "errorId";

    private final String id;
    private final ErrorKind kind;
    private final boolean contextCaptured;

    private VeebotException(ErrorKind kind, String id, boolean captureContext) {
        super(safeMessage(kind), kind.cause(), false, captureContext);
        this.id = id;
        this.kind = kind;
        this.contextCaptured = captureContext;
    }

    /**
     * Classifies the kind, logs it and wraps it into an exception ready to be thrown.
     * Never fails because of logging.
     */
    public static VeebotException of(ErrorKind kind) {
        Objects.requireNonNull(kind, "Error kind is required");
        VeebotException error = new VeebotException(kind, CorrelationIds.next(), shouldCapture(kind));
        error.log();
        return error;
    }

    /**
     * Whether an error of this kind records the call stack. Only internal errors do.
     */
    public static boolean shouldCapture(ErrorKind kind) {
        return kind.classification().isInternal();
    }

    public static VeebotException parseInt(String input, NumberFormatException cause) {
        return of(new ErrorKind.ParseInt(input, cause));
    }

    public static VeebotException parseArg(String argument, VeebotException nested) {
        return of(new ErrorKind.ParseArg(argument, nested));
    }

    /**
     * Wraps an unexpected error reported by the chat platform SDK.
     */
    public static VeebotException discord(Throwable sdkError) {
        return of(new ErrorKind.UnknownDiscord(sdkError));
    }

    public String id() {
        return id;
    }

    public ErrorKind kind() {
        return kind;
    }

    public Classification classification() {
        return kind.classification();
    }

    /**
     * Call stack at the point where the error was created. Empty for user errors.
     */
    public List<StackTraceElement> capturedContext() {
        return List.of(getStackTrace());
    }

    public boolean hasCapturedContext() {
        return contextCaptured && getStackTrace().length > 0;
    }

    /**
     * Builds the message shown in the chat: the display sentence, the error id and a
     * dump of the kind that can be pasted into a bug report.
     */
    public ErrorMessage renderMessage() {
        String body = getMessage()
                + "\n\nError id: **`" + id + "`**"
                + "\n\n```\n" + ErrorKindFormatter.pretty(kind) + "\n```";
        return new ErrorMessage(kind.title(), body);
    }

    private void log() {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(ERROR_ID_KEY, id)) {
            if (contextCaptured) {
                log.error("Command failed: errorId={}, kind={}", id, ErrorKindFormatter.compact(kind), this);
            } else {
                log.error("Command failed: errorId={}, kind={}", id, ErrorKindFormatter.compact(kind));
            }
        } catch (RuntimeException e) {
            // The logging backend itself failed, stderr is the only channel left
            System.err.println("Failed to log error " + id + ": " + e);
        }
    }

    private static String safeMessage(ErrorKind kind) {
        try {
            return kind.message();
        } catch (RuntimeException e) {
            return kind.getClass().getSimpleName();
        }
    }
}
