package fr.lapetina.veebot.domain.error;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Closed set of failures the bot can run into.
 *
 * <p>Every variant states its own classification, title and display message, so adding
 * a variant does not compile until all three are provided. New failure modes get a new
 * variant instead of reusing the payload of an existing one.
 *
 * <p>Variants are only data. They become errors by going through
 * {@link VeebotException#of(ErrorKind)}, which classifies and logs them.
 */
public sealed interface ErrorKind {

    /**
     * Whether this failure is caused by the user or by the bot itself.
     */
    Classification classification();

    /**
     * Short fixed title, one of {@link ErrorTitles}.
     */
    String title();

    /**
     * Human readable sentence describing the failure with its payload.
     */
    String message();

    /**
     * Lower level failure wrapped by this kind, if any.
     */
    default Throwable cause() {
        return null;
    }

    /**
     * Payload fields in declaration order, as shown by {@link ErrorKindFormatter}.
     */
    List<DebugField> debugFields();

    record DebugField(String name, Object value) {
    }

    // ---------------------------------------------------------------------
    // User errors
    // ---------------------------------------------------------------------

    /**
     * A track index outside of the queue. {@code available} is null when the queue is empty.
     */
    record TrackIndexOutOfBounds(int index, IndexRange available) implements ErrorKind {
        @Override
        public Classification classification() {
            return Classification.USER;
        }

        @Override
        public String title() {
            return ErrorTitles.INVALID_ARGUMENT;
        }

        @Override
        public String message() {
            return "Given track index `" + index + "` is out of bounds, available range: "
                    + (available != null ? available : "none");
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("index", index), new DebugField("available", available));
        }
    }

    record NoActiveTrack() implements ErrorKind {
        @Override
        public Classification classification() {
            return Classification.USER;
        }

        @Override
        public String title() {
            return ErrorTitles.INVALID_COMMAND;
        }

        @Override
        public String message() {
            return "No track is currently playing";
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of();
        }
    }

    record UserNotInGuild() implements ErrorKind {
        @Override
        public Classification classification() {
            return Classification.USER;
        }

        @Override
        public String title() {
            return ErrorTitles.NOT_IN_GUILD;
        }

        @Override
        public String message() {
            return "You are not in a discord server (guild) right now";
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of();
        }
    }

    record ParseInt(String input, NumberFormatException error) implements ErrorKind {
        public ParseInt {
            Objects.requireNonNull(input, "Input is required");
            Objects.requireNonNull(error, "Parse error is required");
        }

        @Override
        public Classification classification() {
            return Classification.USER;
        }

        @Override
        public String title() {
            return ErrorTitles.INVALID_ARGUMENT;
        }

        @Override
        public String message() {
            return "Failed to parse an integer: " + error.getMessage();
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("input", input), new DebugField("error", error));
        }

        @Override
        public Throwable cause() {
            return error;
        }
    }

    /**
     * A command argument whose parser failed with an error of its own.
     */
    record ParseArg(String argument, VeebotException error) implements ErrorKind {
        public ParseArg {
            Objects.requireNonNull(argument, "Argument is required");
            Objects.requireNonNull(error, "Nested error is required");
        }

        @Override
        public Classification classification() {
            return Classification.USER;
        }

        @Override
        public String title() {
            return ErrorTitles.INVALID_ARGUMENT;
        }

        @Override
        public String message() {
            return "Parsing the arguments finished with an error: " + error.kind().message();
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("argument", argument), new DebugField("error", error));
        }

        @Override
        public Throwable cause() {
            return error;
        }
    }

    record CommaInImageTag(String input) implements ErrorKind {
        public CommaInImageTag {
            Objects.requireNonNull(input, "Input is required");
        }

        @Override
        public Classification classification() {
            return Classification.USER;
        }

        @Override
        public String title() {
            return ErrorTitles.INVALID_ARGUMENT;
        }

        @Override
        public String message() {
            return "The specified image tags contain a comma (which is prohibited): " + input;
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("input", input));
        }
    }

    record UserNotInVoiceChannel() implements ErrorKind {
        @Override
        public Classification classification() {
            return Classification.USER;
        }

        @Override
        public String title() {
            return ErrorTitles.NOT_IN_VOICE_CHANNEL;
        }

        @Override
        public String message() {
            return "You are not in a voice channel. You need to connect to one first so that "
                    + "I can understand which channel to join.";
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of();
        }
    }

    // ---------------------------------------------------------------------
    // Internal errors
    // ---------------------------------------------------------------------

    /**
     * The bot could not join a voice channel. {@code channelName} is null when unknown.
     */
    record JoinVoiceChannel(String channelName) implements ErrorKind {
        @Override
        public Classification classification() {
            return Classification.INTERNAL;
        }

        @Override
        public String title() {
            return ErrorTitles.PERMISSIONS;
        }

        @Override
        public String message() {
            return "I cannot join the voice channel "
                    + (channelName != null ? channelName : "<unknown channel name>");
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("channelName", channelName));
        }
    }

    record AudioStart(Throwable error) implements ErrorKind {
        public AudioStart {
            Objects.requireNonNull(error, "Audio error is required");
        }

        @Override
        public Classification classification() {
            return Classification.INTERNAL;
        }

        @Override
        public String title() {
            return ErrorTitles.INTERNAL;
        }

        @Override
        public String message() {
            return "Failed to start streaming the audio: " + error;
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("error", error));
        }

        @Override
        public Throwable cause() {
            return error;
        }
    }

    record UnknownDiscord(Throwable error) implements ErrorKind {
        public UnknownDiscord {
            Objects.requireNonNull(error, "Discord error is required");
        }

        @Override
        public Classification classification() {
            return Classification.INTERNAL;
        }

        @Override
        public String title() {
            return ErrorTitles.INTERNAL;
        }

        @Override
        public String message() {
            return "Unknown discord error: " + error;
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("error", error));
        }

        @Override
        public Throwable cause() {
            return error;
        }
    }

    /**
     * The HTTP request could not be sent or did not complete (connection, timeout, I/O).
     */
    record SendRequest(Throwable error) implements ErrorKind {
        public SendRequest {
            Objects.requireNonNull(error, "Transport error is required");
        }

        @Override
        public Classification classification() {
            return Classification.INTERNAL;
        }

        @Override
        public String title() {
            return ErrorTitles.SEND_REQUEST;
        }

        @Override
        public String message() {
            return "Failed to send an http request";
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("error", error));
        }

        @Override
        public Throwable cause() {
            return error;
        }
    }

    /**
     * The server answered with a 4xx or 5xx status.
     */
    record GetRequest(int status, String body) implements ErrorKind {
        public GetRequest {
            Objects.requireNonNull(body, "Body is required");
        }

        @Override
        public Classification classification() {
            return Classification.INTERNAL;
        }

        @Override
        public String title() {
            return ErrorTitles.HTTP;
        }

        @Override
        public String message() {
            return "GET request has failed (http status code: " + status + "):\n" + body;
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("status", status), new DebugField("body", body));
        }
    }

    record UnexpectedJsonShape(Throwable error) implements ErrorKind {
        public UnexpectedJsonShape {
            Objects.requireNonNull(error, "Deserialization error is required");
        }

        @Override
        public Classification classification() {
            return Classification.INTERNAL;
        }

        @Override
        public String title() {
            return ErrorTitles.HTTP;
        }

        @Override
        public String message() {
            return "YouTube has returned an unexpected response JSON object";
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("error", error));
        }

        @Override
        public Throwable cause() {
            return error;
        }
    }

    record YtVidNotFound(String query) implements ErrorKind {
        public YtVidNotFound {
            Objects.requireNonNull(query, "Query is required");
        }

        @Override
        public Classification classification() {
            return Classification.INTERNAL;
        }

        @Override
        public String title() {
            return ErrorTitles.YOUTUBE;
        }

        @Override
        public String message() {
            return "Failed to find youtube video for \"" + query + "\" query.";
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("query", query));
        }
    }

    record YtInferVideoId(URI url) implements ErrorKind {
        public YtInferVideoId {
            Objects.requireNonNull(url, "URL is required");
        }

        @Override
        public Classification classification() {
            return Classification.INTERNAL;
        }

        @Override
        public String title() {
            return ErrorTitles.BAD_YOUTUBE_URL;
        }

        @Override
        public String message() {
            return "Could not infer YouTube video id from the url `" + url + "`";
        }

        @Override
        public List<DebugField> debugFields() {
            return List.of(new DebugField("url", url));
        }
    }
}
