package fr.lapetina.veebot.domain.error;

/**
 * Short titles shown above an error message in the chat.
 */
public final class ErrorTitles {

    public static final String INVALID_COMMAND = "Invalid command error";
    public static final String NOT_IN_GUILD = "Not in a guild error";
    public static final String INVALID_ARGUMENT = "Invalid argument error";
    public static final String NOT_IN_VOICE_CHANNEL = "Not in a voice channel error";
    public static final String PERMISSIONS = "Permissions error";
    public static final String INTERNAL = "Internal error";
    public static final String SEND_REQUEST = "Send request error";
    public static final String HTTP = "HTTP error";
    public static final String YOUTUBE = "YouTube error";
    public static final String BAD_YOUTUBE_URL = "Bad YouTube URL";

    private ErrorTitles() {
    }
}
