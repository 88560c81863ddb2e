package fr.lapetina.veebot.domain.error;

/**
 * Splits failures by who caused them.
 * Drives how much diagnostic context gets logged for an error.
 */
public enum Classification {
    /** Expected failure caused by user input (bad argument, missing voice or guild context) */
    USER,

    /** Unexpected failure of the bot or its infrastructure (SDK, network, malformed responses) */
    INTERNAL;

    public boolean isInternal() {
        return this == INTERNAL;
    }
}
