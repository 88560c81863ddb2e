package fr.lapetina.veebot.domain.error;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates short ids that users can copy from the chat and operators can grep for in logs.
 *
 * <p>Ids are random and not derived from the error content. Uniqueness is best-effort:
 * with 64^6 possible values collisions are unlikely but not checked.
 */
public final class CorrelationIds {

    public static final int LENGTH = 6;

    private static final char[] ALPHABET =
            "_-0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();

    private CorrelationIds() {
    }

    public static String next() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        char[] id = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            id[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(id);
    }
}
