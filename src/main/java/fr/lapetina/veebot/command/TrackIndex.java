package fr.lapetina.veebot.command;

import fr.lapetina.veebot.domain.error.ErrorKind;
import fr.lapetina.veebot.domain.error.IndexRange;
import fr.lapetina.veebot.domain.error.VeebotException;

/**
 * Validation of track positions given by users.
 */
public final class TrackIndex {

    private TrackIndex() {
    }

    /**
     * Checks a zero-based index against a queue of {@code trackCount} tracks.
     *
     * @return the index itself when it is valid
     * @throws VeebotException with {@link ErrorKind.TrackIndexOutOfBounds} otherwise
     */
    public static int resolve(int index, int trackCount) {
        IndexRange available = IndexRange.ofSize(trackCount);
        if (available == null || !available.contains(index)) {
            throw VeebotException.of(new ErrorKind.TrackIndexOutOfBounds(index, available));
        }
        return index;
    }
}
