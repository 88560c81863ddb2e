package fr.lapetina.veebot.domain.error;

/**
 * Half-open range of valid indexes, {@code start} inclusive and {@code end} exclusive.
 */
public record IndexRange(int start, int end) {

    public IndexRange {
        if (start > end) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    /**
     * Range of valid indexes for a collection of the given size, {@code null} if it is empty.
     */
    public static IndexRange ofSize(int size) {
        return size > 0 ? new IndexRange(0, size) : null;
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
