package satchel.core.model.session;

/**
 * Thrown when a serialized session payload exceeds the store's configured maximum length.
 *
 * <p>Raised before any backend call, so nothing is written.
 */
public class SessionTooLargeException extends RuntimeException {

    private final int length;
    private final int maxLength;

    public SessionTooLargeException(int length, int maxLength) {
        super("Session payload is too big: " + length + " bytes exceeds the limit of " + maxLength);
        this.length = length;
        this.maxLength = maxLength;
    }

    /** Returns the serialized payload length in bytes. */
    public int getLength() {
        return length;
    }

    /** Returns the configured limit in bytes. */
    public int getMaxLength() {
        return maxLength;
    }
}
