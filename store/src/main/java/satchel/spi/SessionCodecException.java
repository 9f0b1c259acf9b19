package satchel.spi;

/**
 * Exception thrown when a session cookie cannot be encoded or decoded.
 */
public class SessionCodecException extends RuntimeException {

    /**
     * Why a codec rejected a value.
     */
    public enum Reason {
        /** No codec is configured. */
        NO_CODECS,
        /** The value exceeds the codec's length limit. */
        VALUE_TOO_LONG,
        /** The value is not in the codec's format. */
        MALFORMED,
        /** The authentication code does not match. */
        INVALID_MAC,
        /** The embedded timestamp is not a number. */
        INVALID_TIMESTAMP,
        /** The value was issued too recently. */
        TIMESTAMP_TOO_NEW,
        /** The value is older than the codec's max age. */
        EXPIRED,
        /** The value could not be decrypted. */
        DECRYPTION_FAILED,
        /** The value could not be encrypted. */
        ENCRYPTION_FAILED
    }

    private final Reason reason;

    public SessionCodecException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SessionCodecException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Returns the reason the value was rejected. */
    public Reason getReason() {
        return reason;
    }
}
