package satchel.spi;

/**
 * Exception thrown when session values cannot be converted to or from bytes.
 */
public class SessionSerializationException extends RuntimeException {

    public SessionSerializationException(String message) {
        super(message);
    }

    public SessionSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
