package satchel.spi;

/**
 * Exception thrown when a session storage backend is unusable, for example when
 * the liveness check performed at store construction does not answer as expected.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
