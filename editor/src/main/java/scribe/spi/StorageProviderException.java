package scribe.spi;

/**
 * Exception thrown when a content storage provider cannot be selected or initialized.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
