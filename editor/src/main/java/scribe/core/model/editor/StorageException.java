package scribe.core.model.editor;

/**
 * Persistence layer failure.
 */
public class StorageException extends EditorException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public EditorError.Kind kind() {
        return EditorError.Kind.STORAGE;
    }
}
