package scribe.core.model.editor;

/**
 * Base type of failures raised by the editor core.
 */
public abstract class EditorException extends RuntimeException {

    protected EditorException(String message) {
        super(message);
    }

    protected EditorException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract EditorError.Kind kind();
}
