package scribe.core.model.editor;

/**
 * Request rejected before any storage write.
 */
public class EditorValidationException extends EditorException {

    public EditorValidationException(String message) {
        super(message);
    }

    @Override
    public EditorError.Kind kind() {
        return EditorError.Kind.VALIDATION;
    }
}
