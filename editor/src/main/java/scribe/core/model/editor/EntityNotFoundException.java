package scribe.core.model.editor;

/**
 * Referenced post, category, tag or tracker does not exist.
 */
public class EntityNotFoundException extends EditorValidationException {

    public EntityNotFoundException(String entity, String id) {
        super(entity + " not found: " + id);
    }

    protected EntityNotFoundException(String message) {
        super(message);
    }
}
