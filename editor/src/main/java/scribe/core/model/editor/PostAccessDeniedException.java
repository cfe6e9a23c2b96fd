package scribe.core.model.editor;

/**
 * The acting user is not the author of the post it tried to modify.
 */
public class PostAccessDeniedException extends EditorValidationException {

    public PostAccessDeniedException(String postId, String userId) {
        super("User " + userId + " cannot modify post " + postId);
    }
}
