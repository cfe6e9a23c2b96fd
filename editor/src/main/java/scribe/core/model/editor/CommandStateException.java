package scribe.core.model.editor;

/**
 * A command was asked to undo without the state captured by a successful execute.
 */
public class CommandStateException extends EditorException {

    public CommandStateException(String message) {
        super(message);
    }

    @Override
    public EditorError.Kind kind() {
        return EditorError.Kind.INVARIANT;
    }
}
