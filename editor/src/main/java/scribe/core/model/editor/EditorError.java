package scribe.core.model.editor;

/**
 * Error surfaced on the editor read model.
 *
 * @param kind    error category
 * @param message human-readable description
 */
public record EditorError(Kind kind, String message) {

    public enum Kind {
        /** Rejected before touching storage (no post loaded, unknown block, nothing to undo). */
        VALIDATION,
        /** Persistence failed while executing, undoing or redoing a command. */
        STORAGE,
        /** A command was asked to reverse state it never captured. */
        INVARIANT
    }

    public EditorError {
        if (kind == null) {
            kind = Kind.STORAGE;
        }
        if (message == null || message.isBlank()) {
            message = "An unknown error occurred";
        }
    }

    /**
     * Map a failure to an error. Unknown exception types count as storage failures.
     */
    public static EditorError from(Throwable failure) {
        if (failure instanceof EditorException editorException) {
            return new EditorError(editorException.kind(), editorException.getMessage());
        }
        if (failure instanceof IllegalArgumentException) {
            return new EditorError(Kind.VALIDATION, failure.getMessage());
        }
        return new EditorError(Kind.STORAGE, failure.getMessage());
    }
}
