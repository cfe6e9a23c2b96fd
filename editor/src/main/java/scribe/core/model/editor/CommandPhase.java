package scribe.core.model.editor;

/**
 * Direction in which a command was run.
 */
public enum CommandPhase {
    EXECUTE,
    UNDO,
    REDO
}
