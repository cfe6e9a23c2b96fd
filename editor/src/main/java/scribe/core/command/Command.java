package scribe.core.command;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * A reversible editor operation.
 *
 * <p>Inputs are fixed at construction. State needed to reverse the operation
 * is captured when {@link #execute()} runs, so executing again re-captures it.
 *
 * @param <T> result of each run
 */
public interface Command<T> {

    /**
     * Short label, e.g. "Create text block". Contains no identifiers.
     */
    String description();

    /**
     * When the command was created.
     */
    Instant timestamp();

    Uni<T> execute();

    /**
     * Reverse the last successful execute or redo.
     *
     * <p>Fails with {@link scribe.core.model.editor.CommandStateException} when
     * there is nothing to reverse.
     */
    Uni<T> undo();

    default Uni<T> redo() {
        return execute();
    }
}
