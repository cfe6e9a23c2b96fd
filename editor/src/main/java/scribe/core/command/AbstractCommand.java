package scribe.core.command;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

import scribe.core.model.editor.CommandStateException;

/**
 * Base class tracking whether a command is currently applied.
 *
 * <p>Undo is only allowed while the command is applied: after a successful
 * execute or redo, and before a successful undo.
 *
 * @param <T> result of each run
 */
public abstract class AbstractCommand<T> implements Command<T> {

    private final String description;
    private final Instant timestamp = Instant.now();
    private volatile boolean applied;

    protected AbstractCommand(String description) {
        this.description = description;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public final Uni<T> execute() {
        return Uni.createFrom().deferred(this::apply).invoke(result -> applied = true);
    }

    @Override
    public final Uni<T> undo() {
        return Uni.createFrom()
                .deferred(() -> applied
                        ? revert()
                        : Uni.createFrom()
                                .<T>failure(new CommandStateException(
                                        "Cannot undo '" + description + "': command is not applied")))
                .invoke(result -> applied = false);
    }

    @Override
    public final Uni<T> redo() {
        return Uni.createFrom().deferred(this::reapply).invoke(result -> applied = true);
    }

    public boolean isApplied() {
        return applied;
    }

    /**
     * Perform the operation and capture what {@link #revert()} needs.
     */
    protected abstract Uni<T> apply();

    /**
     * Reverse the operation using the captured state.
     */
    protected abstract Uni<T> revert();

    protected Uni<T> reapply() {
        return apply();
    }
}
