package scribe.core.service.editor;

import java.time.Instant;
import java.util.function.Function;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.command.Command;

/**
 * Decorator feeding a command's results into the editor projection.
 *
 * <p>{@code onApplied} receives execute and redo results, {@code onReverted}
 * undo results. The projection step runs before the history records the
 * outcome, so a failing projection step fails the whole operation. The
 * storage change is then compensated: a failed undo is redone, a failed
 * execute or redo is undone, and the command is left as it was before.
 *
 * @param <T> command result type
 */
class ProjectedCommand<T> implements Command<T> {

    private static final Logger LOG = Logger.getLogger(ProjectedCommand.class);

    private final Command<T> delegate;
    private final Function<T, Uni<?>> onApplied;
    private final Function<T, Uni<?>> onReverted;

    ProjectedCommand(Command<T> delegate, Function<T, Uni<?>> onApplied, Function<T, Uni<?>> onReverted) {
        this.delegate = delegate;
        this.onApplied = onApplied;
        this.onReverted = onReverted;
    }

    @Override
    public String description() {
        return delegate.description();
    }

    @Override
    public Instant timestamp() {
        return delegate.timestamp();
    }

    @Override
    public Uni<T> execute() {
        return delegate.execute().call(result -> project(onApplied, result, delegate::undo));
    }

    @Override
    public Uni<T> undo() {
        return delegate.undo().call(result -> project(onReverted, result, delegate::redo));
    }

    @Override
    public Uni<T> redo() {
        return delegate.redo().call(result -> project(onApplied, result, delegate::undo));
    }

    private Uni<?> project(Function<T, Uni<?>> step, T result, Supplier<Uni<T>> compensation) {
        return Uni.createFrom().deferred(() -> step.apply(result)).onFailure().call(failure -> {
            LOG.warnf("Projecting '%s' failed, compensating: %s", delegate.description(), failure.getMessage());
            return compensation.get();
        });
    }
}
