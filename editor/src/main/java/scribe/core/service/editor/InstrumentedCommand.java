package scribe.core.service.editor;

import java.time.Instant;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.command.Command;
import scribe.core.model.editor.CommandPhase;
import scribe.core.port.out.EditorMetrics;

/**
 * Decorator logging and timing every run of a command.
 *
 * @param <T> command result type
 */
class InstrumentedCommand<T> implements Command<T> {

    private static final Logger LOG = Logger.getLogger(InstrumentedCommand.class);

    private final Command<T> delegate;
    private final EditorMetrics metrics;

    InstrumentedCommand(Command<T> delegate, EditorMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
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
        return measured(CommandPhase.EXECUTE, delegate::execute);
    }

    @Override
    public Uni<T> undo() {
        return measured(CommandPhase.UNDO, delegate::undo);
    }

    @Override
    public Uni<T> redo() {
        return measured(CommandPhase.REDO, delegate::redo);
    }

    private Uni<T> measured(CommandPhase phase, Supplier<Uni<T>> run) {
        return Uni.createFrom().deferred(() -> {
            final long start = System.nanoTime();
            return run.get()
                    .invoke(result -> {
                        LOG.debugf("%s '%s' succeeded", phase, delegate.description());
                        metrics.recordCommand(delegate.description(), phase, true, elapsedMillis(start));
                    })
                    .onFailure()
                    .invoke(failure -> {
                        LOG.warnf("%s '%s' failed: %s", phase, delegate.description(), failure.getMessage());
                        metrics.recordCommand(delegate.description(), phase, false, elapsedMillis(start));
                    });
        });
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
