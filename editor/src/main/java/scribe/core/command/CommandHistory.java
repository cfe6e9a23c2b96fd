package scribe.core.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.model.editor.EditorValidationException;

/**
 * Linear undo/redo stack.
 *
 * <p>{@code currentIndex} points at the last applied command, {@code -1} when
 * none is. Running a new command drops every command after the cursor. A
 * failed execute, undo or redo leaves the stack and cursor untouched.
 *
 * <p>Only one operation may be in flight at a time; a second one fails with
 * {@link IllegalStateException} until the first completes.
 */
public class CommandHistory {

    private static final Logger LOG = Logger.getLogger(CommandHistory.class);

    private final List<Command<?>> commands = new ArrayList<>();
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private int currentIndex = -1;

    /**
     * Build a command, execute it and record it on success.
     *
     * @param factory creates the command; called once the history is free
     * @param <T>     command result type
     * @return Uni with the execute result
     */
    public <T> Uni<T> run(Supplier<? extends Command<T>> factory) {
        return guarded("run", () -> {
            final Command<T> command = factory.get();
            return command.execute().invoke(result -> append(command));
        });
    }

    /**
     * Undo the command at the cursor and move the cursor back.
     *
     * @return Uni completing once undone, failing with "No commands to undo" if none
     */
    public Uni<Void> undo() {
        return guarded("undo", () -> {
            final var command = peekUndo();
            if (command.isEmpty()) {
                return Uni.createFrom().<Void>failure(new EditorValidationException("No commands to undo"));
            }
            return command.get().undo().invoke(result -> moveCursor(-1)).replaceWithVoid();
        });
    }

    /**
     * Redo the command after the cursor and move the cursor forward.
     *
     * @return Uni completing once redone, failing with "No commands to redo" if none
     */
    public Uni<Void> redo() {
        return guarded("redo", () -> {
            final var command = peekRedo();
            if (command.isEmpty()) {
                return Uni.createFrom().<Void>failure(new EditorValidationException("No commands to redo"));
            }
            return command.get().redo().invoke(result -> moveCursor(1)).replaceWithVoid();
        });
    }

    /**
     * Drop every command.
     *
     * @return number of commands dropped
     */
    public synchronized int reset() {
        final int dropped = commands.size();
        commands.clear();
        currentIndex = -1;
        LOG.debugf("Command history reset, %d command(s) dropped", dropped);
        return dropped;
    }

    public synchronized boolean canUndo() {
        return currentIndex >= 0;
    }

    public synchronized boolean canRedo() {
        return currentIndex < commands.size() - 1;
    }

    public synchronized int size() {
        return commands.size();
    }

    public synchronized int currentIndex() {
        return currentIndex;
    }

    public synchronized List<Command<?>> commands() {
        return List.copyOf(commands);
    }

    public synchronized Optional<String> undoDescription() {
        return peekUndo().map(Command::description);
    }

    public synchronized Optional<String> redoDescription() {
        return peekRedo().map(Command::description);
    }

    public boolean isBusy() {
        return inFlight.get();
    }

    private <T> Uni<T> guarded(String operation, Supplier<Uni<T>> action) {
        return Uni.createFrom().deferred(() -> {
            if (!inFlight.compareAndSet(false, true)) {
                return Uni.createFrom()
                        .failure(new IllegalStateException(
                                "Cannot " + operation + " while another command is in progress"));
            }
            final Uni<T> pending;
            try {
                pending = action.get();
            } catch (RuntimeException e) {
                inFlight.set(false);
                return Uni.createFrom().failure(e);
            }
            return pending.eventually(() -> inFlight.set(false));
        });
    }

    private synchronized void append(Command<?> command) {
        if (currentIndex < commands.size() - 1) {
            final int dropped = commands.size() - currentIndex - 1;
            commands.subList(currentIndex + 1, commands.size()).clear();
            LOG.debugf("Dropped %d redo command(s)", dropped);
        }
        commands.add(command);
        currentIndex = commands.size() - 1;
        LOG.debugf("Recorded '%s' at index %d", command.description(), currentIndex);
    }

    private synchronized void moveCursor(int delta) {
        currentIndex += delta;
    }

    private synchronized Optional<Command<?>> peekUndo() {
        return currentIndex >= 0 ? Optional.of(commands.get(currentIndex)) : Optional.empty();
    }

    private synchronized Optional<Command<?>> peekRedo() {
        return currentIndex < commands.size() - 1 ? Optional.of(commands.get(currentIndex + 1)) : Optional.empty();
    }
}
