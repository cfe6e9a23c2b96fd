package scribe.core.port.out;

import scribe.core.model.editor.CommandPhase;

/**
 * Port interface for recording editor command metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface EditorMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record one run of a command.
     *
     * @param command    command description
     * @param phase      execute, undo or redo
     * @param success    whether the run succeeded
     * @param durationMs run time in milliseconds
     */
    void recordCommand(String command, CommandPhase phase, boolean success, long durationMs);

    /**
     * Record a history reset.
     *
     * @param discarded number of commands dropped from the history
     */
    void recordHistoryReset(int discarded);
}
