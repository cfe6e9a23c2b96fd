package scribe.core.port.out;

import java.util.function.Function;

import io.smallrye.mutiny.Uni;

/**
 * Port for the storage engine holding one collection per block type.
 *
 * <p>All access goes through {@link #inTransaction(Function)}: the work function
 * receives a {@link BlockTransaction} exposing every per-type table, and either all
 * of its writes become visible together or, if it throws, none do.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Transactions are atomic and isolated from each other</li>
 *   <li>A failure thrown by the work function rolls back every table it touched</li>
 *   <li>The returned Uni fails with the thrown exception, or a
 *       {@link scribe.core.model.editor.StorageException} for engine errors</li>
 * </ul>
 */
public interface BlockStore {

    /**
     * Run a unit of work inside one storage transaction.
     *
     * @param work function reading and writing block tables
     * @param <T>  result type
     * @return Uni with the work's result once committed
     */
    <T> Uni<T> inTransaction(Function<BlockTransaction, T> work);
}
