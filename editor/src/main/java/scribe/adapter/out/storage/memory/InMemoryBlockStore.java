package scribe.adapter.out.storage.memory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.model.block.Block;
import scribe.core.model.block.BlockPayload;
import scribe.core.model.block.BlockType;
import scribe.core.model.block.ChildRow;
import scribe.core.model.editor.BlockNotFoundException;
import scribe.core.model.editor.StorageException;
import scribe.core.port.out.BlockStore;
import scribe.core.port.out.BlockTable;
import scribe.core.port.out.BlockTransaction;

/**
 * In-memory implementation of BlockStore with one table per block type.
 *
 * <p>Data is NOT persisted across restarts. Transactions are serialized by a
 * lock. Each transaction copies a table the first time it writes to it and
 * publishes all copies together on commit, so a transaction that throws
 * leaves every table exactly as it was.
 *
 * <p>Committed tables are never mutated, which lets readers outside the lock
 * see a consistent snapshot. Work functions must not open nested transactions.
 */
public class InMemoryBlockStore implements BlockStore {

    private static final Logger LOG = Logger.getLogger(InMemoryBlockStore.class);

    static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final ReentrantLock lock = new ReentrantLock();
    private final Duration lockTimeout;

    private volatile Map<BlockType, Map<String, Block>> committed;

    public InMemoryBlockStore() {
        this(DEFAULT_LOCK_TIMEOUT);
    }

    public InMemoryBlockStore(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
        final Map<BlockType, Map<String, Block>> tables = new EnumMap<>(BlockType.class);
        for (BlockType type : BlockType.values()) {
            tables.put(type, Collections.emptyMap());
        }
        this.committed = Collections.unmodifiableMap(tables);
    }

    @Override
    public <T> Uni<T> inTransaction(Function<BlockTransaction, T> work) {
        return Uni.createFrom().item(() -> runLocked(work));
    }

    /**
     * Number of blocks currently committed across all tables.
     */
    public int size() {
        return committed.values().stream().mapToInt(Map::size).sum();
    }

    private <T> T runLocked(Function<BlockTransaction, T> work) {
        acquire();
        try {
            final var transaction = new Transaction(committed);
            final T result;
            try {
                result = work.apply(transaction);
            } catch (RuntimeException e) {
                LOG.debugf("Block transaction rolled back: %s", e.getMessage());
                throw e;
            } finally {
                transaction.close();
            }
            committed = transaction.merged();
            return result;
        } finally {
            lock.unlock();
        }
    }

    private void acquire() {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new StorageException("Timed out after " + lockTimeout + " waiting for block store lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for block store lock", e);
        }
    }

    private static Block assignIds(Block block) {
        final var id = block.id() != null ? block.id() : newId();
        var payload = block.payload();
        if (payload instanceof BlockPayload.Composite<?> composite) {
            payload = assignChildIds(composite);
        }
        return new Block(
                id, block.postId(), block.position(), block.blockName(), payload, block.createdAt(), block.updatedAt());
    }

    private static <C extends ChildRow<C>> BlockPayload assignChildIds(BlockPayload.Composite<C> composite) {
        final List<C> rows = composite.children().stream()
                .map(row -> row.id() == null ? row.withId(newId()) : row)
                .toList();
        return composite.withChildren(rows);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Staged view over the committed tables.
     */
    private static final class Transaction implements BlockTransaction {

        private final Map<BlockType, Map<String, Block>> base;
        private final Map<BlockType, Map<String, Block>> staged = new EnumMap<>(BlockType.class);
        private final Map<BlockType, StagedTable> tables = new EnumMap<>(BlockType.class);
        private boolean open = true;

        Transaction(Map<BlockType, Map<String, Block>> base) {
            this.base = base;
        }

        @Override
        public BlockTable table(BlockType type) {
            return tables.computeIfAbsent(type, StagedTable::new);
        }

        void close() {
            open = false;
        }

        Map<BlockType, Map<String, Block>> merged() {
            if (staged.isEmpty()) {
                return base;
            }
            final Map<BlockType, Map<String, Block>> next = new EnumMap<>(base);
            staged.forEach((type, rows) -> next.put(type, Collections.unmodifiableMap(rows)));
            return Collections.unmodifiableMap(next);
        }

        private final class StagedTable implements BlockTable {

            private final BlockType type;

            StagedTable(BlockType type) {
                this.type = type;
            }

            @Override
            public BlockType type() {
                return type;
            }

            @Override
            public Block create(Block block) {
                requireOwnType(block);
                if (block.id() != null && view().containsKey(block.id())) {
                    throw new IllegalArgumentException("Block id already exists: " + block.id());
                }
                final var stored = assignIds(block);
                writable().put(stored.id(), stored);
                return stored;
            }

            @Override
            public Optional<Block> read(String blockId) {
                return Optional.ofNullable(view().get(blockId));
            }

            @Override
            public Block update(Block block) {
                requireOwnType(block);
                if (block.id() == null || !view().containsKey(block.id())) {
                    throw new BlockNotFoundException(block.id(), type);
                }
                final var stored = assignIds(block);
                writable().put(stored.id(), stored);
                return stored;
            }

            @Override
            public boolean delete(String blockId) {
                if (!view().containsKey(blockId)) {
                    return false;
                }
                writable().remove(blockId);
                return true;
            }

            @Override
            public List<Block> findByPost(String postId) {
                return view().values().stream()
                        .filter(block -> block.postId().equals(postId))
                        .toList();
            }

            @Override
            public int updateMany(String postId, int fromPosition, int delta) {
                final var affected = view().values().stream()
                        .filter(block -> block.postId().equals(postId) && block.position() >= fromPosition)
                        .toList();
                if (affected.isEmpty() || delta == 0) {
                    return 0;
                }
                final var rows = writable();
                for (Block block : affected) {
                    rows.put(block.id(), block.withPosition(block.position() + delta));
                }
                return affected.size();
            }

            private void requireOwnType(Block block) {
                if (block.type() != type) {
                    throw new IllegalArgumentException(
                            "Cannot store " + block.type().label() + " block in " + type.label() + " table");
                }
            }

            private Map<String, Block> view() {
                requireOpen();
                final var rows = staged.get(type);
                return rows != null ? rows : base.get(type);
            }

            private Map<String, Block> writable() {
                requireOpen();
                return staged.computeIfAbsent(type, t -> new LinkedHashMap<>(base.get(t)));
            }

            private void requireOpen() {
                if (!open) {
                    throw new IllegalStateException("Block transaction is no longer open");
                }
            }
        }
    }
}
