package scribe.core.service.block;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInput;
import scribe.core.model.block.BlockPositionUpdate;
import scribe.core.model.block.BlockType;
import scribe.core.model.editor.BlockNotFoundException;
import scribe.core.model.editor.EditorValidationException;
import scribe.core.port.in.BlockManagement;
import scribe.core.port.out.BlockStore;
import scribe.core.port.out.BlockTransaction;

/**
 * Block repository keeping the blocks of each post totally ordered.
 *
 * <p>Blocks of the 13 types live in separate tables of the {@link BlockStore}.
 * Every operation runs in one store transaction, so a position shift across
 * tables and the write that needed it either both happen or neither does.
 *
 * <p>Position rules:
 * <ul>
 *   <li>insert at {@code p}: blocks at {@code >= p} move to {@code +1}</li>
 *   <li>append: {@code max + 1}, or {@code 0} for an empty post</li>
 *   <li>delete at {@code p}: blocks at {@code > p} move to {@code -1}</li>
 *   <li>update never changes a position</li>
 * </ul>
 */
@ApplicationScoped
public class BlockService implements BlockManagement {

    private static final Logger LOG = Logger.getLogger(BlockService.class);

    private final BlockStore store;

    @Inject
    public BlockService(BlockStore store) {
        this.store = store;
    }

    @Override
    public Uni<Block> createBlock(String postId, BlockInput input) {
        if (postId == null || postId.isBlank()) {
            return Uni.createFrom().failure(new EditorValidationException("Post ID cannot be null or blank"));
        }
        if (input.position() != null && input.position() < 0) {
            return Uni.createFrom()
                    .failure(new EditorValidationException("Block position cannot be negative: " + input.position()));
        }

        return store.inTransaction(tx -> {
                    final int position;
                    if (input.position() != null) {
                        position = input.position();
                        final int shifted = tx.tables().stream()
                                .mapToInt(table -> table.updateMany(postId, position, 1))
                                .sum();
                        LOG.debugf(
                                "Shifted %d block(s) of post %s at or after %d", (Object) shifted, postId, position);
                    } else {
                        position = nextPosition(tx, postId);
                    }
                    final var block = new Block(null, postId, position, input.blockName(), input.payload(), null, null);
                    return tx.table(input.type()).create(block);
                })
                .invoke(block -> LOG.debugf(
                        "Created %s block %s at position %d", block.type().label(), block.id(), block.position()));
    }

    @Override
    public Uni<Block> readBlock(String blockId, BlockType type) {
        return store.inTransaction(
                tx -> tx.table(type).read(blockId).orElseThrow(() -> new BlockNotFoundException(blockId, type)));
    }

    @Override
    public Uni<Optional<Block>> findBlock(String blockId) {
        return store.inTransaction(tx -> tx.tables().stream()
                .map(table -> table.read(blockId))
                .flatMap(Optional::stream)
                .findFirst());
    }

    @Override
    public Uni<Block> updateBlock(String blockId, BlockInput input) {
        return store.inTransaction(tx -> {
            final var table = tx.table(input.type());
            final var current =
                    table.read(blockId).orElseThrow(() -> new BlockNotFoundException(blockId, input.type()));
            final var payload = ChildRowMerger.merge(current.payload(), input.payload());
            final var name = input.blockName() != null ? input.blockName() : current.blockName();
            return table.update(current.withContent(name, payload));
        });
    }

    @Override
    public Uni<Block> restoreBlock(Block snapshot) {
        return store.inTransaction(tx -> {
            final var table = tx.table(snapshot.type());
            final var current = table.read(snapshot.id())
                    .orElseThrow(() -> new BlockNotFoundException(snapshot.id(), snapshot.type()));
            // positions only move through create, delete and move; the owner may have been re-created
            return table.update(new Block(
                    snapshot.id(),
                    current.postId(),
                    current.position(),
                    snapshot.blockName(),
                    snapshot.payload(),
                    snapshot.createdAt(),
                    snapshot.updatedAt()));
        });
    }

    @Override
    public Uni<Block> deleteBlock(String blockId, BlockType type) {
        return store.inTransaction(tx -> {
                    final var table = tx.table(type);
                    final var deleted =
                            table.read(blockId).orElseThrow(() -> new BlockNotFoundException(blockId, type));
                    table.delete(blockId);
                    tx.tables().forEach(t -> t.updateMany(deleted.postId(), deleted.position() + 1, -1));
                    return deleted;
                })
                .invoke(block -> LOG.debugf("Deleted %s block %s", block.type().label(), block.id()));
    }

    @Override
    public Uni<List<Block>> getBlocksByPost(String postId) {
        return store.inTransaction(tx -> sorted(tx.tables().stream()
                .flatMap(table -> table.findByPost(postId).stream())
                .toList()));
    }

    @Override
    public Uni<List<Block>> moveBlocks(List<BlockPositionUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            return Uni.createFrom().failure(new EditorValidationException("No block positions to update"));
        }

        final var byType = updates.stream()
                .collect(Collectors.groupingBy(
                        BlockPositionUpdate::blockType, LinkedHashMap::new, Collectors.toList()));

        return store.inTransaction(tx -> {
                    final List<Block> moved = new ArrayList<>(updates.size());
                    byType.forEach((type, group) -> {
                        final var table = tx.table(type);
                        for (BlockPositionUpdate update : group) {
                            final var current = table.read(update.blockId())
                                    .orElseThrow(() -> new BlockNotFoundException(update.blockId(), type));
                            moved.add(table.update(current.withPosition(update.newPosition())));
                        }
                    });
                    return sorted(moved);
                })
                .invoke(moved -> LOG.debugf("Moved %d block(s) across %d type(s)", moved.size(), byType.size()));
    }

    @Override
    public Uni<List<Block>> createBlocks(String postId, List<BlockInput> inputs) {
        if (inputs.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }

        return store.inTransaction(tx -> {
            int next = nextPosition(tx, postId);
            final List<Block> created = new ArrayList<>(inputs.size());
            for (BlockInput input : inputs) {
                final int position = input.position() != null ? input.position() : next;
                next = Math.max(next, position + 1);
                final var block = new Block(null, postId, position, input.blockName(), input.payload(), null, null);
                created.add(tx.table(input.type()).create(block));
            }
            return created;
        });
    }

    @Override
    public Uni<Integer> deleteBlocksByPost(String postId) {
        return store.inTransaction(tx -> {
                    int deleted = 0;
                    for (var table : tx.tables()) {
                        for (Block block : table.findByPost(postId)) {
                            if (table.delete(block.id())) {
                                deleted++;
                            }
                        }
                    }
                    return deleted;
                })
                .invoke(count -> LOG.debugf("Deleted %d block(s) of post %s", count, postId));
    }

    private static int nextPosition(BlockTransaction tx, String postId) {
        return tx.tables().stream()
                .flatMap(table -> table.findByPost(postId).stream())
                .mapToInt(Block::position)
                .max()
                .orElse(-1)
                + 1;
    }

    private static List<Block> sorted(List<Block> blocks) {
        final var result = new ArrayList<>(blocks);
        result.sort(Block.ORDER);
        return List.copyOf(result);
    }
}
