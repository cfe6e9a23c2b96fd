package scribe.core.command.block;

import java.util.List;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockPositionUpdate;
import scribe.core.model.editor.EditorValidationException;
import scribe.core.port.in.BlockManagement;

/**
 * Move several blocks at once; undo moves each of them back to where it was.
 */
public class MoveBlocksCommand extends AbstractCommand<List<Block>> {

    private final BlockManagement blocks;
    private final IdentityAliases aliases;
    private final List<BlockPositionUpdate> updates;

    private List<BlockPositionUpdate> previous;

    public MoveBlocksCommand(BlockManagement blocks, IdentityAliases aliases, List<BlockPositionUpdate> updates) {
        super("Move blocks");
        this.blocks = blocks;
        this.aliases = aliases;
        this.updates = List.copyOf(updates);
    }

    @Override
    protected Uni<List<Block>> apply() {
        if (updates.isEmpty()) {
            return Uni.createFrom().failure(new EditorValidationException("No block positions to update"));
        }

        final var targets = resolve(updates);
        return Multi.createFrom()
                .iterable(targets)
                .onItem()
                .transformToUniAndConcatenate(update -> blocks.readBlock(update.blockId(), update.blockType()))
                .map(Block::currentPosition)
                .collect()
                .asList()
                .invoke(positions -> previous = positions)
                .flatMap(positions -> blocks.moveBlocks(targets));
    }

    @Override
    protected Uni<List<Block>> revert() {
        return blocks.moveBlocks(resolve(previous));
    }

    private List<BlockPositionUpdate> resolve(List<BlockPositionUpdate> positions) {
        return positions.stream()
                .map(update -> update.withBlockId(aliases.resolve(update.blockId())))
                .toList();
    }
}
