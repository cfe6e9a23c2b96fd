package scribe.core.command.block;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInputs;
import scribe.core.model.block.BlockType;
import scribe.core.port.in.BlockManagement;

/**
 * Delete a block; undo re-creates it at its old position under a new id.
 *
 * <p>Execute returns the deleted block, undo the re-created one.
 */
public class DeleteBlockCommand extends AbstractCommand<Block> {

    private final BlockManagement blocks;
    private final IdentityAliases aliases;
    private final String blockId;
    private final BlockType type;

    private Block deleted;

    public DeleteBlockCommand(BlockManagement blocks, IdentityAliases aliases, String blockId, BlockType type) {
        super("Delete " + type.label() + " block");
        this.blocks = blocks;
        this.aliases = aliases;
        this.blockId = blockId;
        this.type = type;
    }

    @Override
    protected Uni<Block> apply() {
        return blocks.deleteBlock(aliases.resolve(blockId), type).invoke(block -> deleted = block);
    }

    @Override
    protected Uni<Block> revert() {
        final var snapshot = deleted;
        return blocks.createBlock(aliases.resolve(snapshot.postId()), BlockInputs.fromSnapshot(snapshot))
                .invoke(restored -> aliases.replace(snapshot.id(), restored.id()));
    }
}
