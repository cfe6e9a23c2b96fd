package scribe.core.command.block;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInput;
import scribe.core.port.in.BlockManagement;

/**
 * Insert a block; undo deletes it again.
 *
 * <p>Each execute creates a fresh row, so a redo gets a new id. The previous id
 * is aliased to it so that older commands keep finding the block.
 */
public class CreateBlockCommand extends AbstractCommand<Block> {

    private final BlockManagement blocks;
    private final IdentityAliases aliases;
    private final String postId;
    private final BlockInput input;

    private Block created;

    public CreateBlockCommand(BlockManagement blocks, IdentityAliases aliases, String postId, BlockInput input) {
        super("Create " + input.type().label() + " block");
        this.blocks = blocks;
        this.aliases = aliases;
        this.postId = postId;
        this.input = input;
    }

    @Override
    protected Uni<Block> apply() {
        return blocks.createBlock(aliases.resolve(postId), input).invoke(block -> {
            if (created != null) {
                aliases.replace(created.id(), block.id());
            }
            created = block;
        });
    }

    @Override
    protected Uni<Block> revert() {
        return blocks.deleteBlock(aliases.resolve(created.id()), created.type());
    }
}
