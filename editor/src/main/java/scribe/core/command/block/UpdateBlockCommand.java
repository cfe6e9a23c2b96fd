package scribe.core.command.block;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInput;
import scribe.core.port.in.BlockManagement;

/**
 * Replace a block's content; undo writes the captured block back, child rows included.
 */
public class UpdateBlockCommand extends AbstractCommand<Block> {

    private final BlockManagement blocks;
    private final IdentityAliases aliases;
    private final String blockId;
    private final BlockInput input;

    private Block previous;

    public UpdateBlockCommand(BlockManagement blocks, IdentityAliases aliases, String blockId, BlockInput input) {
        super("Update " + input.type().label() + " block");
        this.blocks = blocks;
        this.aliases = aliases;
        this.blockId = blockId;
        this.input = input;
    }

    @Override
    protected Uni<Block> apply() {
        final var target = aliases.resolve(blockId);
        return blocks.readBlock(target, input.type())
                .invoke(block -> previous = block)
                .flatMap(block -> blocks.updateBlock(target, input));
    }

    @Override
    protected Uni<Block> revert() {
        return blocks.restoreBlock(previous.withId(aliases.resolve(previous.id())));
    }
}
