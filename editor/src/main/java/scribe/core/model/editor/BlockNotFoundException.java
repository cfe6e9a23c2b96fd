package scribe.core.model.editor;

import scribe.core.model.block.BlockType;

/**
 * Referenced block does not exist in the expected collection.
 */
public class BlockNotFoundException extends EntityNotFoundException {

    public BlockNotFoundException(String blockId, BlockType type) {
        super("Block with id " + blockId + " not found in " + type.label() + " blocks");
    }
}
