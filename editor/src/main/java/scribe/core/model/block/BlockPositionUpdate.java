package scribe.core.model.block;

/**
 * Target position of one block in a bulk move.
 *
 * @param blockId     block to move
 * @param blockType   collection holding the block
 * @param newPosition position to write
 */
public record BlockPositionUpdate(String blockId, BlockType blockType, int newPosition) {

    public BlockPositionUpdate {
        if (blockId == null || blockId.isBlank()) {
            throw new IllegalArgumentException("Block ID cannot be null or blank");
        }
        if (blockType == null) {
            throw new IllegalArgumentException("Block type cannot be null");
        }
        if (newPosition < 0) {
            throw new IllegalArgumentException("Block position cannot be negative: " + newPosition);
        }
    }

    public BlockPositionUpdate withBlockId(String newBlockId) {
        return new BlockPositionUpdate(newBlockId, blockType, newPosition);
    }
}
