package scribe.core.model.block;

/**
 * Caller-supplied data for creating or updating a block.
 *
 * @param position  target position, or {@code null} to append (ignored by updates)
 * @param blockName display label, or {@code null} for the type default
 * @param payload   type-specific content
 */
public record BlockInput(Integer position, String blockName, BlockPayload payload) {

    public BlockInput {
        if (payload == null) {
            throw new IllegalArgumentException("Block payload cannot be null");
        }
    }

    public static BlockInput append(BlockPayload payload) {
        return new BlockInput(null, null, payload);
    }

    public static BlockInput at(int position, BlockPayload payload) {
        return new BlockInput(position, null, payload);
    }

    public BlockType type() {
        return payload.type();
    }
}
