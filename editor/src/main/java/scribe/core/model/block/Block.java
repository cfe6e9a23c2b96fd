package scribe.core.model.block;

import java.time.Instant;
import java.util.Comparator;

/**
 * A typed content unit belonging to a post.
 *
 * <p>{@code position} defines the block's place in the post. Blocks of
 * different types live in separate collections, so readers always sort by
 * {@link #ORDER} after merging them.
 *
 * @param id        store-assigned identifier
 * @param postId    owning post
 * @param position  non-negative order key
 * @param blockName display label
 * @param payload   type-specific content
 * @param createdAt creation instant, breaks position ties
 * @param updatedAt last modification instant
 */
public record Block(
        String id, String postId, int position, String blockName, BlockPayload payload, Instant createdAt, Instant updatedAt) {

    /**
     * Reading order: position ascending, ties broken by insertion order.
     */
    public static final Comparator<Block> ORDER =
            Comparator.comparingInt(Block::position).thenComparing(Block::createdAt);

    public Block {
        if (postId == null || postId.isBlank()) {
            throw new IllegalArgumentException("Block postId cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Block payload cannot be null");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Block position cannot be negative: " + position);
        }
        if (blockName == null || blockName.isBlank()) {
            blockName = payload.type().defaultBlockName(position);
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public BlockType type() {
        return payload.type();
    }

    public Block withId(String newId) {
        return new Block(newId, postId, position, blockName, payload, createdAt, updatedAt);
    }

    public Block withPosition(int newPosition) {
        return new Block(id, postId, newPosition, blockName, payload, createdAt, Instant.now());
    }

    public Block withContent(String newBlockName, BlockPayload newPayload) {
        return new Block(id, postId, position, newBlockName, newPayload, createdAt, Instant.now());
    }

    /**
     * Position update that would move this block to where it currently is.
     */
    public BlockPositionUpdate currentPosition() {
        return new BlockPositionUpdate(id, type(), position);
    }
}
