package scribe.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInput;
import scribe.core.model.block.BlockPositionUpdate;
import scribe.core.model.block.BlockType;

/**
 * Port for reading and writing the blocks of a post.
 *
 * <p>Every operation keeps the blocks of a post totally ordered by position
 * and runs in a single storage transaction spanning all block types.
 */
public interface BlockManagement {

    /**
     * Create a block.
     *
     * <p>With an explicit position every block at or after it moves down by one
     * first; without one the block is appended after the last block.
     *
     * @param postId owning post
     * @param input  position, name and payload
     * @return Uni with the stored block
     */
    Uni<Block> createBlock(String postId, BlockInput input);

    /**
     * Read a block of a known type.
     *
     * @return Uni with the block, failing with BlockNotFoundException if absent
     */
    Uni<Block> readBlock(String blockId, BlockType type);

    /**
     * Look a block up in every block table.
     *
     * @return Uni with the block if any table holds it
     */
    Uni<Optional<Block>> findBlock(String blockId);

    /**
     * Replace a block's name and payload, upserting child rows by id.
     *
     * <p>Child rows missing from the input are kept. The position never changes.
     *
     * @param blockId block to update
     * @param input   new name and payload; the payload type selects the table
     * @return Uni with the stored block
     */
    Uni<Block> updateBlock(String blockId, BlockInput input);

    /**
     * Write a previously captured block back, child rows included.
     *
     * <p>The block keeps its current position and post.
     *
     * @param snapshot block as it was captured
     * @return Uni with the stored block
     */
    Uni<Block> restoreBlock(Block snapshot);

    /**
     * Delete a block and close the gap it leaves.
     *
     * @return Uni with the deleted block
     */
    Uni<Block> deleteBlock(String blockId, BlockType type);

    /**
     * All blocks of a post in reading order.
     */
    Uni<List<Block>> getBlocksByPost(String postId);

    /**
     * Apply many position updates atomically.
     *
     * @param updates target positions; must not be empty
     * @return Uni with the moved blocks in reading order
     */
    Uni<List<Block>> moveBlocks(List<BlockPositionUpdate> updates);

    /**
     * Insert blocks at their given positions without shifting existing ones.
     *
     * @return Uni with the created blocks in the order of {@code inputs}
     */
    Uni<List<Block>> createBlocks(String postId, List<BlockInput> inputs);

    /**
     * Delete every block of a post.
     *
     * @return Uni with the number of deleted blocks
     */
    Uni<Integer> deleteBlocksByPost(String postId);
}
