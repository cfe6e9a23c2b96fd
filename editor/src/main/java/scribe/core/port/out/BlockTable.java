package scribe.core.port.out;

import java.util.List;
import java.util.Optional;

import scribe.core.model.block.Block;
import scribe.core.model.block.BlockType;

/**
 * Storage API of a single block type, used inside a {@link BlockTransaction}.
 *
 * <p>Composite payloads are stored with their child rows; the table assigns
 * ids to the block and to every child row that has none.
 */
public interface BlockTable {

    BlockType type();

    /**
     * Insert a block.
     *
     * @param block block to store; its id may be {@code null}
     * @return the stored block with all ids assigned
     * @throws IllegalArgumentException if the block belongs to another type or the id is taken
     */
    Block create(Block block);

    /**
     * Look up a block by id.
     *
     * @param blockId block identifier
     * @return the block, or empty if this table does not hold it
     */
    Optional<Block> read(String blockId);

    /**
     * Replace a stored block, including its child rows.
     *
     * @param block new version of an existing block
     * @return the stored block with all ids assigned
     * @throws scribe.core.model.editor.BlockNotFoundException if the block does not exist
     */
    Block update(Block block);

    /**
     * Delete a block with its child rows.
     *
     * @param blockId block identifier
     * @return true if a block was removed
     */
    boolean delete(String blockId);

    /**
     * All blocks of a post held by this table, in insertion order.
     *
     * @param postId owning post
     * @return blocks of the post
     */
    List<Block> findByPost(String postId);

    /**
     * Add {@code delta} to the position of every block of the post at or after {@code fromPosition}.
     *
     * @param postId       owning post
     * @param fromPosition lowest position affected
     * @param delta        amount to add, may be negative
     * @return number of blocks changed
     */
    int updateMany(String postId, int fromPosition, int delta);
}
