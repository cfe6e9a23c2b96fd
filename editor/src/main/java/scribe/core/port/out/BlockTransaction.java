package scribe.core.port.out;

import java.util.Arrays;
import java.util.List;

import scribe.core.model.block.BlockType;

/**
 * Handle on the block tables within one open transaction.
 */
public interface BlockTransaction {

    /**
     * Table storing blocks of the given type.
     *
     * @param type block type
     * @return the type's table
     */
    BlockTable table(BlockType type);

    /**
     * All tables, in {@link BlockType} declaration order.
     */
    default List<BlockTable> tables() {
        return Arrays.stream(BlockType.values()).map(this::table).toList();
    }
}
