package scribe.core.model.editor;

import java.util.EnumMap;
import java.util.Map;

import scribe.core.model.block.BlockType;

/**
 * Derived statistics about a post's blocks.
 *
 * @param wordCount   words across textual blocks
 * @param readingTime estimated minutes, rounded up
 * @param blockCounts number of blocks per type, every type present
 * @param totalBlocks number of blocks
 */
public record ContentAnalysis(int wordCount, int readingTime, Map<BlockType, Integer> blockCounts, int totalBlocks) {

    public ContentAnalysis {
        var counts = new EnumMap<BlockType, Integer>(BlockType.class);
        for (BlockType type : BlockType.values()) {
            counts.put(type, 0);
        }
        if (blockCounts != null) {
            counts.putAll(blockCounts);
        }
        blockCounts = Map.copyOf(counts);
    }

    public static ContentAnalysis empty() {
        return new ContentAnalysis(0, 0, Map.of(), 0);
    }

    public int count(BlockType type) {
        return blockCounts.get(type);
    }
}
