package scribe.core.model.editor;

import java.util.List;

import scribe.core.model.block.Block;
import scribe.core.model.post.Post;
import scribe.core.model.post.ProgressTracker;

/**
 * Server-rendered snapshot used to hydrate a freshly opened editor session.
 *
 * @param post     the loaded post
 * @param blocks   its blocks, in any order
 * @param tracker  progress tracker, or {@code null}
 * @param analysis precomputed analysis, or {@code null} to derive it from the blocks
 */
public record ServerState(Post post, List<Block> blocks, ProgressTracker tracker, ContentAnalysis analysis) {

    public ServerState {
        if (post == null) {
            throw new IllegalArgumentException("Server state requires a post");
        }
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
}
