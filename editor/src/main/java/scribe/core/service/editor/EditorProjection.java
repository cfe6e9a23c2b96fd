package scribe.core.service.editor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;

import scribe.core.model.block.Block;
import scribe.core.model.editor.EditorState;
import scribe.core.model.editor.ServerState;
import scribe.core.model.post.Category;
import scribe.core.model.post.Post;
import scribe.core.model.post.ProgressTracker;
import scribe.core.model.post.Tag;

/**
 * Observable read model of an editor session.
 *
 * <p>Single writer, many readers. Block, post and taxonomy changes are
 * staged: {@link #current()} sees them at once, subscribers of
 * {@link #states()} only once {@link #update} commits the operation's final
 * state. Block changes mirror the position rules of the block store so the
 * local list matches what a fresh read would return.
 */
public class EditorProjection {

    private final ContentAnalyzer analyzer;
    private final BroadcastProcessor<EditorState> processor = BroadcastProcessor.create();

    private volatile EditorState state = EditorState.initial();

    public EditorProjection(ContentAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public EditorState current() {
        return state;
    }

    /**
     * Every state produced after subscription. Use {@link #current()} for the present one.
     */
    public Multi<EditorState> states() {
        return processor;
    }

    /**
     * Apply a change and publish the resulting state.
     */
    public synchronized EditorState update(UnaryOperator<EditorState> change) {
        state = change.apply(state);
        processor.onNext(state);
        return state;
    }

    /**
     * Apply a change without publishing it.
     */
    public synchronized EditorState stage(UnaryOperator<EditorState> change) {
        state = change.apply(state);
        return state;
    }

    /**
     * Insert a new block, or replace the block with the same id.
     *
     * <p>A new block at {@code p} moves the blocks at {@code >= p} down by one first.
     */
    public EditorState blockSaved(Block block) {
        return replaceBlocks(blocks -> {
            final var existing = indexOf(blocks, block.id());
            if (existing >= 0) {
                blocks.set(existing, block);
                return blocks;
            }
            final List<Block> shifted = new ArrayList<>(blocks.size() + 1);
            for (Block other : blocks) {
                shifted.add(other.position() >= block.position() ? other.withPosition(other.position() + 1) : other);
            }
            shifted.add(block);
            return shifted;
        });
    }

    /**
     * Remove a block and move the blocks after it up by one.
     */
    public EditorState blockRemoved(Block block) {
        return replaceBlocks(blocks -> {
            if (indexOf(blocks, block.id()) < 0) {
                return blocks;
            }
            final List<Block> shifted = new ArrayList<>(blocks.size());
            for (Block other : blocks) {
                if (other.id().equals(block.id())) {
                    continue;
                }
                shifted.add(other.position() > block.position() ? other.withPosition(other.position() - 1) : other);
            }
            return shifted;
        });
    }

    /**
     * Merge moved blocks into the list.
     */
    public EditorState blocksMoved(List<Block> moved) {
        final Map<String, Block> byId = new HashMap<>();
        moved.forEach(block -> byId.put(block.id(), block));
        return replaceBlocks(blocks -> {
            blocks.replaceAll(block -> byId.getOrDefault(block.id(), block));
            return blocks;
        });
    }

    /**
     * Replace everything derived from the post with a fresh read.
     */
    public EditorState postLoaded(
            Post post, List<Block> blocks, List<Category> categories, List<Tag> tags, ProgressTracker tracker) {
        return stage(current -> current.withPost(post)
                .withBlocks(blocks, analyzer.analyze(blocks))
                .withCategories(categories)
                .withTags(tags)
                .withTracker(tracker));
    }

    /**
     * Adopt a server-rendered snapshot, deriving the analysis when it carries none.
     */
    public EditorState hydrated(ServerState server) {
        final var analysis = server.analysis() != null ? server.analysis() : analyzer.analyze(server.blocks());
        return stage(current -> current.withPost(server.post())
                .withBlocks(server.blocks(), analysis)
                .withTracker(server.tracker()));
    }

    public EditorState postCleared() {
        return stage(current -> current.withPost(null)
                .withBlocks(List.of(), analyzer.analyze(List.of()))
                .withTracker(null));
    }

    public void complete() {
        processor.onComplete();
    }

    private EditorState replaceBlocks(UnaryOperator<List<Block>> change) {
        return stage(current -> {
            final var blocks = change.apply(new ArrayList<>(current.blocks()));
            return current.withBlocks(blocks, analyzer.analyze(blocks));
        });
    }

    private static int indexOf(List<Block> blocks, String blockId) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).id().equals(blockId)) {
                return i;
            }
        }
        return -1;
    }
}
