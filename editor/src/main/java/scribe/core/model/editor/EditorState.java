package scribe.core.model.editor;

import java.util.List;

import scribe.core.model.block.Block;
import scribe.core.model.post.Category;
import scribe.core.model.post.Post;
import scribe.core.model.post.ProgressTracker;
import scribe.core.model.post.Tag;

/**
 * Read model of one editing session.
 *
 * <p>Derived, never authoritative: rebuilt from command results and
 * repository reads. {@code blocks} is always sorted by {@link Block#ORDER}.
 *
 * @param post       current post, or {@code null} when none is loaded
 * @param blocks     the post's blocks in reading order
 * @param categories known categories
 * @param tags       known tags
 * @param tracker    the post's progress tracker, or {@code null}
 * @param analysis   statistics derived from {@code blocks}
 * @param canUndo    whether the history can step back
 * @param canRedo    whether the history can step forward
 * @param error      outcome of the last failed operation, or {@code null}
 */
public record EditorState(
        Post post,
        List<Block> blocks,
        List<Category> categories,
        List<Tag> tags,
        ProgressTracker tracker,
        ContentAnalysis analysis,
        boolean canUndo,
        boolean canRedo,
        EditorError error) {

    public EditorState {
        blocks = blocks == null ? List.of() : blocks.stream().sorted(Block.ORDER).toList();
        categories = categories == null ? List.of() : List.copyOf(categories);
        tags = tags == null ? List.of() : List.copyOf(tags);
        analysis = analysis == null ? ContentAnalysis.empty() : analysis;
    }

    public static EditorState initial() {
        return new EditorState(null, List.of(), List.of(), List.of(), null, ContentAnalysis.empty(), false, false, null);
    }

    public boolean hasPost() {
        return post != null;
    }

    public EditorState withPost(Post newPost) {
        return new EditorState(newPost, blocks, categories, tags, tracker, analysis, canUndo, canRedo, error);
    }

    public EditorState withBlocks(List<Block> newBlocks, ContentAnalysis newAnalysis) {
        return new EditorState(post, newBlocks, categories, tags, tracker, newAnalysis, canUndo, canRedo, error);
    }

    public EditorState withCategories(List<Category> newCategories) {
        return new EditorState(post, blocks, newCategories, tags, tracker, analysis, canUndo, canRedo, error);
    }

    public EditorState withTags(List<Tag> newTags) {
        return new EditorState(post, blocks, categories, newTags, tracker, analysis, canUndo, canRedo, error);
    }

    public EditorState withTracker(ProgressTracker newTracker) {
        return new EditorState(post, blocks, categories, tags, newTracker, analysis, canUndo, canRedo, error);
    }

    public EditorState withHistory(boolean undoable, boolean redoable) {
        return new EditorState(post, blocks, categories, tags, tracker, analysis, undoable, redoable, error);
    }

    public EditorState withError(EditorError newError) {
        return new EditorState(post, blocks, categories, tags, tracker, analysis, canUndo, canRedo, newError);
    }
}
