package scribe.core.service.editor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.command.Command;
import scribe.core.command.CommandHistory;
import scribe.core.command.IdentityAliases;
import scribe.core.command.block.CreateBlockCommand;
import scribe.core.command.block.DeleteBlockCommand;
import scribe.core.command.block.MoveBlocksCommand;
import scribe.core.command.block.UpdateBlockCommand;
import scribe.core.command.post.CreatePostCommand;
import scribe.core.command.post.DeletePostCommand;
import scribe.core.command.post.PublishPostCommand;
import scribe.core.command.post.SchedulePostCommand;
import scribe.core.command.post.UpdatePostCommand;
import scribe.core.command.post.UpdatePostTagsCommand;
import scribe.core.command.post.UpdateProgressTrackerCommand;
import scribe.core.command.taxonomy.CreateCategoryCommand;
import scribe.core.command.taxonomy.CreateTagCommand;
import scribe.core.command.taxonomy.DeleteCategoryCommand;
import scribe.core.command.taxonomy.DeleteTagCommand;
import scribe.core.command.taxonomy.UpdateCategoryCommand;
import scribe.core.command.taxonomy.UpdateTagCommand;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInput;
import scribe.core.model.block.BlockPositionUpdate;
import scribe.core.model.block.BlockType;
import scribe.core.model.editor.EditorError;
import scribe.core.model.editor.EditorState;
import scribe.core.model.editor.EditorValidationException;
import scribe.core.model.editor.ServerState;
import scribe.core.model.post.CategoryData;
import scribe.core.model.post.PostDraft;
import scribe.core.model.post.PostUpdate;
import scribe.core.model.post.TagData;
import scribe.core.model.post.TrackerSettings;
import scribe.core.port.in.BlockManagement;
import scribe.core.port.in.CategoryManagement;
import scribe.core.port.in.PostManagement;
import scribe.core.port.in.ProgressTrackerManagement;
import scribe.core.port.in.TagManagement;
import scribe.core.port.out.EditorMetrics;

/**
 * Editing session of one user.
 *
 * <p>Every mutation runs as a command through the session's history and
 * updates the projection when it succeeds. Entry points never fail: the
 * returned Uni always completes with the resulting {@link EditorState}, and a
 * failure is reported in {@link EditorState#error()} until the next successful
 * operation clears it.
 *
 * <p>Updating the whole post or its tag set, loading a post and accepting a
 * server state reset the history.
 *
 * <p>Sessions are single-actor: operations are issued one after another.
 * Create them through {@link EditorSessionFactory}.
 */
public class EditorSession implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(EditorSession.class);

    private final String userId;
    private final BlockManagement blocks;
    private final PostManagement posts;
    private final CategoryManagement categories;
    private final TagManagement tags;
    private final ProgressTrackerManagement trackers;
    private final EditorMetrics metrics;
    private final EditorProjection projection;
    private final CommandHistory history = new CommandHistory();
    private final IdentityAliases aliases = new IdentityAliases();

    private volatile boolean closed;

    public EditorSession(
            String userId,
            BlockManagement blocks,
            PostManagement posts,
            CategoryManagement categories,
            TagManagement tags,
            ProgressTrackerManagement trackers,
            EditorMetrics metrics,
            ContentAnalyzer analyzer) {
        this.userId = userId;
        this.blocks = blocks;
        this.posts = posts;
        this.categories = categories;
        this.tags = tags;
        this.trackers = trackers;
        this.metrics = metrics;
        this.projection = new EditorProjection(analyzer);
    }

    public String userId() {
        return userId;
    }

    public EditorState state() {
        return projection.current();
    }

    public Multi<EditorState> states() {
        return projection.states();
    }

    // Blocks

    public Uni<EditorState> createBlock(BlockInput input) {
        return perform(
                true,
                postId -> new CreateBlockCommand(blocks, aliases, postId, input),
                this::blockSaved,
                this::blockRemoved,
                false);
    }

    public Uni<EditorState> updateBlock(String blockId, BlockInput input) {
        return perform(
                true,
                postId -> new UpdateBlockCommand(blocks, aliases, blockId, input),
                this::blockSaved,
                this::blockSaved,
                false);
    }

    public Uni<EditorState> deleteBlock(String blockId, BlockType type) {
        return perform(
                true,
                postId -> new DeleteBlockCommand(blocks, aliases, blockId, type),
                this::blockRemoved,
                this::blockSaved,
                false);
    }

    public Uni<EditorState> moveBlocks(List<BlockPositionUpdate> updates) {
        return perform(
                true,
                postId -> new MoveBlocksCommand(blocks, aliases, updates),
                this::blocksMoved,
                this::blocksMoved,
                false);
    }

    /**
     * Move the listed blocks to the positions given by their order in the list.
     *
     * @param orderedIds block ids, first one goes to position 0
     */
    public Uni<EditorState> reorderBlocks(List<String> orderedIds) {
        final var current = projection.current().blocks();
        final List<BlockPositionUpdate> updates = new ArrayList<>(orderedIds.size());
        for (int i = 0; i < orderedIds.size(); i++) {
            final var blockId = aliases.resolve(orderedIds.get(i));
            final var block = current.stream().filter(b -> b.id().equals(blockId)).findFirst();
            if (block.isEmpty()) {
                return rejected(new EditorValidationException("Block not found: " + orderedIds.get(i)));
            }
            updates.add(new BlockPositionUpdate(blockId, block.get().type(), i));
        }
        return moveBlocks(updates);
    }

    /**
     * Current id of a block that may have been re-created by undo or redo.
     */
    public String currentBlockId(String blockId) {
        return aliases.resolve(blockId);
    }

    // Posts

    public Uni<EditorState> createPost(PostDraft draft) {
        return perform(
                false,
                postId -> new CreatePostCommand(posts, aliases, draft, userId),
                post -> reload(post.id()),
                post -> cleared(),
                false);
    }

    public Uni<EditorState> updatePost(PostUpdate update) {
        return perform(
                true,
                postId -> new UpdatePostCommand(posts, aliases, postId, update, userId),
                post -> reload(post.id()),
                post -> reload(post.id()),
                true);
    }

    public Uni<EditorState> deletePost() {
        return perform(
                true,
                postId -> new DeletePostCommand(posts, blocks, trackers, aliases, postId, userId),
                post -> cleared(),
                post -> reload(post.id()),
                false);
    }

    public Uni<EditorState> publishPost() {
        return perform(
                true,
                postId -> new PublishPostCommand(posts, aliases, postId, userId),
                post -> reload(post.id()),
                post -> reload(post.id()),
                false);
    }

    public Uni<EditorState> schedulePost(Instant scheduledAt) {
        return perform(
                true,
                postId -> new SchedulePostCommand(posts, aliases, postId, scheduledAt, userId),
                post -> reload(post.id()),
                post -> reload(post.id()),
                false);
    }

    public Uni<EditorState> updatePostTags(Set<String> tagIds) {
        return perform(
                true,
                postId -> new UpdatePostTagsCommand(posts, aliases, postId, tagIds, userId),
                post -> reload(post.id()),
                post -> reload(post.id()),
                true);
    }

    public Uni<EditorState> updateProgressTracker(TrackerSettings settings) {
        return perform(
                true,
                postId -> new UpdateProgressTrackerCommand(trackers, aliases, postId, settings),
                tracker -> projected(() -> projection.stage(state -> state.withTracker(tracker))),
                tracker -> projected(() -> projection.stage(state -> state.withTracker(tracker))),
                false);
    }

    // Taxonomy

    public Uni<EditorState> createCategory(CategoryData data) {
        return perform(
                false,
                postId -> new CreateCategoryCommand(categories, data),
                category -> refreshCategories(),
                category -> refreshCategories(),
                false);
    }

    public Uni<EditorState> updateCategory(String categoryId, CategoryData data) {
        return perform(
                false,
                postId -> new UpdateCategoryCommand(categories, categoryId, data),
                category -> refreshCategories(),
                category -> refreshCategories(),
                false);
    }

    public Uni<EditorState> deleteCategory(String categoryId) {
        return perform(
                false,
                postId -> new DeleteCategoryCommand(categories, categoryId),
                category -> refreshCategories(),
                category -> refreshCategories(),
                false);
    }

    public Uni<EditorState> createTag(TagData data) {
        return perform(
                false, postId -> new CreateTagCommand(tags, data), tag -> refreshTags(), tag -> refreshTags(), false);
    }

    public Uni<EditorState> updateTag(String tagId, TagData data) {
        return perform(
                false,
                postId -> new UpdateTagCommand(tags, tagId, data),
                tag -> refreshTags(),
                tag -> refreshTags(),
                false);
    }

    public Uni<EditorState> deleteTag(String tagId) {
        return perform(
                false,
                postId -> new DeleteTagCommand(tags, tagId),
                tag -> refreshTags(),
                tag -> refreshTags(),
                false);
    }

    // History

    public Uni<EditorState> undo() {
        if (closed) {
            return rejected(closedError());
        }
        return history.undo().map(ignored -> succeeded()).onFailure().recoverWithItem(this::failed);
    }

    public Uni<EditorState> redo() {
        if (closed) {
            return rejected(closedError());
        }
        return history.redo().map(ignored -> succeeded()).onFailure().recoverWithItem(this::failed);
    }

    public Optional<String> undoDescription() {
        return history.undoDescription();
    }

    public Optional<String> redoDescription() {
        return history.redoDescription();
    }

    // Loading

    /**
     * Load a post with its blocks, tracker, categories and tags, resetting the history.
     */
    public Uni<EditorState> loadPost(String postId) {
        if (closed) {
            return rejected(closedError());
        }
        return reload(postId)
                .invoke(state -> clearHistory())
                .map(ignored -> succeeded())
                .onFailure()
                .recoverWithItem(this::failed);
    }

    /**
     * Adopt a server-rendered state, resetting the history.
     */
    public EditorState acceptServerState(ServerState server) {
        if (closed) {
            return failed(closedError());
        }
        projection.hydrated(server);
        clearHistory();
        return succeeded();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        history.reset();
        aliases.clear();
        projection.complete();
        LOG.debugf("Closed editor session of %s", userId);
    }

    private <T> Uni<EditorState> perform(
            boolean requiresPost,
            Function<String, Command<T>> factory,
            Function<T, Uni<?>> onApplied,
            Function<T, Uni<?>> onReverted,
            boolean resetsHistory) {
        if (closed) {
            return rejected(closedError());
        }
        final var current = projection.current();
        if (requiresPost && !current.hasPost()) {
            return rejected(new EditorValidationException("No post loaded"));
        }

        final var postId = current.hasPost() ? aliases.resolve(current.post().id()) : null;
        return history.run(() -> new ProjectedCommand<>(
                        new InstrumentedCommand<>(factory.apply(postId), metrics), onApplied, onReverted))
                .invoke(result -> {
                    if (resetsHistory) {
                        clearHistory();
                    }
                })
                .map(result -> succeeded())
                .onFailure()
                .recoverWithItem(this::failed);
    }

    private void clearHistory() {
        final int dropped = history.reset();
        aliases.clear();
        metrics.recordHistoryReset(dropped);
    }

    private Uni<EditorState> reload(String postId) {
        return Uni.combine()
                .all()
                .unis(
                        posts.getPost(postId),
                        blocks.getBlocksByPost(postId),
                        categories.listCategories(),
                        tags.listTags(),
                        trackers.findTracker(postId))
                .asTuple()
                .map(loaded -> projection.postLoaded(
                        loaded.getItem1(),
                        loaded.getItem2(),
                        loaded.getItem3(),
                        loaded.getItem4(),
                        loaded.getItem5().orElse(null)));
    }

    private Uni<EditorState> cleared() {
        return projected(projection::postCleared);
    }

    private Uni<EditorState> refreshCategories() {
        return categories.listCategories().map(list -> projection.stage(state -> state.withCategories(list)));
    }

    private Uni<EditorState> refreshTags() {
        return tags.listTags().map(list -> projection.stage(state -> state.withTags(list)));
    }

    private Uni<EditorState> blockSaved(Block block) {
        return projected(() -> projection.blockSaved(block));
    }

    private Uni<EditorState> blockRemoved(Block block) {
        return projected(() -> projection.blockRemoved(block));
    }

    private Uni<EditorState> blocksMoved(List<Block> moved) {
        return projected(() -> projection.blocksMoved(moved));
    }

    private static Uni<EditorState> projected(Supplier<EditorState> change) {
        return Uni.createFrom().item(change);
    }

    private EditorState succeeded() {
        return projection.update(state -> state.withError(null).withHistory(history.canUndo(), history.canRedo()));
    }

    private EditorState failed(Throwable failure) {
        final var error = EditorError.from(failure);
        LOG.warnf("Editor operation failed (%s): %s", error.kind(), error.message());
        return projection.update(state -> state.withError(error).withHistory(history.canUndo(), history.canRedo()));
    }

    private Uni<EditorState> rejected(Throwable failure) {
        return Uni.createFrom().item(() -> failed(failure));
    }

    private static EditorValidationException closedError() {
        return new EditorValidationException("Editor session is closed");
    }
}
