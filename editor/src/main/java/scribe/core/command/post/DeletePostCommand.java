package scribe.core.command.post;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInputs;
import scribe.core.model.post.Post;
import scribe.core.model.post.PostDraft;
import scribe.core.model.post.ProgressTracker;
import scribe.core.port.in.BlockManagement;
import scribe.core.port.in.PostManagement;
import scribe.core.port.in.ProgressTrackerManagement;

/**
 * Delete a post with its blocks and tracker.
 *
 * <p>Undo re-creates the post under a new id with the captured fields and
 * publication state, then its blocks at their old positions and its tracker.
 * The post and every block are aliased to their new ids, so block commands
 * further back in the history still find them. Execute returns the deleted
 * post, undo the re-created one.
 */
public class DeletePostCommand extends AbstractCommand<Post> {

    private final PostManagement posts;
    private final BlockManagement blocks;
    private final ProgressTrackerManagement trackers;
    private final IdentityAliases aliases;
    private final String postId;
    private final String userId;

    private Post post;
    private List<Block> content = List.of();
    private Optional<ProgressTracker> tracker = Optional.empty();

    public DeletePostCommand(
            PostManagement posts,
            BlockManagement blocks,
            ProgressTrackerManagement trackers,
            IdentityAliases aliases,
            String postId,
            String userId) {
        super("Delete post");
        this.posts = posts;
        this.blocks = blocks;
        this.trackers = trackers;
        this.aliases = aliases;
        this.postId = postId;
        this.userId = userId;
    }

    @Override
    protected Uni<Post> apply() {
        final var target = aliases.resolve(postId);
        return posts.getPost(target)
                .invoke(captured -> post = captured)
                .chain(captured -> blocks.getBlocksByPost(target))
                .invoke(captured -> content = captured)
                .chain(captured -> trackers.findTracker(target))
                .invoke(captured -> tracker = captured)
                .chain(captured -> posts.deletePost(target, userId));
    }

    @Override
    protected Uni<Post> revert() {
        final var snapshot = post;
        return posts.createPost(PostDraft.copyOf(snapshot), userId)
                .invoke(created -> aliases.replace(snapshot.id(), created.id()))
                .chain(created -> posts.restorePost(snapshot.withId(created.id()), userId))
                .call(restored -> blocks.createBlocks(
                                restored.id(),
                                content.stream().map(BlockInputs::fromSnapshot).toList())
                        .invoke(this::aliasBlocks))
                .call(restored -> tracker.map(t -> trackers.saveTracker(restored.id(), t.settings()))
                        .orElseGet(() -> Uni.createFrom().nullItem()));
    }

    private void aliasBlocks(List<Block> recreated) {
        for (int i = 0; i < recreated.size(); i++) {
            aliases.replace(content.get(i).id(), recreated.get(i).id());
        }
    }
}
