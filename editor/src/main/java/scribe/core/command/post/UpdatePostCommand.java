package scribe.core.command.post;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.post.Post;
import scribe.core.model.post.PostUpdate;
import scribe.core.port.in.PostManagement;

/**
 * Apply a partial post update; undo writes every captured field back.
 */
public class UpdatePostCommand extends AbstractCommand<Post> {

    private final PostManagement posts;
    private final IdentityAliases aliases;
    private final String postId;
    private final PostUpdate update;
    private final String userId;

    private Post previous;

    public UpdatePostCommand(
            PostManagement posts, IdentityAliases aliases, String postId, PostUpdate update, String userId) {
        super("Update post");
        this.posts = posts;
        this.aliases = aliases;
        this.postId = postId;
        this.update = update;
        this.userId = userId;
    }

    @Override
    protected Uni<Post> apply() {
        final var target = aliases.resolve(postId);
        return posts.getPost(target)
                .invoke(post -> previous = post)
                .flatMap(post -> posts.updatePost(target, update, userId));
    }

    @Override
    protected Uni<Post> revert() {
        return posts.restorePost(previous.withId(aliases.resolve(previous.id())), userId);
    }
}
