package scribe.core.command.post;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.post.Post;
import scribe.core.port.in.PostManagement;

/**
 * Base of commands changing only the publication state of a post.
 *
 * <p>Undo restores {@code published}, {@code publishedAt} and {@code scheduledAt}
 * as captured and leaves every other field as it is now.
 */
abstract class PublicationCommand extends AbstractCommand<Post> {

    protected final PostManagement posts;
    protected final String userId;
    private final IdentityAliases aliases;
    private final String postId;

    private Post previous;

    PublicationCommand(
            String description, PostManagement posts, IdentityAliases aliases, String postId, String userId) {
        super(description);
        this.posts = posts;
        this.aliases = aliases;
        this.postId = postId;
        this.userId = userId;
    }

    @Override
    protected final Uni<Post> apply() {
        final var target = aliases.resolve(postId);
        return posts.getPost(target).invoke(post -> previous = post).flatMap(post -> changePublication(target));
    }

    @Override
    protected final Uni<Post> revert() {
        return posts.getPost(aliases.resolve(postId))
                .flatMap(current -> posts.restorePost(current.withPublicationOf(previous), userId));
    }

    protected abstract Uni<Post> changePublication(String postId);
}
