package scribe.core.command.post;

import java.util.Set;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.post.Post;
import scribe.core.port.in.PostManagement;

/**
 * Replace the tag set of a post; undo puts the previous set back.
 */
public class UpdatePostTagsCommand extends AbstractCommand<Post> {

    private final PostManagement posts;
    private final IdentityAliases aliases;
    private final String postId;
    private final Set<String> tagIds;
    private final String userId;

    private Set<String> previousTagIds;

    public UpdatePostTagsCommand(
            PostManagement posts, IdentityAliases aliases, String postId, Set<String> tagIds, String userId) {
        super("Update post tags");
        this.posts = posts;
        this.aliases = aliases;
        this.postId = postId;
        this.tagIds = Set.copyOf(tagIds);
        this.userId = userId;
    }

    @Override
    protected Uni<Post> apply() {
        final var target = aliases.resolve(postId);
        return posts.getPost(target)
                .invoke(post -> previousTagIds = post.tagIds())
                .flatMap(post -> posts.updatePostTags(target, tagIds, userId));
    }

    @Override
    protected Uni<Post> revert() {
        return posts.updatePostTags(aliases.resolve(postId), previousTagIds, userId);
    }
}
