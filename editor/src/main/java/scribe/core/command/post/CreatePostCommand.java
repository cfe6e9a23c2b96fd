package scribe.core.command.post;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.post.Post;
import scribe.core.model.post.PostDraft;
import scribe.core.port.in.PostManagement;

/**
 * Create a post; undo deletes it.
 */
public class CreatePostCommand extends AbstractCommand<Post> {

    private final PostManagement posts;
    private final IdentityAliases aliases;
    private final PostDraft draft;
    private final String userId;

    private Post created;

    public CreatePostCommand(PostManagement posts, IdentityAliases aliases, PostDraft draft, String userId) {
        super("Create post");
        this.posts = posts;
        this.aliases = aliases;
        this.draft = draft;
        this.userId = userId;
    }

    @Override
    protected Uni<Post> apply() {
        return posts.createPost(draft, userId).invoke(post -> {
            if (created != null) {
                aliases.replace(created.id(), post.id());
            }
            created = post;
        });
    }

    @Override
    protected Uni<Post> revert() {
        return posts.deletePost(aliases.resolve(created.id()), userId);
    }
}
