package scribe.core.command.post;

import io.smallrye.mutiny.Uni;

import scribe.core.command.IdentityAliases;
import scribe.core.model.post.Post;
import scribe.core.port.in.PostManagement;

/**
 * Publish a post now, clearing any schedule.
 */
public class PublishPostCommand extends PublicationCommand {

    public PublishPostCommand(PostManagement posts, IdentityAliases aliases, String postId, String userId) {
        super("Publish post", posts, aliases, postId, userId);
    }

    @Override
    protected Uni<Post> changePublication(String postId) {
        return posts.publishPost(postId, userId);
    }
}
