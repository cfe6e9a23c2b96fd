package scribe.core.command.post;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

import scribe.core.command.IdentityAliases;
import scribe.core.model.post.Post;
import scribe.core.port.in.PostManagement;

/**
 * Schedule a post for publication at a later instant.
 */
public class SchedulePostCommand extends PublicationCommand {

    private final Instant scheduledAt;

    public SchedulePostCommand(
            PostManagement posts, IdentityAliases aliases, String postId, Instant scheduledAt, String userId) {
        super("Schedule post", posts, aliases, postId, userId);
        this.scheduledAt = scheduledAt;
    }

    @Override
    protected Uni<Post> changePublication(String postId) {
        return posts.schedulePost(postId, scheduledAt, userId);
    }
}
