package scribe.core.port.in;

import java.time.Instant;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Post;
import scribe.core.model.post.PostDraft;
import scribe.core.model.post.PostUpdate;

/**
 * Port for managing posts.
 *
 * <p>Every mutating operation except {@link #createPost} requires the acting
 * user to be the post's author and fails with
 * {@link scribe.core.model.editor.PostAccessDeniedException} otherwise.
 */
public interface PostManagement {

    /**
     * Create a post owned by {@code userId}.
     *
     * <p>A blank title is replaced by the configured default title. Without a
     * slug one is generated from the title and made unique with a numeric suffix.
     *
     * @param draft  post content and initial publication state
     * @param userId author of the new post
     * @return Uni with the stored post
     */
    Uni<Post> createPost(PostDraft draft, String userId);

    /**
     * Load a post.
     *
     * @return Uni with the post, failing with EntityNotFoundException if absent
     */
    Uni<Post> getPost(String postId);

    /**
     * Apply a partial update.
     *
     * <p>Publishing a draft sets {@code publishedAt} to now and unpublishing
     * clears it. Setting a schedule publishes the post at the scheduled instant.
     *
     * @param postId post to update
     * @param update fields to change
     * @param userId acting user
     * @return Uni with the updated post
     */
    Uni<Post> updatePost(String postId, PostUpdate update, String userId);

    /**
     * Write a captured post back with every field as captured.
     *
     * @param snapshot post as it was captured; its id must exist
     * @param userId   acting user
     * @return Uni with the stored post
     */
    Uni<Post> restorePost(Post snapshot, String userId);

    /**
     * Delete a post together with its blocks and progress tracker.
     *
     * @return Uni with the deleted post
     */
    Uni<Post> deletePost(String postId, String userId);

    /**
     * Publish a post now and clear any schedule.
     */
    Uni<Post> publishPost(String postId, String userId);

    /**
     * Schedule a post for publication.
     *
     * @param scheduledAt publication instant, in the future unless configured otherwise
     */
    Uni<Post> schedulePost(String postId, Instant scheduledAt, String userId);

    /**
     * Replace the tag set of a post.
     */
    Uni<Post> updatePostTags(String postId, Set<String> tagIds, String userId);
}
