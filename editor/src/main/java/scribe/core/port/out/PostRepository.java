package scribe.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Post;

/**
 * Port interface for persistent storage of posts.
 */
public interface PostRepository {

    /**
     * Save or update a post.
     *
     * @param post the post to persist
     * @return Uni completing when save is durable
     */
    Uni<Void> save(Post post);

    /**
     * Find a post by its identifier.
     *
     * @param postId the post identifier
     * @return Uni with Optional containing the post if found
     */
    Uni<Optional<Post>> findById(String postId);

    /**
     * Delete a post.
     *
     * @param postId the post identifier
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String postId);

    /**
     * Retrieve all posts.
     *
     * @return Uni with list of all posts
     */
    Uni<List<Post>> findAll();

    /**
     * Check whether a slug is used by a post other than {@code excludePostId}.
     *
     * @param slug          slug to check
     * @param excludePostId post to ignore, may be null
     * @return Uni with true if the slug is taken
     */
    Uni<Boolean> slugTaken(String slug, String excludePostId);
}
