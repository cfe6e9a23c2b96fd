package scribe.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.ProgressTracker;

/**
 * Port interface for persistent storage of progress trackers, keyed by post.
 */
public interface ProgressTrackerRepository {

    /**
     * Save or replace the tracker of {@code tracker.postId()}.
     *
     * @param tracker the tracker to persist
     * @return Uni completing when save is durable
     */
    Uni<Void> save(ProgressTracker tracker);

    Uni<Optional<ProgressTracker>> findByPostId(String postId);

    /**
     * Delete the tracker of a post.
     *
     * @param postId the post identifier
     * @return Uni with true if deleted, false if the post had none
     */
    Uni<Boolean> deleteByPostId(String postId);
}
