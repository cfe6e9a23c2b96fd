package scribe.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.ProgressTracker;
import scribe.core.model.post.TrackerSettings;

/**
 * Port for the reading progress tracker of a post.
 */
public interface ProgressTrackerManagement {

    Uni<Optional<ProgressTracker>> findTracker(String postId);

    /**
     * Create the post's tracker, or update it if one exists.
     */
    Uni<ProgressTracker> saveTracker(String postId, TrackerSettings settings);

    /**
     * Store a captured tracker as it was.
     */
    Uni<ProgressTracker> restoreTracker(ProgressTracker snapshot);

    /**
     * @return Uni with true if the post had a tracker
     */
    Uni<Boolean> deleteTracker(String postId);
}
