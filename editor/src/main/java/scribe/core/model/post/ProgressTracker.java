package scribe.core.model.post;

import java.time.Instant;

/**
 * Reading progress indicator settings of a post. At most one per post.
 */
public record ProgressTracker(
        String id, String postId, ProgressVariant variant, boolean showPercentage, Instant createdAt, Instant updatedAt) {

    public ProgressTracker {
        if (postId == null || postId.isBlank()) {
            throw new IllegalArgumentException("Tracker postId cannot be null or blank");
        }
        variant = variant == null ? ProgressVariant.SUBTLE : variant;
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public TrackerSettings settings() {
        return new TrackerSettings(variant, showPercentage);
    }

    public ProgressTracker withSettings(TrackerSettings settings) {
        return new ProgressTracker(id, postId, settings.variant(), settings.showPercentage(), createdAt, Instant.now());
    }
}
