package scribe.core.service.post;

import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.ProgressTracker;
import scribe.core.model.post.TrackerSettings;
import scribe.core.port.in.ProgressTrackerManagement;
import scribe.core.port.out.ProgressTrackerRepository;

/**
 * Service for the per-post reading progress tracker.
 */
@ApplicationScoped
public class ProgressTrackerService implements ProgressTrackerManagement {

    private final ProgressTrackerRepository repository;

    @Inject
    public ProgressTrackerService(ProgressTrackerRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<Optional<ProgressTracker>> findTracker(String postId) {
        return repository.findByPostId(postId);
    }

    @Override
    public Uni<ProgressTracker> saveTracker(String postId, TrackerSettings settings) {
        return repository.findByPostId(postId)
                .map(existing -> existing.map(tracker -> tracker.withSettings(settings))
                        .orElseGet(() -> new ProgressTracker(
                                UUID.randomUUID().toString(),
                                postId,
                                settings.variant(),
                                settings.showPercentage(),
                                null,
                                null)))
                .call(repository::save);
    }

    @Override
    public Uni<ProgressTracker> restoreTracker(ProgressTracker snapshot) {
        return repository.save(snapshot).replaceWith(snapshot);
    }

    @Override
    public Uni<Boolean> deleteTracker(String postId) {
        return repository.deleteByPostId(postId);
    }
}
