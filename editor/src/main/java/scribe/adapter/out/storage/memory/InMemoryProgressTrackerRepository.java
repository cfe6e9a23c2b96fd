package scribe.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.ProgressTracker;
import scribe.core.port.out.ProgressTrackerRepository;

/**
 * In-memory implementation of ProgressTrackerRepository, one tracker per post.
 *
 * <p>Thread-safety: Uses ConcurrentHashMap for safe concurrent access.
 */
public class InMemoryProgressTrackerRepository implements ProgressTrackerRepository {

    private final ConcurrentHashMap<String, ProgressTracker> byPost = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(ProgressTracker tracker) {
        return Uni.createFrom().item(() -> {
            byPost.put(tracker.postId(), tracker);
            return null;
        });
    }

    @Override
    public Uni<Optional<ProgressTracker>> findByPostId(String postId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(byPost.get(postId)));
    }

    @Override
    public Uni<Boolean> deleteByPostId(String postId) {
        return Uni.createFrom().item(() -> byPost.remove(postId) != null);
    }
}
