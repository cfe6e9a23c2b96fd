package scribe.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Post;
import scribe.core.port.out.PostRepository;

/**
 * In-memory implementation of PostRepository.
 *
 * <p>Data is NOT persisted across restarts.
 *
 * <p>Thread-safety: Uses ConcurrentHashMap for safe concurrent access.
 */
public class InMemoryPostRepository implements PostRepository {

    private final ConcurrentHashMap<String, Post> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(Post post) {
        return Uni.createFrom().item(() -> {
            storage.put(post.id(), post);
            return null;
        });
    }

    @Override
    public Uni<Optional<Post>> findById(String postId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(postId)));
    }

    @Override
    public Uni<Boolean> delete(String postId) {
        return Uni.createFrom().item(() -> storage.remove(postId) != null);
    }

    @Override
    public Uni<List<Post>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(storage.values()));
    }

    @Override
    public Uni<Boolean> slugTaken(String slug, String excludePostId) {
        return Uni.createFrom().item(() -> storage.values().stream()
                .anyMatch(post -> Objects.equals(post.slug(), slug) && !Objects.equals(post.id(), excludePostId)));
    }
}
