package scribe.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Category;
import scribe.core.port.out.CategoryRepository;

/**
 * In-memory implementation of CategoryRepository.
 *
 * <p>Thread-safety: Uses ConcurrentHashMap for safe concurrent access.
 */
public class InMemoryCategoryRepository implements CategoryRepository {

    private final ConcurrentHashMap<String, Category> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(Category category) {
        return Uni.createFrom().item(() -> {
            storage.put(category.id(), category);
            return null;
        });
    }

    @Override
    public Uni<Optional<Category>> findById(String categoryId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(categoryId)));
    }

    @Override
    public Uni<Boolean> delete(String categoryId) {
        return Uni.createFrom().item(() -> storage.remove(categoryId) != null);
    }

    @Override
    public Uni<List<Category>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(storage.values()));
    }
}
