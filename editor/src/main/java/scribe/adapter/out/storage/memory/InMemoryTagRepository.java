package scribe.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Tag;
import scribe.core.port.out.TagRepository;

/**
 * In-memory implementation of TagRepository.
 *
 * <p>Thread-safety: Uses ConcurrentHashMap for safe concurrent access.
 */
public class InMemoryTagRepository implements TagRepository {

    private final ConcurrentHashMap<String, Tag> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(Tag tag) {
        return Uni.createFrom().item(() -> {
            storage.put(tag.id(), tag);
            return null;
        });
    }

    @Override
    public Uni<Optional<Tag>> findById(String tagId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(tagId)));
    }

    @Override
    public Uni<Boolean> delete(String tagId) {
        return Uni.createFrom().item(() -> storage.remove(tagId) != null);
    }

    @Override
    public Uni<List<Tag>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(storage.values()));
    }
}
