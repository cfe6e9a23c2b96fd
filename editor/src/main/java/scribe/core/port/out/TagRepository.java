package scribe.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Tag;

/**
 * Port interface for persistent storage of tags.
 */
public interface TagRepository {

    Uni<Void> save(Tag tag);

    Uni<Optional<Tag>> findById(String tagId);

    /**
     * Delete a tag.
     *
     * @param tagId the tag identifier
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String tagId);

    Uni<List<Tag>> findAll();
}
