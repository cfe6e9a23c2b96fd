package scribe.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import scribe.core.model.post.Tag;
import scribe.core.model.post.TagData;

/**
 * Port for managing tags.
 */
public interface TagManagement {

    Uni<Tag> createTag(TagData data);

    /**
     * @return Uni with the updated tag, failing with EntityNotFoundException if absent
     */
    Uni<Tag> updateTag(String tagId, TagData data);

    /**
     * Store a captured tag under its original id.
     */
    Uni<Tag> restoreTag(Tag snapshot);

    /**
     * @return Uni with the tag, failing with EntityNotFoundException if absent
     */
    Uni<Tag> getTag(String tagId);

    /**
     * @return Uni with the deleted tag, failing with EntityNotFoundException if absent
     */
    Uni<Tag> deleteTag(String tagId);

    Uni<List<Tag>> listTags();
}
