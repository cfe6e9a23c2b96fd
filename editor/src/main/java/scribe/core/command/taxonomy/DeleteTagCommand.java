package scribe.core.command.taxonomy;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.model.post.Tag;
import scribe.core.port.in.TagManagement;

/**
 * Delete a tag; undo re-creates it under the same id.
 */
public class DeleteTagCommand extends AbstractCommand<Tag> {

    private final TagManagement tags;
    private final String tagId;

    private Tag deleted;

    public DeleteTagCommand(TagManagement tags, String tagId) {
        super("Delete tag");
        this.tags = tags;
        this.tagId = tagId;
    }

    @Override
    protected Uni<Tag> apply() {
        return tags.deleteTag(tagId).invoke(tag -> deleted = tag);
    }

    @Override
    protected Uni<Tag> revert() {
        return tags.restoreTag(deleted);
    }
}
