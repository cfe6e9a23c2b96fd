package scribe.core.command.taxonomy;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.model.post.Tag;
import scribe.core.model.post.TagData;
import scribe.core.port.in.TagManagement;

/**
 * Create a tag; undo deletes it and redo brings it back under the same id.
 */
public class CreateTagCommand extends AbstractCommand<Tag> {

    private final TagManagement tags;
    private final TagData data;

    private Tag created;

    public CreateTagCommand(TagManagement tags, TagData data) {
        super("Create tag");
        this.tags = tags;
        this.data = data;
    }

    @Override
    protected Uni<Tag> apply() {
        return tags.createTag(data).invoke(tag -> created = tag);
    }

    @Override
    protected Uni<Tag> revert() {
        return tags.deleteTag(created.id());
    }

    @Override
    protected Uni<Tag> reapply() {
        return created != null ? tags.restoreTag(created) : apply();
    }
}
