package scribe.core.command.taxonomy;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.model.post.Tag;
import scribe.core.model.post.TagData;
import scribe.core.port.in.TagManagement;

/**
 * Update a tag; undo restores the captured version.
 */
public class UpdateTagCommand extends AbstractCommand<Tag> {

    private final TagManagement tags;
    private final String tagId;
    private final TagData data;

    private Tag previous;

    public UpdateTagCommand(TagManagement tags, String tagId, TagData data) {
        super("Update tag");
        this.tags = tags;
        this.tagId = tagId;
        this.data = data;
    }

    @Override
    protected Uni<Tag> apply() {
        return tags.getTag(tagId)
                .invoke(tag -> previous = tag)
                .flatMap(tag -> tags.updateTag(tagId, data));
    }

    @Override
    protected Uni<Tag> revert() {
        return tags.restoreTag(previous);
    }
}
