package scribe.core.service.post;

import java.util.List;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.model.editor.EntityNotFoundException;
import scribe.core.model.post.Tag;
import scribe.core.model.post.TagData;
import scribe.core.port.in.TagManagement;
import scribe.core.port.out.TagRepository;

/**
 * Service for managing tags.
 */
@ApplicationScoped
public class TagService implements TagManagement {

    private static final Logger LOG = Logger.getLogger(TagService.class);

    private final TagRepository repository;

    @Inject
    public TagService(TagRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<Tag> createTag(TagData data) {
        return Uni.createFrom()
                .item(() -> Tag.create(UUID.randomUUID().toString(), withSlug(data)))
                .call(repository::save)
                .invoke(tag -> LOG.debugf("Created tag %s (%s)", tag.id(), tag.name()));
    }

    @Override
    public Uni<Tag> updateTag(String tagId, TagData data) {
        return find(tagId).map(existing -> existing.withData(withSlug(data))).call(repository::save);
    }

    @Override
    public Uni<Tag> restoreTag(Tag snapshot) {
        return repository.save(snapshot).replaceWith(snapshot);
    }

    @Override
    public Uni<Tag> getTag(String tagId) {
        return find(tagId);
    }

    @Override
    public Uni<Tag> deleteTag(String tagId) {
        return find(tagId).call(tag -> repository.delete(tagId));
    }

    @Override
    public Uni<List<Tag>> listTags() {
        return repository.findAll();
    }

    private Uni<Tag> find(String tagId) {
        return repository.findById(tagId)
                .map(existing -> existing.orElseThrow(() -> new EntityNotFoundException("Tag", tagId)));
    }

    private static TagData withSlug(TagData data) {
        if (data.slug() != null && !data.slug().isBlank()) {
            return data;
        }
        return new TagData(data.name(), Slugs.slugify(data.name()));
    }
}
