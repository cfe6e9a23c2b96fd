package scribe.core.model.post;

import java.time.Instant;

/**
 * Free-form label attached to posts.
 */
public record Tag(String id, String name, String slug, Instant createdAt, Instant updatedAt) {

    public Tag {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Tag ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name cannot be null or blank");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public static Tag create(String id, TagData data) {
        return new Tag(id, data.name(), data.slug(), null, null);
    }

    public Tag withData(TagData data) {
        return new Tag(id, data.name(), data.slug(), createdAt, Instant.now());
    }

    public TagData data() {
        return new TagData(name, slug);
    }
}
