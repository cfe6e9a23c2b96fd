package scribe.core.model.post;

import java.time.Instant;

/**
 * Post category.
 *
 * @param id          unique identifier
 * @param name        display name
 * @param slug        URL slug
 * @param description optional description
 * @param color       optional display color
 * @param parentId    optional parent category
 * @param createdAt   creation instant
 * @param updatedAt   last modification instant
 */
public record Category(
        String id,
        String name,
        String slug,
        String description,
        String color,
        String parentId,
        Instant createdAt,
        Instant updatedAt) {

    public Category {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Category ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Category name cannot be null or blank");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public static Category create(String id, CategoryData data) {
        return new Category(
                id, data.name(), data.slug(), data.description(), data.color(), data.parentId(), null, null);
    }

    public Category withData(CategoryData data) {
        return new Category(
                id, data.name(), data.slug(), data.description(), data.color(), data.parentId(), createdAt, Instant.now());
    }

    public CategoryData data() {
        return new CategoryData(name, slug, description, color, parentId);
    }
}
