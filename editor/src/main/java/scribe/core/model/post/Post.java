package scribe.core.model.post;

import java.time.Instant;
import java.util.Set;

/**
 * Post aggregate root.
 *
 * <p>A post owns its blocks (stored separately), an optional category, a set
 * of tag references, an optional progress tracker and its publication state.
 *
 * @param id          unique identifier
 * @param authorId    user that created the post
 * @param title       post title
 * @param slug        URL slug, unique across posts
 * @param excerpt     optional summary
 * @param categoryId  optional category reference
 * @param tagIds      referenced tag ids
 * @param published   whether the post is visible
 * @param publishedAt when the post went (or goes) live
 * @param scheduledAt future publication instant, if scheduled
 * @param featured    whether the post is highlighted
 * @param createdAt   creation instant
 * @param updatedAt   last modification instant
 */
public record Post(
        String id,
        String authorId,
        String title,
        String slug,
        String excerpt,
        String categoryId,
        Set<String> tagIds,
        boolean published,
        Instant publishedAt,
        Instant scheduledAt,
        boolean featured,
        Instant createdAt,
        Instant updatedAt) {

    public Post {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Post ID cannot be null or blank");
        }
        if (authorId == null || authorId.isBlank()) {
            throw new IllegalArgumentException("Post author cannot be null or blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Post title cannot be null or blank");
        }
        tagIds = tagIds == null ? Set.of() : Set.copyOf(tagIds);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public boolean isScheduled() {
        return scheduledAt != null;
    }

    /**
     * Copy of this post stored under another id, every other field unchanged.
     */
    public Post withId(String newId) {
        return new Post(
                newId,
                authorId,
                title,
                slug,
                excerpt,
                categoryId,
                tagIds,
                published,
                publishedAt,
                scheduledAt,
                featured,
                createdAt,
                updatedAt);
    }

    public Post withTags(Set<String> newTagIds) {
        return toBuilder().tagIds(newTagIds).updatedAt(Instant.now()).build();
    }

    /**
     * Copy of this post carrying the publication fields of {@code other}.
     */
    public Post withPublicationOf(Post other) {
        return toBuilder()
                .published(other.published())
                .publishedAt(other.publishedAt())
                .scheduledAt(other.scheduledAt())
                .updatedAt(Instant.now())
                .build();
    }

    public Builder toBuilder() {
        return builder(id, authorId)
                .title(title)
                .slug(slug)
                .excerpt(excerpt)
                .categoryId(categoryId)
                .tagIds(tagIds)
                .published(published)
                .publishedAt(publishedAt)
                .scheduledAt(scheduledAt)
                .featured(featured)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder(String id, String authorId) {
        return new Builder(id, authorId);
    }

    public static class Builder {
        private final String id;
        private final String authorId;
        private String title;
        private String slug;
        private String excerpt;
        private String categoryId;
        private Set<String> tagIds = Set.of();
        private boolean published;
        private Instant publishedAt;
        private Instant scheduledAt;
        private boolean featured;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String id, String authorId) {
            this.id = id;
            this.authorId = authorId;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder excerpt(String excerpt) {
            this.excerpt = excerpt;
            return this;
        }

        public Builder categoryId(String categoryId) {
            this.categoryId = categoryId;
            return this;
        }

        public Builder tagIds(Set<String> tagIds) {
            this.tagIds = tagIds;
            return this;
        }

        public Builder published(boolean published) {
            this.published = published;
            return this;
        }

        public Builder publishedAt(Instant publishedAt) {
            this.publishedAt = publishedAt;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder featured(boolean featured) {
            this.featured = featured;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Post build() {
            return new Post(
                    id,
                    authorId,
                    title,
                    slug,
                    excerpt,
                    categoryId,
                    tagIds,
                    published,
                    publishedAt,
                    scheduledAt,
                    featured,
                    createdAt,
                    updatedAt);
        }
    }
}
