package scribe.core.model.post;

import java.time.Instant;
import java.util.Set;

/**
 * Input for creating a post.
 *
 * @param title       required title
 * @param slug        optional slug, generated from the title when absent
 * @param excerpt     optional summary
 * @param categoryId  optional category reference
 * @param tagIds      initial tags
 * @param published   publish immediately
 * @param scheduledAt optional future publication instant
 * @param featured    highlight flag
 */
public record PostDraft(
        String title,
        String slug,
        String excerpt,
        String categoryId,
        Set<String> tagIds,
        boolean published,
        Instant scheduledAt,
        boolean featured) {

    public PostDraft {
        tagIds = tagIds == null ? Set.of() : Set.copyOf(tagIds);
    }

    public static PostDraft titled(String title) {
        return new PostDraft(title, null, null, null, Set.of(), false, null, false);
    }

    /**
     * Draft that re-creates a captured post with its content fields and publication state.
     */
    public static PostDraft copyOf(Post post) {
        return new PostDraft(
                post.title(),
                post.slug(),
                post.excerpt(),
                post.categoryId(),
                post.tagIds(),
                post.published(),
                post.scheduledAt(),
                post.featured());
    }
}
