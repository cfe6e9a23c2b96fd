package scribe.core.model.post;

import java.time.Instant;
import java.util.Set;

/**
 * Partial update of a post. {@code null} fields keep their current value.
 *
 * <p>{@code scheduledAt} is only applied when {@code updateSchedule} is set,
 * which allows clearing a schedule explicitly.
 */
public record PostUpdate(
        String title,
        String slug,
        String excerpt,
        String categoryId,
        Set<String> tagIds,
        Boolean published,
        Boolean featured,
        boolean updateSchedule,
        Instant scheduledAt) {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private String slug;
        private String excerpt;
        private String categoryId;
        private Set<String> tagIds;
        private Boolean published;
        private Boolean featured;
        private boolean updateSchedule;
        private Instant scheduledAt;

        private Builder() {}

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

        public Builder published(Boolean published) {
            this.published = published;
            return this;
        }

        public Builder featured(Boolean featured) {
            this.featured = featured;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.updateSchedule = true;
            this.scheduledAt = scheduledAt;
            return this;
        }

        public PostUpdate build() {
            return new PostUpdate(
                    title, slug, excerpt, categoryId, tagIds, published, featured, updateSchedule, scheduledAt);
        }
    }
}
