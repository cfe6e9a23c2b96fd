package scribe.core.model.post;

/**
 * Editable fields of a {@link Category}.
 */
public record CategoryData(String name, String slug, String description, String color, String parentId) {

    public static CategoryData of(String name, String slug) {
        return new CategoryData(name, slug, null, null, null);
    }
}
