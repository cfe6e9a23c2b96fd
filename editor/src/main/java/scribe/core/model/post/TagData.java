package scribe.core.model.post;

/**
 * Editable fields of a {@link Tag}.
 */
public record TagData(String name, String slug) {}
