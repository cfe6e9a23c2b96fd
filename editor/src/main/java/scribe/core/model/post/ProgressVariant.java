package scribe.core.model.post;

/**
 * Visual style of the reading progress indicator.
 */
public enum ProgressVariant {
    SUBTLE,
    VIBRANT,
    CIRCULAR,
    NONE
}
