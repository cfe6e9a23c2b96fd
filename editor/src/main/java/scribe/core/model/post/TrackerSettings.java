package scribe.core.model.post;

/**
 * Editable fields of a {@link ProgressTracker}.
 */
public record TrackerSettings(ProgressVariant variant, boolean showPercentage) {}
