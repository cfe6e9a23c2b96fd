package scribe.core.model.block;

/**
 * Chart rendering style.
 */
public enum ChartType {
    AREA, BAR, LINE, PIE
}
