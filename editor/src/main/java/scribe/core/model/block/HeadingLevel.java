package scribe.core.model.block;

/**
 * Heading rank, H1 being the most prominent.
 */
public enum HeadingLevel {
    H1, H2, H3, H4, H5, H6
}
