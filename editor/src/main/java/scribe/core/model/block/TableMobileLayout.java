package scribe.core.model.block;

/**
 * How a table block collapses on narrow screens.
 */
public enum TableMobileLayout {
    SCROLL, STACK, CARDS
}
