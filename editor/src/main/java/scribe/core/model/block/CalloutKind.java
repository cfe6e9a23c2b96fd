package scribe.core.model.block;

/**
 * Visual style of a callout block.
 */
public enum CalloutKind {
    INFO, WARNING, ERROR, SUCCESS, TIP
}
