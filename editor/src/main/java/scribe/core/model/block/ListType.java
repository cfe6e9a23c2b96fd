package scribe.core.model.block;

/**
 * Rendering style of a list block.
 */
public enum ListType {
    BULLET, NUMBERED, CHECKLIST
}
