package scribe.core.model.block;

/**
 * Kinds of content block a post can contain.
 *
 * <p>Each type is persisted in its own collection, so the enum order also
 * fixes the order in which tables are visited during fan-out reads and
 * multi-table writes.
 */
public enum BlockType {
    TEXT("text"),
    IMAGES("images"),
    VIDEO("video"),
    QUOTE("quote"),
    CALLOUT("callout"),
    CODE("code"),
    TABLE("table"),
    TWITTER("twitter"),
    INSTAGRAM("instagram"),
    CHART("chart"),
    POLL("poll"),
    HEADING("heading"),
    LIST("list");

    private final String label;

    BlockType(String label) {
        this.label = label;
    }

    /**
     * Lower-case label used for default block names and metric tags.
     */
    public String label() {
        return label;
    }

    /**
     * Default display name for a block of this type created at the given position.
     *
     * @param position the block position
     * @return name such as {@code textBlock-3}
     */
    public String defaultBlockName(int position) {
        return label + "Block-" + position;
    }
}
