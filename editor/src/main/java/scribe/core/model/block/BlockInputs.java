package scribe.core.model.block;

import java.util.List;

/**
 * Conversions from stored blocks back to creation inputs.
 */
public final class BlockInputs {

    private BlockInputs() {}

    /**
     * Build the input that re-creates a captured block at its original position.
     *
     * <p>Child row ids are dropped so the store issues fresh rows for the new block.
     *
     * @param snapshot block captured before it was deleted
     * @return creation input carrying the same position, name and content
     */
    public static BlockInput fromSnapshot(Block snapshot) {
        return new BlockInput(snapshot.position(), snapshot.blockName(), detachChildren(snapshot.payload()));
    }

    /**
     * Copy of the payload whose child rows carry no ids.
     */
    public static BlockPayload detachChildren(BlockPayload payload) {
        return switch (payload.type()) {
            case IMAGES -> {
                var images = (BlockPayload.Images) payload;
                yield images.withChildren(detach(images.images()));
            }
            case INSTAGRAM -> {
                var instagram = (BlockPayload.Instagram) payload;
                yield instagram.withChildren(detach(instagram.files()));
            }
            case POLL -> {
                var poll = (BlockPayload.Poll) payload;
                yield poll.withChildren(detach(poll.options()));
            }
            case LIST -> {
                var list = (BlockPayload.ItemList) payload;
                yield list.withChildren(detach(list.items()));
            }
            case TEXT, VIDEO, QUOTE, CALLOUT, CODE, TABLE, TWITTER, CHART, HEADING -> payload;
        };
    }

    private static <C extends ChildRow<C>> List<C> detach(List<C> rows) {
        return rows.stream().map(row -> row.withId(null)).toList();
    }
}
