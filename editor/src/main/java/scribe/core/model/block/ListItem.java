package scribe.core.model.block;

/**
 * Entry of a {@link BlockPayload.ItemList} block.
 *
 * @param id       row id, {@code null} until stored
 * @param title    item text
 * @param position order inside the list
 * @param checked  tick state for checklists
 */
public record ListItem(String id, String title, int position, boolean checked) implements ChildRow<ListItem> {

    public static ListItem of(String title, int position) {
        return new ListItem(null, title, position, false);
    }

    @Override
    public ListItem withId(String newId) {
        return new ListItem(newId, title, position, checked);
    }
}
