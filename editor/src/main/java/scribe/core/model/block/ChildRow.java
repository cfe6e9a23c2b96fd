package scribe.core.model.block;

/**
 * A row embedded in a composite block payload (gallery image, poll option, ...).
 *
 * <p>Child rows are owned by their parent block. A {@code null} id marks a row
 * that has not been persisted yet; the store assigns one on insert.
 *
 * @param <C> the concrete row type
 */
public interface ChildRow<C extends ChildRow<C>> {

    String id();

    C withId(String id);
}
