package scribe.core.service.block;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import scribe.core.model.block.BlockPayload;
import scribe.core.model.block.ChildRow;

/**
 * Upserts the child rows of composite payloads.
 *
 * <p>Rows are matched by id. A matched row is replaced in place, a row without
 * id or with an unknown id is appended as a new row, and a stored row missing
 * from the input is kept.
 */
final class ChildRowMerger {

    private ChildRowMerger() {}

    static BlockPayload merge(BlockPayload stored, BlockPayload incoming) {
        if (incoming instanceof BlockPayload.Composite<?> composite
                && stored instanceof BlockPayload.Composite<?> existing) {
            return mergeRows(composite, existing.children());
        }
        return incoming;
    }

    @SuppressWarnings("unchecked")
    private static <C extends ChildRow<C>> BlockPayload mergeRows(
            BlockPayload.Composite<C> incoming, List<?> storedRows) {
        final var stored = (List<C>) storedRows;
        final Map<String, C> byId = new HashMap<>();
        for (C row : incoming.children()) {
            if (row.id() != null) {
                byId.put(row.id(), row);
            }
        }

        final List<C> merged = new ArrayList<>(stored.size() + incoming.children().size());
        final Set<String> storedIds = new HashSet<>();
        for (C row : stored) {
            storedIds.add(row.id());
            merged.add(byId.getOrDefault(row.id(), row));
        }
        for (C row : incoming.children()) {
            if (row.id() == null) {
                merged.add(row);
            } else if (!storedIds.contains(row.id())) {
                merged.add(row.withId(null));
            }
        }
        return incoming.withChildren(merged);
    }
}
