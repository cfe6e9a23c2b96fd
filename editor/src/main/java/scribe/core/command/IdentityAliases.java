package scribe.core.command;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps ids of entities that were deleted and re-created to their current ids.
 *
 * <p>Undoing a delete re-creates the entity under a new id. Commands further
 * back in the history still hold the old id and resolve it here before every
 * storage call. Chains are followed, so {@code a -> b -> c} resolves {@code a}
 * to {@code c}.
 */
public class IdentityAliases {

    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    /**
     * Current id for {@code id}; {@code id} itself if it was never replaced.
     */
    public String resolve(String id) {
        if (id == null) {
            return null;
        }
        var current = id;
        for (int hops = 0; hops <= aliases.size(); hops++) {
            final var next = aliases.get(current);
            if (next == null) {
                return current;
            }
            current = next;
        }
        throw new IllegalStateException("Alias cycle detected for id " + id);
    }

    /**
     * Record that {@code oldId} now lives under {@code newId}.
     */
    public void replace(String oldId, String newId) {
        if (oldId == null || newId == null || oldId.equals(newId)) {
            return;
        }
        aliases.remove(newId);
        aliases.put(oldId, newId);
    }

    public int size() {
        return aliases.size();
    }

    public void clear() {
        aliases.clear();
    }
}
