package scribe.core.model.block;

/**
 * Selectable answer of a {@link BlockPayload.Poll}.
 *
 * @param id    row id, {@code null} until stored
 * @param label answer text
 */
public record PollOption(String id, String label) implements ChildRow<PollOption> {

    public static PollOption of(String label) {
        return new PollOption(null, label);
    }

    @Override
    public PollOption withId(String newId) {
        return new PollOption(newId, label);
    }
}
