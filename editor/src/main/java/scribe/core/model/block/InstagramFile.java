package scribe.core.model.block;

/**
 * Media file attached to an {@link BlockPayload.Instagram} embed.
 *
 * @param id     row id, {@code null} until stored
 * @param fileId uploaded file reference
 */
public record InstagramFile(String id, String fileId) implements ChildRow<InstagramFile> {

    public static InstagramFile of(String fileId) {
        return new InstagramFile(null, fileId);
    }

    @Override
    public InstagramFile withId(String newId) {
        return new InstagramFile(newId, fileId);
    }
}
