package scribe.core.model.block;

/**
 * One image of an {@link BlockPayload.Images} gallery.
 *
 * @param id      row id, {@code null} until stored
 * @param fileId  uploaded file reference
 * @param alt     alternative text
 * @param caption optional caption
 * @param order   display order inside the gallery
 */
public record GalleryImage(String id, String fileId, String alt, String caption, int order)
        implements ChildRow<GalleryImage> {

    public static GalleryImage of(String fileId, String alt, int order) {
        return new GalleryImage(null, fileId, alt, null, order);
    }

    @Override
    public GalleryImage withId(String newId) {
        return new GalleryImage(newId, fileId, alt, caption, order);
    }
}
