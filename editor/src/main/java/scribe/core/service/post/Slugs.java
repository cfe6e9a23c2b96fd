package scribe.core.service.post;

import java.util.Locale;

/**
 * URL slug derivation.
 */
final class Slugs {

    private static final String FALLBACK = "post";

    private Slugs() {}

    /**
     * Lower-case, strip everything but letters, digits, spaces and hyphens,
     * then join words with single hyphens.
     */
    static String slugify(String text) {
        if (text == null) {
            return FALLBACK;
        }
        final var slug = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s-]", "")
                .trim()
                .replaceAll("\\s+", "-")
                .replaceAll("-+", "-");
        return slug.isEmpty() ? FALLBACK : slug;
    }
}
