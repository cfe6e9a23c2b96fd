package scribe.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the block editor.
 *
 * <p>Configuration prefix: {@code scribe.editor}
 */
@ConfigMapping(prefix = "scribe.editor")
public interface EditorConfig {

    /**
     * Title given to posts created without one.
     *
     * @return default title (default: "My new blog post")
     */
    @WithDefault("My new blog post")
    String newPostTitle();

    /**
     * Content analysis settings.
     */
    AnalysisConfig analysis();

    /**
     * Post scheduling settings.
     */
    ScheduleConfig schedule();

    /**
     * Command metrics settings.
     */
    MetricsConfig metrics();

    interface AnalysisConfig {

        /**
         * Reading speed used for the reading time estimate.
         *
         * @return words per minute (default: 200)
         */
        @WithDefault("200")
        int wordsPerMinute();
    }

    interface ScheduleConfig {

        /**
         * Reject schedule requests whose instant is not in the future.
         *
         * @return true if the instant must be in the future (default: true)
         */
        @WithDefault("true")
        boolean requireFuture();
    }

    interface MetricsConfig {

        /**
         * @return true if command metrics are recorded (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
