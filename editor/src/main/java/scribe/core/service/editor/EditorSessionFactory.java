package scribe.core.service.editor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import scribe.core.model.editor.ServerState;
import scribe.core.port.in.BlockManagement;
import scribe.core.port.in.CategoryManagement;
import scribe.core.port.in.PostManagement;
import scribe.core.port.in.ProgressTrackerManagement;
import scribe.core.port.in.TagManagement;
import scribe.core.port.out.EditorMetrics;

/**
 * Opens editor sessions. Each session owns its history and projection and
 * lives until closed by its caller.
 */
@ApplicationScoped
public class EditorSessionFactory {

    private static final Logger LOG = Logger.getLogger(EditorSessionFactory.class);

    private final BlockManagement blocks;
    private final PostManagement posts;
    private final CategoryManagement categories;
    private final TagManagement tags;
    private final ProgressTrackerManagement trackers;
    private final EditorMetrics metrics;
    private final ContentAnalyzer analyzer;

    @Inject
    public EditorSessionFactory(
            BlockManagement blocks,
            PostManagement posts,
            CategoryManagement categories,
            TagManagement tags,
            ProgressTrackerManagement trackers,
            EditorMetrics metrics,
            ContentAnalyzer analyzer) {
        this.blocks = blocks;
        this.posts = posts;
        this.categories = categories;
        this.tags = tags;
        this.trackers = trackers;
        this.metrics = metrics;
        this.analyzer = analyzer;
    }

    /**
     * Open an empty session for {@code userId}. Load or create a post before editing blocks.
     */
    public EditorSession open(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        LOG.debugf("Opening editor session for %s", userId);
        return new EditorSession(userId, blocks, posts, categories, tags, trackers, metrics, analyzer);
    }

    /**
     * Open a session hydrated from a server-rendered state.
     */
    public EditorSession open(String userId, ServerState server) {
        final var session = open(userId);
        session.acceptServerState(server);
        return session;
    }
}
