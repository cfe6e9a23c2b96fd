package scribe.core.command.post;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import scribe.core.command.AbstractCommand;
import scribe.core.command.IdentityAliases;
import scribe.core.model.post.ProgressTracker;
import scribe.core.model.post.TrackerSettings;
import scribe.core.port.in.ProgressTrackerManagement;

/**
 * Create or update the progress tracker of a post.
 *
 * <p>Undo restores the previous tracker, or deletes the tracker when the post
 * had none; in that case the undo result is {@code null}.
 */
public class UpdateProgressTrackerCommand extends AbstractCommand<ProgressTracker> {

    private final ProgressTrackerManagement trackers;
    private final IdentityAliases aliases;
    private final String postId;
    private final TrackerSettings settings;

    private Optional<ProgressTracker> previous = Optional.empty();

    public UpdateProgressTrackerCommand(
            ProgressTrackerManagement trackers, IdentityAliases aliases, String postId, TrackerSettings settings) {
        super("Update progress tracker");
        this.trackers = trackers;
        this.aliases = aliases;
        this.postId = postId;
        this.settings = settings;
    }

    @Override
    protected Uni<ProgressTracker> apply() {
        final var target = aliases.resolve(postId);
        return trackers.findTracker(target)
                .invoke(existing -> previous = existing)
                .flatMap(existing -> trackers.saveTracker(target, settings));
    }

    @Override
    protected Uni<ProgressTracker> revert() {
        final var target = aliases.resolve(postId);
        if (previous.isPresent()) {
            final var tracker = previous.get();
            return trackers.restoreTracker(new ProgressTracker(
                    tracker.id(),
                    target,
                    tracker.variant(),
                    tracker.showPercentage(),
                    tracker.createdAt(),
                    tracker.updatedAt()));
        }
        return trackers.deleteTracker(target).replaceWith((ProgressTracker) null);
    }
}
