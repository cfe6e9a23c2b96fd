package scribe.core.service.post;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scribe.core.config.EditorConfig;
import scribe.core.model.editor.EditorValidationException;
import scribe.core.model.editor.EntityNotFoundException;
import scribe.core.model.editor.PostAccessDeniedException;
import scribe.core.model.post.Post;
import scribe.core.model.post.PostDraft;
import scribe.core.model.post.PostUpdate;
import scribe.core.port.in.BlockManagement;
import scribe.core.port.in.PostManagement;
import scribe.core.port.out.PostRepository;
import scribe.core.port.out.ProgressTrackerRepository;

/**
 * Service for managing posts and their publication state.
 *
 * <p>Slugs are unique across posts. Generated slugs take the first free
 * candidate of {@code base}, {@code base-1}, {@code base-2}, ...; explicit
 * slugs are rejected when another post uses them.
 */
@ApplicationScoped
public class PostService implements PostManagement {

    private static final Logger LOG = Logger.getLogger(PostService.class);

    private final PostRepository repository;
    private final BlockManagement blocks;
    private final ProgressTrackerRepository trackers;
    private final EditorConfig config;

    @Inject
    public PostService(
            PostRepository repository,
            BlockManagement blocks,
            ProgressTrackerRepository trackers,
            EditorConfig config) {
        this.repository = repository;
        this.blocks = blocks;
        this.trackers = trackers;
        this.config = config;
    }

    @Override
    public Uni<Post> createPost(PostDraft draft, String userId) {
        if (userId == null || userId.isBlank()) {
            return Uni.createFrom().failure(new EditorValidationException("Author ID cannot be null or blank"));
        }

        final var title = draft.title() == null || draft.title().isBlank() ? config.newPostTitle() : draft.title();
        return resolveSlug(title, draft.slug(), null).flatMap(slug -> {
            final var now = Instant.now();
            final var builder = Post.builder(UUID.randomUUID().toString(), userId)
                    .title(title)
                    .slug(slug)
                    .excerpt(draft.excerpt())
                    .categoryId(draft.categoryId())
                    .tagIds(draft.tagIds())
                    .published(draft.published())
                    .publishedAt(draft.published() ? now : null)
                    .featured(draft.featured())
                    .createdAt(now);
            if (draft.scheduledAt() != null) {
                builder.scheduledAt(draft.scheduledAt()).published(true).publishedAt(draft.scheduledAt());
            }
            final var post = builder.build();
            return repository.save(post).replaceWith(post);
        })
        .invoke(post -> LOG.infof("Created post %s (%s) for %s", post.id(), post.slug(), userId));
    }

    @Override
    public Uni<Post> getPost(String postId) {
        return repository.findById(postId)
                .map(existing -> existing.orElseThrow(() -> new EntityNotFoundException("Post", postId)));
    }

    @Override
    public Uni<Post> updatePost(String postId, PostUpdate update, String userId) {
        return findOwned(postId, userId)
                .call(existing -> requireSlugAvailable(update.slug(), postId))
                .map(existing -> apply(existing, update))
                .call(repository::save)
                .invoke(post -> LOG.debugf("Updated post %s", post.id()));
    }

    @Override
    public Uni<Post> restorePost(Post snapshot, String userId) {
        return findOwned(snapshot.id(), userId)
                .call(existing -> requireSlugAvailable(snapshot.slug(), snapshot.id()))
                .map(existing -> snapshot.toBuilder().updatedAt(Instant.now()).build())
                .call(repository::save);
    }

    @Override
    public Uni<Post> deletePost(String postId, String userId) {
        return findOwned(postId, userId)
                .call(post -> blocks.deleteBlocksByPost(postId))
                .call(post -> trackers.deleteByPostId(postId))
                .call(post -> repository.delete(postId))
                .invoke(post -> LOG.infof("Deleted post %s with its blocks", postId));
    }

    @Override
    public Uni<Post> publishPost(String postId, String userId) {
        return updatePost(
                postId, PostUpdate.builder().published(true).scheduledAt(null).build(), userId);
    }

    @Override
    public Uni<Post> schedulePost(String postId, Instant scheduledAt, String userId) {
        if (scheduledAt == null) {
            return Uni.createFrom().failure(new EditorValidationException("Scheduled date is required"));
        }
        if (config.schedule().requireFuture() && !scheduledAt.isAfter(Instant.now())) {
            return Uni.createFrom().failure(new EditorValidationException("Scheduled date must be in the future"));
        }
        return updatePost(postId, PostUpdate.builder().scheduledAt(scheduledAt).build(), userId);
    }

    @Override
    public Uni<Post> updatePostTags(String postId, Set<String> tagIds, String userId) {
        return findOwned(postId, userId)
                .map(post -> post.withTags(tagIds))
                .call(repository::save);
    }

    private Uni<Post> findOwned(String postId, String userId) {
        return getPost(postId).invoke(post -> {
            if (!post.authorId().equals(userId)) {
                throw new PostAccessDeniedException(postId, userId);
            }
        });
    }

    private static Post apply(Post existing, PostUpdate update) {
        final var now = Instant.now();
        final var builder = existing.toBuilder().updatedAt(now);
        if (update.title() != null) {
            builder.title(update.title());
        }
        if (update.slug() != null) {
            builder.slug(update.slug());
        }
        if (update.excerpt() != null) {
            builder.excerpt(update.excerpt());
        }
        if (update.categoryId() != null) {
            builder.categoryId(update.categoryId());
        }
        if (update.tagIds() != null) {
            builder.tagIds(update.tagIds());
        }
        if (update.featured() != null) {
            builder.featured(update.featured());
        }
        if (update.published() != null) {
            final boolean publish = update.published();
            if (publish && (!existing.published() || existing.isScheduled())) {
                builder.publishedAt(now);
            } else if (!publish) {
                builder.publishedAt(null);
            }
            builder.published(publish);
        }
        if (update.updateSchedule()) {
            builder.scheduledAt(update.scheduledAt());
            if (update.scheduledAt() != null) {
                builder.published(true).publishedAt(update.scheduledAt());
            }
        }
        return builder.build();
    }

    private Uni<String> resolveSlug(String title, String requested, String excludePostId) {
        if (requested != null && !requested.isBlank()) {
            return requireSlugAvailable(requested, excludePostId).replaceWith(requested);
        }
        final var base = Slugs.slugify(title);
        return firstFreeSlug(base, base, 1, excludePostId);
    }

    private Uni<String> firstFreeSlug(String base, String candidate, int counter, String excludePostId) {
        return repository.slugTaken(candidate, excludePostId).flatMap(taken -> taken
                ? firstFreeSlug(base, base + "-" + counter, counter + 1, excludePostId)
                : Uni.createFrom().item(candidate));
    }

    private Uni<Void> requireSlugAvailable(String slug, String excludePostId) {
        if (slug == null) {
            return Uni.createFrom().voidItem();
        }
        return repository.slugTaken(slug, excludePostId).flatMap(taken -> taken
                ? Uni.createFrom().<Void>failure(new EditorValidationException("Slug already in use: " + slug))
                : Uni.createFrom().voidItem());
    }
}
