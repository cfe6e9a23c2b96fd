package scribe.core.command.post;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import scribe.adapter.out.storage.memory.InMemoryBlockStore;
import scribe.adapter.out.storage.memory.InMemoryPostRepository;
import scribe.adapter.out.storage.memory.InMemoryProgressTrackerRepository;
import scribe.core.command.IdentityAliases;
import scribe.core.config.EditorConfigFixture;
import scribe.core.model.block.BlockInput;
import scribe.core.model.block.BlockPayload;
import scribe.core.model.editor.CommandStateException;
import scribe.core.model.editor.EntityNotFoundException;
import scribe.core.model.post.Post;
import scribe.core.model.post.PostDraft;
import scribe.core.model.post.PostUpdate;
import scribe.core.model.post.ProgressVariant;
import scribe.core.model.post.TrackerSettings;
import scribe.core.service.block.BlockService;
import scribe.core.service.post.PostService;
import scribe.core.service.post.ProgressTrackerService;

@DisplayName("Post commands")
class PostCommandsTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String USER = "alice";

    private BlockService blocks;
    private PostService posts;
    private ProgressTrackerService trackers;
    private IdentityAliases aliases;
    private Post post;

    @BeforeEach
    void setUp() {
        final var trackerRepository = new InMemoryProgressTrackerRepository();
        blocks = new BlockService(new InMemoryBlockStore());
        posts = new PostService(
                new InMemoryPostRepository(), blocks, trackerRepository, EditorConfigFixture.defaults());
        trackers = new ProgressTrackerService(trackerRepository);
        aliases = new IdentityAliases();
        post = posts.createPost(PostDraft.titled("Hello"), USER).await().atMost(TIMEOUT);
    }

    private Post reload(String postId) {
        return posts.getPost(aliases.resolve(postId)).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("CreatePostCommand")
    class CreateTests {

        @Test
        @DisplayName("should delete the post on undo")
        void shouldDeleteOnUndo() {
            final var command = new CreatePostCommand(posts, aliases, PostDraft.titled("Second"), USER);

            final var created = command.execute().await().atMost(TIMEOUT);
            command.undo().await().atMost(TIMEOUT);

            assertThrows(EntityNotFoundException.class, () -> posts.getPost(created.id())
                    .await()
                    .atMost(TIMEOUT));

            final var again = command.redo().await().atMost(TIMEOUT);
            assertEquals(again.id(), aliases.resolve(created.id()));
            assertEquals("second", again.slug());
        }
    }

    @Nested
    @DisplayName("UpdatePostCommand")
    class UpdateTests {

        @Test
        @DisplayName("should write the captured fields back on undo")
        void shouldRestoreFields() {
            final var command = new UpdatePostCommand(
                    posts, aliases, post.id(), PostUpdate.builder().title("Renamed").featured(true).build(), USER);

            command.execute().await().atMost(TIMEOUT);
            assertEquals("Renamed", reload(post.id()).title());

            command.undo().await().atMost(TIMEOUT);

            final var restored = reload(post.id());
            assertEquals("Hello", restored.title());
            assertFalse(restored.featured());
        }

        @Test
        @DisplayName("should refuse undo before execute")
        void shouldRefuseUndoBeforeExecute() {
            final var command = new UpdatePostCommand(
                    posts, aliases, post.id(), PostUpdate.builder().title("x").build(), USER);

            assertThrows(CommandStateException.class, () -> command.undo().await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("publication commands")
    class PublicationTests {

        @Test
        @DisplayName("should unpublish on undo of publish")
        void shouldUndoPublish() {
            final var command = new PublishPostCommand(posts, aliases, post.id(), USER);

            command.execute().await().atMost(TIMEOUT);
            assertTrue(reload(post.id()).published());

            command.undo().await().atMost(TIMEOUT);

            final var restored = reload(post.id());
            assertFalse(restored.published());
            assertNull(restored.publishedAt());
        }

        @Test
        @DisplayName("should clear the schedule on undo of schedule")
        void shouldUndoSchedule() {
            final var at = Instant.now().plus(3, ChronoUnit.DAYS);
            final var command = new SchedulePostCommand(posts, aliases, post.id(), at, USER);

            command.execute().await().atMost(TIMEOUT);
            assertEquals(at, reload(post.id()).scheduledAt());

            command.undo().await().atMost(TIMEOUT);

            assertNull(reload(post.id()).scheduledAt());
            assertFalse(reload(post.id()).published());
        }
    }

    @Test
    @DisplayName("should restore the previous tag set")
    void shouldUndoTagUpdate() {
        final var command = new UpdatePostTagsCommand(posts, aliases, post.id(), Set.of("java"), USER);

        command.execute().await().atMost(TIMEOUT);
        command.undo().await().atMost(TIMEOUT);

        assertTrue(reload(post.id()).tagIds().isEmpty());
    }

    @Test
    @DisplayName("should delete a tracker that did not exist before")
    void shouldUndoTrackerCreation() {
        final var command = new UpdateProgressTrackerCommand(
                trackers, aliases, post.id(), new TrackerSettings(ProgressVariant.VIBRANT, true));

        command.execute().await().atMost(TIMEOUT);
        final var undone = command.undo().await().atMost(TIMEOUT);

        assertNull(undone);
        assertTrue(trackers.findTracker(post.id()).await().atMost(TIMEOUT).isEmpty());
    }

    @Nested
    @DisplayName("DeletePostCommand")
    class DeleteTests {

        @Test
        @DisplayName("should re-create the post with its blocks and tracker on undo")
        void shouldRestoreEverything() {
            blocks.createBlock(post.id(), BlockInput.append(new BlockPayload.Text("a", false)))
                    .await()
                    .atMost(TIMEOUT);
            blocks.createBlock(post.id(), BlockInput.append(new BlockPayload.Quote("b", null, null)))
                    .await()
                    .atMost(TIMEOUT);
            trackers.saveTracker(post.id(), new TrackerSettings(ProgressVariant.CIRCULAR, true))
                    .await()
                    .atMost(TIMEOUT);
            final var command = new DeletePostCommand(posts, blocks, trackers, aliases, post.id(), USER);

            command.execute().await().atMost(TIMEOUT);
            final var restored = command.undo().await().atMost(TIMEOUT);

            assertNotEquals(post.id(), restored.id());
            assertEquals(restored.id(), aliases.resolve(post.id()));
            assertEquals(post.slug(), restored.slug());
            assertEquals(post.createdAt(), restored.createdAt());
            final var content = blocks.getBlocksByPost(restored.id()).await().atMost(TIMEOUT);
            assertEquals(2, content.size());
            assertEquals(0, content.get(0).position());
            assertEquals(1, content.get(1).position());
            final var tracker = trackers.findTracker(restored.id()).await().atMost(TIMEOUT);
            assertEquals(ProgressVariant.CIRCULAR, tracker.orElseThrow().variant());

            command.redo().await().atMost(TIMEOUT);
            assertThrows(EntityNotFoundException.class, () -> posts.getPost(restored.id())
                    .await()
                    .atMost(TIMEOUT));
        }
    }
}
