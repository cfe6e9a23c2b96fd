package scribe.core.service.editor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import scribe.adapter.out.storage.memory.InMemoryBlockStore;
import scribe.adapter.out.storage.memory.InMemoryCategoryRepository;
import scribe.adapter.out.storage.memory.InMemoryPostRepository;
import scribe.adapter.out.storage.memory.InMemoryProgressTrackerRepository;
import scribe.adapter.out.storage.memory.InMemoryTagRepository;
import scribe.adapter.out.telemetry.MicrometerEditorMetrics;
import scribe.core.config.EditorConfigFixture;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInput;
import scribe.core.model.block.BlockPayload;
import scribe.core.model.block.BlockType;
import scribe.core.model.editor.EditorError;
import scribe.core.model.editor.EditorState;
import scribe.core.model.editor.ServerState;
import scribe.core.model.editor.StorageException;
import scribe.core.model.post.CategoryData;
import scribe.core.model.post.Post;
import scribe.core.model.post.PostDraft;
import scribe.core.model.post.PostUpdate;
import scribe.core.model.post.ProgressVariant;
import scribe.core.model.post.TrackerSettings;
import scribe.core.port.in.BlockManagement;
import scribe.core.port.in.CategoryManagement;
import scribe.core.port.in.PostManagement;
import scribe.core.port.in.ProgressTrackerManagement;
import scribe.core.port.in.TagManagement;
import scribe.core.service.block.BlockService;
import scribe.core.service.post.CategoryService;
import scribe.core.service.post.PostService;
import scribe.core.service.post.ProgressTrackerService;
import scribe.core.service.post.TagService;

@DisplayName("EditorSession")
class EditorSessionTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String USER = "alice";

    private SimpleMeterRegistry registry;
    private EditorSessionFactory factory;
    private EditorSession session;

    @BeforeEach
    void setUp() {
        final var config = EditorConfigFixture.defaults();
        final var trackerRepository = new InMemoryProgressTrackerRepository();
        final var blocks = new BlockService(new InMemoryBlockStore());
        registry = new SimpleMeterRegistry();
        factory = new EditorSessionFactory(
                blocks,
                new PostService(new InMemoryPostRepository(), blocks, trackerRepository, config),
                new CategoryService(new InMemoryCategoryRepository()),
                new TagService(new InMemoryTagRepository()),
                new ProgressTrackerService(trackerRepository),
                new MicrometerEditorMetrics(registry, config),
                new ContentAnalyzer(config));
        session = factory.open(USER);
    }

    private static EditorState await(Uni<EditorState> uni) {
        return uni.await().atMost(TIMEOUT);
    }

    private EditorState withPost() {
        return await(session.createPost(PostDraft.titled("Hello")));
    }

    private static BlockInput text(String content) {
        return BlockInput.append(new BlockPayload.Text(content, false));
    }

    private static List<String> texts(EditorState state) {
        return state.blocks().stream().map(block -> ((BlockPayload.Text) block.payload()).text()).toList();
    }

    @Nested
    @DisplayName("guards")
    class GuardTests {

        @Test
        @DisplayName("should report an error instead of failing when no post is loaded")
        void shouldRequirePost() {
            final var state = await(session.createBlock(text("a")));

            assertEquals(new EditorError(EditorError.Kind.VALIDATION, "No post loaded"), state.error());
            assertFalse(state.canUndo());
        }

        @Test
        @DisplayName("should report nothing to undo")
        void shouldReportEmptyUndo() {
            final var state = await(session.undo());

            assertEquals("No commands to undo", state.error().message());
        }

        @Test
        @DisplayName("should leave the history untouched when a block is unknown")
        void shouldKeepHistoryOnUnknownBlock() {
            withPost();
            await(session.createBlock(text("a")));

            final var state = await(session.deleteBlock("missing", BlockType.TEXT));

            assertEquals(EditorError.Kind.VALIDATION, state.error().kind());
            assertTrue(state.error().message().contains("missing"));
            assertEquals(1, state.blocks().size());
            assertTrue(state.canUndo());
            assertEquals(Optional.of("Create text block"), session.undoDescription());
        }

        @Test
        @DisplayName("should clear the error on the next success")
        void shouldClearErrorOnSuccess() {
            withPost();
            assertNotNull(await(session.redo()).error());

            final var state = await(session.createBlock(text("a")));

            assertNull(state.error());
        }

        @Test
        @DisplayName("should reject operations after close")
        void shouldRejectAfterClose() {
            withPost();
            session.close();

            final var state = await(session.createBlock(text("a")));

            assertEquals("Editor session is closed", state.error().message());
        }

        @Test
        @DisplayName("should refuse a blank user")
        void shouldRefuseBlankUser() {
            assertThrows(IllegalArgumentException.class, () -> factory.open(" "));
            assertEquals(USER, session.userId());
        }
    }

    @Nested
    @DisplayName("block editing")
    class BlockTests {

        @Test
        @DisplayName("should undo and redo block creation")
        void shouldUndoAndRedoCreate() {
            withPost();
            await(session.createBlock(text("a")));
            await(session.createBlock(text("b")));

            final var undone = await(session.undo());
            assertEquals(List.of("a"), texts(undone));
            assertTrue(undone.canRedo());

            final var redone = await(session.redo());
            assertEquals(List.of("a", "b"), texts(redone));
            assertFalse(redone.canRedo());
            assertEquals(2, redone.analysis().wordCount());
        }

        @Test
        @DisplayName("should restore a deleted block and keep later commands working")
        void shouldUndoDelete() {
            withPost();
            await(session.createBlock(text("a")));
            final var created = await(session.createBlock(text("b"))).blocks().get(1);
            await(session.updateBlock(created.id(), text("b2")));
            await(session.deleteBlock(created.id(), BlockType.TEXT));

            final var restored = await(session.undo());
            assertEquals(List.of("a", "b2"), texts(restored));
            final var newId = restored.blocks().get(1).id();
            assertNotEquals(created.id(), newId);
            assertEquals(newId, session.currentBlockId(created.id()));

            final var reverted = await(session.undo());
            assertNull(reverted.error());
            assertEquals(List.of("a", "b"), texts(reverted));
        }

        @Test
        @DisplayName("should reorder blocks and undo the move")
        void shouldReorder() {
            withPost();
            await(session.createBlock(text("a")));
            await(session.createBlock(text("b")));
            final var ids = session.state().blocks().stream().map(Block::id).toList();

            final var moved = await(session.reorderBlocks(List.of(ids.get(1), ids.get(0))));
            assertEquals(List.of("b", "a"), texts(moved));
            assertEquals(Optional.of("Move blocks"), session.undoDescription());

            assertEquals(List.of("a", "b"), texts(await(session.undo())));
        }

        @Test
        @DisplayName("should publish one state per operation with current history flags")
        void shouldPublishStates() {
            withPost();
            final List<EditorState> seen = new ArrayList<>();
            session.states().subscribe().with(seen::add);

            await(session.createBlock(text("a")));
            assertEquals(1, seen.size());
            assertEquals(1, seen.get(0).blocks().size());
            assertTrue(seen.get(0).canUndo());

            await(session.undo());
            assertEquals(2, seen.size());
            assertTrue(seen.get(1).blocks().isEmpty());
            assertTrue(seen.get(1).canRedo());
        }
    }

    @Nested
    @DisplayName("post editing")
    class PostTests {

        @Test
        @DisplayName("should reset the history after a post update")
        void shouldResetOnPostUpdate() {
            withPost();
            await(session.createBlock(text("a")));

            final var state = await(session.updatePost(PostUpdate.builder().title("Renamed").build()));

            assertEquals("Renamed", state.post().title());
            assertFalse(state.canUndo());
            assertFalse(state.canRedo());
            assertEquals(1.0, registry.get("scribe.editor.history.resets").counter().count());
        }

        @Test
        @DisplayName("should bring a deleted post back on undo")
        void shouldUndoPostDelete() {
            final var post = withPost().post();
            await(session.createBlock(text("a")));
            await(session.updateProgressTracker(new TrackerSettings(ProgressVariant.VIBRANT, true)));

            final var deleted = await(session.deletePost());
            assertNull(deleted.post());
            assertTrue(deleted.blocks().isEmpty());

            final var restored = await(session.undo());
            assertNotNull(restored.post());
            assertNotEquals(post.id(), restored.post().id());
            assertEquals(List.of("a"), texts(restored));
            assertEquals(ProgressVariant.VIBRANT, restored.tracker().variant());

            final var afterUndo = await(session.createBlock(text("b")));
            assertNull(afterUndo.error());
            assertEquals(List.of("a", "b"), texts(afterUndo));
        }

        @Test
        @DisplayName("should undo a block update made before the post was deleted")
        void shouldUndoUpdateAcrossPostDelete() {
            withPost();
            final var block = await(session.createBlock(text("a"))).blocks().get(0);
            await(session.updateBlock(block.id(), text("b")));
            await(session.deletePost());

            final var restored = await(session.undo());
            assertEquals(List.of("b"), texts(restored));
            assertEquals(restored.blocks().get(0).id(), session.currentBlockId(block.id()));

            final var reverted = await(session.undo());
            assertNull(reverted.error());
            assertEquals(List.of("a"), texts(reverted));
            assertEquals(reverted.post().id(), reverted.blocks().get(0).postId());

            final var removed = await(session.undo());
            assertNull(removed.error());
            assertTrue(removed.blocks().isEmpty());
        }

        @Test
        @DisplayName("should undo a block creation made before the post was deleted")
        void shouldUndoCreateAcrossPostDelete() {
            withPost();
            await(session.createBlock(text("a")));
            await(session.deletePost());
            await(session.undo());

            final var state = await(session.undo());

            assertNull(state.error());
            assertTrue(state.blocks().isEmpty());
            assertTrue(state.canUndo());
            assertTrue(state.canRedo());
        }

        @Test
        @DisplayName("should schedule and undo the schedule")
        void shouldUndoSchedule() {
            withPost();
            final var at = Instant.now().plus(1, ChronoUnit.DAYS);

            assertEquals(at, await(session.schedulePost(at)).post().scheduledAt());

            final var undone = await(session.undo());
            assertNull(undone.post().scheduledAt());
            assertFalse(undone.post().published());
        }

        @Test
        @DisplayName("should load a post and start with an empty history")
        void shouldLoadPost() {
            final var post = withPost().post();
            await(session.createBlock(text("a")));
            await(session.createCategory(CategoryData.of("News", null)));

            final var other = factory.open(USER);
            final var loaded = await(other.loadPost(post.id()));

            assertEquals(post.id(), loaded.post().id());
            assertEquals(List.of("a"), texts(loaded));
            assertEquals(1, loaded.categories().size());
            assertFalse(loaded.canUndo());
        }
    }

    @Nested
    @DisplayName("server state")
    class ServerStateTests {

        @Test
        @DisplayName("should adopt a server state and derive its analysis")
        void shouldAcceptServerState() {
            final var post = Post.builder("p1", USER).title("Server").slug("server").build();
            final var block = new Block(
                    "b1", "p1", 0, null, new BlockPayload.Text("three little words", false), null, null);

            final var opened = factory.open(USER, new ServerState(post, List.of(block), null, null));

            final var state = opened.state();
            assertEquals("p1", state.post().id());
            assertEquals(3, state.analysis().wordCount());
            assertFalse(state.canUndo());
            assertNull(state.error());
        }
    }

    @Nested
    @DisplayName("storage failures")
    class StorageFailureTests {

        @Test
        @DisplayName("should surface a storage failure as an error state")
        void shouldReportStorageFailure() {
            final BlockManagement blocks = mock(BlockManagement.class);
            when(blocks.createBlock(anyString(), any(BlockInput.class)))
                    .thenReturn(Uni.createFrom().failure(new StorageException("disk full")));
            final var failing = new EditorSession(
                    USER,
                    blocks,
                    mock(PostManagement.class),
                    mock(CategoryManagement.class),
                    mock(TagManagement.class),
                    mock(ProgressTrackerManagement.class),
                    new MicrometerEditorMetrics(registry, true),
                    new ContentAnalyzer(200));
            failing.acceptServerState(new ServerState(
                    Post.builder("p1", USER).title("T").build(), List.of(), null, null));

            final var state = await(failing.createBlock(text("a")));

            assertEquals(new EditorError(EditorError.Kind.STORAGE, "disk full"), state.error());
            assertFalse(state.canUndo());
            assertEquals(1.0, registry.get("scribe.editor.commands")
                    .tag("outcome", "failure")
                    .counter()
                    .count());
        }

        @Test
        @DisplayName("should put the storage back when the state cannot be refreshed after undo")
        void shouldCompensateFailedProjection() {
            final CategoryManagement categories = spy(new CategoryService(new InMemoryCategoryRepository()));
            doCallRealMethod()
                    .doReturn(Uni.createFrom().failure(new StorageException("listing unavailable")))
                    .doCallRealMethod()
                    .when(categories)
                    .listCategories();
            final var flaky = new EditorSession(
                    USER,
                    mock(BlockManagement.class),
                    mock(PostManagement.class),
                    categories,
                    mock(TagManagement.class),
                    mock(ProgressTrackerManagement.class),
                    new MicrometerEditorMetrics(registry, true),
                    new ContentAnalyzer(200));
            final var created = await(flaky.createCategory(CategoryData.of("News", null))).categories().get(0);

            final var failed = await(flaky.undo());

            assertEquals(new EditorError(EditorError.Kind.STORAGE, "listing unavailable"), failed.error());
            assertTrue(failed.canUndo());
            assertFalse(failed.canRedo());
            assertEquals(created, categories.getCategory(created.id()).await().atMost(TIMEOUT));

            final var undone = await(flaky.undo());
            assertNull(undone.error());
            assertTrue(undone.categories().isEmpty());
            assertTrue(undone.canRedo());
        }
    }

    @Test
    @DisplayName("should refresh categories after undo of a category change")
    void shouldRefreshCategories() {
        final var created = await(session.createCategory(CategoryData.of("News", null)));
        assertEquals(1, created.categories().size());

        final var undone = await(session.undo());

        assertTrue(undone.categories().isEmpty());
        assertTrue(undone.canRedo());
        assertTrue(undone.tags().isEmpty());
    }
}
