package scribe.core.service.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import scribe.adapter.out.storage.memory.InMemoryBlockStore;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockInput;
import scribe.core.model.block.BlockPayload;
import scribe.core.model.block.BlockPositionUpdate;
import scribe.core.model.block.BlockType;
import scribe.core.model.block.GalleryImage;
import scribe.core.model.editor.BlockNotFoundException;
import scribe.core.model.editor.EditorValidationException;

@DisplayName("BlockService")
class BlockServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String POST = "post-1";

    private BlockService service;

    @BeforeEach
    void setUp() {
        service = new BlockService(new InMemoryBlockStore());
    }

    private static BlockPayload.Text text(String content) {
        return new BlockPayload.Text(content, false);
    }

    private static BlockPayload.Quote quote(String content) {
        return new BlockPayload.Quote(content, null, null);
    }

    private static BlockPayload.Images images(GalleryImage... rows) {
        return new BlockPayload.Images(null, List.of(rows));
    }

    private Block create(BlockInput input) {
        return service.createBlock(POST, input).await().atMost(TIMEOUT);
    }

    private List<Block> blocks() {
        return service.getBlocksByPost(POST).await().atMost(TIMEOUT);
    }

    private static List<BlockType> types(List<Block> blocks) {
        return blocks.stream().map(Block::type).toList();
    }

    private static List<Integer> positions(List<Block> blocks) {
        return blocks.stream().map(Block::position).toList();
    }

    @Nested
    @DisplayName("createBlock()")
    class CreateBlockTests {

        @Test
        @DisplayName("should append after the last block")
        void shouldAppend() {
            final var first = create(BlockInput.append(text("a")));
            final var second = create(BlockInput.append(quote("b")));

            assertEquals(0, first.position());
            assertEquals(1, second.position());
        }

        @Test
        @DisplayName("should shift blocks of every type at or after the insert position")
        void shouldShiftOnInsert() {
            create(BlockInput.append(text("a")));
            create(BlockInput.append(quote("b")));

            final var inserted = create(BlockInput.at(1, images(GalleryImage.of("f1", "alt", 0))));

            final var result = blocks();
            assertEquals(List.of(BlockType.TEXT, BlockType.IMAGES, BlockType.QUOTE), types(result));
            assertEquals(List.of(0, 1, 2), positions(result));
            assertEquals(inserted.id(), result.get(1).id());
        }

        @Test
        @DisplayName("should reject a negative position")
        void shouldRejectNegativePosition() {
            final var input = new BlockInput(-1, null, text("a"));

            assertThrows(EditorValidationException.class, () -> service.createBlock(POST, input)
                    .await()
                    .atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should reject a missing post id")
        void shouldRejectMissingPost() {
            assertThrows(EditorValidationException.class, () -> service.createBlock(" ", BlockInput.append(text("a")))
                    .await()
                    .atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("updateBlock()")
    class UpdateBlockTests {

        @Test
        @DisplayName("should keep position and name when not supplied")
        void shouldKeepPositionAndName() {
            create(BlockInput.append(text("a")));
            final var block = create(BlockInput.append(text("b")));

            final var updated = service.updateBlock(block.id(), BlockInput.append(text("changed")))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(1, updated.position());
            assertEquals(block.blockName(), updated.blockName());
            assertEquals("changed", ((BlockPayload.Text) updated.payload()).text());
        }

        @Test
        @DisplayName("should upsert child rows by id")
        void shouldUpsertChildren() {
            final var block = create(BlockInput.append(
                    images(GalleryImage.of("f1", "one", 0), GalleryImage.of("f2", "two", 1))));
            final var stored = ((BlockPayload.Images) block.payload()).images();

            final var changed = new GalleryImage(stored.get(0).id(), "f1", "renamed", null, 0);
            final var added = GalleryImage.of("f3", "three", 2);
            final var updated = service.updateBlock(block.id(), BlockInput.append(images(changed, added)))
                    .await()
                    .atMost(TIMEOUT);

            final var rows = ((BlockPayload.Images) updated.payload()).images();
            assertEquals(3, rows.size());
            assertEquals(stored.get(0).id(), rows.get(0).id());
            assertEquals("renamed", rows.get(0).alt());
            assertEquals(stored.get(1).id(), rows.get(1).id());
            assertTrue(rows.stream().allMatch(row -> row.id() != null));
        }

        @Test
        @DisplayName("should fail for an unknown block")
        void shouldFailForUnknownBlock() {
            assertThrows(BlockNotFoundException.class, () -> service.updateBlock("nope", BlockInput.append(text("x")))
                    .await()
                    .atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("restoreBlock()")
    class RestoreBlockTests {

        @Test
        @DisplayName("should write the snapshot content at the current position")
        void shouldRestoreContent() {
            final var original = create(BlockInput.append(text("before")));
            service.updateBlock(original.id(), BlockInput.append(text("after")))
                    .await()
                    .atMost(TIMEOUT);
            create(BlockInput.at(0, quote("q")));

            final var restored = service.restoreBlock(original).await().atMost(TIMEOUT);

            assertEquals("before", ((BlockPayload.Text) restored.payload()).text());
            assertEquals(1, restored.position());
        }

        @Test
        @DisplayName("should keep the block on its current post")
        void shouldKeepCurrentPost() {
            final var original = create(BlockInput.append(text("before")));
            final var stale = new Block(
                    original.id(), "deleted-post", 0, null, text("restored"), original.createdAt(), null);

            final var restored = service.restoreBlock(stale).await().atMost(TIMEOUT);

            assertEquals(POST, restored.postId());
            assertEquals(1, blocks().size());
            assertEquals("restored", ((BlockPayload.Text) blocks().get(0).payload()).text());
        }
    }

    @Nested
    @DisplayName("deleteBlock()")
    class DeleteBlockTests {

        @Test
        @DisplayName("should close the gap left by the deleted block")
        void shouldCompactPositions() {
            create(BlockInput.append(text("a")));
            final var middle = create(BlockInput.append(quote("b")));
            create(BlockInput.append(text("c")));

            final var deleted = service.deleteBlock(middle.id(), BlockType.QUOTE)
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(middle.id(), deleted.id());
            assertEquals(List.of(0, 1), positions(blocks()));
        }

        @Test
        @DisplayName("should fail for a block of another type")
        void shouldFailForWrongType() {
            final var block = create(BlockInput.append(text("a")));

            assertThrows(BlockNotFoundException.class, () -> service.deleteBlock(block.id(), BlockType.QUOTE)
                    .await()
                    .atMost(TIMEOUT));
            assertEquals(1, blocks().size());
        }
    }

    @Nested
    @DisplayName("moveBlocks()")
    class MoveBlocksTests {

        @Test
        @DisplayName("should apply positions across block types")
        void shouldMoveAcrossTypes() {
            final var t = create(BlockInput.append(text("t")));
            final var i = create(BlockInput.append(images(GalleryImage.of("f", "a", 0))));
            final var q = create(BlockInput.append(quote("q")));

            service.moveBlocks(List.of(
                            new BlockPositionUpdate(i.id(), BlockType.IMAGES, 0),
                            new BlockPositionUpdate(q.id(), BlockType.QUOTE, 1),
                            new BlockPositionUpdate(t.id(), BlockType.TEXT, 2)))
                    .await()
                    .atMost(TIMEOUT);

            final var moved = blocks();
            assertEquals(List.of(BlockType.IMAGES, BlockType.QUOTE, BlockType.TEXT), types(moved));
            assertEquals(List.of(0, 1, 2), positions(moved));

            service.moveBlocks(List.of(t.currentPosition(), i.currentPosition(), q.currentPosition()))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(List.of(BlockType.TEXT, BlockType.IMAGES, BlockType.QUOTE), types(blocks()));
        }

        @Test
        @DisplayName("should leave every position untouched when one block is missing")
        void shouldBeAtomic() {
            final var t = create(BlockInput.append(text("t")));
            create(BlockInput.append(quote("q")));

            assertThrows(BlockNotFoundException.class, () -> service.moveBlocks(List.of(
                            new BlockPositionUpdate(t.id(), BlockType.TEXT, 5),
                            new BlockPositionUpdate("missing", BlockType.QUOTE, 0)))
                    .await()
                    .atMost(TIMEOUT));

            assertEquals(List.of(0, 1), positions(blocks()));
            assertEquals(BlockType.TEXT, blocks().get(0).type());
        }

        @Test
        @DisplayName("should reject an empty move")
        void shouldRejectEmptyMove() {
            final var exception = assertThrows(EditorValidationException.class, () -> service.moveBlocks(List.of())
                    .await()
                    .atMost(TIMEOUT));

            assertEquals("No block positions to update", exception.getMessage());
        }
    }

    @Nested
    @DisplayName("bulk operations")
    class BulkTests {

        @Test
        @DisplayName("should create blocks with fresh ids and delete them by post")
        void shouldCreateAndDeleteByPost() {
            final var original = create(BlockInput.append(text("a")));

            final var created = service.createBlocks("post-2", List.of(
                            BlockInput.at(0, text("x")), BlockInput.at(1, quote("y"))))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(2, created.size());
            assertNotEquals(original.id(), created.get(0).id());

            final int deleted = service.deleteBlocksByPost("post-2").await().atMost(TIMEOUT);
            assertEquals(2, deleted);
            assertEquals(1, blocks().size());
        }

        @Test
        @DisplayName("should return created blocks in input order")
        void shouldKeepInputOrder() {
            final var created = service.createBlocks(POST, List.of(
                            BlockInput.at(2, text("c")), BlockInput.at(0, quote("a")), BlockInput.at(1, text("b"))))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(List.of(2, 0, 1), positions(created));
            assertEquals(List.of(BlockType.QUOTE, BlockType.TEXT, BlockType.TEXT), types(blocks()));
        }

        @Test
        @DisplayName("should find a block without knowing its type")
        void shouldFindBlock() {
            final var block = create(BlockInput.append(quote("q")));

            assertTrue(service.findBlock(block.id()).await().atMost(TIMEOUT).isPresent());
            assertTrue(service.findBlock("nope").await().atMost(TIMEOUT).isEmpty());
        }
    }
}
