package scribe.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import scribe.spi.ContentStorageProvider;
import scribe.spi.StorageAdapterConfig;
import scribe.spi.StorageProviderException;

@DisplayName("ContentStorageProviderLoader")
class ContentStorageProviderLoaderTest {

    private static ContentStorageProvider provider(String name, int priority, boolean available) {
        final var provider = mock(ContentStorageProvider.class);
        when(provider.name()).thenReturn(name);
        when(provider.priority()).thenReturn(priority);
        when(provider.isAvailable()).thenReturn(available);
        return provider;
    }

    @Nested
    @DisplayName("selectProvider()")
    class SelectProviderTests {

        @Test
        @DisplayName("should use the configured provider")
        void shouldUseConfiguredProvider() {
            final var memory = provider("memory", 0, true);
            final var sql = provider("sql", 10, true);

            assertSame(memory, ContentStorageProviderLoader.selectProvider(List.of(memory, sql), "memory"));
        }

        @Test
        @DisplayName("should pick the highest priority available provider")
        void shouldPickHighestPriority() {
            final var memory = provider("memory", 0, true);
            final var sql = provider("sql", 10, true);
            final var broken = provider("broken", 100, false);

            assertSame(sql, ContentStorageProviderLoader.selectProvider(List.of(memory, sql, broken), null));
        }

        @Test
        @DisplayName("should fail for an unknown configured provider")
        void shouldFailForUnknownProvider() {
            final var memory = provider("memory", 0, true);

            final var exception = assertThrows(
                    StorageProviderException.class,
                    () -> ContentStorageProviderLoader.selectProvider(List.of(memory), "redis"));

            assertTrue(exception.getMessage().contains("redis"));
        }

        @Test
        @DisplayName("should fail when no provider is available")
        void shouldFailWhenNoneAvailable() {
            final var broken = provider("broken", 5, false);

            assertThrows(
                    StorageProviderException.class,
                    () -> ContentStorageProviderLoader.selectProvider(List.of(broken), " "));
        }
    }

    @Test
    @DisplayName("should discover the in-memory provider and build its repositories")
    void shouldDiscoverMemoryProvider() {
        final var config = mock(StorageAdapterConfig.class);
        when(config.getDuration("scribe.storage.memory.lock-timeout")).thenReturn(Optional.of(Duration.ofSeconds(2)));
        final var loader = new ContentStorageProviderLoader(Optional.empty(), config);

        assertEquals("memory", loader.getStorageProvider().name());
        assertNotNull(loader.blockStore());
        assertNotNull(loader.postRepository());
        assertNotNull(loader.categoryRepository());
        assertNotNull(loader.tagRepository());
        assertNotNull(loader.progressTrackerRepository());
    }
}
