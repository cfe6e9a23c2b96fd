package scribe.spi;

import scribe.core.port.out.BlockStore;
import scribe.core.port.out.CategoryRepository;
import scribe.core.port.out.PostRepository;
import scribe.core.port.out.ProgressTrackerRepository;
import scribe.core.port.out.TagRepository;

/**
 * Service Provider Interface for blog content storage backends.
 *
 * <p>A provider supplies the block store with its per-type tables and the
 * repositories for posts, categories, tags and progress trackers.
 *
 * <p>Providers are discovered via ServiceLoader. Configure the preferred
 * provider with scribe.storage.provider, or let the loader select the
 * highest priority available provider.
 *
 * <p>To implement a custom provider:
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create a META-INF/services/scribe.spi.ContentStorageProvider file</li>
 *   <li>Add the fully qualified class name to the file</li>
 * </ol>
 */
public interface ContentStorageProvider {

    /**
     * Get the provider name.
     *
     * @return short name for configuration (e.g., "memory")
     */
    String name();

    /**
     * Get the provider description.
     *
     * @return human-readable description
     */
    String description();

    /**
     * Get the provider priority.
     *
     * <p>Higher priority providers are preferred when auto-selecting.
     * Memory provider should use 0, persistent providers should use higher values.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available.
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    BlockStore createBlockStore(StorageAdapterConfig config);

    PostRepository createPostRepository(StorageAdapterConfig config);

    CategoryRepository createCategoryRepository(StorageAdapterConfig config);

    TagRepository createTagRepository(StorageAdapterConfig config);

    ProgressTrackerRepository createProgressTrackerRepository(StorageAdapterConfig config);
}
