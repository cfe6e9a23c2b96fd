package scribe.adapter.out.storage.memory;

import scribe.core.port.out.BlockStore;
import scribe.core.port.out.CategoryRepository;
import scribe.core.port.out.PostRepository;
import scribe.core.port.out.ProgressTrackerRepository;
import scribe.core.port.out.TagRepository;
import scribe.spi.ContentStorageProvider;
import scribe.spi.StorageAdapterConfig;

/**
 * In-memory storage provider for blog content.
 *
 * <p>Provides non-persistent storage suitable for development, testing,
 * and editor sessions whose content is synchronized externally.
 *
 * <p>Data is NOT persisted across application restarts.
 */
public class InMemoryContentStorageProvider implements ContentStorageProvider {

    static final String LOCK_TIMEOUT_KEY = "scribe.storage.memory.lock-timeout";

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory content storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority, used as fallback
    }

    @Override
    public BlockStore createBlockStore(StorageAdapterConfig config) {
        return new InMemoryBlockStore(
                config.getDuration(LOCK_TIMEOUT_KEY).orElse(InMemoryBlockStore.DEFAULT_LOCK_TIMEOUT));
    }

    @Override
    public PostRepository createPostRepository(StorageAdapterConfig config) {
        return new InMemoryPostRepository();
    }

    @Override
    public CategoryRepository createCategoryRepository(StorageAdapterConfig config) {
        return new InMemoryCategoryRepository();
    }

    @Override
    public TagRepository createTagRepository(StorageAdapterConfig config) {
        return new InMemoryTagRepository();
    }

    @Override
    public ProgressTrackerRepository createProgressTrackerRepository(StorageAdapterConfig config) {
        return new InMemoryProgressTrackerRepository();
    }
}
