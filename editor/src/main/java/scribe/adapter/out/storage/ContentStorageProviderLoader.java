package scribe.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import scribe.core.port.out.BlockStore;
import scribe.core.port.out.CategoryRepository;
import scribe.core.port.out.PostRepository;
import scribe.core.port.out.ProgressTrackerRepository;
import scribe.core.port.out.TagRepository;
import scribe.spi.ContentStorageProvider;
import scribe.spi.StorageAdapterConfig;
import scribe.spi.StorageProviderException;

/**
 * Discovers and loads content storage providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If scribe.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 *
 * <p>Every repository is produced from the same provider so that blocks,
 * posts and their metadata share one backend.
 *
 * <p>Thread-safety: Uses synchronized methods for lazy provider initialization
 * to ensure thread-safe access from CDI producer methods.
 */
@ApplicationScoped
public class ContentStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(ContentStorageProviderLoader.class);

    private final Optional<String> configuredStorageProvider;
    private final StorageAdapterConfig config;

    private ContentStorageProvider storageProvider;

    @Inject
    public ContentStorageProviderLoader(
            @ConfigProperty(name = "scribe.storage.provider") Optional<String> configuredStorageProvider,
            StorageAdapterConfig config) {
        this.configuredStorageProvider = configuredStorageProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public BlockStore blockStore() {
        final var provider = getStorageProvider();
        LOG.infof("Creating block store from provider: %s (%s)", provider.name(), provider.description());
        return provider.createBlockStore(config);
    }

    @Produces
    @ApplicationScoped
    public PostRepository postRepository() {
        return getStorageProvider().createPostRepository(config);
    }

    @Produces
    @ApplicationScoped
    public CategoryRepository categoryRepository() {
        return getStorageProvider().createCategoryRepository(config);
    }

    @Produces
    @ApplicationScoped
    public TagRepository tagRepository() {
        return getStorageProvider().createTagRepository(config);
    }

    @Produces
    @ApplicationScoped
    public ProgressTrackerRepository progressTrackerRepository() {
        return getStorageProvider().createProgressTrackerRepository(config);
    }

    synchronized ContentStorageProvider getStorageProvider() {
        if (storageProvider != null) {
            return storageProvider;
        }

        final List<ContentStorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(ContentStorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No content storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d content storage provider(s): %s",
                providers.size(),
                providers.stream().map(ContentStorageProvider::name).toList());

        storageProvider = selectProvider(providers, configuredStorageProvider.orElse(null));

        return storageProvider;
    }

    static ContentStorageProvider selectProvider(List<ContentStorageProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured content storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(ContentStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(ContentStorageProvider::isAvailable)
                .max(Comparator.comparingInt(ContentStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available content storage providers"));
    }
}
