package scribe.adapter.out.storage;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import scribe.spi.StorageAdapterConfig;

/**
 * MicroProfile Config implementation of StorageAdapterConfig.
 */
@ApplicationScoped
public class MicroProfileStorageAdapterConfig implements StorageAdapterConfig {

    private final Config config;

    @Inject
    public MicroProfileStorageAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(key, String.class);
    }

    @Override
    public String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    @Override
    public Optional<Duration> getDuration(String key) {
        return get(key).map(Duration::parse);
    }
}
