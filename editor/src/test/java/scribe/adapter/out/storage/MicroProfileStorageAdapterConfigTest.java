package scribe.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MicroProfileStorageAdapterConfig")
class MicroProfileStorageAdapterConfigTest {

    private Config config;
    private MicroProfileStorageAdapterConfig adapterConfig;

    @BeforeEach
    void setUp() {
        config = mock(Config.class);
        adapterConfig = new MicroProfileStorageAdapterConfig(config);
    }

    @Test
    @DisplayName("should parse ISO-8601 durations")
    void shouldParseDuration() {
        when(config.getOptionalValue("scribe.storage.memory.lock-timeout", String.class))
                .thenReturn(Optional.of("PT2S"));

        assertEquals(Optional.of(Duration.ofSeconds(2)), adapterConfig.getDuration("scribe.storage.memory.lock-timeout"));
    }

    @Test
    @DisplayName("should fall back to the default for missing keys")
    void shouldUseDefault() {
        when(config.getOptionalValue("missing", String.class)).thenReturn(Optional.empty());

        assertEquals("fallback", adapterConfig.getOrDefault("missing", "fallback"));
        assertTrue(adapterConfig.get("missing").isEmpty());
    }
}
