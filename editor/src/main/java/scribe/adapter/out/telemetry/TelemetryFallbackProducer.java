package scribe.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;

/**
 * Provides a default MeterRegistry when no metrics extension contributes one.
 */
@ApplicationScoped
public class TelemetryFallbackProducer {

    /**
     * Provides a fallback MeterRegistry.
     *
     * @return a simple in-memory meter registry
     */
    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
