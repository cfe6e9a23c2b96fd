package scribe.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import scribe.core.config.EditorConfig;
import scribe.core.model.editor.CommandPhase;
import scribe.core.port.out.EditorMetrics;

/**
 * Micrometer implementation of EditorMetrics.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code scribe.editor.commands} - Command runs by command, phase and outcome</li>
 *   <li>{@code scribe.editor.command.duration} - Command latency by command and phase</li>
 *   <li>{@code scribe.editor.history.resets} - History resets</li>
 *   <li>{@code scribe.editor.history.discarded} - Commands dropped by resets</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerEditorMetrics implements EditorMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerEditorMetrics(MeterRegistry registry, EditorConfig config) {
        this(registry, config != null && config.metrics().enabled());
    }

    public MicrometerEditorMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordCommand(String command, CommandPhase phase, boolean success, long durationMs) {
        if (!enabled) {
            return;
        }

        final var phaseTag = phase.name().toLowerCase(Locale.ROOT);
        Counter.builder("scribe.editor.commands")
                .description("Editor command runs")
                .tag("command", nullSafe(command))
                .tag("phase", phaseTag)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();

        Timer.builder("scribe.editor.command.duration")
                .description("Editor command latency")
                .tag("command", nullSafe(command))
                .tag("phase", phaseTag)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordHistoryReset(int discarded) {
        if (!enabled) {
            return;
        }

        Counter.builder("scribe.editor.history.resets")
                .description("Command history resets")
                .register(registry)
                .increment();

        Counter.builder("scribe.editor.history.discarded")
                .description("Commands dropped by history resets")
                .register(registry)
                .increment(discarded);
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
