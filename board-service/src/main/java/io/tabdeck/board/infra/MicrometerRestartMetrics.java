package io.tabdeck.board.infra;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.channel.ChannelRegistry;
import io.tabdeck.status.restart.RestartMetrics;
import io.tabdeck.status.restart.RestartOutcome;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Micrometer implementation of {@link RestartMetrics}. Also registers a gauge with the number of
 * connected status observers.
 */
public final class MicrometerRestartMetrics implements RestartMetrics {

    static final String REQUESTS = "tabdeck_restart_requests";
    static final String OUTCOMES = "tabdeck_restart_outcomes";
    static final String DURATION = "tabdeck_restart_duration";
    static final String SUBSCRIBERS = "tabdeck_status_subscribers";

    private final MeterRegistry registry;

    public MicrometerRestartMetrics(MeterRegistry registry, ChannelRegistry channels) {
        this.registry = Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(channels, "channels");
        Gauge.builder(SUBSCRIBERS, channels, ChannelRegistry::subscriberCount)
            .description("Connected status stream observers")
            .register(registry);
    }

    @Override
    public void requestAccepted(ResourceKey key) {
        requests(key, "accepted").increment();
    }

    @Override
    public void requestRejected(ResourceKey key) {
        requests(key, "rejected").increment();
    }

    @Override
    public void restartFinished(ResourceKey key, RestartOutcome outcome, Duration elapsed) {
        String tag = outcome.name().toLowerCase(Locale.ROOT);
        Counter.builder(OUTCOMES)
            .description("Finished restarts by terminal outcome")
            .tags("resource", key.toString(), "outcome", tag)
            .register(registry)
            .increment();
        Timer.builder(DURATION)
            .description("Time from accepted restart to terminal outcome")
            .tags("resource", key.toString(), "outcome", tag)
            .register(registry)
            .record(elapsed);
    }

    private Counter requests(ResourceKey key, String outcome) {
        return Counter.builder(REQUESTS)
            .description("Restart requests by admission outcome")
            .tags("resource", key.toString(), "outcome", outcome)
            .register(registry);
    }
}
