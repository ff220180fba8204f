package io.tabdeck.board.infra;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.channel.ChannelRegistry;
import io.tabdeck.status.channel.Subscription;
import io.tabdeck.status.restart.RestartOutcome;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class MicrometerRestartMetricsTest {
    private static final ResourceKey KEY = ResourceKey.of("home", "z2m");

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ChannelRegistry channels = new ChannelRegistry();
    private final MicrometerRestartMetrics metrics = new MicrometerRestartMetrics(registry, channels);

    @Test
    void countsAdmissionOutcomes() {
        metrics.requestAccepted(KEY);
        metrics.requestRejected(KEY);
        metrics.requestRejected(KEY);

        assertThat(registry.get(MicrometerRestartMetrics.REQUESTS).tag("outcome", "accepted").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(MicrometerRestartMetrics.REQUESTS).tag("outcome", "rejected").counter().count())
            .isEqualTo(2.0);
        assertThat(registry.get(MicrometerRestartMetrics.REQUESTS).tag("resource", "home/z2m").counters())
            .hasSize(2);
    }

    @Test
    void recordsTerminalOutcomeAndDuration() {
        metrics.restartFinished(KEY, RestartOutcome.TIMEOUT, Duration.ofSeconds(180));

        assertThat(registry.get(MicrometerRestartMetrics.OUTCOMES).tag("outcome", "timeout").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(MicrometerRestartMetrics.DURATION).tag("outcome", "timeout").timer()
            .totalTime(TimeUnit.SECONDS)).isEqualTo(180.0);
    }

    @Test
    void gaugeFollowsConnectedObservers() {
        try (Subscription first = channels.channelFor(KEY).subscribe();
             Subscription second = channels.channelFor(ResourceKey.of("tabs", "tab-1")).subscribe()) {
            assertThat(registry.get(MicrometerRestartMetrics.SUBSCRIBERS).gauge().value()).isEqualTo(2.0);
        }

        assertThat(registry.get(MicrometerRestartMetrics.SUBSCRIBERS).gauge().value()).isZero();
    }
}
