package io.tabdeck.board.app;

import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.channel.ChannelRegistry;
import io.tabdeck.status.channel.DeliveryEvent;
import io.tabdeck.status.channel.Subscription;
import io.tabdeck.status.sse.StatusStreamEncoder;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pumps one observer's subscription into an HTTP response body.
 * <p>
 * The subscription is released whichever way the stream ends: the channel closing, the peer
 * disconnecting (write failure) or the serving thread being interrupted. A failing observer only
 * ends its own stream.
 */
public class StatusStreamWriter {
    private static final Logger log = LoggerFactory.getLogger(StatusStreamWriter.class);

    private final ChannelRegistry channels;
    private final StatusStreamEncoder encoder;
    private final Duration heartbeat;

    public StatusStreamWriter(ChannelRegistry channels, StatusStreamEncoder encoder, Duration heartbeat) {
        this.channels = Objects.requireNonNull(channels, "channels");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
        if (heartbeat.isZero() || heartbeat.isNegative()) {
            throw new IllegalArgumentException("heartbeat must be positive");
        }
    }

    public Duration heartbeat() {
        return heartbeat;
    }

    public void stream(ResourceKey key, OutputStream out) {
        try (Subscription subscription = channels.channelFor(key).subscribe()) {
            log.info("[STREAM] {} observer {} connected", key, subscription.id());
            String reason = pump(subscription, out);
            log.info("[STREAM] {} observer {} finished: {} (dropped={})",
                key, subscription.id(), reason, subscription.droppedCount());
        }
    }

    private String pump(Subscription subscription, OutputStream out) {
        while (true) {
            DeliveryEvent event;
            try {
                event = subscription.next(heartbeat);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return "interrupted";
            }
            Optional<byte[]> frame = encoder.encodeBytes(event);
            if (frame.isEmpty()) {
                return "channel closed";
            }
            try {
                out.write(frame.get());
                out.flush();
            } catch (IOException e) {
                log.debug("[STREAM] {} observer {} write failed", subscription.key(), subscription.id(), e);
                return "peer disconnected";
            }
        }
    }
}
