package io.tabdeck.status.sse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabdeck.status.WorkloadStatus;
import io.tabdeck.status.channel.DeliveryEvent;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders subscription events as text/event-stream frames.
 * <p>
 * Every frame starts with a {@code retry:} line, names its event and ends with a blank line. A
 * closed subscription produces no frame; the stream simply ends.
 */
public final class StatusStreamEncoder {

  public static final Duration DEFAULT_RETRY = Duration.ofMillis(3000);
  public static final String STATUS_EVENT = "status";
  public static final String HEARTBEAT_EVENT = "heartbeat";

  private final ObjectMapper json;
  private final long retryMillis;

  public StatusStreamEncoder(ObjectMapper json) {
    this(json, DEFAULT_RETRY);
  }

  public StatusStreamEncoder(ObjectMapper json, Duration retry) {
    this.json = Objects.requireNonNull(json, "json");
    Objects.requireNonNull(retry, "retry");
    if (retry.isNegative() || retry.isZero()) {
      throw new IllegalArgumentException("retry must be positive");
    }
    this.retryMillis = retry.toMillis();
  }

  public Optional<String> encode(DeliveryEvent event) {
    Objects.requireNonNull(event, "event");
    return switch (event.kind()) {
      case STATUS -> Optional.of(frame(STATUS_EVENT, statusBody(event.status())));
      case HEARTBEAT -> Optional.of(frame(HEARTBEAT_EVENT, "{}"));
      case CLOSED -> Optional.empty();
    };
  }

  public Optional<byte[]> encodeBytes(DeliveryEvent event) {
    return encode(event).map(frame -> frame.getBytes(StandardCharsets.UTF_8));
  }

  private String statusBody(WorkloadStatus status) {
    try {
      return json.writeValueAsString(status);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize status %s".formatted(status.state()), e);
    }
  }

  private String frame(String event, String data) {
    return "retry: " + retryMillis + "\n"
        + "event: " + event + "\n"
        + "data: " + data + "\n"
        + "\n";
  }
}
