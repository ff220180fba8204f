package io.tabdeck.status.channel;

import io.tabdeck.status.WorkloadStatus;
import java.util.Objects;

/**
 * One item handed to a subscription consumer: a status change, an idle heartbeat, or the end of
 * the subscription.
 */
public record DeliveryEvent(Kind kind, WorkloadStatus status) {

  public enum Kind {
    STATUS,
    HEARTBEAT,
    CLOSED
  }

  private static final DeliveryEvent HEARTBEAT = new DeliveryEvent(Kind.HEARTBEAT, null);
  private static final DeliveryEvent CLOSED = new DeliveryEvent(Kind.CLOSED, null);

  public DeliveryEvent {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.STATUS) {
      Objects.requireNonNull(status, "status");
    } else if (status != null) {
      throw new IllegalArgumentException(kind + " events carry no status");
    }
  }

  public static DeliveryEvent status(WorkloadStatus status) {
    return new DeliveryEvent(Kind.STATUS, status);
  }

  public static DeliveryEvent heartbeat() {
    return HEARTBEAT;
  }

  public static DeliveryEvent closed() {
    return CLOSED;
  }

  public boolean isStatus() {
    return kind == Kind.STATUS;
  }
}
