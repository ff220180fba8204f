package io.tabdeck.status.restart;

import java.util.Objects;

public record RolloutSignal(Kind kind, String message) {

  public enum Kind {
    READY,
    NOT_READY,
    FAILED
  }

  private static final RolloutSignal READY = new RolloutSignal(Kind.READY, null);
  private static final RolloutSignal NOT_READY = new RolloutSignal(Kind.NOT_READY, null);

  public RolloutSignal {
    Objects.requireNonNull(kind, "kind");
  }

  public static RolloutSignal ready() {
    return READY;
  }

  public static RolloutSignal notReady() {
    return NOT_READY;
  }

  public static RolloutSignal notReady(String detail) {
    return new RolloutSignal(Kind.NOT_READY, detail);
  }

  public static RolloutSignal failed(String message) {
    return new RolloutSignal(Kind.FAILED, message);
  }
}
