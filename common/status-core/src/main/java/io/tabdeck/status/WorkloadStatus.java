package io.tabdeck.status;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * Last known state of a workload as seen by observers.
 * <p>
 * Only {@link StatusState#ERROR} carries a message; the other states always have a {@code null}
 * message.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record WorkloadStatus(StatusState state, String message) {

  private static final WorkloadStatus RUNNING = new WorkloadStatus(StatusState.RUNNING, null);
  private static final WorkloadStatus RESTARTING = new WorkloadStatus(StatusState.RESTARTING, null);

  public WorkloadStatus {
    Objects.requireNonNull(state, "state");
    message = switch (state) {
      case RUNNING, RESTARTING -> null;
      case ERROR -> message == null || message.isBlank() ? "unknown error" : message;
    };
  }

  public static WorkloadStatus running() {
    return RUNNING;
  }

  public static WorkloadStatus restarting() {
    return RESTARTING;
  }

  public static WorkloadStatus error(String message) {
    return new WorkloadStatus(StatusState.ERROR, message);
  }

  @JsonIgnore
  public boolean isTerminal() {
    return switch (state) {
      case RUNNING, ERROR -> true;
      case RESTARTING -> false;
    };
  }
}
