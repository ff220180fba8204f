package io.tabdeck.status.restart;

/**
 * Failure reported by, or while talking to, the orchestrator. The message is shown to operators
 * as the workload's error status, so it must not carry stack detail.
 */
public class RolloutException extends RuntimeException {

  private final WorkloadRef workload;

  public RolloutException(String message, WorkloadRef workload) {
    super(message);
    this.workload = workload;
  }

  public RolloutException(String message, WorkloadRef workload, Throwable cause) {
    super(message, cause);
    this.workload = workload;
  }

  public WorkloadRef workload() {
    return workload;
  }
}
