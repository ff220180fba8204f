package io.tabdeck.status.restart;

/**
 * Port to the system that actually rolls workloads.
 */
public interface RolloutClient {

  /**
   * Asks the orchestrator to restart the workload.
   *
   * @throws RolloutException when the orchestrator rejects or cannot be reached
   */
  RolloutTrigger triggerRestart(WorkloadRef workload);

  /**
   * Opens a watch over the rollout started by {@code trigger}. Callers must close the watch.
   */
  RolloutWatch watch(WorkloadRef workload, RolloutTrigger trigger);
}
