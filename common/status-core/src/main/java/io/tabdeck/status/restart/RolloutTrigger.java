package io.tabdeck.status.restart;

import java.time.Instant;
import java.util.Objects;

/**
 * Acknowledgement of a restart trigger.
 *
 * @param workload    workload that was restarted
 * @param revision    orchestrator revision the rollout is expected to reach
 * @param baseline    orchestrator-specific marker of the rollout state before the trigger, or
 *                    {@code null} when there was none
 * @param triggeredAt when the trigger was accepted
 */
public record RolloutTrigger(WorkloadRef workload, long revision, String baseline, Instant triggeredAt) {

  public RolloutTrigger {
    Objects.requireNonNull(workload, "workload");
    Objects.requireNonNull(triggeredAt, "triggeredAt");
  }

  public RolloutTrigger(WorkloadRef workload, long revision, Instant triggeredAt) {
    this(workload, revision, null, triggeredAt);
  }
}
