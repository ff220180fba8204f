package io.tabdeck.status.restart;

import io.tabdeck.status.ResourceKey;
import java.time.Instant;
import java.util.Objects;

/**
 * An accepted restart that has not reached a terminal outcome yet.
 */
public record RestartJob(String id, ResourceKey key, WorkloadRef workload, Instant acceptedAt) {

  public RestartJob {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(workload, "workload");
    Objects.requireNonNull(acceptedAt, "acceptedAt");
  }
}
