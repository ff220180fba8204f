package io.tabdeck.status.restart;

/**
 * Names the orchestrated workload a restart is issued against, as understood by the
 * {@link RolloutClient}.
 */
public record WorkloadRef(String namespace, String workload) {

  public WorkloadRef {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("namespace must not be blank");
    }
    if (workload == null || workload.isBlank()) {
      throw new IllegalArgumentException("workload must not be blank");
    }
    namespace = namespace.trim();
    workload = workload.trim();
  }

  @Override
  public String toString() {
    return namespace + "/" + workload;
  }
}
