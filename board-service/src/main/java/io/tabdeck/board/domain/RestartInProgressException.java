package io.tabdeck.board.domain;

import io.tabdeck.status.restart.WorkloadRef;

/**
 * Raised when a restart is requested while one is still being watched for the same workload.
 */
public class RestartInProgressException extends RuntimeException {

    private final WorkloadRef workload;

    public RestartInProgressException(WorkloadRef workload) {
        super("restart already in progress (namespace=" + workload.namespace()
            + ", service=" + workload.workload() + ")");
        this.workload = workload;
    }

    public WorkloadRef workload() {
        return workload;
    }
}
