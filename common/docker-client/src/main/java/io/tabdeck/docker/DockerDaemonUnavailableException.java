package io.tabdeck.docker;

import io.tabdeck.status.restart.RolloutException;

/**
 * Indicates that the Docker daemon could not be reached from the current runtime.
 */
public class DockerDaemonUnavailableException extends RolloutException {

    public DockerDaemonUnavailableException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
