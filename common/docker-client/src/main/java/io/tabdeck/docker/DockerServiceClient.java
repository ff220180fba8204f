package io.tabdeck.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.model.Service;
import com.github.dockerjava.api.model.ServiceSpec;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thin wrapper over {@link DockerClient} for the Swarm service calls used by restarts. Failures that
 * mean the daemon itself is unreachable surface as {@link DockerDaemonUnavailableException}.
 */
public class DockerServiceClient {
    private static final String DOCKER_HINT =
            "Ensure Docker is running in Swarm mode and that the process can access the Docker socket "
                    + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";

    private final DockerClient dockerClient;

    public DockerServiceClient(DockerClient dockerClient) {
        this.dockerClient = Objects.requireNonNull(dockerClient, "dockerClient");
    }

    public Service inspectService(String serviceName) {
        return callDocker("inspect service " + serviceName,
                () -> dockerClient.inspectServiceCmd(serviceName).exec());
    }

    public void updateService(String serviceId, ServiceSpec spec, long version) {
        callDocker("update service " + serviceId,
                () -> dockerClient.updateServiceCmd(serviceId, spec).withVersion(version).exec());
    }

    public void ping() {
        callDocker("ping daemon", () -> dockerClient.pingCmd().exec());
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private void callDocker(String action, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof DockerDaemonUnavailableException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(
                    "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT,
                    e);
        }
        return e;
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                    || t instanceof NoRouteToHostException
                    || t instanceof SocketTimeoutException
                    || t instanceof UnknownHostException
                    || t instanceof FileNotFoundException
                    || t instanceof NoSuchFileException
                    || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if ("com.sun.jna.LastErrorException".equals(t.getClass().getName())
                    && messageContains(t, "No such file or directory")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
                .contains(needle.toLowerCase(Locale.ROOT));
    }
}
