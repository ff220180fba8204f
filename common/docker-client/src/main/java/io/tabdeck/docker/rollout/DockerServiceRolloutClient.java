package io.tabdeck.docker.rollout;

import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.ResourceVersion;
import com.github.dockerjava.api.model.Service;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.TaskSpec;
import com.github.dockerjava.api.model.ServiceUpdateState;
import com.github.dockerjava.api.model.ServiceUpdateStatus;
import io.tabdeck.docker.DockerDaemonUnavailableException;
import io.tabdeck.docker.DockerServiceClient;
import io.tabdeck.status.restart.RolloutClient;
import io.tabdeck.status.restart.RolloutException;
import io.tabdeck.status.restart.RolloutSignal;
import io.tabdeck.status.restart.RolloutTrigger;
import io.tabdeck.status.restart.RolloutWatch;
import io.tabdeck.status.restart.WorkloadRef;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RolloutClient} backed by Docker Swarm services.
 * <p>
 * A restart forces a rolling update of the service (the equivalent of
 * {@code docker service update --force}) and then polls the service's update status until the
 * daemon reports the update as completed, paused or rolled back. Workloads map to stack services:
 * {@code <namespace>_<workload>}, or just {@code <workload>} in the {@value #DEFAULT_NAMESPACE}
 * namespace.
 */
public final class DockerServiceRolloutClient implements RolloutClient {

    public static final String DEFAULT_NAMESPACE = "default";
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    private static final Logger log = LoggerFactory.getLogger(DockerServiceRolloutClient.class);

    private final DockerServiceClient docker;
    private final Duration pollInterval;

    public DockerServiceRolloutClient(DockerServiceClient docker) {
        this(docker, DEFAULT_POLL_INTERVAL);
    }

    public DockerServiceRolloutClient(DockerServiceClient docker, Duration pollInterval) {
        this.docker = Objects.requireNonNull(docker, "docker");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public static String serviceName(WorkloadRef workload) {
        if (DEFAULT_NAMESPACE.equals(workload.namespace())) {
            return workload.workload();
        }
        return workload.namespace() + "_" + workload.workload();
    }

    @Override
    public RolloutTrigger triggerRestart(WorkloadRef workload) {
        String name = serviceName(workload);
        Service service = call(workload, "inspect", () -> docker.inspectService(name));
        ServiceSpec spec = service.getSpec();
        if (spec == null || spec.getTaskTemplate() == null) {
            throw new RolloutException("service " + name + " has no task template", workload);
        }
        long version = versionOf(service);
        String baseline = startedAt(service.getUpdateStatus());
        TaskSpec template = spec.getTaskTemplate();
        Integer previous = template.getForceUpdate();
        int forceUpdate = previous == null ? 1 : previous + 1;
        template.withForceUpdate(forceUpdate);

        log.debug("Forcing update of service {} (id={}, version={}, forceUpdate={})",
                name, service.getId(), version, forceUpdate);
        call(workload, "update", () -> {
            docker.updateService(service.getId(), spec, version);
            return null;
        });
        log.info("Rolling update triggered for service {} at version {}", name, version);
        return new RolloutTrigger(workload, version + 1, baseline, Instant.now());
    }

    @Override
    public RolloutWatch watch(WorkloadRef workload, RolloutTrigger trigger) {
        return new ServiceUpdateWatch(workload, serviceName(workload), trigger);
    }

    RolloutSignal evaluate(Service service, RolloutTrigger trigger) {
        if (versionOf(service) < trigger.revision()) {
            return RolloutSignal.notReady("service version behind trigger");
        }
        ServiceUpdateStatus status = service.getUpdateStatus();
        if (status == null || status.getState() == null) {
            return RolloutSignal.notReady("update not started");
        }
        String startedAt = startedAt(status);
        if (startedAt == null || startedAt.equals(trigger.baseline())) {
            return RolloutSignal.notReady("update not started");
        }
        ServiceUpdateState state = status.getState();
        return switch (state) {
            case COMPLETED -> RolloutSignal.ready();
            case UPDATING -> RolloutSignal.notReady(status.getMessage());
            default -> RolloutSignal.failed(
                    "service update " + describe(state) + ": " + Optional.ofNullable(status.getMessage())
                            .filter(m -> !m.isBlank())
                            .orElse("no details reported"));
        };
    }

    private static String describe(ServiceUpdateState state) {
        return state.name().toLowerCase().replace('_', ' ');
    }

    private static long versionOf(Service service) {
        ResourceVersion version = service.getVersion();
        return version == null ? 0L : version.getIndex();
    }

    private static String startedAt(ServiceUpdateStatus status) {
        if (status == null) {
            return null;
        }
        Date startedAt = status.getStartedAt();
        return startedAt == null ? null : startedAt.toInstant().toString();
    }

    private static <T> T call(WorkloadRef workload, String action, Supplier<T> supplier) {
        String name = serviceName(workload);
        try {
            return supplier.get();
        } catch (DockerDaemonUnavailableException e) {
            throw e;
        } catch (NotFoundException e) {
            throw new RolloutException("service " + name + " not found", workload, e);
        } catch (DockerException e) {
            throw new RolloutException("Docker API error during " + action + " of " + name + ": "
                    + e.getHttpStatus(), workload, e);
        } catch (RolloutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RolloutException("unexpected error during " + action + " of " + name + ": "
                    + e.getMessage(), workload, e);
        }
    }

    private final class ServiceUpdateWatch implements RolloutWatch {

        private final WorkloadRef workload;
        private final String serviceName;
        private final RolloutTrigger trigger;
        private long nextPollNanos = System.nanoTime();
        private boolean closed;

        private ServiceUpdateWatch(WorkloadRef workload, String serviceName, RolloutTrigger trigger) {
            this.workload = workload;
            this.serviceName = serviceName;
            this.trigger = Objects.requireNonNull(trigger, "trigger");
        }

        @Override
        public Optional<RolloutSignal> next(Duration maxWait) throws InterruptedException {
            if (closed) {
                throw new IllegalStateException("watch for " + serviceName + " is closed");
            }
            long wait = nextPollNanos - System.nanoTime();
            if (wait > 0L) {
                long sleep = Math.min(wait, maxWait.toNanos());
                TimeUnit.NANOSECONDS.sleep(sleep);
                if (sleep < wait) {
                    return Optional.empty();
                }
            }
            nextPollNanos = System.nanoTime() + pollInterval.toNanos();
            Service service = call(workload, "inspect", () -> docker.inspectService(serviceName));
            RolloutSignal signal = evaluate(service, trigger);
            log.debug("Service {} rollout signal {} ({})", serviceName, signal.kind(), signal.message());
            return Optional.of(signal);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
