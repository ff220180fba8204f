package io.tabdeck.board.infra.docker;

import io.tabdeck.docker.DockerServiceClient;
import java.util.Objects;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports whether the Docker daemon that restarts go through answers a ping.
 */
public class DockerHealthIndicator implements HealthIndicator {

    private final DockerServiceClient docker;

    public DockerHealthIndicator(DockerServiceClient docker) {
        this.docker = Objects.requireNonNull(docker, "docker");
    }

    @Override
    public Health health() {
        try {
            docker.ping();
            return Health.up().build();
        } catch (RuntimeException e) {
            return Health.down().withDetail("error", e.getMessage()).build();
        }
    }
}
