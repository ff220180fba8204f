package io.tabdeck.board.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import io.tabdeck.board.config.BoardProperties;
import io.tabdeck.docker.DockerServiceClient;
import io.tabdeck.docker.rollout.DockerServiceRolloutClient;
import io.tabdeck.status.restart.RolloutClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DockerConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DockerConfiguration.class);

    @Bean
    public DockerClient dockerClient(BoardProperties properties) {
        DefaultDockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder().build();
        BoardProperties.Docker timeouts = properties.getDocker();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(timeouts.getConnectTimeout())
                .responseTimeout(timeouts.getResponseTimeout())
                .build();
        log.info("Using Docker host {} (connect timeout {}, response timeout {})",
                config.getDockerHost(), timeouts.getConnectTimeout(), timeouts.getResponseTimeout());
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public DockerServiceClient dockerServiceClient(DockerClient dockerClient) {
        return new DockerServiceClient(dockerClient);
    }

    @Bean
    public RolloutClient rolloutClient(DockerServiceClient dockerServiceClient, BoardProperties properties) {
        return new DockerServiceRolloutClient(dockerServiceClient, properties.getRestart().getPollInterval());
    }

    @Bean
    public DockerHealthIndicator dockerHealthIndicator(DockerServiceClient dockerServiceClient) {
        return new DockerHealthIndicator(dockerServiceClient);
    }
}
