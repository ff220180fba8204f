package io.tabdeck.board.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tabdeck.board")
public class BoardProperties {

    private final List<Tab> tabs;
    private final Stream stream;
    private final Restart restart;
    private final Docker docker;
    private final Cors cors;

    public BoardProperties(@NotEmpty List<@Valid Tab> tabs,
                           @Valid @DefaultValue Stream stream,
                           @Valid @DefaultValue Restart restart,
                           @Valid @DefaultValue Docker docker,
                           @Valid @DefaultValue Cors cors) {
        if (tabs == null || tabs.isEmpty()) {
            throw new IllegalArgumentException("tabs: at least one tab must be defined");
        }
        this.tabs = List.copyOf(tabs);
        this.stream = Objects.requireNonNull(stream, "stream");
        this.restart = Objects.requireNonNull(restart, "restart");
        this.docker = Objects.requireNonNull(docker, "docker");
        this.cors = Objects.requireNonNull(cors, "cors");
    }

    public List<Tab> getTabs() {
        return tabs;
    }

    public Stream getStream() {
        return stream;
    }

    public Restart getRestart() {
        return restart;
    }

    public Docker getDocker() {
        return docker;
    }

    public Cors getCors() {
        return cors;
    }

    @Validated
    public static final class Tab {

        private final String text;
        private final String iconUrl;
        private final String iframeUrl;
        private final String tabColor;
        private final @Valid Orchestration orchestration;

        public Tab(@NotBlank String text,
                   @NotBlank String iconUrl,
                   @NotBlank String iframeUrl,
                   String tabColor,
                   @Valid Orchestration orchestration) {
            this.text = requireNonBlank(text, "text");
            this.iconUrl = requireNonBlank(iconUrl, "iconUrl");
            this.iframeUrl = requireNonBlank(iframeUrl, "iframeUrl");
            this.tabColor = tabColor == null ? null : requireNonBlank(tabColor, "tabColor");
            this.orchestration = orchestration;
        }

        public String getText() {
            return text;
        }

        public String getIconUrl() {
            return iconUrl;
        }

        public String getIframeUrl() {
            return iframeUrl;
        }

        public String getTabColor() {
            return tabColor;
        }

        public Orchestration getOrchestration() {
            return orchestration;
        }
    }

    @Validated
    public static final class Orchestration {

        private final String namespace;
        private final String service;

        public Orchestration(@NotBlank String namespace, @NotBlank String service) {
            this.namespace = requireNonBlank(namespace, "orchestration.namespace");
            this.service = requireNonBlank(service, "orchestration.service");
        }

        public String getNamespace() {
            return namespace;
        }

        public String getService() {
            return service;
        }
    }

    @Validated
    public static final class Stream {

        private final Duration heartbeat;
        private final Duration retry;
        private final int queueCapacity;

        public Stream(@NotNull @DefaultValue("30s") Duration heartbeat,
                      @NotNull @DefaultValue("3000ms") Duration retry,
                      @DefaultValue("32") int queueCapacity) {
            this.heartbeat = requirePositive(heartbeat, "stream.heartbeat");
            this.retry = requirePositive(retry, "stream.retry");
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("stream.queueCapacity must be at least 1");
            }
            this.queueCapacity = queueCapacity;
        }

        public Duration getHeartbeat() {
            return heartbeat;
        }

        public Duration getRetry() {
            return retry;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }
    }

    @Validated
    public static final class Restart {

        private final Duration timeout;
        private final Duration pollInterval;

        public Restart(@NotNull @DefaultValue("180s") Duration timeout,
                       @NotNull @DefaultValue("2s") Duration pollInterval) {
            this.timeout = requirePositive(timeout, "restart.timeout");
            this.pollInterval = requirePositive(pollInterval, "restart.pollInterval");
        }

        public Duration getTimeout() {
            return timeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }
    }

    /**
     * Timeouts of the HTTP client talking to the Docker daemon. A stalled daemon otherwise blocks
     * a restart watcher indefinitely.
     */
    @Validated
    public static final class Docker {

        private final Duration connectTimeout;
        private final Duration responseTimeout;

        public Docker(@NotNull @DefaultValue("5s") Duration connectTimeout,
                      @NotNull @DefaultValue("30s") Duration responseTimeout) {
            this.connectTimeout = requirePositive(connectTimeout, "docker.connectTimeout");
            this.responseTimeout = requirePositive(responseTimeout, "docker.responseTimeout");
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }
    }

    public static final class Cors {

        private final List<String> allowedOrigins;

        public Cors(@DefaultValue List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins == null
                ? List.of()
                : allowedOrigins.stream().map(String::trim).filter(o -> !o.isEmpty()).toList();
        }

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public boolean isEnabled() {
            return !allowedOrigins.isEmpty();
        }
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }

    private static Duration requirePositive(Duration value, String field) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }
}
