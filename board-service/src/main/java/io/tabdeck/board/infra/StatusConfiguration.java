package io.tabdeck.board.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.tabdeck.board.app.StatusStreamWriter;
import io.tabdeck.board.config.BoardProperties;
import io.tabdeck.board.domain.Tab;
import io.tabdeck.board.domain.TabCatalog;
import io.tabdeck.status.channel.ChannelRegistry;
import io.tabdeck.status.restart.RestartCoordinator;
import io.tabdeck.status.restart.RestartMetrics;
import io.tabdeck.status.restart.RolloutClient;
import io.tabdeck.status.restart.WorkloadRef;
import io.tabdeck.status.sse.StatusStreamEncoder;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatusConfiguration {
    private static final Logger log = LoggerFactory.getLogger(StatusConfiguration.class);

    @Bean
    public TabCatalog tabCatalog(BoardProperties properties) {
        List<Tab> tabs = new ArrayList<>();
        List<BoardProperties.Tab> configured = properties.getTabs();
        for (int i = 0; i < configured.size(); i++) {
            BoardProperties.Tab tab = configured.get(i);
            BoardProperties.Orchestration orchestration = tab.getOrchestration();
            WorkloadRef workload = orchestration == null
                ? null
                : new WorkloadRef(orchestration.getNamespace(), orchestration.getService());
            tabs.add(new Tab(i, tab.getText(), tab.getIconUrl(), tab.getIframeUrl(), tab.getTabColor(), workload));
        }
        TabCatalog catalog = new TabCatalog(tabs);
        log.info("Loaded {} tab(s), {} restartable", catalog.size(),
            catalog.tabs().stream().filter(Tab::restartable).count());
        return catalog;
    }

    @Bean(destroyMethod = "closeAll")
    public ChannelRegistry channelRegistry(BoardProperties properties) {
        return new ChannelRegistry(properties.getStream().getQueueCapacity());
    }

    @Bean
    public RestartMetrics restartMetrics(MeterRegistry meterRegistry, ChannelRegistry channels) {
        return new MicrometerRestartMetrics(meterRegistry, channels);
    }

    @Bean(destroyMethod = "close")
    public RestartCoordinator restartCoordinator(ChannelRegistry channels,
                                                 RolloutClient rolloutClient,
                                                 RestartMetrics restartMetrics,
                                                 BoardProperties properties) {
        return new RestartCoordinator(channels, rolloutClient, properties.getRestart().getTimeout(), restartMetrics);
    }

    @Bean
    public StatusStreamEncoder statusStreamEncoder(ObjectMapper objectMapper, BoardProperties properties) {
        return new StatusStreamEncoder(objectMapper, properties.getStream().getRetry());
    }

    @Bean
    public StatusStreamWriter statusStreamWriter(ChannelRegistry channels,
                                                 StatusStreamEncoder encoder,
                                                 BoardProperties properties) {
        log.info("Status streams use a {} heartbeat", properties.getStream().getHeartbeat());
        return new StatusStreamWriter(channels, encoder, properties.getStream().getHeartbeat());
    }
}
