package io.tabdeck.board.app;

import io.tabdeck.board.domain.RestartInProgressException;
import io.tabdeck.board.domain.Tab;
import io.tabdeck.board.domain.TabCatalog;
import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.restart.RestartCoordinator;
import io.tabdeck.status.restart.RestartDecision;
import io.tabdeck.status.restart.WorkloadRef;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves a tab index to its workload and hands the restart to the {@link RestartCoordinator}.
 */
@Service
public class TabRestartService {
    private static final Logger log = LoggerFactory.getLogger(TabRestartService.class);

    private final TabCatalog catalog;
    private final RestartCoordinator coordinator;

    public TabRestartService(TabCatalog catalog, RestartCoordinator coordinator) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    }

    public Tab restart(int index) {
        Tab tab = catalog.restartable(index);
        WorkloadRef workload = tab.workloadRef().orElseThrow();
        ResourceKey key = tab.resourceKey();
        RestartDecision decision = coordinator.requestRestart(key, workload);
        if (decision == RestartDecision.REJECTED_IN_PROGRESS) {
            log.info("[RESTART] tab {} ({}) already restarting", index, key);
            throw new RestartInProgressException(workload);
        }
        log.info("[RESTART] tab {} ({}) restart accepted", index, key);
        return tab;
    }
}
