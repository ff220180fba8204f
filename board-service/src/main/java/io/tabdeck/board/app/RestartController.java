package io.tabdeck.board.app;

import io.tabdeck.board.domain.Tab;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface for restarting the workload behind a tab via {@code /api/restart/{idx}}.
 * <p>
 * The call returns as soon as the restart is accepted; progress is published on the tab's status
 * stream ({@code restarting}, then {@code running} or {@code error}).
 */
@RestController
@RequestMapping("/api/restart")
public class RestartController {
    private static final Logger log = LoggerFactory.getLogger(RestartController.class);

    private final TabRestartService restarts;

    public RestartController(TabRestartService restarts) {
        this.restarts = Objects.requireNonNull(restarts, "restarts");
    }

    @PostMapping("/{idx}")
    public ResponseEntity<RestartResponse> restart(@PathVariable("idx") int idx) {
        String path = "/api/restart/" + idx;
        log.info("[REST] POST {}", path);
        Tab tab = restarts.restart(idx);
        ResponseEntity<RestartResponse> response = ResponseEntity.ok(RestartResponse.restarting());
        log.info("[REST] POST {} -> status={} workload={}", path, response.getStatusCode(), tab.workload());
        return response;
    }
}
