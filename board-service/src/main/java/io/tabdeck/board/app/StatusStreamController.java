package io.tabdeck.board.app;

import io.tabdeck.board.domain.Tab;
import io.tabdeck.board.domain.TabCatalog;
import io.tabdeck.status.ResourceKey;
import java.util.Objects;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Server-sent status stream for a tab. The first frame is always the tab's current state; after
 * that every transition is pushed, with heartbeats while idle.
 */
@RestController
@RequestMapping("/api/status")
public class StatusStreamController {

    private final TabCatalog catalog;
    private final StatusStreamWriter writer;

    public StatusStreamController(TabCatalog catalog, StatusStreamWriter writer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @GetMapping("/{idx}/stream")
    public ResponseEntity<StreamingResponseBody> stream(@PathVariable("idx") int idx) {
        Tab tab = catalog.tab(idx);
        ResourceKey key = tab.resourceKey();
        StreamingResponseBody body = out -> writer.stream(key, out);
        return ResponseEntity.ok()
            .cacheControl(CacheControl.noCache())
            .header("X-Accel-Buffering", "no")
            .contentType(MediaType.TEXT_EVENT_STREAM)
            .body(body);
    }
}
