package io.tabdeck.board.app;

import io.tabdeck.board.domain.TabCatalog;
import java.util.Objects;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ConfigController {

    private final TabCatalog catalog;

    public ConfigController(TabCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @GetMapping("/config")
    public ConfigResponse config() {
        return ConfigResponse.of(catalog.tabs());
    }
}
