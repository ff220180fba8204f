package io.tabdeck.board.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.restart.WorkloadRef;
import java.util.List;
import org.junit.jupiter.api.Test;

class TabCatalogTest {

    private final TabCatalog catalog = new TabCatalog(List.of(
        new Tab(0, "Zigbee2MQTT", "/z2m.svg", "https://z2m", null, new WorkloadRef("home", "z2m")),
        new Tab(1, "Docs", "/docs.svg", "https://docs", "#333", null)));

    @Test
    void restartableTabMapsToItsWorkload() {
        Tab tab = catalog.restartable(0);

        assertThat(tab.resourceKey()).isEqualTo(ResourceKey.of("home", "z2m"));
    }

    @Test
    void staticTabGetsItsOwnKey() {
        assertThat(catalog.tab(1).resourceKey()).isEqualTo(ResourceKey.of("tabs", "tab-1"));
        assertThat(catalog.tab(1).restartable()).isFalse();
    }

    @Test
    void unknownIndexIsNotFound() {
        assertThatThrownBy(() -> catalog.tab(2))
            .isInstanceOf(TabNotFoundException.class)
            .hasMessage("tab index 2 is out of range");
        assertThatThrownBy(() -> catalog.restartable(-1)).isInstanceOf(TabNotFoundException.class);
    }

    @Test
    void staticTabIsNotRestartable() {
        assertThatThrownBy(() -> catalog.restartable(1))
            .isInstanceOf(TabNotRestartableException.class)
            .hasMessage("tab index 1 is not restartable");
    }

    @Test
    void requiresAtLeastOneTab() {
        assertThatThrownBy(() -> new TabCatalog(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsTabsOutOfPosition() {
        Tab misplaced = new Tab(3, "Docs", "/docs.svg", "https://docs", null, null);

        assertThatThrownBy(() -> new TabCatalog(List.of(misplaced))).isInstanceOf(IllegalArgumentException.class);
    }
}
