package io.tabdeck.board.app;

import io.tabdeck.board.domain.Tab;
import java.util.List;

/**
 * Body of {@code GET /api/config}.
 */
public record ConfigResponse(List<TabView> tabs) {

    public ConfigResponse {
        tabs = List.copyOf(tabs);
    }

    public static ConfigResponse of(List<Tab> tabs) {
        return new ConfigResponse(tabs.stream().map(TabView::of).toList());
    }

    public record TabView(String text, String iconUrl, String iframeUrl, boolean restartable, String tabColor) {

        static TabView of(Tab tab) {
            return new TabView(tab.text(), tab.iconUrl(), tab.iframeUrl(), tab.restartable(), tab.tabColor());
        }
    }
}
