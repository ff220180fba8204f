package io.tabdeck.board.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, index-addressed list of the configured tabs.
 */
public class TabCatalog {

    private final List<Tab> tabs;

    public TabCatalog(List<Tab> tabs) {
        Objects.requireNonNull(tabs, "tabs");
        if (tabs.isEmpty()) {
            throw new IllegalArgumentException("at least one tab must be defined");
        }
        for (int i = 0; i < tabs.size(); i++) {
            if (tabs.get(i).index() != i) {
                throw new IllegalArgumentException("tab at position " + i + " has index " + tabs.get(i).index());
            }
        }
        this.tabs = List.copyOf(tabs);
    }

    public List<Tab> tabs() {
        return tabs;
    }

    public int size() {
        return tabs.size();
    }

    public Tab tab(int index) {
        if (index < 0 || index >= tabs.size()) {
            throw new TabNotFoundException(index);
        }
        return tabs.get(index);
    }

    public Tab restartable(int index) {
        Tab tab = tab(index);
        if (!tab.restartable()) {
            throw new TabNotRestartableException(index);
        }
        return tab;
    }
}
