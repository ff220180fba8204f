package io.tabdeck.board.domain;

import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.restart.WorkloadRef;
import java.util.Objects;
import java.util.Optional;

/**
 * One configured dashboard tab. Tabs with a workload can be restarted; static tabs still get a
 * status channel of their own so observers can subscribe uniformly.
 */
public record Tab(int index,
                  String text,
                  String iconUrl,
                  String iframeUrl,
                  String tabColor,
                  WorkloadRef workload) {

    public static final String STATIC_TAB_NAMESPACE = "tabs";

    public Tab {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(iconUrl, "iconUrl");
        Objects.requireNonNull(iframeUrl, "iframeUrl");
    }

    public boolean restartable() {
        return workload != null;
    }

    public Optional<WorkloadRef> workloadRef() {
        return Optional.ofNullable(workload);
    }

    public ResourceKey resourceKey() {
        if (workload == null) {
            return ResourceKey.of(STATIC_TAB_NAMESPACE, "tab-" + index);
        }
        return ResourceKey.of(workload.namespace(), workload.workload());
    }
}
