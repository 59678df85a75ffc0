package com.diagramparser.core.model.flowchart;

import java.util.Objects;

/**
 * {@code click nodeId ...}
 *
 * @param nodeId clicked node
 * @param action click behaviour
 */
public record ClickEvent(
    String nodeId,
    ClickAction action
) {
    public ClickEvent {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }
}
