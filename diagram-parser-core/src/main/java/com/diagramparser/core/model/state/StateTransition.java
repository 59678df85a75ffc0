package com.diagramparser.core.model.state;

import java.util.Objects;

/**
 * Directed edge between two states.
 *
 * <p>A label {@code event [guard] / action} is decomposed into its three parts. Each
 * part is {@code null} when absent. A label such as {@code "/ action"} yields an empty
 * event string rather than {@code null}.
 *
 * @param from source state id
 * @param to target state id
 * @param event triggering event, or {@code null}
 * @param guard guard condition without brackets, or {@code null}
 * @param action action text, or {@code null}
 */
public record StateTransition(
    String from,
    String to,
    String event,
    String guard,
    String action
) {
    public StateTransition {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }
}
