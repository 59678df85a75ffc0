package com.diagramparser.core.model.state;

import java.util.List;
import java.util.Objects;

/**
 * A node of a state diagram.
 *
 * @param id unique identifier within the diagram
 * @param displayName label from {@code state "Label" as id} or {@code id : Label}, or {@code null}
 * @param stateType kind of state
 * @param substates ids of direct children, in first-seen order (composite states only)
 * @param concurrentRegions reserved for concurrent regions, always empty
 */
public record State(
    String id,
    String displayName,
    StateType stateType,
    List<String> substates,
    List<String> concurrentRegions
) {
    public State {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(stateType, "stateType must not be null");
        substates = substates == null ? List.of() : List.copyOf(substates);
        concurrentRegions = concurrentRegions == null ? List.of() : List.copyOf(concurrentRegions);
    }

    /**
     * Creates a state without display name or children.
     *
     * @param id state id
     * @param stateType state kind
     * @return new state
     */
    public static State of(String id, StateType stateType) {
        return new State(id, null, stateType, List.of(), List.of());
    }
}
