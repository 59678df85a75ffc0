package com.diagramparser.core.model.state;

import com.diagramparser.core.model.AccessibilityInfo;
import com.diagramparser.core.model.DiagramAst;
import com.diagramparser.core.model.DiagramKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Syntax tree of a state diagram.
 *
 * <p>Every transition endpoint is a key of {@link #states()}. Containment through
 * {@link State#substates()} forms a tree; transitions may form cycles.
 *
 * @param title diagram title, or {@code null}
 * @param accessibility accessibility metadata
 * @param version header variant
 * @param states states keyed by id, in declaration order
 * @param transitions transitions in source order, duplicates allowed
 * @param notes notes in source order
 */
public record StateDiagram(
    String title,
    AccessibilityInfo accessibility,
    StateVersion version,
    Map<String, State> states,
    List<StateTransition> transitions,
    List<StateNote> notes
) implements DiagramAst {

    public StateDiagram {
        Objects.requireNonNull(version, "version must not be null");
        accessibility = accessibility == null ? AccessibilityInfo.empty() : accessibility;
        states = states == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(states));
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    @Override
    public DiagramKind kind() {
        return DiagramKind.STATE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitState(this);
    }
}
