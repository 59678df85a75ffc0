package com.diagramparser.core.grammar.impl.state;

import com.diagramparser.core.model.state.State;
import com.diagramparser.core.model.state.StateTransition;
import com.diagramparser.core.model.state.StateType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state registry for a single parse.
 *
 * <p>Holds the declared states in first-seen order together with the stack of
 * enclosing composite states. Any state touched while a composite is open becomes one
 * of its substates. The pseudostate {@code [*]} is never registered during the pass;
 * {@link #toStates(List)} adds it afterwards according to how transitions use it.
 */
final class StateTable {

    static final String PSEUDOSTATE = "[*]";

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Deque<String> composites = new ArrayDeque<>();

    /**
     * Returns the state with this id, creating a simple one if needed, and claims it
     * for the innermost open composite.
     */
    Entry touch(String id) {
        Entry entry = null;
        if (!PSEUDOSTATE.equals(id)) {
            entry = entries.computeIfAbsent(id, Entry::new);
        }
        claim(id);
        return entry;
    }

    void declare(String id, StateType type, String displayName) {
        Entry entry = touch(id);
        if (entry == null) {
            return;
        }
        if (type != StateType.SIMPLE || entry.type == null) {
            entry.type = type;
        }
        if (displayName != null) {
            entry.displayName = displayName;
        }
    }

    /**
     * Marks a state composite and makes it the innermost open composite.
     */
    void enterComposite(String id) {
        Entry entry = touch(id);
        if (entry == null) {
            return;
        }
        entry.type = StateType.COMPOSITE;
        composites.push(id);
    }

    /**
     * Closes the innermost composite.
     *
     * @return false if no composite was open
     */
    boolean exitComposite() {
        if (composites.isEmpty()) {
            return false;
        }
        composites.pop();
        return true;
    }

    int depth() {
        return composites.size();
    }

    private void claim(String id) {
        if (composites.isEmpty() || PSEUDOSTATE.equals(id)) {
            return;
        }
        String parent = composites.peek();
        if (parent.equals(id)) {
            return;
        }
        List<String> substates = entries.get(parent).substates;
        if (!substates.contains(id)) {
            substates.add(id);
        }
    }

    /**
     * Freezes the table into immutable states, synthesising {@code [*]} if the
     * transitions reference it.
     */
    Map<String, State> toStates(List<StateTransition> transitions) {
        Map<String, State> states = new LinkedHashMap<>();
        boolean asSource = transitions.stream().anyMatch(t -> PSEUDOSTATE.equals(t.from()));
        boolean asTarget = transitions.stream().anyMatch(t -> PSEUDOSTATE.equals(t.to()));
        if (asSource || asTarget) {
            StateType type;
            if (asSource && !asTarget) {
                type = StateType.START;
            } else if (asTarget && !asSource) {
                type = StateType.END;
            } else {
                // Used as both source and target: no single pseudostate kind applies
                type = StateType.SIMPLE;
            }
            states.put(PSEUDOSTATE, State.of(PSEUDOSTATE, type));
        }
        for (Entry entry : entries.values()) {
            states.put(entry.id, entry.freeze());
        }
        return states;
    }

    static final class Entry {
        private final String id;
        private String displayName;
        private StateType type;
        private final List<String> substates = new ArrayList<>();

        private Entry(String id) {
            this.id = id;
        }

        void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        private State freeze() {
            StateType resolved = type == null ? StateType.SIMPLE : type;
            List<String> children = resolved == StateType.COMPOSITE ? substates : List.of();
            return new State(id, displayName, resolved, children, List.of());
        }
    }
}
