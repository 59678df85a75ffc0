package com.diagramparser.core.grammar.impl.state;

/**
 * Decomposed transition label {@code event [guard] / action}.
 *
 * <p>The first {@code [...]} span is taken as the guard and removed; what remains is
 * split on the first {@code /} into event and action. Parts that do not occur are
 * {@code null}, but a present {@code /} always yields an event, possibly {@code ""}.
 *
 * @param event event text, or {@code null}
 * @param guard guard text without brackets, or {@code null}
 * @param action action text, or {@code null}
 */
record TransitionLabel(
    String event,
    String guard,
    String action
) {
    static final TransitionLabel NONE = new TransitionLabel(null, null, null);

    static TransitionLabel parse(String label) {
        if (label == null) {
            return NONE;
        }
        String guard = null;
        String rest = label.trim();

        int open = rest.indexOf('[');
        if (open >= 0) {
            int close = rest.indexOf(']', open + 1);
            if (close >= 0) {
                guard = rest.substring(open + 1, close).trim();
                String before = rest.substring(0, open).trim();
                String after = rest.substring(close + 1).trim();
                rest = (before + " " + after).trim();
            }
        }

        String event = null;
        String action = null;
        int slash = rest.indexOf('/');
        if (slash >= 0) {
            event = rest.substring(0, slash).trim();
            action = rest.substring(slash + 1).trim();
        } else if (!rest.isEmpty()) {
            event = rest;
        }
        return new TransitionLabel(event, guard, action);
    }
}
