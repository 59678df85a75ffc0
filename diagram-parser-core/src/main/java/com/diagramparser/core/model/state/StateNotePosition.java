package com.diagramparser.core.model.state;

/**
 * Placement of a note relative to its state.
 */
public enum StateNotePosition {
    LEFT_OF,
    RIGHT_OF,
    ABOVE,
    BELOW
}
