package com.diagramparser.core.model.sequence;

public enum NotePosition {
    LEFT_OF,
    RIGHT_OF,
    OVER
}
