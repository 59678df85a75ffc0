package com.diagramparser.core.model.state;

/**
 * Kind of a state node.
 */
public enum StateType {
    SIMPLE,
    COMPOSITE,
    CHOICE,
    FORK,
    JOIN,
    START,
    END
}
