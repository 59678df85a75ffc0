package com.diagramparser.core.model.state;

/**
 * Header variant a state diagram was declared with.
 */
public enum StateVersion {
    /** {@code stateDiagram} */
    V1,

    /** {@code stateDiagram-v2} */
    V2
}
