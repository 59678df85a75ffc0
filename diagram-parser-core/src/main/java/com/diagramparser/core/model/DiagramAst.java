package com.diagramparser.core.model;

import com.diagramparser.core.model.flowchart.FlowchartDiagram;
import com.diagramparser.core.model.sequence.SequenceDiagram;
import com.diagramparser.core.model.state.StateDiagram;

/**
 * Root of every syntax tree produced by the parser.
 *
 * <p>Implementations are immutable records. Consumers that need to handle every
 * diagram variant should go through {@link #accept(Visitor)}; adding a variant adds
 * a visitor method, so missing cases fail at compile time.
 *
 * <p><b>Example</b></p>
 * <pre>{@code
 * int size = ast.accept(new DiagramAst.Visitor<>() {
 *     public Integer visitState(StateDiagram d) { return d.states().size(); }
 *     public Integer visitSequence(SequenceDiagram d) { return d.participants().size(); }
 *     public Integer visitFlowchart(FlowchartDiagram d) { return d.nodes().size(); }
 * });
 * }</pre>
 *
 * @since 1.0.0
 */
public interface DiagramAst {

    /**
     * @return diagram family of this tree
     */
    DiagramKind kind();

    /**
     * @return title from a {@code title} directive, or {@code null}
     */
    String title();

    /**
     * @return accessibility metadata, never {@code null}
     */
    AccessibilityInfo accessibility();

    /**
     * Double-dispatches to the visitor method matching this variant.
     *
     * @param visitor visitor to call
     * @param <R> visitor result type
     * @return the visitor's result
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Visitor over all diagram variants.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitState(StateDiagram diagram);

        R visitSequence(SequenceDiagram diagram);

        R visitFlowchart(FlowchartDiagram diagram);
    }
}
