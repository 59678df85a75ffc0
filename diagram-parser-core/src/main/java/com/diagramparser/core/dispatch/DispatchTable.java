package com.diagramparser.core.dispatch;

import com.diagramparser.core.config.ParserConfig;
import com.diagramparser.core.grammar.DiagramGrammar;
import com.diagramparser.core.grammar.impl.flowchart.FlowchartGrammar;
import com.diagramparser.core.grammar.impl.sequence.SequenceDiagramGrammar;
import com.diagramparser.core.grammar.impl.state.StateDiagramGrammar;
import com.diagramparser.core.model.DiagramKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered header table used to pick a grammar for a diagram.
 *
 * <p>Rules are tested top to bottom and the first prefix match wins. A literal that
 * extends a shorter literal of another rule must appear in an earlier rule, and within
 * a rule longer literals come first, e.g. {@code architecture-beta} before
 * {@code architecture} and {@code statediagram-v2} before {@code statediagram}.
 *
 * <p>Only state, sequence and flowchart rules carry a grammar. The rest are detected
 * so that {@link DiagramParser} can report them as unsupported rather than unknown.
 *
 * @since 1.0.0
 */
public final class DispatchTable {

    private final List<DispatchRule> rules;

    /**
     * Builds the table with grammars configured from {@code config}.
     *
     * @param config parser configuration
     */
    public DispatchTable(ParserConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.rules = List.of(
            rule(DiagramKind.SANKEY, null, "sankey-beta", "sankey"),
            rule(DiagramKind.TIMELINE, null, "timeline"),
            rule(DiagramKind.JOURNEY, null, "journey"),
            rule(DiagramKind.SEQUENCE, new SequenceDiagramGrammar(config.sequence().maxBlockDepth()),
                "sequencediagram"),
            rule(DiagramKind.CLASS, null, "classdiagram"),
            rule(DiagramKind.STATE, new StateDiagramGrammar(), "statediagram-v2", "statediagram"),
            rule(DiagramKind.FLOWCHART, new FlowchartGrammar(config.flowchart().defaultDirection()),
                "flowchart", "graph"),
            rule(DiagramKind.GANTT, null, "gantttestclick", "gantt"),
            rule(DiagramKind.PIE, null, "pie"),
            rule(DiagramKind.GIT, null, "gitgraph"),
            rule(DiagramKind.INFO, null, "info"),
            rule(DiagramKind.ER, null, "erdiagramtitletext", "erdiagram"),
            rule(DiagramKind.C4, null,
                "c4context", "c4container", "c4component", "c4dynamic", "c4deployment"),
            rule(DiagramKind.MINDMAP, null, "mindmap"),
            rule(DiagramKind.QUADRANT, null, "quadrantchart", "quadrant"),
            rule(DiagramKind.XY_CHART, null, "xychart-beta", "xychart"),
            rule(DiagramKind.KANBAN, null, "kanban"),
            rule(DiagramKind.BLOCK, null, "block-beta", "block"),
            rule(DiagramKind.ARCHITECTURE, null, "architecture-beta", "architecture"),
            rule(DiagramKind.PACKET, null, "packet-beta", "packet"),
            rule(DiagramKind.REQUIREMENT, null, "requirementdiagram", "requirement"),
            rule(DiagramKind.TREEMAP, null, "treemap-beta", "treemap"),
            rule(DiagramKind.RADAR, null, "radar")
        );
    }

    /**
     * @return rules in match order
     */
    public List<DispatchRule> rules() {
        return rules;
    }

    /**
     * Finds the first rule whose literals prefix the header.
     *
     * @param header lowercased, trimmed first line
     * @return matching rule, if any
     */
    public Optional<DispatchRule> ruleFor(String header) {
        return rules.stream()
            .filter(rule -> rule.match(header) != null)
            .findFirst();
    }

    /**
     * Returns the rule for a kind.
     *
     * @param kind diagram kind
     * @return rule; every kind has exactly one
     */
    public DispatchRule ruleOf(DiagramKind kind) {
        return rules.stream()
            .filter(rule -> rule.kind() == kind)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No dispatch rule for " + kind));
    }

    private static DispatchRule rule(DiagramKind kind, DiagramGrammar<?> grammar, String... literals) {
        return new DispatchRule(List.of(literals), kind, grammar);
    }
}
