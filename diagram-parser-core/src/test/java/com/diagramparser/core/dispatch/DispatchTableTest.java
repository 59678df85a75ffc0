package com.diagramparser.core.dispatch;

import com.diagramparser.core.config.ParserConfig;
import com.diagramparser.core.grammar.impl.flowchart.FlowchartGrammar;
import com.diagramparser.core.grammar.impl.sequence.SequenceDiagramGrammar;
import com.diagramparser.core.grammar.impl.state.StateDiagramGrammar;
import com.diagramparser.core.model.DiagramKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DispatchTable} and {@link DispatchRule}.
 */
class DispatchTableTest {

    private DispatchTable table;

    @BeforeEach
    void setUp() {
        table = new DispatchTable(ParserConfig.defaults());
    }

    @Test
    void rules_noLiteralIsShadowedByAnEarlierPrefix() {
        // Given: every literal in match order
        List<String> literals = table.rules().stream()
            .flatMap(rule -> rule.literals().stream())
            .collect(Collectors.toList());

        // Then: an earlier literal never prefixes a later one
        for (int i = 0; i < literals.size(); i++) {
            for (int j = i + 1; j < literals.size(); j++) {
                assertThat(literals.get(j).startsWith(literals.get(i)))
                    .as("'%s' is shadowed by earlier '%s'", literals.get(j), literals.get(i))
                    .isFalse();
            }
        }
    }

    @Test
    void rules_coverEveryKindOnce() {
        assertThat(table.rules()).extracting(DispatchRule::kind)
            .containsExactlyInAnyOrder(DiagramKind.values());
    }

    @ParameterizedTest
    @CsvSource({
        "statediagram-v2,            STATE,        statediagram-v2",
        "statediagram,               STATE,        statediagram",
        "sequencediagram,            SEQUENCE,     sequencediagram",
        "graph td,                   FLOWCHART,    graph",
        "flowchart-elk lr,           FLOWCHART,    flowchart",
        "architecture-beta,          ARCHITECTURE, architecture-beta",
        "architecture,               ARCHITECTURE, architecture",
        "erdiagram,                  ER,           erdiagram",
        "gitgraph,                   GIT,          gitgraph",
        "c4deployment,               C4,           c4deployment",
        "xychart-beta,               XY_CHART,     xychart-beta",
        "quadrantchart,              QUADRANT,     quadrantchart",
        "requirementdiagram,         REQUIREMENT,  requirementdiagram",
        "sankey-beta,                SANKEY,       sankey-beta"
    })
    void ruleFor_matchesLongestLiteralOfRule(String header, DiagramKind kind, String literal) {
        DispatchRule rule = table.ruleFor(header).orElseThrow();

        assertThat(rule.kind()).isEqualTo(kind);
        assertThat(rule.match(header)).isEqualTo(literal);
    }

    @Test
    void ruleFor_unknownHeader_isEmpty() {
        assertThat(table.ruleFor("banana")).isEmpty();
    }

    @Test
    void ruleOf_onlyThreeKindsCarryGrammars() {
        assertThat(table.ruleOf(DiagramKind.STATE).grammar()).isInstanceOf(StateDiagramGrammar.class);
        assertThat(table.ruleOf(DiagramKind.SEQUENCE).grammar()).isInstanceOf(SequenceDiagramGrammar.class);
        assertThat(table.ruleOf(DiagramKind.FLOWCHART).grammar()).isInstanceOf(FlowchartGrammar.class);
        assertThat(table.rules()).filteredOn(DispatchRule::hasGrammar)
            .extracting(DispatchRule::kind)
            .containsExactlyInAnyOrder(DiagramKind.STATE, DiagramKind.SEQUENCE, DiagramKind.FLOWCHART);
    }

    @Test
    void dispatchRule_requiresLiterals() {
        assertThatThrownBy(() -> new DispatchRule(List.of(), DiagramKind.PIE, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one literal required");
    }

    @Test
    void headerLine_skipsBlankAndCommentLines() {
        String text = """

            %% generated
            // tool comment
            # shell style
               sequenceDiagram
            Alice->>Bob: hi
            """;

        assertThat(DiagramTypeSniffer.headerLine(text)).isEqualTo("sequenceDiagram");
        assertThat(DiagramTypeSniffer.headerLine("%% only\n\n")).isNull();
    }
}
