package com.diagramparser.core.grammar.impl.state;

import com.diagramparser.core.error.DiagramParseException;
import com.diagramparser.core.error.DiagramSyntaxException;
import com.diagramparser.core.error.EmptyInputException;
import com.diagramparser.core.model.state.State;
import com.diagramparser.core.model.state.StateDiagram;
import com.diagramparser.core.model.state.StateNote;
import com.diagramparser.core.model.state.StateNotePosition;
import com.diagramparser.core.model.state.StateTransition;
import com.diagramparser.core.model.state.StateType;
import com.diagramparser.core.model.state.StateVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link StateDiagramGrammar}.
 *
 * <p>These tests validate the grammar's ability to:
 * <ul>
 *   <li>Record the header version</li>
 *   <li>Decompose transition labels into event, guard and action</li>
 *   <li>Synthesise the {@code [*]} pseudostate from its usage</li>
 *   <li>Track composite states and their substates</li>
 *   <li>Skip malformed lines instead of failing</li>
 * </ul>
 *
 * @see StateDiagramGrammar
 * @since 1.0.0
 */
class StateDiagramGrammarTest {

    private StateDiagramGrammar grammar;

    @BeforeEach
    void setUp() {
        grammar = new StateDiagramGrammar();
    }

    @Test
    void parse_startAndEndThroughSamePseudostate_yieldsSimplePseudostate() throws DiagramParseException {
        // Given: [*] used both as source and as target
        String source = """
            stateDiagram-v2
            [*] --> Still
            Still --> [*]
            """;

        // When: Grammar is executed
        StateDiagram diagram = grammar.parse(source);

        // Then: Both states exist, [*] is Simple
        assertThat(diagram.version()).isEqualTo(StateVersion.V2);
        assertThat(diagram.states()).containsOnlyKeys("[*]", "Still");
        assertThat(diagram.states().get("[*]").stateType()).isEqualTo(StateType.SIMPLE);
        assertThat(diagram.states().get("Still").stateType()).isEqualTo(StateType.SIMPLE);
        assertThat(diagram.transitions()).hasSize(2);
    }

    @Test
    void parse_pseudostateOnlyAsSource_isStart() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram
            [*] --> Idle
            Idle --> Running
            """);

        assertThat(diagram.version()).isEqualTo(StateVersion.V1);
        assertThat(diagram.states().get("[*]").stateType()).isEqualTo(StateType.START);
    }

    @Test
    void parse_pseudostateOnlyAsTarget_isEnd() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            Running --> [*]
            """);

        assertThat(diagram.states().get("[*]").stateType()).isEqualTo(StateType.END);
    }

    @Test
    void parse_transitionLabel_splitsEventGuardAndAction() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("stateDiagram-v2\nS1 --> S2 : event[guard]/action");

        assertThat(diagram.transitions()).singleElement().satisfies(transition -> {
            assertThat(transition.from()).isEqualTo("S1");
            assertThat(transition.to()).isEqualTo("S2");
            assertThat(transition.event()).isEqualTo("event");
            assertThat(transition.guard()).isEqualTo("guard");
            assertThat(transition.action()).isEqualTo("action");
        });
    }

    @Test
    void parse_transitionWithoutLabel_hasNullParts() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("stateDiagram-v2\nA --> B");

        StateTransition transition = diagram.transitions().get(0);
        assertThat(transition.event()).isNull();
        assertThat(transition.guard()).isNull();
        assertThat(transition.action()).isNull();
    }

    @Test
    void parse_everyTransitionEndpoint_isAState() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            [*] --> First
            First --> Second : go
            Second --> Third
            Third --> First
            Third --> [*]
            """);

        for (StateTransition transition : diagram.transitions()) {
            assertThat(diagram.states()).containsKeys(transition.from(), transition.to());
        }
    }

    @Test
    void parse_compositeWithBraceOnSameLine_collectsSubstates() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            [*] --> Active
            state Active {
                [*] --> Working
                Working --> Paused
                Paused --> Working
            }
            Active --> Done
            """);

        State active = diagram.states().get("Active");
        assertThat(active.stateType()).isEqualTo(StateType.COMPOSITE);
        assertThat(active.substates()).containsExactly("Working", "Paused");
        assertThat(active.concurrentRegions()).isEmpty();
        assertThat(diagram.states().get("Done").substates()).isEmpty();
    }

    @Test
    void parse_identifierFollowedByBraceLine_opensComposite() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            Outer
            {
                Inner1 --> Inner2
            }
            """);

        assertThat(diagram.states().get("Outer").stateType()).isEqualTo(StateType.COMPOSITE);
        assertThat(diagram.states().get("Outer").substates()).containsExactly("Inner1", "Inner2");
    }

    @Test
    void parse_nestedComposites_formTree() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            state Outer {
                state Middle {
                    Leaf
                }
                Sibling
            }
            """);

        assertThat(diagram.states().get("Outer").substates()).containsExactly("Middle", "Sibling");
        assertThat(diagram.states().get("Middle").stateType()).isEqualTo(StateType.COMPOSITE);
        assertThat(diagram.states().get("Middle").substates()).containsExactly("Leaf");
    }

    @Test
    void parse_looseOpeningBrace_doesNotOpenComposite() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            A --> B
            {
            C --> D
            """);

        assertThat(diagram.states().values())
            .extracting(State::stateType)
            .containsOnly(StateType.SIMPLE);
        assertThat(diagram.transitions()).hasSize(2);
    }

    @Test
    void parse_declarations_setDisplayNamesAndTypes() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            state "Waiting for input" as Waiting
            state Decide <<choice>>
            state Split <<fork>>
            state Merge <<join>>
            Waiting : Idle until a key is pressed
            Plain
            """);

        assertThat(diagram.states().get("Waiting").displayName()).isEqualTo("Idle until a key is pressed");
        assertThat(diagram.states().get("Decide").stateType()).isEqualTo(StateType.CHOICE);
        assertThat(diagram.states().get("Split").stateType()).isEqualTo(StateType.FORK);
        assertThat(diagram.states().get("Merge").stateType()).isEqualTo(StateType.JOIN);
        assertThat(diagram.states().get("Plain").stateType()).isEqualTo(StateType.SIMPLE);
    }

    @Test
    void parse_quotedDeclaration_keepsDisplayName() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            state "Long name" as S
            S --> T
            """);

        assertThat(diagram.states().get("S").displayName()).isEqualTo("Long name");
        assertThat(diagram.states()).containsOnlyKeys("S", "T");
    }

    @Test
    void parse_laterSimpleDeclaration_keepsChoiceType() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            state Check <<choice>>
            Check --> Yes : [ok]
            state Check
            """);

        assertThat(diagram.states().get("Check").stateType()).isEqualTo(StateType.CHOICE);
        assertThat(diagram.transitions().get(0).guard()).isEqualTo("ok");
        assertThat(diagram.transitions().get(0).event()).isNull();
    }

    @Test
    void parse_notes_recordsPositionTargetAndText() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            A --> B
            note right of A : single line
            note left of B
                first
                second
            end note
            """);

        assertThat(diagram.notes()).containsExactly(
            new StateNote(StateNotePosition.RIGHT_OF, "A", "single line"),
            new StateNote(StateNotePosition.LEFT_OF, "B", "first\nsecond"));
        assertThat(diagram.states()).containsOnlyKeys("A", "B");
    }

    @Test
    void parse_directivesAndIgnoredStatements_areNotStates() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            title Traffic light
            accTitle: Lights
            accDescr {
                Cycles through
                three colours
            }
            direction LR
            %% comment
            Red --> Green
            --
            Green --> Yellow
            """);

        assertThat(diagram.title()).isEqualTo("Traffic light");
        assertThat(diagram.accessibility().title()).isEqualTo("Lights");
        assertThat(diagram.accessibility().description()).isEqualTo("Cycles through three colours");
        assertThat(diagram.states()).containsOnlyKeys("Red", "Green", "Yellow");
    }

    @Test
    void parse_stateNamedLikeKeyword_isNotTreatedAsDirection() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            direction TB
            directionFinder --> Idle
            """);

        assertThat(diagram.states()).containsOnlyKeys("directionFinder", "Idle");
        assertThat(diagram.transitions()).extracting(StateTransition::from, StateTransition::to)
            .containsExactly(tuple("directionFinder", "Idle"));
    }

    @Test
    void parse_malformedLines_areSkipped() throws DiagramParseException {
        // Given: lines the grammar cannot interpret mixed with valid ones
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            A --> B
            --> C
            D -->
            E --> F --> G
            this is not a statement
            }
            B --> A
            """);

        // Then: only the valid transitions survive
        assertThat(diagram.transitions()).extracting(StateTransition::from, StateTransition::to)
            .containsExactly(tuple("A", "B"), tuple("B", "A"));
        assertThat(diagram.states()).containsOnlyKeys("A", "B");
    }

    @Test
    void parse_selfLoopAndDuplicateTransitions_areKept() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            stateDiagram-v2
            A --> A
            A --> B
            A --> B
            """);

        assertThat(diagram.transitions()).hasSize(3);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\n", "%% only a comment\n// another"})
    void parse_emptyInput_throwsEmptyInput(String source) {
        assertThatThrownBy(() -> grammar.parse(source))
            .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void parse_wrongHeader_throwsSyntaxError() {
        assertThatThrownBy(() -> grammar.parse("flowchart TD\nA --> B"))
            .isInstanceOf(DiagramSyntaxException.class)
            .hasMessageContaining("stateDiagram");
    }

    @Test
    void parse_leadingCommentsBeforeHeader_areAllowed() throws DiagramParseException {
        StateDiagram diagram = grammar.parse("""
            %% generated
            
            stateDiagram
            A --> B
            """);

        assertThat(diagram.states()).containsOnlyKeys("A", "B");
    }
}
