package com.diagramparser.core.grammar.impl.state;

import com.diagramparser.core.error.DiagramParseException;
import com.diagramparser.core.grammar.base.AbstractLineGrammar;
import com.diagramparser.core.grammar.base.DirectiveAccumulator;
import com.diagramparser.core.grammar.base.HeaderLiterals;
import com.diagramparser.core.grammar.base.HeaderValidator;
import com.diagramparser.core.grammar.base.LexicalRules;
import com.diagramparser.core.grammar.base.ValidatedLine;
import com.diagramparser.core.model.DiagramKind;
import com.diagramparser.core.model.state.State;
import com.diagramparser.core.model.state.StateDiagram;
import com.diagramparser.core.model.state.StateNote;
import com.diagramparser.core.model.state.StateNotePosition;
import com.diagramparser.core.model.state.StateTransition;
import com.diagramparser.core.model.state.StateType;
import com.diagramparser.core.model.state.StateVersion;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar for {@code stateDiagram} and {@code stateDiagram-v2}.
 *
 * <p>Lines are read one at a time. The only structural state is the stack of open
 * composite states kept by {@link StateTable}; everything else is written straight
 * into the output.
 *
 * <p><b>Supported statements:</b>
 * <ul>
 *   <li>{@code A --> B : event [guard] / action}</li>
 *   <li>{@code state "Display name" as A}, {@code state A <<choice>>} (also fork, join, end)</li>
 *   <li><code>state A {</code>, <code>A {</code>, or {@code A} followed by a line holding only <code>{</code>;
 *       closed by <code>}</code></li>
 *   <li>{@code A : description}</li>
 *   <li>{@code note left of A : text} and the multi-line form ending in {@code end note}</li>
 *   <li>{@code direction LR} and {@code --} separators, accepted and ignored</li>
 * </ul>
 *
 * <p>Malformed lines are skipped. Only empty input and a bad header fail the parse.
 *
 * @since 1.0.0
 */
public class StateDiagramGrammar extends AbstractLineGrammar<StateDiagram> {

    private static final String ARROW = "-->";
    private static final String STATE_KEYWORD = "state ";
    private static final String NOTE_KEYWORD = "note ";
    private static final String END_NOTE = "end note";
    private static final String DIRECTION_KEYWORD = "direction";
    private static final String CONCURRENCY_SEPARATOR = "--";
    private static final String OPEN_BRACE = "{";
    private static final String CLOSE_BRACE = "}";

    private static final Pattern QUOTED_DECLARATION =
        Pattern.compile("^\"([^\"]*)\"\\s+as\\s+(\\S+)$");
    private static final Pattern STEREOTYPE =
        Pattern.compile("^(\\S+)\\s*<<\\s*(\\w+)\\s*>>$");
    private static final Pattern ID_AS_QUOTED =
        Pattern.compile("^(\\S+)\\s+as\\s+\"([^\"]*)\"$");

    @Override
    public DiagramKind getKind() {
        return DiagramKind.STATE;
    }

    @Override
    public String getDisplayName() {
        return "State Diagram Grammar";
    }

    @Override
    public List<String> getHeaderLiterals() {
        return HeaderLiterals.STATE;
    }

    @Override
    protected StateDiagram parseLines(List<String> lines) throws DiagramParseException {
        HeaderValidator header = newHeaderValidator();
        DirectiveAccumulator directives = new DirectiveAccumulator();
        StateTable table = new StateTable();
        List<StateTransition> transitions = new ArrayList<>();
        List<StateNote> notes = new ArrayList<>();
        StateVersion version = StateVersion.V1;
        int looseBraces = 0;

        int index = 0;
        while (index < lines.size()) {
            ValidatedLine line = header.validate(lines.get(index), index + 1);
            index++;
            if (line.isHeader()) {
                version = HeaderLiterals.STATE_V2.equals(line.header()) ? StateVersion.V2 : StateVersion.V1;
                continue;
            }
            if (line.skip() || directives.accept(line.text())) {
                continue;
            }

            String text = line.text();
            if (LexicalRules.startsWithWord(text, DIRECTION_KEYWORD) || text.equals(CONCURRENCY_SEPARATOR)) {
                continue;
            }
            if (text.startsWith(NOTE_KEYWORD)) {
                index = parseNote(text, lines, index, notes, line);
                continue;
            }
            if (text.startsWith(STATE_KEYWORD)) {
                if (nextLineOpensBlock(lines, index) && parseStateDeclaration(text + " " + OPEN_BRACE, table)) {
                    index++;
                } else if (!parseStateDeclaration(text, table)) {
                    skipped(line);
                }
                continue;
            }
            if (text.equals(OPEN_BRACE)) {
                looseBraces++;
                continue;
            }
            if (text.equals(CLOSE_BRACE)) {
                if (!table.exitComposite()) {
                    log.debug("Unbalanced '}' at line {}", line.lineNumber());
                }
                continue;
            }
            if (text.endsWith(" " + OPEN_BRACE)) {
                String id = text.substring(0, text.length() - 2).trim();
                if (LexicalRules.isIdentifier(id)) {
                    table.enterComposite(id);
                } else {
                    skipped(line);
                }
                continue;
            }
            if (text.contains(ARROW)) {
                StateTransition transition = parseTransition(text, table);
                if (transition == null) {
                    skipped(line);
                } else {
                    transitions.add(transition);
                }
                continue;
            }
            if (parseDescription(text, table)) {
                continue;
            }
            if (LexicalRules.isIdentifier(text)) {
                if (nextLineOpensBlock(lines, index)) {
                    table.enterComposite(text);
                    index++;
                } else {
                    table.touch(text);
                }
                continue;
            }
            skipped(line);
        }
        directives.finish();

        if (looseBraces > 0 || table.depth() > 0) {
            log.debug("State diagram ended with {} loose opening braces and {} unclosed composites", looseBraces, table.depth());
        }
        Map<String, State> states = table.toStates(transitions);
        log.debug("Parsed state diagram: {} states, {} transitions, {} notes",
            states.size(), transitions.size(), notes.size());
        return new StateDiagram(directives.getTitle(), directives.getAccessibility(), version,
            states, transitions, notes);
    }

    private static boolean nextLineOpensBlock(List<String> lines, int nextIndex) {
        return nextIndex < lines.size() && lines.get(nextIndex).trim().equals(OPEN_BRACE);
    }

    /**
     * Handles {@code state ...} lines, including a trailing <code>{</code>.
     *
     * @return false if the declaration is malformed
     */
    private boolean parseStateDeclaration(String text, StateTable table) {
        String body = text.substring(STATE_KEYWORD.length()).trim();
        boolean opensBlock = body.endsWith(OPEN_BRACE);
        if (opensBlock) {
            body = body.substring(0, body.length() - 1).trim();
        }
        if (body.isEmpty()) {
            return false;
        }

        String id;
        String displayName = null;
        StateType type = StateType.SIMPLE;

        Matcher quoted = QUOTED_DECLARATION.matcher(body);
        Matcher idAsQuoted = ID_AS_QUOTED.matcher(body);
        Matcher stereotype = STEREOTYPE.matcher(body);
        if (quoted.matches()) {
            displayName = quoted.group(1);
            id = quoted.group(2);
        } else if (idAsQuoted.matches()) {
            id = idAsQuoted.group(1);
            displayName = idAsQuoted.group(2);
        } else if (stereotype.matches()) {
            id = stereotype.group(1);
            type = stereotypeType(stereotype.group(2));
        } else if (LexicalRules.isIdentifier(body)) {
            id = body;
        } else {
            return false;
        }

        table.declare(id, type, displayName);
        if (opensBlock) {
            table.enterComposite(id);
        }
        return true;
    }

    private static StateType stereotypeType(String stereotype) {
        return switch (stereotype.toLowerCase(Locale.ROOT)) {
            case "choice" -> StateType.CHOICE;
            case "fork" -> StateType.FORK;
            case "join" -> StateType.JOIN;
            case "end" -> StateType.END;
            default -> StateType.SIMPLE;
        };
    }

    /**
     * Parses {@code A --> B : label}; returns null for malformed transitions.
     */
    private StateTransition parseTransition(String text, StateTable table) {
        int arrow = text.indexOf(ARROW);
        if (text.indexOf(ARROW, arrow + ARROW.length()) >= 0) {
            return null;
        }
        String from = text.substring(0, arrow).trim();
        String right = text.substring(arrow + ARROW.length()).trim();

        String to = right;
        String label = null;
        int colon = right.indexOf(':');
        if (colon >= 0) {
            to = right.substring(0, colon).trim();
            label = right.substring(colon + 1).trim();
        }
        if (from.isEmpty() || to.isEmpty()) {
            return null;
        }

        table.touch(from);
        table.touch(to);
        TransitionLabel parts = TransitionLabel.parse(label);
        return new StateTransition(from, to, parts.event(), parts.guard(), parts.action());
    }

    /**
     * Handles {@code A : description}, which names a state.
     */
    private static boolean parseDescription(String text, StateTable table) {
        String[] parts = LexicalRules.splitFirst(text, ":");
        if (parts == null || !LexicalRules.isIdentifier(parts[0])) {
            return false;
        }
        StateTable.Entry entry = table.touch(parts[0]);
        if (entry != null && !parts[1].isEmpty()) {
            entry.setDisplayName(parts[1]);
        }
        return true;
    }

    /**
     * Parses a note; for the multi-line form consumes lines up to {@code end note}.
     *
     * @return index of the next unread line
     */
    private int parseNote(String text, List<String> lines, int nextIndex, List<StateNote> notes, ValidatedLine line) {
        String rest = text.substring(NOTE_KEYWORD.length()).trim();
        StateNotePosition position = null;
        for (StateNotePosition candidate : StateNotePosition.values()) {
            String keyword = candidate.name().toLowerCase(Locale.ROOT).replace('_', ' ') + " ";
            if (rest.startsWith(keyword)) {
                position = candidate;
                rest = rest.substring(keyword.length()).trim();
                break;
            }
        }
        if (position == null) {
            skipped(line);
            return nextIndex;
        }

        String[] parts = LexicalRules.splitFirst(rest, ":");
        if (parts != null) {
            if (!parts[0].isEmpty()) {
                notes.add(new StateNote(position, parts[0], parts[1]));
            }
            return nextIndex;
        }

        List<String> body = new ArrayList<>();
        int index = nextIndex;
        while (index < lines.size()) {
            String noteLine = lines.get(index).trim();
            index++;
            if (noteLine.equals(END_NOTE)) {
                break;
            }
            body.add(noteLine);
        }
        if (!rest.isEmpty()) {
            notes.add(new StateNote(position, rest, String.join("\n", body)));
        }
        return index;
    }
}
