package com.diagramparser.core.grammar.impl.sequence;

import com.diagramparser.core.grammar.base.DirectiveAccumulator;
import com.diagramparser.core.grammar.base.LexicalRules;
import com.diagramparser.core.model.sequence.Activate;
import com.diagramparser.core.model.sequence.Alt;
import com.diagramparser.core.model.sequence.AutoNumber;
import com.diagramparser.core.model.sequence.Create;
import com.diagramparser.core.model.sequence.Critical;
import com.diagramparser.core.model.sequence.Deactivate;
import com.diagramparser.core.model.sequence.Destroy;
import com.diagramparser.core.model.sequence.Loop;
import com.diagramparser.core.model.sequence.Message;
import com.diagramparser.core.model.sequence.Note;
import com.diagramparser.core.model.sequence.NotePosition;
import com.diagramparser.core.model.sequence.Opt;
import com.diagramparser.core.model.sequence.Par;
import com.diagramparser.core.model.sequence.Participant;
import com.diagramparser.core.model.sequence.ParticipantType;
import com.diagramparser.core.model.sequence.SequenceStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser over the body lines of one sequence diagram.
 *
 * <p>A cursor walks the trimmed body lines. Each block keyword ({@code loop}, {@code alt},
 * {@code opt}, {@code par}, {@code critical}) parses its body with a recursive call that
 * stops at a terminator line: {@code end}, or a branch keyword of the enclosing block
 * ({@code else}, {@code and}, {@code option}). A block missing its {@code end} is closed
 * at end of input.
 *
 * <p>{@code rect}, {@code break} and {@code box} blocks have no node of their own; their
 * statements are spliced into the enclosing list so that their {@code end} does not close
 * an outer block.
 *
 * <p>Blocks nested deeper than {@code maxBlockDepth} are consumed without recursion and
 * dropped from the tree.
 */
final class SequenceBodyParser {

    private static final Logger log = LoggerFactory.getLogger(SequenceBodyParser.class);

    private static final String END = "end";
    private static final String ELSE = "else";
    private static final String AND = "and";
    private static final String OPTION = "option";

    private static final Set<String> END_ONLY = Set.of(END);
    private static final Set<String> ALT_TERMINATORS = Set.of(END, ELSE);
    private static final Set<String> PAR_TERMINATORS = Set.of(END, AND);
    private static final Set<String> CRITICAL_TERMINATORS = Set.of(END, OPTION);
    private static final Set<String> BLOCK_OPENERS =
        Set.of("loop", "alt", "opt", "par", "critical", "rect", "break", "box");
    private static final Set<String> TRANSPARENT_BLOCKS = Set.of("rect", "break", "box");

    private static final String PARTICIPANT = "participant ";
    private static final String ACTOR = "actor ";
    private static final String CREATE = "create ";
    private static final String DESTROY = "destroy ";
    private static final String ACTIVATE = "activate ";
    private static final String DEACTIVATE = "deactivate ";
    private static final String NOTE = "note ";
    private static final String AUTONUMBER = "autonumber";
    private static final String AS = " as ";

    private final List<String> lines;
    private final int maxBlockDepth;
    private final ParticipantRegistry participants = new ParticipantRegistry();
    private final DirectiveAccumulator directives = new DirectiveAccumulator();
    private AutoNumber autonumber;
    private int cursor;

    /**
     * @param lines trimmed body lines, header excluded
     * @param maxBlockDepth deepest block level kept in the tree
     */
    SequenceBodyParser(List<String> lines, int maxBlockDepth) {
        this.lines = lines;
        this.maxBlockDepth = maxBlockDepth;
    }

    /**
     * Parses the whole body.
     *
     * @return top-level statements
     */
    List<SequenceStatement> parse() {
        // No terminators at top level: a stray 'end' is skipped like any unknown line
        List<SequenceStatement> statements = parseStatements(0, Set.of());
        directives.finish();
        if (participants.hasLateAliases()) {
            log.debug("Resolving endpoints again for aliases declared after first use");
            statements = new EndpointResolver(participants).resolveAll(statements);
        }
        return statements;
    }

    ParticipantRegistry participants() {
        return participants;
    }

    DirectiveAccumulator directives() {
        return directives;
    }

    AutoNumber autonumber() {
        return autonumber;
    }

    /**
     * Parses statements until a line whose keyword is in {@code terminators}, which is
     * left unconsumed, or until end of input.
     */
    private List<SequenceStatement> parseStatements(int depth, Set<String> terminators) {
        List<SequenceStatement> statements = new ArrayList<>();
        while (cursor < lines.size()) {
            String line = lines.get(cursor);
            if (LexicalRules.isSkippable(line)) {
                cursor++;
                continue;
            }
            if (directives.accept(line)) {
                cursor++;
                continue;
            }
            String keyword = keyword(line);
            if (terminators.contains(keyword)) {
                return statements;
            }
            if (BLOCK_OPENERS.contains(keyword)) {
                parseBlock(keyword, line, depth + 1, statements);
                continue;
            }
            cursor++;
            parseSimpleStatement(line, statements);
        }
        return statements;
    }

    private void parseBlock(String keyword, String line, int depth, List<SequenceStatement> out) {
        if (depth > maxBlockDepth) {
            log.debug("Dropping '{}' block nested {} levels deep (limit {})", keyword, depth, maxBlockDepth);
            skipBlock();
            return;
        }
        String condition = line.substring(keyword.length()).trim();
        cursor++;

        if (TRANSPARENT_BLOCKS.contains(keyword)) {
            out.addAll(parseStatements(depth, END_ONLY));
            consume(END);
            return;
        }

        switch (keyword) {
            case "loop" -> {
                List<SequenceStatement> body = parseStatements(depth, END_ONLY);
                consume(END);
                out.add(new Loop(condition, body));
            }
            case "opt" -> {
                List<SequenceStatement> body = parseStatements(depth, END_ONLY);
                consume(END);
                out.add(new Opt(condition, body));
            }
            case "alt" -> out.add(parseAlt(condition, depth));
            case "par" -> out.add(parsePar(condition, depth));
            case "critical" -> out.add(parseCritical(condition, depth));
            default -> throw new IllegalStateException("Unhandled block keyword: " + keyword);
        }
    }

    private Alt parseAlt(String condition, int depth) {
        List<SequenceStatement> primary = parseStatements(depth, ALT_TERMINATORS);
        boolean sawElse = false;
        String elseCondition = null;
        List<SequenceStatement> elseStatements = new ArrayList<>();
        while (cursor < lines.size() && ELSE.equals(keyword(lines.get(cursor)))) {
            String branchCondition = lines.get(cursor).substring(ELSE.length()).trim();
            if (!sawElse && !branchCondition.isEmpty()) {
                elseCondition = branchCondition;
            }
            sawElse = true;
            cursor++;
            elseStatements.addAll(parseStatements(depth, ALT_TERMINATORS));
        }
        consume(END);
        Alt.ElseBranch elseBranch = sawElse ? new Alt.ElseBranch(elseCondition, elseStatements) : null;
        return new Alt(condition, primary, elseBranch);
    }

    private Par parsePar(String condition, int depth) {
        List<Par.Branch> branches = new ArrayList<>();
        branches.add(new Par.Branch(emptyToNull(condition), parseStatements(depth, PAR_TERMINATORS)));
        while (cursor < lines.size() && AND.equals(keyword(lines.get(cursor)))) {
            String branchCondition = lines.get(cursor).substring(AND.length()).trim();
            cursor++;
            branches.add(new Par.Branch(emptyToNull(branchCondition), parseStatements(depth, PAR_TERMINATORS)));
        }
        consume(END);
        return new Par(branches);
    }

    private Critical parseCritical(String condition, int depth) {
        List<SequenceStatement> body = parseStatements(depth, CRITICAL_TERMINATORS);
        List<Critical.Option> options = new ArrayList<>();
        while (cursor < lines.size() && OPTION.equals(keyword(lines.get(cursor)))) {
            String optionCondition = lines.get(cursor).substring(OPTION.length()).trim();
            cursor++;
            options.add(new Critical.Option(optionCondition, parseStatements(depth, CRITICAL_TERMINATORS)));
        }
        consume(END);
        return new Critical(condition, body, options);
    }

    /**
     * Consumes a block and everything nested in it without building statements.
     */
    private void skipBlock() {
        int level = 0;
        while (cursor < lines.size()) {
            String keyword = keyword(lines.get(cursor));
            cursor++;
            if (BLOCK_OPENERS.contains(keyword)) {
                level++;
            } else if (END.equals(keyword) && --level == 0) {
                return;
            }
        }
    }

    private void consume(String keyword) {
        if (cursor < lines.size() && keyword.equals(keyword(lines.get(cursor)))) {
            cursor++;
        } else {
            log.debug("Block closed at end of input without '{}'", keyword);
        }
    }

    private void parseSimpleStatement(String line, List<SequenceStatement> out) {
        if (line.startsWith(PARTICIPANT) || line.startsWith(ACTOR)) {
            declareParticipant(line);
            return;
        }
        if (line.startsWith(CREATE)) {
            Participant created = parseCreate(line.substring(CREATE.length()).trim());
            if (created != null) {
                out.add(new Create(created));
            } else {
                log.debug("Skipping malformed create: '{}'", line);
            }
            return;
        }
        if (line.startsWith(DESTROY)) {
            out.add(new Destroy(participants.ensure(line.substring(DESTROY.length()).trim())));
            return;
        }
        if (line.startsWith(ACTIVATE)) {
            out.add(new Activate(participants.ensure(line.substring(ACTIVATE.length()).trim())));
            return;
        }
        if (line.startsWith(DEACTIVATE)) {
            out.add(new Deactivate(participants.ensure(line.substring(DEACTIVATE.length()).trim())));
            return;
        }
        if (line.startsWith(NOTE)) {
            Note note = parseNote(line.substring(NOTE.length()).trim());
            if (note != null) {
                out.add(note);
            } else {
                log.debug("Ignoring note without position: '{}'", line);
            }
            return;
        }
        if (AUTONUMBER.equals(keyword(line))) {
            autonumber = parseAutonumber(line);
            return;
        }
        if (!parseMessage(line, out)) {
            log.debug("Skipping unrecognised line: '{}'", line);
        }
    }

    private Participant declareParticipant(String line) {
        boolean actor = line.startsWith(ACTOR);
        String declaration = line.substring(actor ? ACTOR.length() : PARTICIPANT.length()).trim();
        if (declaration.isEmpty()) {
            return null;
        }
        String name = declaration;
        String alias = null;
        int as = declaration.indexOf(AS);
        if (as >= 0) {
            name = declaration.substring(0, as).trim();
            alias = declaration.substring(as + AS.length()).trim();
            if (alias.isEmpty()) {
                alias = null;
            }
        }
        return participants.declare(name, alias, actor ? ParticipantType.ACTOR : ParticipantType.PARTICIPANT);
    }

    private Participant parseCreate(String rest) {
        if (!rest.startsWith(PARTICIPANT) && !rest.startsWith(ACTOR)) {
            return null;
        }
        return declareParticipant(rest);
    }

    /**
     * Parses the text after {@code note }; returns null without a known position.
     */
    private Note parseNote(String rest) {
        NotePosition position;
        String remainder;
        if (rest.startsWith("left of ")) {
            position = NotePosition.LEFT_OF;
            remainder = rest.substring("left of ".length());
        } else if (rest.startsWith("right of ")) {
            position = NotePosition.RIGHT_OF;
            remainder = rest.substring("right of ".length());
        } else if (rest.startsWith("over ")) {
            position = NotePosition.OVER;
            remainder = rest.substring("over ".length());
        } else {
            return null;
        }

        String actors = remainder.trim();
        String text = "";
        int colon = remainder.indexOf(':');
        if (colon >= 0) {
            actors = remainder.substring(0, colon).trim();
            text = remainder.substring(colon + 1).trim();
        }
        if (actors.isEmpty()) {
            return null;
        }
        List<String> resolved = new ArrayList<>();
        for (String actor : actors.split(",")) {
            String trimmed = actor.trim();
            if (!trimmed.isEmpty()) {
                resolved.add(participants.resolve(trimmed));
            }
        }
        return new Note(position, String.join(",", resolved), text);
    }

    private static AutoNumber parseAutonumber(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length > 1 && parts[1].equalsIgnoreCase("off")) {
            return new AutoNumber(null, null, false);
        }
        Integer start = parts.length > 1 ? parseInteger(parts[1]) : null;
        Integer step = parts.length > 2 ? parseInteger(parts[2]) : null;
        return new AutoNumber(start, step, true);
    }

    private static Integer parseInteger(String token) {
        try {
            return Integer.valueOf(token);
        } catch (NumberFormatException e) {
            log.debug("Non-numeric autonumber value '{}'", token);
            return null;
        }
    }

    /**
     * Parses {@code From ARROW To : text}; the arrow is searched before the first colon
     * so that arrows inside the message text are ignored.
     *
     * @return false if the line is not a message
     */
    private boolean parseMessage(String line, List<SequenceStatement> out) {
        int colon = line.indexOf(':');
        String head = colon >= 0 ? line.substring(0, colon) : line;
        String text = colon >= 0 ? line.substring(colon + 1).trim() : "";

        for (MessageArrow arrow : MessageArrow.LONGEST_FIRST) {
            int position = head.indexOf(arrow.literal());
            if (position < 0) {
                continue;
            }
            String fromName = head.substring(0, position).trim();
            String toName = head.substring(position + arrow.literal().length()).trim();

            boolean activateTarget = toName.startsWith("+");
            boolean deactivateSource = toName.startsWith("-");
            if (activateTarget || deactivateSource) {
                toName = toName.substring(1).trim();
            }
            if (fromName.isEmpty() || toName.isEmpty()) {
                return false;
            }

            String from = participants.ensure(fromName);
            String to = participants.ensure(toName);
            out.add(new Message(from, to, text, arrow.type()));
            if (activateTarget) {
                out.add(new Activate(to));
            } else if (deactivateSource) {
                out.add(new Deactivate(from));
            }
            return true;
        }
        return false;
    }

    private static String keyword(String line) {
        int space = 0;
        while (space < line.length() && !Character.isWhitespace(line.charAt(space))) {
            space++;
        }
        return line.substring(0, space);
    }

    private static String emptyToNull(String text) {
        return text == null || text.isEmpty() ? null : text;
    }
}
