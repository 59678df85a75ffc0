package com.diagramparser.core.grammar.base;

import com.diagramparser.core.model.AccessibilityInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects {@code title}, {@code accTitle} and {@code accDescr} directives from diagram bodies.
 *
 * <p>Recognised forms:
 * <pre>
 * title Some title
 * accTitle: Accessible title      (also "accTitle Accessible title")
 * accDescr: One-line description  (also "accDescr One-line description")
 * accDescr {
 *     Multi-line description,
 *     joined with single spaces
 * }
 * </pre>
 *
 * <p>Inside an {@code accDescr} block every line is consumed; comment and blank lines
 * are dropped and the rest is joined with single spaces. The accumulator is a two-state
 * machine ({@link Mode#IDLE}, {@link Mode#IN_BLOCK}); one instance belongs to a single parse.
 *
 * @since 1.0.0
 */
public class DirectiveAccumulator {

    /**
     * Parsing mode of the accumulator.
     */
    public enum Mode {
        IDLE,
        IN_BLOCK
    }

    private static final String TITLE = "title ";
    private static final String ACC_TITLE = "accTitle";
    private static final String ACC_DESCR = "accDescr";
    private static final String BLOCK_END = "}";

    private Mode mode = Mode.IDLE;
    private final List<String> blockLines = new ArrayList<>();
    private String title;
    private String accTitle;
    private String accDescr;

    /**
     * Offers a trimmed line to the accumulator.
     *
     * @param line trimmed line
     * @return true if the line was a directive (or part of a block) and must not be parsed further
     */
    public boolean accept(String line) {
        if (mode == Mode.IN_BLOCK) {
            if (line.equals(BLOCK_END)) {
                closeBlock();
            } else if (line.endsWith(BLOCK_END) && !line.startsWith(LexicalRules.COMMENT_MARKER)) {
                blockLines.add(line.substring(0, line.length() - 1).trim());
                closeBlock();
            } else if (!LexicalRules.isSkippable(line)) {
                blockLines.add(line);
            }
            return true;
        }

        if (line.startsWith(TITLE)) {
            title = line.substring(TITLE.length()).trim();
            return true;
        }
        String value = keywordValue(line, ACC_TITLE);
        if (value != null) {
            accTitle = value;
            return true;
        }
        if (line.startsWith(ACC_DESCR)) {
            String rest = line.substring(ACC_DESCR.length()).trim();
            if (rest.startsWith("{")) {
                openBlock(rest.substring(1).trim());
                return true;
            }
            value = keywordValue(line, ACC_DESCR);
            if (value != null) {
                accDescr = value;
                return true;
            }
        }
        return false;
    }

    /**
     * Flushes an {@code accDescr} block left open at end of input.
     */
    public void finish() {
        if (mode == Mode.IN_BLOCK) {
            closeBlock();
        }
    }

    public Mode getMode() {
        return mode;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return accessibility info gathered so far
     */
    public AccessibilityInfo getAccessibility() {
        return new AccessibilityInfo(accTitle, accDescr);
    }

    private void openBlock(String inline) {
        mode = Mode.IN_BLOCK;
        blockLines.clear();
        if (inline.isEmpty()) {
            return;
        }
        // accDescr { text } on one line
        if (inline.endsWith(BLOCK_END)) {
            blockLines.add(inline.substring(0, inline.length() - 1).trim());
            closeBlock();
        } else {
            blockLines.add(inline);
        }
    }

    private void closeBlock() {
        List<String> parts = new ArrayList<>();
        for (String part : blockLines) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        accDescr = String.join(" ", parts);
        blockLines.clear();
        mode = Mode.IDLE;
    }

    /**
     * Matches {@code keyword: value} and {@code keyword value}.
     */
    private static String keywordValue(String line, String keyword) {
        if (!line.startsWith(keyword)) {
            return null;
        }
        String rest = line.substring(keyword.length());
        if (rest.startsWith(":")) {
            return rest.substring(1).trim();
        }
        if (rest.startsWith(" ")) {
            return rest.trim();
        }
        return null;
    }
}
