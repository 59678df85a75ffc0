package com.diagramparser.core.grammar.base;

import com.diagramparser.core.error.DiagramSyntaxException;
import com.diagramparser.core.error.EnhancedSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks that the first meaningful line of a diagram starts with one of the grammar's
 * header literals.
 *
 * <p>An instance tracks whether the header has been seen yet, so it belongs to a single
 * parse. Lines before the header that are blank or comments ({@code %%}, {@code //} and
 * {@code #}, the same set {@code DiagramTypeSniffer} skips) are marked as skippable;
 * once the header is matched every later line passes through unchecked.
 *
 * <p><b>Matching rules:</b>
 * <ul>
 *   <li>Case-sensitive prefix match on the trimmed line</li>
 *   <li>The longest matching literal wins, so {@code stateDiagram-v2} is reported over {@code stateDiagram}</li>
 *   <li>A near miss (different case, or at most two edits away) raises an
 *       {@link EnhancedSyntaxException} with a suggestion; any other mismatch raises a
 *       plain {@link DiagramSyntaxException}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class HeaderValidator {

    private static final int MAX_SUGGESTION_DISTANCE = 2;

    private final List<String> literals;
    private boolean headerSeen;

    /**
     * @param literals accepted header literals
     */
    public HeaderValidator(List<String> literals) {
        if (literals == null || literals.isEmpty()) {
            throw new IllegalArgumentException("At least one header literal required");
        }
        this.literals = List.copyOf(literals);
    }

    /**
     * Classifies a line and validates it if it is the first meaningful one.
     *
     * @param line raw line
     * @param lineNumber 1-based line number, used in error locations
     * @return trimmed line with skip and header flags
     * @throws DiagramSyntaxException if this is the first meaningful line and it matches no literal
     */
    public ValidatedLine validate(String line, int lineNumber) throws DiagramSyntaxException {
        String trimmed = line.trim();
        if (LexicalRules.isSkippable(trimmed)) {
            return new ValidatedLine(trimmed, lineNumber, true, null);
        }
        if (headerSeen) {
            return new ValidatedLine(trimmed, lineNumber, false, null);
        }
        if (LexicalRules.isPreambleLine(trimmed)) {
            return new ValidatedLine(trimmed, lineNumber, true, null);
        }

        String matched = longestMatch(trimmed);
        if (matched == null) {
            throw mismatch(line, trimmed, lineNumber);
        }
        headerSeen = true;
        return new ValidatedLine(trimmed, lineNumber, true, matched);
    }

    public boolean isHeaderSeen() {
        return headerSeen;
    }

    private String longestMatch(String trimmed) {
        String best = null;
        for (String literal : literals) {
            if (trimmed.startsWith(literal) && (best == null || literal.length() > best.length())) {
                best = literal;
            }
        }
        return best;
    }

    private DiagramSyntaxException mismatch(String rawLine, String trimmed, int lineNumber) {
        int column = LexicalRules.leadingWhitespace(rawLine) + 1;
        String keyword = firstWord(trimmed);
        String detail = "Invalid diagram header";

        List<String> suggestions = new ArrayList<>();
        for (String literal : literals) {
            if (isNearMiss(keyword, literal)) {
                suggestions.add("did you mean '" + literal + "'?");
            }
        }
        if (suggestions.isEmpty()) {
            return new DiagramSyntaxException(detail, literals, trimmed, lineNumber, column);
        }
        String snippet = EnhancedSyntaxException.formatSnippet(rawLine, lineNumber, column, keyword.length());
        return new EnhancedSyntaxException(detail, literals, trimmed, lineNumber, column, suggestions, snippet);
    }

    private static String firstWord(String trimmed) {
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end);
    }

    private static boolean isNearMiss(String found, String literal) {
        if (found.toLowerCase(Locale.ROOT).equals(literal.toLowerCase(Locale.ROOT))) {
            return true;
        }
        if (Math.abs(found.length() - literal.length()) > MAX_SUGGESTION_DISTANCE) {
            return false;
        }
        return editDistance(found, literal) <= MAX_SUGGESTION_DISTANCE;
    }

    /**
     * Levenshtein distance with a two-row table.
     */
    static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
