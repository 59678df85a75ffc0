package com.diagramparser.core.grammar.base;

/**
 * Line classification and small text helpers shared by every grammar.
 *
 * @since 1.0.0
 */
public final class LexicalRules {

    public static final String COMMENT_MARKER = "%%";
    public static final String ALT_COMMENT_MARKER = "//";
    public static final String HASH_COMMENT_MARKER = "#";

    private LexicalRules() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns true for blank lines and for lines whose first non-blank characters are
     * {@code %%} or {@code //}.
     *
     * @param line raw or trimmed line, may be {@code null}
     * @return true if the line carries no diagram content
     */
    public static boolean isSkippable(String line) {
        if (line == null) {
            return true;
        }
        String trimmed = line.trim();
        return trimmed.isEmpty() || isComment(trimmed);
    }

    /**
     * Returns true for lines that may precede a diagram header: skippable lines and
     * {@code #} comments. {@code #} is not a comment inside a diagram body.
     *
     * @param line raw or trimmed line, may be {@code null}
     * @return true if the line is ignored before the header
     */
    public static boolean isPreambleLine(String line) {
        return isSkippable(line) || line.trim().startsWith(HASH_COMMENT_MARKER);
    }

    /**
     * @param trimmed trimmed line
     * @return true if the line is a comment
     */
    public static boolean isComment(String trimmed) {
        return trimmed.startsWith(COMMENT_MARKER) || trimmed.startsWith(ALT_COMMENT_MARKER);
    }

    /**
     * Counts leading whitespace characters.
     *
     * @param line raw line
     * @return number of leading whitespace characters
     */
    public static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }

    /**
     * Strips one pair of matching surrounding double or single quotes, after trimming.
     *
     * @param text text to unquote
     * @return trimmed text without surrounding quotes
     */
    public static String unquote(String text) {
        String trimmed = text.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    /**
     * Splits on the first occurrence of a separator.
     *
     * @param text text to split
     * @param separator separator literal
     * @return two trimmed parts, or {@code null} if the separator is absent
     */
    public static String[] splitFirst(String text, String separator) {
        int index = text.indexOf(separator);
        if (index < 0) {
            return null;
        }
        return new String[] {
            text.substring(0, index).trim(),
            text.substring(index + separator.length()).trim()
        };
    }

    /**
     * Returns the text after {@code prefix}, trimmed, if {@code line} starts with it.
     *
     * @param line trimmed line
     * @param prefix keyword prefix, usually ending in a space
     * @return remainder, or {@code null} if the prefix does not match
     */
    public static String afterPrefix(String line, String prefix) {
        return line.startsWith(prefix) ? line.substring(prefix.length()).trim() : null;
    }

    /**
     * Checks that {@code line} starts with {@code keyword} as a whole word.
     *
     * @param line trimmed line
     * @param keyword keyword without trailing space
     * @return true for {@code keyword} alone or followed by whitespace
     */
    public static boolean startsWithWord(String line, String keyword) {
        if (!line.startsWith(keyword)) {
            return false;
        }
        return line.length() == keyword.length() || Character.isWhitespace(line.charAt(keyword.length()));
    }

    /**
     * Returns true for strings usable as plain identifiers: letters, digits, {@code _} and {@code -}.
     *
     * @param text candidate
     * @return true if non-empty and made of identifier characters only
     */
    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isIdentifierChar(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
