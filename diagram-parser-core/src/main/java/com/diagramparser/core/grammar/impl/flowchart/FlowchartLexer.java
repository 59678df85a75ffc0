package com.diagramparser.core.grammar.impl.flowchart;

import com.diagramparser.core.error.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one line of flowchart source into {@link FlowToken}s.
 *
 * <p>{@code [}, {@code (}, {@code {} and {@code >} are shape delimiters only right after a
 * node id; anywhere else they are plain text. Once a shape is open, only the closers that
 * pair with its opener end it, so brackets inside labels never confuse the scanner. Among
 * openers sharing a prefix the longest one whose closer occurs later on the line is chosen,
 * falling back to the longest one.
 *
 * <p>Ids may contain single hyphens between identifier characters ({@code node-1}).
 * Between {@code |} pipes no shape is opened. A {@code ;} outside shapes and pipes
 * separates statements.
 *
 * <p><b>Link lexemes:</b>
 * <pre>
 * --&gt;  ---  -.-&gt;  -.-  ==&gt;  ===  ~~~  --o  --x  &lt;--&gt;     (longer runs allowed)
 * --   ==   -.                                          (start of "A -- text --&gt; B")
 * .-&gt;  .-                                               (end of "A -. text .-&gt; B")
 * </pre>
 *
 * @since 1.0.0
 */
public class FlowchartLexer {

    private static final Pattern MULTI_DIRECTIONAL = Pattern.compile("<(?:-{2,}|={2,}|-\\.+-)>");
    private static final Pattern DOTTED = Pattern.compile("-\\.+->?");
    private static final Pattern DASHED_ENDING = Pattern.compile("-{2,}[ox]");
    private static final Pattern DASHED = Pattern.compile("-{2,}>|-{3,}");
    private static final Pattern THICK = Pattern.compile("={2,}>|={3,}");
    private static final Pattern INVISIBLE = Pattern.compile("~{3,}");
    private static final Pattern DOTTED_CLOSE = Pattern.compile("\\.-+>?");

    /**
     * Tokenizes a line.
     *
     * @param line source line, untrimmed so that columns match the input
     * @param lineNumber 1-based line number for error locations
     * @return tokens in source order
     * @throws LexException if a double-quoted string is not closed on the same line
     */
    public List<FlowToken> tokenize(String line, int lineNumber) throws LexException {
        return new Run(line, lineNumber).tokenize();
    }

    /**
     * Splits a token list into statements at {@link FlowTokenType#SEMICOLON} tokens.
     *
     * @param tokens tokens of one line
     * @return non-empty statements
     */
    public static List<List<FlowToken>> splitStatements(List<FlowToken> tokens) {
        List<List<FlowToken>> statements = new ArrayList<>();
        List<FlowToken> current = new ArrayList<>();
        for (FlowToken token : tokens) {
            if (token.is(FlowTokenType.SEMICOLON)) {
                if (!current.isEmpty()) {
                    statements.add(current);
                }
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        if (!current.isEmpty()) {
            statements.add(current);
        }
        return statements;
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Checks that {@code text} would lex as one node id.
     *
     * @param text candidate id
     * @return true for ids such as {@code A}, {@code node_1} or {@code node-1}
     */
    static boolean isNodeId(String text) {
        if (text == null || text.isEmpty() || !isIdentifierChar(text.charAt(0))) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '-') {
                if (i + 1 >= text.length() || !isIdentifierChar(text.charAt(i + 1))) {
                    return false;
                }
            } else if (!isIdentifierChar(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * State of tokenizing one line.
     */
    private static final class Run {
        private final String line;
        private final int lineNumber;
        private final List<FlowToken> tokens = new ArrayList<>();
        private int pos;
        private boolean spaceBefore;
        private String openShape;
        private boolean inPipe;

        private Run(String line, int lineNumber) {
            this.line = line;
            this.lineNumber = lineNumber;
        }

        private List<FlowToken> tokenize() throws LexException {
            while (pos < line.length()) {
                char c = line.charAt(pos);
                if (Character.isWhitespace(c)) {
                    spaceBefore = true;
                    pos++;
                    continue;
                }
                if (c == '"') {
                    readString();
                } else if (openShape != null && readShapeClose()) {
                    openShape = null;
                } else if (isIdentifierChar(c)) {
                    readIdentifier();
                } else if (openShape == null && !inPipe && readShapeOpen()) {
                    // opener emitted
                } else if (!readLink()) {
                    readPunctuation(c);
                }
                spaceBefore = false;
            }
            return tokens;
        }

        private void emit(FlowTokenType type, int length) {
            emit(type, line.substring(pos, pos + length), null, length);
        }

        private void emit(FlowTokenType type, String lexeme, String text, int length) {
            tokens.add(new FlowToken(type, lexeme, text, spaceBefore, pos + 1));
            pos += length;
        }

        private void readString() throws LexException {
            int close = line.indexOf('"', pos + 1);
            if (close < 0) {
                throw new LexException("Unterminated string literal", lineNumber, pos + 1);
            }
            String lexeme = line.substring(pos, close + 1);
            emit(FlowTokenType.STRING, lexeme, lexeme.substring(1, lexeme.length() - 1), lexeme.length());
        }

        /**
         * Reads an id such as {@code node-1}. A {@code -} belongs to the id only when an
         * identifier character follows it, so {@code A-->B} still splits at the link.
         */
        private void readIdentifier() {
            int end = pos;
            while (end < line.length()) {
                char c = line.charAt(end);
                if (isIdentifierChar(c)) {
                    end++;
                } else if (c == '-' && end + 1 < line.length() && isIdentifierChar(line.charAt(end + 1))) {
                    end += 2;
                } else {
                    break;
                }
            }
            emit(FlowTokenType.IDENTIFIER, end - pos);
        }

        private boolean readShapeOpen() {
            if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(FlowTokenType.IDENTIFIER)) {
                return false;
            }
            String chosen = null;
            for (String opener : ShapeDelimiters.openers()) {
                if (!line.startsWith(opener, pos)) {
                    continue;
                }
                if (opener.equals(">") && spaceBefore) {
                    continue;
                }
                if (chosen == null) {
                    chosen = opener;
                }
                if (hasCloserAfter(opener, pos + opener.length())) {
                    chosen = opener;
                    break;
                }
            }
            if (chosen == null) {
                return false;
            }
            openShape = chosen;
            emit(FlowTokenType.SHAPE_OPEN, chosen.length());
            return true;
        }

        private boolean hasCloserAfter(String opener, int from) {
            for (String closer : ShapeDelimiters.closersFor(opener)) {
                if (line.indexOf(closer, from) >= 0) {
                    return true;
                }
            }
            return false;
        }

        private boolean readShapeClose() {
            for (String closer : ShapeDelimiters.closersFor(openShape)) {
                if (line.startsWith(closer, pos)) {
                    emit(FlowTokenType.SHAPE_CLOSE, closer.length());
                    return true;
                }
            }
            return false;
        }

        private boolean readLink() {
            char c = line.charAt(pos);
            return switch (c) {
                case '<' -> match(MULTI_DIRECTIONAL, FlowTokenType.LINK);
                case '-' -> match(DOTTED, FlowTokenType.LINK)
                    || matchDashedEnding()
                    || match(DASHED, FlowTokenType.LINK)
                    || literal("--", FlowTokenType.LINK_TEXT_START)
                    || literal("-.", FlowTokenType.LINK_TEXT_START);
                case '=' -> match(THICK, FlowTokenType.LINK) || literal("==", FlowTokenType.LINK_TEXT_START);
                case '~' -> match(INVISIBLE, FlowTokenType.LINK);
                case '.' -> match(DOTTED_CLOSE, FlowTokenType.LINK);
                default -> false;
            };
        }

        /**
         * {@code --o} and {@code --x} only count as links when not followed by more of a word.
         */
        private boolean matchDashedEnding() {
            Matcher matcher = DASHED_ENDING.matcher(line).region(pos, line.length());
            if (!matcher.lookingAt()) {
                return false;
            }
            int end = matcher.end();
            if (end < line.length() && isIdentifierChar(line.charAt(end))) {
                return false;
            }
            emit(FlowTokenType.LINK, end - pos);
            return true;
        }

        private boolean match(Pattern pattern, FlowTokenType type) {
            Matcher matcher = pattern.matcher(line).region(pos, line.length());
            if (!matcher.lookingAt()) {
                return false;
            }
            emit(type, matcher.end() - pos);
            return true;
        }

        private boolean literal(String literal, FlowTokenType type) {
            if (!line.startsWith(literal, pos)) {
                return false;
            }
            emit(type, literal.length());
            return true;
        }

        private void readPunctuation(char c) {
            if (openShape == null && !inPipe && c == ';') {
                emit(FlowTokenType.SEMICOLON, 1);
            } else if (openShape == null && c == '|') {
                inPipe = !inPipe;
                emit(FlowTokenType.PIPE, 1);
            } else if (openShape == null && !inPipe && c == '&') {
                emit(FlowTokenType.AMPERSAND, 1);
            } else if (openShape == null && !inPipe && line.startsWith(":::", pos)) {
                emit(FlowTokenType.CLASS_SEPARATOR, 3);
            } else {
                emit(FlowTokenType.TEXT, 1);
            }
        }
    }
}
