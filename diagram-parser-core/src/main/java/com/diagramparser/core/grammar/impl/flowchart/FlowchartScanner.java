package com.diagramparser.core.grammar.impl.flowchart;

import com.diagramparser.core.model.flowchart.FlowEdge;
import com.diagramparser.core.model.flowchart.NodeShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the tokens of one flowchart statement into nodes and edges.
 *
 * <p>A statement is a chain of node groups joined by links:
 * <pre>
 * statement := group (link label? group)*
 * group     := node ('&amp;' node)*
 * node      := IDENTIFIER (SHAPE_OPEN any* SHAPE_CLOSE)? (':::' IDENTIFIER)?
 * label     := '|' any* '|'  or the text form  '--' any* LINK
 * </pre>
 *
 * <p>Every step consumes at least one token. A shape with no closer is abandoned: the
 * node keeps its id, and scanning resumes at the token after the id. Tokens that start
 * no chain are skipped one at a time.
 */
final class FlowchartScanner {

    private static final Logger log = LoggerFactory.getLogger(FlowchartScanner.class);

    private final FlowchartBuilder builder;
    private List<FlowToken> tokens;
    private int index;

    FlowchartScanner(FlowchartBuilder builder) {
        this.builder = builder;
    }

    /**
     * Scans one statement, recording what it declares in the builder.
     *
     * @param statement tokens of one statement
     */
    void scan(List<FlowToken> statement) {
        this.tokens = statement;
        this.index = 0;
        while (index < tokens.size()) {
            if (current().is(FlowTokenType.IDENTIFIER)) {
                scanChain();
            } else {
                log.debug("Skipping token '{}' at column {}", current().lexeme(), current().column());
                index++;
            }
        }
    }

    private FlowToken current() {
        return tokens.get(index);
    }

    private boolean at(FlowTokenType type) {
        return index < tokens.size() && tokens.get(index).is(type);
    }

    private void scanChain() {
        List<String> sources = scanGroup();
        while (!sources.isEmpty() && (at(FlowTokenType.LINK) || at(FlowTokenType.LINK_TEXT_START))) {
            int linkStart = index;
            LinkSpec link;
            String label = null;

            if (at(FlowTokenType.LINK_TEXT_START)) {
                index++;
                int close = findNext(FlowTokenType.LINK);
                if (close < 0) {
                    log.debug("Link text at column {} never closed", tokens.get(linkStart).column());
                    index = tokens.size();
                    return;
                }
                label = joinText(index, close);
                link = LinkSpec.parse(tokens.get(close).lexeme());
                index = close + 1;
            } else {
                link = LinkSpec.parse(current().lexeme());
                index++;
            }

            if (at(FlowTokenType.PIPE)) {
                index++;
                int close = findNext(FlowTokenType.PIPE);
                int end = close < 0 ? tokens.size() : close;
                label = joinText(index, end);
                index = close < 0 ? tokens.size() : close + 1;
            }

            if (link == null || !at(FlowTokenType.IDENTIFIER)) {
                log.debug("Link at column {} has no target", tokens.get(linkStart).column());
                return;
            }

            List<String> targets = scanGroup();
            for (String from : sources) {
                for (String to : targets) {
                    builder.addEdge(new FlowEdge(from, to, link.edgeType(), label, link.minLength()));
                }
            }
            sources = targets;
        }
    }

    /**
     * Scans {@code node (& node)*}; the cursor must be on an identifier.
     */
    private List<String> scanGroup() {
        List<String> ids = new ArrayList<>();
        ids.add(scanNode());
        while (at(FlowTokenType.AMPERSAND) && index + 1 < tokens.size()
            && tokens.get(index + 1).is(FlowTokenType.IDENTIFIER)) {
            index++;
            ids.add(scanNode());
        }
        return ids;
    }

    /**
     * Scans one node reference with its optional shape and class suffix.
     *
     * @return node id
     */
    private String scanNode() {
        FlowToken idToken = current();
        String id = idToken.lexeme();
        index++;

        if (at(FlowTokenType.SHAPE_OPEN)) {
            String opener = current().lexeme();
            int close = findNext(FlowTokenType.SHAPE_CLOSE);
            NodeShape shape = close < 0 ? null : ShapeDelimiters.shapeOf(opener, tokens.get(close).lexeme());
            if (shape == null) {
                // Abandon the definition; resume right after the id
                log.debug("Unclosed '{}' after node '{}' at column {}", opener, id, idToken.column());
                builder.ensureNode(id);
                return id;
            }
            builder.defineNode(id, shape, labelText(index + 1, close));
            index = close + 1;
        } else {
            builder.ensureNode(id);
        }

        if (at(FlowTokenType.CLASS_SEPARATOR) && index + 1 < tokens.size()
            && tokens.get(index + 1).is(FlowTokenType.IDENTIFIER)) {
            builder.addClass(id, tokens.get(index + 1).lexeme());
            index += 2;
        }
        return id;
    }

    private int findNext(FlowTokenType type) {
        for (int i = index; i < tokens.size(); i++) {
            if (tokens.get(i).is(type)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Node label: a lone quoted string keeps its content verbatim.
     */
    private String labelText(int from, int to) {
        if (to - from == 1 && tokens.get(from).is(FlowTokenType.STRING)) {
            return tokens.get(from).text();
        }
        return joinText(from, to);
    }

    /**
     * Rebuilds text from tokens, with a single space wherever the source had whitespace.
     *
     * @return trimmed text, or {@code null} if empty
     */
    private String joinText(int from, int to) {
        StringBuilder text = new StringBuilder();
        for (int i = from; i < to; i++) {
            FlowToken token = tokens.get(i);
            if (token.spaceBefore() && text.length() > 0) {
                text.append(' ');
            }
            text.append(token.text());
        }
        String result = text.toString().trim();
        return result.isEmpty() ? null : result;
    }
}
