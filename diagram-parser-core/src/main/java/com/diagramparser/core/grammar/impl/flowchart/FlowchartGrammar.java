package com.diagramparser.core.grammar.impl.flowchart;

import com.diagramparser.core.config.ParserConfig;
import com.diagramparser.core.error.DiagramParseException;
import com.diagramparser.core.error.LexException;
import com.diagramparser.core.grammar.base.AbstractLineGrammar;
import com.diagramparser.core.grammar.base.DirectiveAccumulator;
import com.diagramparser.core.grammar.base.HeaderLiterals;
import com.diagramparser.core.grammar.base.HeaderValidator;
import com.diagramparser.core.grammar.base.LexicalRules;
import com.diagramparser.core.grammar.base.ValidatedLine;
import com.diagramparser.core.model.DiagramKind;
import com.diagramparser.core.model.flowchart.ClassDef;
import com.diagramparser.core.model.flowchart.ClickAction;
import com.diagramparser.core.model.flowchart.ClickEvent;
import com.diagramparser.core.model.flowchart.FlowDirection;
import com.diagramparser.core.model.flowchart.FlowchartDiagram;
import com.diagramparser.core.model.flowchart.StyleDefinition;
import com.diagramparser.core.model.flowchart.StyleTarget;
import com.diagramparser.core.util.SyntheticIdGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar for {@code flowchart} and {@code graph} diagrams.
 *
 * <p>The header may name a direction ({@code TB}, {@code TD}, {@code BT}, {@code RL},
 * {@code LR}); without one the configured default applies. Keyword lines
 * ({@code subgraph}, {@code end}, {@code direction}, {@code classDef}, {@code class},
 * {@code style}, {@code click}, {@code linkStyle}) are handled line by line. Every other
 * line is tokenized by {@link FlowchartLexer}, split into statements at {@code ;}, and
 * scanned by {@link FlowchartScanner}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * flowchart LR
 *     A[Start] -->|go| B{Check}
 *     B -- yes --> C([Done]) & D[(Store)]
 *     subgraph backend [Back end]
 *         D
 *     end
 * }</pre>
 *
 * <p>An unterminated double-quoted string is the only body-level error; any other
 * malformed input is skipped.
 *
 * @since 1.0.0
 */
public class FlowchartGrammar extends AbstractLineGrammar<FlowchartDiagram> {

    private static final String SUBGRAPH_ID_PREFIX = "subgraph";

    private static final Pattern SUBGRAPH_WITH_TITLE = Pattern.compile("^([^\\s\\[]+)\\s*\\[(.*)]$");
    private static final Pattern CLICK_ARGUMENT = Pattern.compile("\"[^\"]*\"|\\S+");

    private final FlowDirection defaultDirection;
    private final FlowchartLexer lexer = new FlowchartLexer();

    public FlowchartGrammar() {
        this(ParserConfig.DEFAULT_DIRECTION);
    }

    /**
     * @param defaultDirection direction used when the header names none
     */
    public FlowchartGrammar(FlowDirection defaultDirection) {
        this.defaultDirection = Objects.requireNonNull(defaultDirection, "defaultDirection must not be null");
    }

    @Override
    public DiagramKind getKind() {
        return DiagramKind.FLOWCHART;
    }

    @Override
    public String getDisplayName() {
        return "Flowchart Grammar";
    }

    @Override
    public List<String> getHeaderLiterals() {
        return HeaderLiterals.FLOWCHART;
    }

    @Override
    protected FlowchartDiagram parseLines(List<String> lines) throws DiagramParseException {
        HeaderValidator header = newHeaderValidator();
        DirectiveAccumulator directives = new DirectiveAccumulator();
        FlowchartBuilder builder = new FlowchartBuilder(new SyntheticIdGenerator(SUBGRAPH_ID_PREFIX));
        FlowchartScanner scanner = new FlowchartScanner(builder);
        FlowDirection direction = defaultDirection;

        for (int i = 0; i < lines.size(); i++) {
            ValidatedLine line = header.validate(lines.get(i), i + 1);
            if (line.isHeader()) {
                String remainder = line.headerRemainder();
                String[] parts = LexicalRules.splitFirst(remainder, ";");
                String directionText = parts == null ? remainder : parts[0];
                FlowDirection declared = FlowDirection.fromLiteral(directionText);
                direction = declared == null ? defaultDirection : declared;
                if (parts != null && !parts[1].isEmpty()) {
                    // "graph TD;A-->B" puts statements on the header line
                    scanStatements(parts[1], line.lineNumber(), scanner);
                }
                continue;
            }
            if (line.skip() || directives.accept(line.text())) {
                continue;
            }
            if (!handleKeywordLine(line, builder)) {
                scanStatements(lines.get(i), line.lineNumber(), scanner);
            }
        }
        directives.finish();

        if (builder.openSubgraphCount() > 0) {
            log.debug("Closing {} subgraphs left open at end of input", builder.openSubgraphCount());
        }
        FlowchartDiagram diagram = builder.build(directives.getTitle(), directives.getAccessibility(), direction);
        log.debug("Parsed flowchart: {} nodes, {} edges, {} subgraphs",
            diagram.nodes().size(), diagram.edges().size(), diagram.subgraphs().size());
        return diagram;
    }

    private void scanStatements(String text, int lineNumber, FlowchartScanner scanner) throws LexException {
        for (List<FlowToken> statement : FlowchartLexer.splitStatements(lexer.tokenize(text, lineNumber))) {
            scanner.scan(statement);
        }
    }

    /**
     * Handles lines starting with a flowchart keyword.
     *
     * @return false if the line is not a keyword line
     */
    private boolean handleKeywordLine(ValidatedLine line, FlowchartBuilder builder) {
        String text = stripSemicolon(line.text());
        String keyword = firstWord(text);
        String rest = text.substring(keyword.length()).trim();

        switch (keyword) {
            case "subgraph" -> openSubgraph(rest, builder);
            case "end" -> {
                if (!rest.isEmpty()) {
                    return false;
                }
                if (!builder.closeSubgraph()) {
                    log.debug("Ignoring 'end' outside subgraph at line {}", line.lineNumber());
                }
            }
            case "direction" -> {
                FlowDirection direction = FlowDirection.fromLiteral(rest);
                if (direction == null || !builder.setSubgraphDirection(direction)) {
                    skipped(line);
                }
            }
            case "classDef" -> parseClassDef(rest, builder, line);
            case "class" -> parseClassAssignment(rest, builder, line);
            case "style" -> parseStyle(rest, builder, line);
            case "click" -> parseClick(rest, builder, line);
            case "linkStyle" -> log.debug("Ignoring linkStyle at line {}", line.lineNumber());
            default -> {
                return false;
            }
        }
        return true;
    }

    private void openSubgraph(String rest, FlowchartBuilder builder) {
        String id = null;
        String title = null;
        Matcher withTitle = SUBGRAPH_WITH_TITLE.matcher(rest);
        if (rest.isEmpty()) {
            // anonymous
        } else if (withTitle.matches() && FlowchartLexer.isNodeId(withTitle.group(1))) {
            id = withTitle.group(1);
            title = LexicalRules.unquote(withTitle.group(2));
        } else if (rest.startsWith("\"")) {
            title = LexicalRules.unquote(rest);
        } else if (FlowchartLexer.isNodeId(rest)) {
            id = rest;
        } else {
            title = rest;
        }
        String opened = builder.openSubgraph(id, title);
        log.debug("Opened subgraph '{}'", opened);
    }

    /**
     * {@code classDef name[,name] prop:value,prop:value}
     */
    private void parseClassDef(String rest, FlowchartBuilder builder, ValidatedLine line) {
        String names = firstWord(rest);
        if (names.isEmpty()) {
            skipped(line);
            return;
        }
        Map<String, String> styles = parseStyles(rest.substring(names.length()));
        for (String name : names.split(",")) {
            if (!name.isBlank()) {
                builder.addClassDef(new ClassDef(name.trim(), styles));
            }
        }
    }

    /**
     * {@code class A,B className}
     */
    private void parseClassAssignment(String rest, FlowchartBuilder builder, ValidatedLine line) {
        String[] parts = rest.split("\\s+");
        if (parts.length < 2) {
            skipped(line);
            return;
        }
        String className = parts[parts.length - 1];
        String ids = String.join("", Arrays.copyOf(parts, parts.length - 1));
        for (String id : ids.split(",")) {
            if (!id.isBlank()) {
                builder.addClass(id.trim(), className);
            }
        }
    }

    /**
     * {@code style id prop:value,prop:value}
     */
    private void parseStyle(String rest, FlowchartBuilder builder, ValidatedLine line) {
        String id = firstWord(rest);
        if (id.isEmpty()) {
            skipped(line);
            return;
        }
        StyleTarget.TargetType type = builder.isSubgraph(id) && !builder.hasNode(id)
            ? StyleTarget.TargetType.SUBGRAPH
            : StyleTarget.TargetType.NODE;
        builder.addStyle(new StyleDefinition(new StyleTarget(type, id), parseStyles(rest.substring(id.length()))));
    }

    /**
     * Click forms:
     * <pre>
     * click A callback ["tooltip"]
     * click A call callback(args) ["tooltip"]
     * click A "https://example.com" ["tooltip"] [_blank]
     * click A href "https://example.com" ["tooltip"] [_blank]
     * </pre>
     */
    private void parseClick(String rest, FlowchartBuilder builder, ValidatedLine line) {
        List<String> args = new ArrayList<>();
        Matcher matcher = CLICK_ARGUMENT.matcher(rest);
        while (matcher.find()) {
            args.add(matcher.group());
        }
        if (args.size() < 2) {
            skipped(line);
            return;
        }

        String nodeId = args.get(0);
        String first = args.get(1);
        ClickAction action;
        if (first.equals("href") && args.size() > 2) {
            action = ClickAction.href(LexicalRules.unquote(args.get(2)), linkTarget(args, 3));
        } else if (first.startsWith("\"")) {
            action = ClickAction.href(LexicalRules.unquote(first), linkTarget(args, 2));
        } else if (first.equals("call") && args.size() > 2) {
            String call = args.get(2);
            int paren = call.indexOf('(');
            action = ClickAction.callback(paren > 0 ? call.substring(0, paren) : call);
        } else {
            action = ClickAction.callback(first);
        }
        builder.addClick(new ClickEvent(nodeId, action));
    }

    private static String linkTarget(List<String> args, int from) {
        for (int i = from; i < args.size(); i++) {
            if (args.get(i).startsWith("_")) {
                return args.get(i);
            }
        }
        return null;
    }

    /**
     * Parses {@code fill:#f9f,stroke:#333,stroke-width:4px}.
     */
    private static Map<String, String> parseStyles(String text) {
        Map<String, String> styles = new LinkedHashMap<>();
        for (String entry : text.trim().split(",")) {
            String[] pair = LexicalRules.splitFirst(entry, ":");
            if (pair != null && !pair[0].isEmpty()) {
                styles.put(pair[0], pair[1]);
            }
        }
        return styles;
    }

    private static String stripSemicolon(String text) {
        return text.endsWith(";") ? text.substring(0, text.length() - 1).trim() : text;
    }

    private static String firstWord(String text) {
        int end = 0;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }
}
