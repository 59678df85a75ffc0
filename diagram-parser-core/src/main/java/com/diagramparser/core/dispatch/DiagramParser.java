package com.diagramparser.core.dispatch;

import com.diagramparser.core.config.ParserConfig;
import com.diagramparser.core.error.DiagramParseException;
import com.diagramparser.core.error.UnsupportedDiagramTypeException;
import com.diagramparser.core.grammar.DiagramGrammar;
import com.diagramparser.core.model.DiagramAst;
import com.diagramparser.core.model.DiagramKind;
import com.diagramparser.core.model.flowchart.FlowchartDiagram;
import com.diagramparser.core.model.sequence.SequenceDiagram;
import com.diagramparser.core.model.state.StateDiagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the library: detects the diagram type of a text and parses it.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DiagramParser parser = new DiagramParser();
 * DiagramAst ast = parser.parse("""
 *     flowchart LR
 *         A --> B
 *     """);
 * }</pre>
 *
 * <p>Instances hold no per-parse state and may be shared between threads.
 *
 * @since 1.0.0
 */
public class DiagramParser {

    private static final Logger log = LoggerFactory.getLogger(DiagramParser.class);

    private final ParserConfig config;
    private final DispatchTable table;
    private final DiagramTypeSniffer sniffer;

    public DiagramParser() {
        this(ParserConfig.defaults());
    }

    public DiagramParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.table = new DispatchTable(config);
        this.sniffer = new DiagramTypeSniffer(table);
    }

    /**
     * Parses a diagram of any supported kind.
     *
     * <p>The header selects the grammar, which then receives the full text.
     *
     * @param text diagram text
     * @return syntax tree
     * @throws DiagramParseException if the input is empty, its type is unknown or unsupported,
     *                               or the selected grammar fails
     */
    public DiagramAst parse(String text) throws DiagramParseException {
        Objects.requireNonNull(text, "text must not be null");
        DispatchRule rule = sniffer.sniff(text);
        DiagramGrammar<?> grammar = grammarFor(rule);
        log.debug("Dispatching {} diagram to {}", rule.kind().getId(), grammar.getDisplayName());
        return grammar.parse(text);
    }

    /**
     * Detects the kind of a diagram without parsing its body.
     *
     * @param text diagram text
     * @return detected kind, which may have no grammar in this library
     * @throws DiagramParseException if the input is empty or its type is unknown
     */
    public DiagramKind detectKind(String text) throws DiagramParseException {
        Objects.requireNonNull(text, "text must not be null");
        return sniffer.sniff(text).kind();
    }

    public StateDiagram parseState(String text) throws DiagramParseException {
        return (StateDiagram) grammarOf(DiagramKind.STATE).parse(text);
    }

    public SequenceDiagram parseSequence(String text) throws DiagramParseException {
        return (SequenceDiagram) grammarOf(DiagramKind.SEQUENCE).parse(text);
    }

    public FlowchartDiagram parseFlowchart(String text) throws DiagramParseException {
        return (FlowchartDiagram) grammarOf(DiagramKind.FLOWCHART).parse(text);
    }

    public ParserConfig getConfig() {
        return config;
    }

    public DispatchTable getDispatchTable() {
        return table;
    }

    private DiagramGrammar<?> grammarOf(DiagramKind kind) throws UnsupportedDiagramTypeException {
        return grammarFor(table.ruleOf(kind));
    }

    private DiagramGrammar<?> grammarFor(DispatchRule rule) throws UnsupportedDiagramTypeException {
        if (!rule.hasGrammar() || config.dispatch().isDisabled(rule.kind())) {
            log.debug("No enabled grammar for {} diagrams", rule.kind().getId());
            throw new UnsupportedDiagramTypeException(rule.kind());
        }
        return rule.grammar();
    }
}
