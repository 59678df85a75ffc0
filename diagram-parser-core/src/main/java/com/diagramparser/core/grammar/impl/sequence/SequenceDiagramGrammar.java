package com.diagramparser.core.grammar.impl.sequence;

import com.diagramparser.core.config.ParserConfig;
import com.diagramparser.core.error.DiagramParseException;
import com.diagramparser.core.grammar.base.AbstractLineGrammar;
import com.diagramparser.core.grammar.base.HeaderLiterals;
import com.diagramparser.core.grammar.base.HeaderValidator;
import com.diagramparser.core.grammar.base.ValidatedLine;
import com.diagramparser.core.model.DiagramKind;
import com.diagramparser.core.model.sequence.SequenceDiagram;
import com.diagramparser.core.model.sequence.SequenceStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Grammar for {@code sequenceDiagram}.
 *
 * <p><b>Supported statements:</b>
 * <ul>
 *   <li>{@code participant Alice as A}, {@code actor Bob}</li>
 *   <li>Messages with any of the arrows in {@link com.diagramparser.core.model.sequence.ArrowType},
 *       optionally with {@code +}/{@code -} activation shorthand on the target</li>
 *   <li>{@code loop}, {@code alt}/{@code else}, {@code opt}, {@code par}/{@code and},
 *       {@code critical}/{@code option} blocks, nested to any depth up to the configured limit</li>
 *   <li>{@code note left of|right of|over A[,B]: text}</li>
 *   <li>{@code activate}, {@code deactivate}, {@code create}, {@code destroy}</li>
 *   <li>{@code autonumber [start [step]]} and {@code autonumber off}</li>
 * </ul>
 *
 * <p>Aliases are resolved everywhere, so messages only ever carry canonical names.
 *
 * @since 1.0.0
 */
public class SequenceDiagramGrammar extends AbstractLineGrammar<SequenceDiagram> {

    private final int maxBlockDepth;

    public SequenceDiagramGrammar() {
        this(ParserConfig.DEFAULT_MAX_BLOCK_DEPTH);
    }

    /**
     * @param maxBlockDepth deepest block nesting kept in the tree
     */
    public SequenceDiagramGrammar(int maxBlockDepth) {
        if (maxBlockDepth < 1) {
            throw new IllegalArgumentException("maxBlockDepth must be at least 1");
        }
        this.maxBlockDepth = maxBlockDepth;
    }

    @Override
    public DiagramKind getKind() {
        return DiagramKind.SEQUENCE;
    }

    @Override
    public String getDisplayName() {
        return "Sequence Diagram Grammar";
    }

    @Override
    public List<String> getHeaderLiterals() {
        return HeaderLiterals.SEQUENCE;
    }

    @Override
    protected SequenceDiagram parseLines(List<String> lines) throws DiagramParseException {
        HeaderValidator header = newHeaderValidator();
        List<String> body = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            ValidatedLine line = header.validate(lines.get(i), i + 1);
            if (!line.skip()) {
                body.add(line.text());
            }
        }

        SequenceBodyParser parser = new SequenceBodyParser(body, maxBlockDepth);
        List<SequenceStatement> statements = parser.parse();
        SequenceDiagram diagram = new SequenceDiagram(
            parser.directives().getTitle(),
            parser.directives().getAccessibility(),
            parser.participants().toList(),
            statements,
            parser.autonumber()
        );
        log.debug("Parsed sequence diagram: {} participants, {} top-level statements",
            diagram.participants().size(), statements.size());
        return diagram;
    }
}
