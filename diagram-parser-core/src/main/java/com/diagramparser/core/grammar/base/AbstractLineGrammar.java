package com.diagramparser.core.grammar.base;

import com.diagramparser.core.error.DiagramParseException;
import com.diagramparser.core.error.EmptyInputException;
import com.diagramparser.core.grammar.DiagramGrammar;
import com.diagramparser.core.model.DiagramAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Base class for grammars that read diagram source line by line.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Logger initialization (one logger per grammar class)</li>
 *   <li>The empty-input check shared by every grammar</li>
 *   <li>Line splitting and a fresh {@link HeaderValidator} per parse</li>
 * </ul>
 *
 * <p>Subclasses implement {@link #parseLines(List)} and keep all mutable parse state in
 * locals or in per-call helper objects, never in fields.
 *
 * @param <T> syntax tree type
 * @since 1.0.0
 */
public abstract class AbstractLineGrammar<T extends DiagramAst> implements DiagramGrammar<T> {

    /**
     * Logger instance for this grammar.
     * Automatically initialized with the concrete grammar class name.
     */
    protected final Logger log;

    protected AbstractLineGrammar() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final T parse(String text) throws DiagramParseException {
        Objects.requireNonNull(text, "text must not be null");
        List<String> lines = text.lines().toList();
        if (lines.stream().allMatch(LexicalRules::isPreambleLine)) {
            throw new EmptyInputException();
        }
        T result = parseLines(lines);
        log.debug("{} parsed {} lines", getDisplayName(), lines.size());
        return result;
    }

    /**
     * Parses the source lines of a diagram that is known to have content.
     *
     * @param lines raw source lines, header included
     * @return syntax tree
     * @throws DiagramParseException on a hard failure
     */
    protected abstract T parseLines(List<String> lines) throws DiagramParseException;

    /**
     * @return a header validator for a new parse, accepting {@link #getHeaderLiterals()}
     */
    protected HeaderValidator newHeaderValidator() {
        return new HeaderValidator(getHeaderLiterals());
    }

    /**
     * Logs a body line the grammar could not interpret.
     *
     * @param line validated line being skipped
     */
    protected void skipped(ValidatedLine line) {
        log.debug("Skipping unrecognised line {}: '{}'", line.lineNumber(), line.text());
    }
}
