package com.diagramparser.core.grammar.base;

import com.diagramparser.core.error.DiagramSyntaxException;
import com.diagramparser.core.error.EnhancedSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HeaderValidator}.
 */
class HeaderValidatorTest {

    @Test
    void validate_skippableLinesBeforeHeader_areSkipped() throws DiagramSyntaxException {
        HeaderValidator validator = new HeaderValidator(HeaderLiterals.FLOWCHART);

        ValidatedLine blank = validator.validate("   ", 1);
        ValidatedLine comment = validator.validate("%% leading comment", 2);

        assertThat(blank.skip()).isTrue();
        assertThat(comment.skip()).isTrue();
        assertThat(validator.isHeaderSeen()).isFalse();
    }

    @Test
    void validate_hashCommentBeforeHeader_isSkippedButNotAfter() throws DiagramSyntaxException {
        HeaderValidator validator = new HeaderValidator(HeaderLiterals.FLOWCHART);

        ValidatedLine preamble = validator.validate("# exported diagram", 1);
        validator.validate("flowchart TD", 2);
        ValidatedLine body = validator.validate("# not a comment here", 3);

        assertThat(preamble.skip()).isTrue();
        assertThat(preamble.isHeader()).isFalse();
        assertThat(body.skip()).isFalse();
    }

    @Test
    void validate_matchingHeader_marksHeaderSeen() throws DiagramSyntaxException {
        HeaderValidator validator = new HeaderValidator(HeaderLiterals.FLOWCHART);

        ValidatedLine header = validator.validate("  graph LR", 1);

        assertThat(header.isHeader()).isTrue();
        assertThat(header.skip()).isTrue();
        assertThat(header.header()).isEqualTo("graph");
        assertThat(header.headerRemainder()).isEqualTo("LR");
        assertThat(validator.isHeaderSeen()).isTrue();
    }

    @Test
    void validate_afterHeader_passesLinesThrough() throws DiagramSyntaxException {
        HeaderValidator validator = new HeaderValidator(HeaderLiterals.SEQUENCE);
        validator.validate("sequenceDiagram", 1);

        ValidatedLine body = validator.validate("   Alice->>Bob: hi   ", 2);

        assertThat(body.skip()).isFalse();
        assertThat(body.isHeader()).isFalse();
        assertThat(body.text()).isEqualTo("Alice->>Bob: hi");
        assertThat(body.lineNumber()).isEqualTo(2);
    }

    @Test
    void validate_overlappingLiterals_prefersLongest() throws DiagramSyntaxException {
        HeaderValidator validator = new HeaderValidator(HeaderLiterals.STATE);

        ValidatedLine header = validator.validate("stateDiagram-v2", 1);

        assertThat(header.header()).isEqualTo(HeaderLiterals.STATE_V2);
    }

    @Test
    void validate_unrelatedHeader_throwsSyntaxError() {
        HeaderValidator validator = new HeaderValidator(HeaderLiterals.FLOWCHART);

        assertThatThrownBy(() -> validator.validate("pie title Pets", 3))
            .isExactlyInstanceOf(DiagramSyntaxException.class)
            .satisfies(error -> {
                DiagramSyntaxException syntax = (DiagramSyntaxException) error;
                assertThat(syntax.getExpected()).containsExactly("flowchart", "graph");
                assertThat(syntax.getFound()).isEqualTo("pie title Pets");
                assertThat(syntax.getLine()).isEqualTo(3);
                assertThat(syntax.getColumn()).isEqualTo(1);
            });
    }

    @Test
    void validate_wrongCase_throwsEnhancedErrorWithSuggestion() {
        HeaderValidator validator = new HeaderValidator(HeaderLiterals.SEQUENCE);

        assertThatThrownBy(() -> validator.validate("  sequencediagram", 1))
            .isInstanceOf(EnhancedSyntaxException.class)
            .satisfies(error -> {
                EnhancedSyntaxException enhanced = (EnhancedSyntaxException) error;
                assertThat(enhanced.getSuggestions()).containsExactly("did you mean 'sequenceDiagram'?");
                assertThat(enhanced.getColumn()).isEqualTo(3);
                assertThat(enhanced.getSnippet()).contains("^^^^^^^^^^^^^^^ expected");
            });
    }

    @Test
    void validate_typo_throwsEnhancedErrorWithSuggestion() {
        HeaderValidator validator = new HeaderValidator(HeaderLiterals.FLOWCHART);

        assertThatThrownBy(() -> validator.validate("grph TD", 1))
            .isInstanceOf(EnhancedSyntaxException.class)
            .satisfies(error -> assertThat(((EnhancedSyntaxException) error).getSuggestions())
                .containsExactly("did you mean 'graph'?"));
    }

    @Test
    void constructor_withoutLiterals_throwsException() {
        assertThatThrownBy(() -> new HeaderValidator(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void editDistance_computesLevenshtein() {
        assertThat(HeaderValidator.editDistance("graph", "graph")).isZero();
        assertThat(HeaderValidator.editDistance("grph", "graph")).isEqualTo(1);
        assertThat(HeaderValidator.editDistance("kitten", "sitting")).isEqualTo(3);
        assertThat(HeaderValidator.editDistance("", "abc")).isEqualTo(3);
    }
}
