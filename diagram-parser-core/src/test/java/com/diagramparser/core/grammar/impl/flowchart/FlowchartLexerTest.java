package com.diagramparser.core.grammar.impl.flowchart;

import com.diagramparser.core.error.LexException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.diagramparser.core.grammar.impl.flowchart.FlowTokenType.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FlowchartLexer}.
 */
class FlowchartLexerTest {

    private final FlowchartLexer lexer = new FlowchartLexer();

    @Test
    void tokenize_nodesAndArrow() throws LexException {
        List<FlowToken> tokens = lexer.tokenize("A[Start] --> B[End]", 1);

        assertThat(tokens).extracting(FlowToken::type).containsExactly(
            IDENTIFIER, SHAPE_OPEN, IDENTIFIER, SHAPE_CLOSE, LINK, IDENTIFIER, SHAPE_OPEN, IDENTIFIER, SHAPE_CLOSE);
        assertThat(tokens.get(4).lexeme()).isEqualTo("-->");
        assertThat(tokens.get(4).spaceBefore()).isTrue();
        assertThat(tokens.get(4).column()).isEqualTo(10);
    }

    @Test
    void tokenize_hyphenInsideId_isPartOfIdentifier() throws LexException {
        List<FlowToken> tokens = lexer.tokenize("node-1-->node-2 A-.->B-x", 1);

        assertThat(tokens).extracting(FlowToken::lexeme)
            .containsExactly("node-1", "-->", "node-2", "A", "-.->", "B-x");
    }

    @Test
    void isNodeId_acceptsSingleHyphensBetweenIdentifierChars() {
        assertThat(FlowchartLexer.isNodeId("node-1")).isTrue();
        assertThat(FlowchartLexer.isNodeId("a_b-c-d")).isTrue();
        assertThat(FlowchartLexer.isNodeId("a--b")).isFalse();
        assertThat(FlowchartLexer.isNodeId("-a")).isFalse();
        assertThat(FlowchartLexer.isNodeId("a-")).isFalse();
        assertThat(FlowchartLexer.isNodeId("a b")).isFalse();
        assertThat(FlowchartLexer.isNodeId("")).isFalse();
    }

    @Test
    void tokenize_bracketsOfOtherShapesInsideLabel_areText() throws LexException {
        List<FlowToken> tokens = lexer.tokenize("A[Call (sync) now]", 1);

        assertThat(tokens).extracting(FlowToken::type).containsExactly(
            IDENTIFIER, SHAPE_OPEN, IDENTIFIER, TEXT, IDENTIFIER, TEXT, IDENTIFIER, SHAPE_CLOSE);
    }

    @Test
    void tokenize_openerNotAfterIdentifier_isText() throws LexException {
        List<FlowToken> tokens = lexer.tokenize("A -- (see) --> B", 1);

        assertThat(tokens).extracting(FlowToken::type).containsExactly(
            IDENTIFIER, LINK_TEXT_START, TEXT, IDENTIFIER, TEXT, LINK, IDENTIFIER);
    }

    @Test
    void tokenize_multiCharacterOpener_prefersOneWithCloser() throws LexException {
        assertThat(lexer.tokenize("A((circle))", 1)).extracting(FlowToken::lexeme)
            .containsExactly("A", "((", "circle", "))");
        assertThat(lexer.tokenize("A[/lean/]", 1)).extracting(FlowToken::lexeme)
            .containsExactly("A", "[/", "lean", "/]");
        assertThat(lexer.tokenize("A[(db)]", 1)).extracting(FlowToken::lexeme)
            .containsExactly("A", "[(", "db", ")]");
    }

    @Test
    void tokenize_asymmetricOpener_requiresNoSpace() throws LexException {
        assertThat(lexer.tokenize("A>flag]", 1)).extracting(FlowToken::type)
            .containsExactly(IDENTIFIER, SHAPE_OPEN, IDENTIFIER, SHAPE_CLOSE);
        assertThat(lexer.tokenize("A >flag]", 1)).extracting(FlowToken::type)
            .doesNotContain(SHAPE_OPEN);
    }

    @Test
    void tokenize_linkVariants() throws LexException {
        assertThat(lexer.tokenize("A---B-.->C==>D~~~E<-->F --o G --x H===I-.-J", 1))
            .filteredOn(token -> token.is(LINK))
            .extracting(FlowToken::lexeme)
            .containsExactly("---", "-.->", "==>", "~~~", "<-->", "--o", "--x", "===", "-.-");
    }

    @Test
    void tokenize_circleEndingFollowedByWord_isNotCircleLink() throws LexException {
        List<FlowToken> tokens = lexer.tokenize("A --oops", 1);

        assertThat(tokens).extracting(FlowToken::type).containsExactly(IDENTIFIER, LINK_TEXT_START, IDENTIFIER);
    }

    @Test
    void tokenize_textLinks() throws LexException {
        assertThat(lexer.tokenize("A -- text --> B", 1)).extracting(FlowToken::type)
            .containsExactly(IDENTIFIER, LINK_TEXT_START, IDENTIFIER, LINK, IDENTIFIER);
        assertThat(lexer.tokenize("A -. text .-> B", 1)).extracting(FlowToken::lexeme)
            .containsExactly("A", "-.", "text", ".->", "B");
        assertThat(lexer.tokenize("A == text ==> B", 1)).extracting(FlowToken::lexeme)
            .containsExactly("A", "==", "text", "==>", "B");
    }

    @Test
    void tokenize_pipeLabel_doesNotOpenShapes() throws LexException {
        List<FlowToken> tokens = lexer.tokenize("A -->|x[1]| B", 1);

        assertThat(tokens).extracting(FlowToken::type).containsExactly(
            IDENTIFIER, LINK, PIPE, IDENTIFIER, TEXT, IDENTIFIER, TEXT, PIPE, IDENTIFIER);
    }

    @Test
    void tokenize_quotedString_keepsContent() throws LexException {
        List<FlowToken> tokens = lexer.tokenize("A[\"Hello; [world]\"]", 1);

        assertThat(tokens).extracting(FlowToken::type)
            .containsExactly(IDENTIFIER, SHAPE_OPEN, STRING, SHAPE_CLOSE);
        assertThat(tokens.get(2).text()).isEqualTo("Hello; [world]");
        assertThat(tokens.get(2).lexeme()).isEqualTo("\"Hello; [world]\"");
    }

    @Test
    void tokenize_unterminatedString_throwsLexException() {
        assertThatThrownBy(() -> lexer.tokenize("A[\"oops] --> B", 7))
            .isInstanceOf(LexException.class)
            .satisfies(error -> {
                LexException lex = (LexException) error;
                assertThat(lex.getLine()).isEqualTo(7);
                assertThat(lex.getColumn()).isEqualTo(3);
            });
    }

    @Test
    void tokenize_punctuation() throws LexException {
        assertThat(lexer.tokenize("A & B:::hot; C", 1)).extracting(FlowToken::type)
            .containsExactly(IDENTIFIER, AMPERSAND, IDENTIFIER, CLASS_SEPARATOR, IDENTIFIER, SEMICOLON, IDENTIFIER);
    }

    @Test
    void splitStatements_dropsEmptyStatements() throws LexException {
        List<List<FlowToken>> statements =
            FlowchartLexer.splitStatements(lexer.tokenize(";A --> B;; B --> C;", 1));

        assertThat(statements).hasSize(2);
        assertThat(statements.get(1)).extracting(FlowToken::lexeme).containsExactly("B", "-->", "C");
    }

    @Test
    void tokenize_semicolonInsideShape_doesNotSplit() throws LexException {
        List<List<FlowToken>> statements =
            FlowchartLexer.splitStatements(lexer.tokenize("A[a;b] --> B", 1));

        assertThat(statements).hasSize(1);
    }
}
