package com.diagramparser.core.grammar.base;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DirectiveAccumulator}.
 */
class DirectiveAccumulatorTest {

    @Test
    void accept_singleLineDirectives_recordsValues() {
        DirectiveAccumulator directives = new DirectiveAccumulator();

        assertThat(directives.accept("title Order flow")).isTrue();
        assertThat(directives.accept("accTitle: Orders")).isTrue();
        assertThat(directives.accept("accDescr Order processing steps")).isTrue();

        assertThat(directives.getTitle()).isEqualTo("Order flow");
        assertThat(directives.getAccessibility().title()).isEqualTo("Orders");
        assertThat(directives.getAccessibility().description()).isEqualTo("Order processing steps");
    }

    @Test
    void accept_nonDirective_returnsFalse() {
        DirectiveAccumulator directives = new DirectiveAccumulator();

        assertThat(directives.accept("A --> B")).isFalse();
        assertThat(directives.accept("accTitleX")).isFalse();
        assertThat(directives.getAccessibility().isEmpty()).isTrue();
    }

    @Test
    void accept_multiLineDescription_joinsWithSingleSpaces() {
        DirectiveAccumulator directives = new DirectiveAccumulator();

        directives.accept("accDescr {");
        assertThat(directives.getMode()).isEqualTo(DirectiveAccumulator.Mode.IN_BLOCK);
        assertThat(directives.accept("First line")).isTrue();
        assertThat(directives.accept("")).isTrue();
        assertThat(directives.accept("%% ignored")).isTrue();
        assertThat(directives.accept("second line")).isTrue();
        assertThat(directives.accept("}")).isTrue();

        assertThat(directives.getMode()).isEqualTo(DirectiveAccumulator.Mode.IDLE);
        assertThat(directives.getAccessibility().description()).isEqualTo("First line second line");
    }

    @Test
    void accept_blockClosedOnLastTextLine_keepsText() {
        DirectiveAccumulator directives = new DirectiveAccumulator();

        directives.accept("accDescr {");
        directives.accept("Only line }");

        assertThat(directives.getMode()).isEqualTo(DirectiveAccumulator.Mode.IDLE);
        assertThat(directives.getAccessibility().description()).isEqualTo("Only line");
    }

    @Test
    void accept_inlineBlock_closesImmediately() {
        DirectiveAccumulator directives = new DirectiveAccumulator();

        directives.accept("accDescr { Short description }");

        assertThat(directives.getMode()).isEqualTo(DirectiveAccumulator.Mode.IDLE);
        assertThat(directives.getAccessibility().description()).isEqualTo("Short description");
    }

    @Test
    void finish_unterminatedBlock_flushesCollectedText() {
        DirectiveAccumulator directives = new DirectiveAccumulator();
        directives.accept("accDescr {");
        directives.accept("never closed");

        directives.finish();

        assertThat(directives.getMode()).isEqualTo(DirectiveAccumulator.Mode.IDLE);
        assertThat(directives.getAccessibility().description()).isEqualTo("never closed");
    }
}
