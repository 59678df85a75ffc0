package com.diagramparser.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SyntheticIdGenerator}.
 */
class SyntheticIdGeneratorTest {

    @Test
    void next_fromFreshGenerator_startsAtZero() {
        SyntheticIdGenerator generator = new SyntheticIdGenerator("subgraph");

        assertThat(generator.next()).isEqualTo("subgraph_0");
        assertThat(generator.next()).isEqualTo("subgraph_1");
        assertThat(generator.next()).isEqualTo("subgraph_2");
    }

    @Test
    void issued_countsGeneratedIds() {
        SyntheticIdGenerator generator = new SyntheticIdGenerator("node");

        assertThat(generator.issued()).isZero();
        generator.next();
        generator.next();

        assertThat(generator.issued()).isEqualTo(2);
    }

    @Test
    void next_withSeparateGenerators_countsIndependently() {
        SyntheticIdGenerator first = new SyntheticIdGenerator("subgraph");
        SyntheticIdGenerator second = new SyntheticIdGenerator("subgraph");

        first.next();
        first.next();

        assertThat(second.next()).isEqualTo("subgraph_0");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "\t"})
    void constructor_withBlankPrefix_throwsException(String prefix) {
        assertThatThrownBy(() -> new SyntheticIdGenerator(prefix))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Prefix must not be blank");
    }
}
