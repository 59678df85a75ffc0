package com.diagramparser.core.util;

/**
 * Generates ids for elements the source leaves unnamed, such as anonymous subgraphs.
 *
 * <p>One instance is created per parse and passed down explicitly, so ids are
 * deterministic for a given input and independent of any other parse running at the
 * same time. Instances are not thread-safe.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SyntheticIdGenerator ids = new SyntheticIdGenerator("subgraph");
 * ids.next(); // "subgraph_0"
 * ids.next(); // "subgraph_1"
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SyntheticIdGenerator {

    private final String prefix;
    private int counter;

    /**
     * @param prefix prefix of every generated id
     * @throws IllegalArgumentException if prefix is null or blank
     */
    public SyntheticIdGenerator(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Prefix must not be blank");
        }
        this.prefix = prefix;
    }

    /**
     * Returns the next id, {@code prefix_N} with N counting from zero.
     *
     * @return fresh id
     */
    public String next() {
        return prefix + "_" + counter++;
    }

    /**
     * @return number of ids handed out so far
     */
    public int issued() {
        return counter;
    }
}
