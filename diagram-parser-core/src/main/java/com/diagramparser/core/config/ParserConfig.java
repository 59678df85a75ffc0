package com.diagramparser.core.config;

import com.diagramparser.core.model.DiagramKind;
import com.diagramparser.core.model.flowchart.FlowDirection;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parser settings.
 *
 * <p>Loaded from {@code diagram-parser.yaml} by {@link ConfigLoader}. Every section is
 * optional; missing sections and values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * flowchart:
 *   defaultDirection: LR
 *
 * sequence:
 *   maxBlockDepth: 16
 *
 * dispatch:
 *   disabledKinds:
 *     - sequence
 * }</pre>
 *
 * @param flowchart flowchart settings
 * @param sequence sequence diagram settings
 * @param dispatch dispatcher settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserConfig(
    @JsonProperty("flowchart") FlowchartSettings flowchart,
    @JsonProperty("sequence") SequenceSettings sequence,
    @JsonProperty("dispatch") DispatchSettings dispatch
) {
    public static final FlowDirection DEFAULT_DIRECTION = FlowDirection.TD;
    public static final int DEFAULT_MAX_BLOCK_DEPTH = 32;

    public ParserConfig {
        if (flowchart == null) {
            flowchart = new FlowchartSettings(null);
        }
        if (sequence == null) {
            sequence = new SequenceSettings(null);
        }
        if (dispatch == null) {
            dispatch = new DispatchSettings(null);
        }
    }

    /**
     * Creates the built-in configuration: direction {@code TD}, block depth 32, all kinds enabled.
     *
     * @return default configuration
     */
    public static ParserConfig defaults() {
        return new ParserConfig(null, null, null);
    }

    /**
     * Flowchart settings.
     *
     * @param defaultDirection direction used when the header omits one or names an unknown one
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FlowchartSettings(
        @JsonProperty("defaultDirection") FlowDirection defaultDirection
    ) {
        public FlowchartSettings {
            if (defaultDirection == null) {
                defaultDirection = DEFAULT_DIRECTION;
            }
        }
    }

    /**
     * Sequence diagram settings.
     *
     * @param maxBlockDepth deepest block nesting kept in the tree; deeper blocks are dropped
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SequenceSettings(
        @JsonProperty("maxBlockDepth") Integer maxBlockDepth
    ) {
        public SequenceSettings {
            if (maxBlockDepth == null) {
                maxBlockDepth = DEFAULT_MAX_BLOCK_DEPTH;
            }
            if (maxBlockDepth < 1) {
                throw new IllegalArgumentException("maxBlockDepth must be at least 1, was " + maxBlockDepth);
            }
        }
    }

    /**
     * Dispatcher settings.
     *
     * @param disabledKinds kind ids (see {@link DiagramKind#getId()}) reported as unsupported
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DispatchSettings(
        @JsonProperty("disabledKinds") List<String> disabledKinds
    ) {
        public DispatchSettings {
            disabledKinds = disabledKinds == null ? List.of() : List.copyOf(disabledKinds);
        }

        /**
         * Resolves configured ids to kinds, ignoring ids that name no kind.
         *
         * @return disabled kinds
         */
        public Set<DiagramKind> resolvedKinds() {
            return disabledKinds.stream()
                .map(DiagramKind::fromId)
                .filter(kind -> kind != null)
                .collect(Collectors.toUnmodifiableSet());
        }

        public boolean isDisabled(DiagramKind kind) {
            return resolvedKinds().contains(kind);
        }
    }
}
