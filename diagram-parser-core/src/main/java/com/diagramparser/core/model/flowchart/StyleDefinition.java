package com.diagramparser.core.model.flowchart;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code style id fill:#f9f,stroke:#333}
 *
 * @param target styled element
 * @param styles CSS-like properties in source order
 */
public record StyleDefinition(
    StyleTarget target,
    Map<String, String> styles
) {
    public StyleDefinition {
        Objects.requireNonNull(target, "target must not be null");
        styles = styles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(styles));
    }
}
