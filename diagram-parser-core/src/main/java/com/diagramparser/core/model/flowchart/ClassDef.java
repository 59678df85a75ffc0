package com.diagramparser.core.model.flowchart;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code classDef name fill:#f9f,stroke:#333}
 *
 * @param name class name
 * @param styles CSS-like properties in source order
 */
public record ClassDef(
    String name,
    Map<String, String> styles
) {
    public ClassDef {
        Objects.requireNonNull(name, "name must not be null");
        styles = styles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(styles));
    }
}
