package com.diagramparser.core.model;

/**
 * Accessibility metadata declared through {@code accTitle} and {@code accDescr} directives.
 *
 * @param title accessible title, or {@code null}
 * @param description accessible description, or {@code null}
 */
public record AccessibilityInfo(
    String title,
    String description
) {
    /**
     * Creates an instance with neither title nor description.
     *
     * @return empty accessibility info
     */
    public static AccessibilityInfo empty() {
        return new AccessibilityInfo(null, null);
    }

    /**
     * @return true if neither field is set
     */
    public boolean isEmpty() {
        return title == null && description == null;
    }
}
