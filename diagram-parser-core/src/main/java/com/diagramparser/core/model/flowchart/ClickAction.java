package com.diagramparser.core.model.flowchart;

/**
 * What happens when a node is clicked: a callback, a link, or both.
 *
 * @param callback JavaScript callback name, or {@code null}
 * @param href link URL, or {@code null}
 * @param target link target such as {@code _blank}, or {@code null}
 */
public record ClickAction(
    String callback,
    String href,
    String target
) {
    public ClickAction {
        if (callback == null && href == null) {
            throw new IllegalArgumentException("callback or href must be set");
        }
    }

    public static ClickAction callback(String callback) {
        return new ClickAction(callback, null, null);
    }

    public static ClickAction href(String href, String target) {
        return new ClickAction(null, href, target);
    }

    public boolean hasCallback() {
        return callback != null;
    }

    public boolean hasHref() {
        return href != null;
    }
}
