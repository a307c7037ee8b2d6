package com.hired.core.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An extra section ready for a template.
 *
 * @param id original top-level key, usable as an element id
 * @param title display title
 * @param value pruned value
 * @param html minimal markup fragment presenting the value
 */
public record RenderedExtraSection(
    String id,
    String title,
    Object value,
    String html
) {
    public RenderedExtraSection {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(html, "html must not be null");
    }

    Map<String, Object> toVariables() {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("id", id);
        variables.put("title", title);
        variables.put("value", value);
        variables.put("html", html);
        return variables;
    }
}
