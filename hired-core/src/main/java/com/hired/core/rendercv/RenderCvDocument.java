package com.hired.core.rendercv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A RenderCV input document and the data problems found while building it.
 *
 * @param document {@code cv} and {@code design} blocks, ready for YAML serialization
 * @param warnings human-readable notes about defaulted or unsupported data
 */
public record RenderCvDocument(
    Map<String, Object> document,
    List<String> warnings
) {
    public RenderCvDocument {
        document = Collections.unmodifiableMap(new LinkedHashMap<>(document));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> cv() {
        return (Map<String, Object>) document.getOrDefault("cv", Map.of());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> sections() {
        return (Map<String, Object>) cv().getOrDefault("sections", Map.of());
    }
}
