package com.hired.core.content;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ContentSource} over an in-memory map.
 */
public class MapContentSource implements ContentSource {

    private final Map<String, Object> data;

    public MapContentSource(Map<String, ?> data) {
        Objects.requireNonNull(data, "data must not be null");
        this.data = new LinkedHashMap<>(data);
    }

    @Override
    public Map<String, Object> read() {
        return new LinkedHashMap<>(data);
    }

    @Override
    public String describe() {
        return "in-memory content (" + data.size() + " keys)";
    }
}
