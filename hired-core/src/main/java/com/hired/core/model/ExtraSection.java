package com.hired.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Caller-supplied top-level content outside the core resume schema.
 *
 * @param key original top-level key
 * @param title human readable title derived from the key
 * @param value raw value (string, list, map or scalar)
 */
public record ExtraSection(
    String key,
    String title,
    Object value
) {
    /**
     * Compact constructor with validation.
     */
    public ExtraSection {
        Objects.requireNonNull(key, "key must not be null");
        if (title == null || title.isBlank()) {
            title = titleFor(key);
        }
    }

    /**
     * Creates an extra section whose title is derived from the key.
     *
     * @param key top-level key
     * @param value raw value
     * @return extra section
     */
    public static ExtraSection of(String key, Object value) {
        return new ExtraSection(key, titleFor(key), value);
    }

    /**
     * Turns {@code side_projects} or {@code side-projects} into {@code Side Projects}.
     *
     * @param key top-level key
     * @return title-cased words
     */
    public static String titleFor(String key) {
        String[] words = key.replace('_', ' ').replace('-', ' ').trim().split("\\s+");
        StringBuilder title = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return title.length() == 0 ? key : title.toString();
    }
}
