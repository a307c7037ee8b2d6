package com.hired.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resume data handed to the renderers.
 *
 * <p>Content arrives already validated from a content source. Core sections are
 * kept as ordered lists of entries; every top-level key outside the schema is
 * preserved, in encounter order, as an {@link ExtraSection}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Map<String, Object> raw = new LinkedHashMap<>();
 * raw.put("basics", Map.of("name", "Alice"));
 * raw.put("work", List.of(Map.of("name", "Acme", "position", "Engineer")));
 * raw.put("volunteering", "Red Cross");
 *
 * ResumeContent content = ResumeContent.fromMap(raw);
 * content.extraSections(); // [ExtraSection[key=volunteering, ...]]
 * }</pre>
 *
 * @param basics contact block (name, label, email, phone, url, summary, location, profiles)
 * @param sections entries per core section
 * @param extraSections top-level content outside the schema, in encounter order
 */
public record ResumeContent(
    Map<String, Object> basics,
    Map<ResumeSection, List<Map<String, Object>>> sections,
    List<ExtraSection> extraSections
) {
    /**
     * Compact constructor with validation.
     */
    public ResumeContent {
        basics = basics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(basics));
        EnumMap<ResumeSection, List<Map<String, Object>>> copy = new EnumMap<>(ResumeSection.class);
        if (sections != null) {
            sections.forEach((section, entries) -> copy.put(section, entries == null ? List.of() : List.copyOf(entries)));
        }
        sections = Collections.unmodifiableMap(copy);
        extraSections = extraSections == null ? List.of() : List.copyOf(extraSections);
    }

    /**
     * Creates content from a raw top-level map (as read from JSON or YAML).
     *
     * <p>Never fails for well-formed maps: a section given as a single object is
     * treated as a one-entry list, and scalar entries are wrapped as
     * {@code {"name": value}}. A {@code null} key carries no section name and is skipped.
     *
     * @param raw ordered top-level map
     * @return resume content
     */
    public static ResumeContent fromMap(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw must not be null");

        Map<String, Object> basics = new LinkedHashMap<>();
        Map<ResumeSection, List<Map<String, Object>>> sections = new EnumMap<>(ResumeSection.class);
        List<ExtraSection> extras = new ArrayList<>();

        raw.forEach((key, value) -> {
            if (key == null) {
                return;
            }
            if (ResumeSection.BASICS_KEY.equals(key)) {
                if (value instanceof Map<?, ?> map) {
                    map.forEach((k, v) -> basics.put(String.valueOf(k), v));
                }
            } else if (ResumeSection.IGNORED_KEYS.contains(key)) {
                // schema bookkeeping
            } else {
                ResumeSection.fromKey(key).ifPresentOrElse(
                    section -> sections.put(section, toEntries(value)),
                    () -> extras.add(ExtraSection.of(key, value)));
            }
        });

        return new ResumeContent(basics, sections, extras);
    }

    /**
     * Returns the entries of a section.
     *
     * @param section core section
     * @return entries, empty list if absent
     */
    public List<Map<String, Object>> section(ResumeSection section) {
        return sections.getOrDefault(section, List.of());
    }

    public List<Map<String, Object>> work() {
        return section(ResumeSection.WORK);
    }

    public List<Map<String, Object>> education() {
        return section(ResumeSection.EDUCATION);
    }

    public List<Map<String, Object>> projects() {
        return section(ResumeSection.PROJECTS);
    }

    public List<Map<String, Object>> skills() {
        return section(ResumeSection.SKILLS);
    }

    /**
     * Returns the candidate name, or an empty string.
     *
     * @return name from basics
     */
    public String name() {
        Object name = basics.get("name");
        return name == null ? "" : name.toString();
    }

    private static List<Map<String, Object>> toEntries(Object value) {
        List<Map<String, Object>> entries = new ArrayList<>();
        if (value instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                addEntry(entries, item);
            }
        } else if (value != null) {
            addEntry(entries, value);
        }
        return entries;
    }

    private static void addEntry(List<Map<String, Object>> entries, Object item) {
        if (item == null) {
            return;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        if (item instanceof Map<?, ?> map) {
            map.forEach((k, v) -> entry.put(String.valueOf(k), v));
        } else {
            entry.put("name", item);
        }
        entries.add(entry);
    }
}
