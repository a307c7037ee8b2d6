package com.hired.core.context;

import com.hired.core.model.ExtraSection;
import com.hired.core.model.ResumeSection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Pruned, presentation-ready view of resume content.
 *
 * <p>Only non-empty sections are present. Templates test for a section by
 * checking its variable, so an absent section renders no heading at all.
 *
 * <p><b>Template variables</b> (see {@link #toVariables()}):
 * <ul>
 *   <li>{@code basics} - contact block map</li>
 *   <li>{@code location} - formatted location line, only when present</li>
 *   <li>{@code profiles} - {@code {label, url}} per online profile</li>
 *   <li>{@code work}, {@code education}, {@code projects}, {@code skills} - entry lists, only when non-empty</li>
 *   <li>{@code sections} - the other non-empty core sections as {@code {key, title, entries, rows}},
 *       where each row lists an entry's fields as {@code {label, text}}</li>
 *   <li>{@code extraSections} - {@code {id, title, value, html}} in original order</li>
 * </ul>
 *
 * @param basics pruned contact block
 * @param sections non-empty core sections in schema order
 * @param extraSections non-empty extra sections in encounter order
 */
public record TemplateContext(
    Map<String, Object> basics,
    Map<ResumeSection, List<Map<String, Object>>> sections,
    List<RenderedExtraSection> extraSections
) {
    private static final List<String> LOCATION_KEYS = List.of("address", "city", "region", "postalCode", "countryCode");

    public TemplateContext {
        basics = basics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(basics));
        EnumMap<ResumeSection, List<Map<String, Object>>> copy = new EnumMap<>(ResumeSection.class);
        if (sections != null) {
            sections.forEach((section, entries) -> {
                if (entries != null && !entries.isEmpty()) {
                    copy.put(section, List.copyOf(entries));
                }
            });
        }
        sections = Collections.unmodifiableMap(copy);
        extraSections = extraSections == null ? List.of() : List.copyOf(extraSections);
    }

    /**
     * Whether a section survived pruning.
     *
     * @param section core section
     * @return true if the section has at least one entry
     */
    public boolean hasSection(ResumeSection section) {
        return sections.containsKey(section);
    }

    /**
     * Returns a string field of the contact block.
     *
     * @param field field name
     * @return value as string, or null if absent
     */
    public String basic(String field) {
        Object value = basics.get(field);
        return value == null ? null : value.toString();
    }

    /**
     * Formats the location of the contact block.
     *
     * <p>A structured location is joined as {@code address, city, region, postalCode, countryCode}.
     *
     * @return location line, or null if absent
     */
    public String location() {
        Object location = basics.get("location");
        if (location instanceof Map<?, ?> map) {
            StringJoiner place = new StringJoiner(", ");
            LOCATION_KEYS.stream().map(map::get).filter(Objects::nonNull).map(Object::toString).forEach(place::add);
            return place.length() == 0 ? null : place.toString();
        }
        return location == null ? null : location.toString();
    }

    /**
     * Returns the online profiles of the contact block as {@code {label, url}} maps.
     *
     * @return profiles in original order
     */
    public List<Map<String, Object>> profiles() {
        List<Map<String, Object>> profiles = new ArrayList<>();
        if (basics.get("profiles") instanceof Collection<?> items) {
            for (Object item : items) {
                Map<String, Object> profile = new LinkedHashMap<>();
                if (item instanceof Map<?, ?> map) {
                    Object network = map.get("network");
                    Object username = map.get("username");
                    Object url = map.get("url");
                    StringJoiner label = new StringJoiner(": ");
                    if (network != null) {
                        label.add(network.toString());
                    }
                    if (username != null) {
                        label.add(username.toString());
                    } else if (url != null) {
                        label.add(url.toString());
                    }
                    profile.put("label", label.toString());
                    profile.put("url", url == null ? null : url.toString());
                } else {
                    profile.put("label", String.valueOf(item));
                    profile.put("url", null);
                }
                profiles.add(profile);
            }
        }
        return profiles;
    }

    /**
     * Converts the context into template variables.
     *
     * @return mutable variable map
     */
    public Map<String, Object> toVariables() {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("basics", basics);
        String location = location();
        if (location != null) {
            variables.put("location", location);
        }
        variables.put("profiles", profiles());

        List<Map<String, Object>> generic = new ArrayList<>();
        sections.forEach((section, entries) -> {
            if (section.hasDedicatedLayout()) {
                variables.put(section.key(), entries);
            } else {
                Map<String, Object> block = new LinkedHashMap<>();
                block.put("key", section.key());
                block.put("title", section.title());
                block.put("entries", entries);
                block.put("rows", entries.stream().map(TemplateContext::fields).toList());
                generic.add(block);
            }
        });
        variables.put("sections", generic);
        variables.put("extraSections", extraSections.stream().map(RenderedExtraSection::toVariables).toList());
        return variables;
    }

    private static List<Map<String, Object>> fields(Map<String, Object> entry) {
        List<Map<String, Object>> fields = new ArrayList<>();
        entry.forEach((key, value) -> {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("label", ExtraSection.titleFor(key));
            field.put("text", inline(value));
            fields.add(field);
        });
        return fields;
    }

    private static String inline(Object value) {
        if (value instanceof Map<?, ?> map) {
            StringJoiner joined = new StringJoiner("; ");
            map.forEach((key, child) -> joined.add(key + ": " + inline(child)));
            return joined.toString();
        }
        if (value instanceof Collection<?> items) {
            StringJoiner joined = new StringJoiner(", ");
            items.forEach(item -> joined.add(inline(item)));
            return joined.toString();
        }
        return String.valueOf(value);
    }
}
