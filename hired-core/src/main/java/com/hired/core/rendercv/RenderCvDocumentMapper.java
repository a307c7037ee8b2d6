package com.hired.core.rendercv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.hired.core.context.EmptyValues;
import com.hired.core.model.ExtraSection;
import com.hired.core.model.ResumeContent;
import com.hired.core.model.ResumeSection;
import com.hired.core.renderer.RenderException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts resume content into the document shape read by the RenderCV command
 * line tool.
 *
 * <p>Required fields that are missing are filled with placeholder values and a
 * warning is recorded for each one, so a sparse resume still renders. Sections
 * RenderCV does not know are passed through as text entries with a warning.
 *
 * <p><b>Output shape:</b>
 * <pre>{@code
 * cv:
 *   name: Alice Example
 *   email: alice@example.com
 *   sections:
 *     experience:
 *       - company: Acme
 *         position: Engineer
 *         start_date: 2020-01
 *         end_date: present
 * design:
 *   theme: classic
 * }</pre>
 */
public class RenderCvDocumentMapper {

    static final String DEFAULT_NAME = "Professional Name";
    static final String DEFAULT_COMPANY = "Company Name";
    static final String DEFAULT_POSITION = "Position Title";
    static final String DEFAULT_INSTITUTION = "Educational Institution";
    static final String DEFAULT_AREA = "Field of Study";
    static final String DEFAULT_PROJECT = "Project Name";
    static final String DEFAULT_SKILL = "Skill Category";

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}(-\\d{2}){0,2}");
    private static final String PRESENT = "present";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private final String theme;

    /**
     * Creates a mapper.
     *
     * @param theme RenderCV design theme
     */
    public RenderCvDocumentMapper(String theme) {
        this.theme = theme == null || theme.isBlank() ? "classic" : theme;
    }

    /**
     * Builds the RenderCV document.
     *
     * @param content resume content
     * @return document and warnings
     */
    public RenderCvDocument map(ResumeContent content) {
        List<String> warnings = new ArrayList<>();
        Map<String, Object> cv = new LinkedHashMap<>();
        Map<String, Object> basics = content.basics();

        String name = required(text(basics, "name"), DEFAULT_NAME, "basics", "name", warnings);
        cv.put("name", name);
        putIfPresent(cv, "location", location(basics.get("location")));
        putIfPresent(cv, "email", text(basics, "email"));
        putIfPresent(cv, "phone", text(basics, "phone"));
        putIfPresent(cv, "website", text(basics, "url"));
        List<Map<String, Object>> networks = socialNetworks(basics.get("profiles"));
        if (!networks.isEmpty()) {
            cv.put("social_networks", networks);
        }

        Map<String, Object> sections = new LinkedHashMap<>();
        String summary = text(basics, "summary");
        if (summary != null) {
            sections.put("summary", List.of(summary));
        }
        content.sections().forEach((section, entries) -> {
            List<Object> mapped = mapSection(section, entries, name, warnings);
            if (!mapped.isEmpty()) {
                sections.merge(sectionTitle(section), mapped, RenderCvDocumentMapper::concat);
            }
        });
        for (ExtraSection extra : content.extraSections()) {
            List<Object> lines = textLines(extra.value());
            if (lines.isEmpty()) {
                continue;
            }
            warnings.add("Unknown section '" + extra.key() + "' may not render correctly");
            sections.put(extra.title(), lines);
        }
        if (!sections.isEmpty()) {
            cv.put("sections", sections);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("cv", cv);
        document.put("design", Map.of("theme", theme));
        return new RenderCvDocument(document, warnings);
    }

    /**
     * Serializes a document to YAML.
     *
     * @param document document to write
     * @return YAML text
     * @throws RenderException if serialization fails
     */
    public String toYaml(RenderCvDocument document) {
        try {
            return YAML_MAPPER.writeValueAsString(document.document());
        } catch (JsonProcessingException e) {
            throw new RenderException("Failed to serialize RenderCV document", e);
        }
    }

    private List<Object> mapSection(ResumeSection section, List<Map<String, Object>> entries,
                                    String name, List<String> warnings) {
        List<Object> mapped = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Map<String, Object> entry = entries.get(i);
            if (EmptyValues.isEmpty(entry)) {
                continue;
            }
            String where = section.key() + " entry " + i;
            Map<String, Object> out = new LinkedHashMap<>();
            switch (section) {
                case WORK, VOLUNTEER -> {
                    String company = section == ResumeSection.WORK
                        ? firstText(entry, "name", "company")
                        : text(entry, "organization");
                    out.put("company", required(company, DEFAULT_COMPANY, where, "company", warnings));
                    out.put("position", required(text(entry, "position"), DEFAULT_POSITION, where, "position", warnings));
                    putIfPresent(out, "location", location(entry.get("location")));
                    putDates(out, entry, where, warnings);
                    putIfPresent(out, "summary", text(entry, "summary"));
                    putIfPresent(out, "highlights", strings(entry.get("highlights")));
                }
                case EDUCATION -> {
                    out.put("institution", required(text(entry, "institution"), DEFAULT_INSTITUTION, where, "institution", warnings));
                    out.put("area", required(text(entry, "area"), DEFAULT_AREA, where, "area", warnings));
                    putIfPresent(out, "degree", text(entry, "studyType"));
                    putDates(out, entry, where, warnings);
                    List<String> highlights = new ArrayList<>();
                    String score = text(entry, "score");
                    if (score != null) {
                        highlights.add("Score: " + score);
                    }
                    List<String> courses = strings(entry.get("courses"));
                    if (courses != null) {
                        highlights.addAll(courses);
                    }
                    putIfPresent(out, "highlights", highlights.isEmpty() ? null : highlights);
                }
                case PROJECTS -> {
                    out.put("name", required(text(entry, "name"), DEFAULT_PROJECT, where, "name", warnings));
                    putDates(out, entry, where, warnings);
                    putIfPresent(out, "summary", firstText(entry, "description", "summary"));
                    putIfPresent(out, "highlights", strings(entry.get("highlights")));
                }
                case SKILLS -> {
                    out.put("label", required(text(entry, "name"), DEFAULT_SKILL, where, "name", warnings));
                    out.put("details", joined(entry.get("keywords")));
                }
                case LANGUAGES -> oneLine(out, text(entry, "language"), text(entry, "fluency"));
                case INTERESTS -> oneLine(out, text(entry, "name"), joined(entry.get("keywords")));
                case AWARDS -> oneLine(out, text(entry, "title"), joinNonNull(text(entry, "awarder"), text(entry, "date")));
                case CERTIFICATES -> oneLine(out, text(entry, "name"), joinNonNull(text(entry, "issuer"), text(entry, "date")));
                case PUBLICATIONS -> {
                    out.put("title", required(text(entry, "name"), "Publication Title", where, "name", warnings));
                    out.put("authors", List.of(name));
                    putIfPresent(out, "journal", text(entry, "publisher"));
                    putIfPresent(out, "date", normalizeDate(text(entry, "releaseDate")));
                    putIfPresent(out, "url", text(entry, "url"));
                }
                case REFERENCES -> {
                    String reference = joinWith(" - ", text(entry, "reference"), text(entry, "name"));
                    if (reference != null) {
                        mapped.add(reference);
                    }
                    continue;
                }
                default -> throw new IllegalStateException("Unhandled section: " + section);
            }
            if (!out.isEmpty()) {
                mapped.add(out);
            }
        }
        return mapped;
    }

    private static String sectionTitle(ResumeSection section) {
        return switch (section) {
            case WORK, VOLUNTEER -> "experience";
            default -> section.key();
        };
    }

    private static void putDates(Map<String, Object> out, Map<String, Object> entry,
                                 String where, List<String> warnings) {
        String start = text(entry, "startDate");
        String end = text(entry, "endDate");
        if (start == null) {
            if (end != null) {
                out.put("date", end);
            }
            return;
        }
        String normalizedStart = normalizeDate(start);
        String normalizedEnd = end == null ? PRESENT : normalizeDate(end);
        if (!isStructuredDate(normalizedStart) || !isStructuredDate(normalizedEnd)) {
            warnings.add(where + " has free-form dates, rendering them as text: '" + start + "'");
            out.put("date", end == null ? start : start + " - " + end);
            return;
        }
        out.put("start_date", normalizedStart);
        out.put("end_date", normalizedEnd);
    }

    private static boolean isStructuredDate(String value) {
        return PRESENT.equals(value) || ISO_DATE.matcher(value).matches();
    }

    /**
     * Normalizes a date to {@code YYYY}, {@code YYYY-MM}, {@code YYYY-MM-DD} or
     * {@code present} where possible; anything else is returned trimmed.
     */
    static String normalizeDate(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase(PRESENT) || trimmed.equalsIgnoreCase("current")) {
            return PRESENT;
        }
        String iso = trimmed.length() >= 10 && trimmed.charAt(4) == '-' ? trimmed.substring(0, 10) : trimmed;
        return ISO_DATE.matcher(iso).matches() ? iso : trimmed;
    }

    private static void oneLine(Map<String, Object> out, String label, String details) {
        if (label == null && details == null) {
            return;
        }
        out.put("label", label == null ? "" : label);
        out.put("details", details == null ? "" : details);
    }

    private static String required(String value, String fallback, String where, String field, List<String> warnings) {
        if (value != null) {
            return value;
        }
        warnings.add(where + " missing '" + field + "', using default: '" + fallback + "'");
        return fallback;
    }

    private static String location(Object value) {
        if (value instanceof Map<?, ?> map) {
            return joinWith(", ",
                text(map, "city"), text(map, "region"), text(map, "countryCode"));
        }
        return value == null || EmptyValues.isEmpty(value) ? null : value.toString().trim();
    }

    private static List<Map<String, Object>> socialNetworks(Object profiles) {
        List<Map<String, Object>> networks = new ArrayList<>();
        if (profiles instanceof Collection<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> profile) {
                    String network = text(profile, "network");
                    String username = text(profile, "username");
                    if (network != null && username != null) {
                        Map<String, Object> entry = new LinkedHashMap<>();
                        entry.put("network", network);
                        entry.put("username", username);
                        networks.add(entry);
                    }
                }
            }
        }
        return networks;
    }

    private static List<Object> textLines(Object value) {
        List<Object> lines = new ArrayList<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, item) -> {
                if (!EmptyValues.isEmpty(item)) {
                    lines.add(key + ": " + flatten(item));
                }
            });
        } else if (value instanceof Collection<?> list) {
            for (Object item : list) {
                if (!EmptyValues.isEmpty(item)) {
                    lines.add(flatten(item));
                }
            }
        } else if (!EmptyValues.isEmpty(value)) {
            lines.add(value.toString().trim());
        }
        return lines;
    }

    private static String flatten(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .filter(e -> !EmptyValues.isEmpty(e.getValue()))
                .map(e -> e.getKey() + ": " + flatten(e.getValue()))
                .collect(Collectors.joining("; "));
        }
        if (value instanceof Collection<?> list) {
            return list.stream()
                .filter(item -> !EmptyValues.isEmpty(item))
                .map(RenderCvDocumentMapper::flatten)
                .collect(Collectors.joining(", "));
        }
        return String.valueOf(value).trim();
    }

    private static List<String> strings(Object value) {
        if (!(value instanceof Collection<?> list)) {
            return value == null || EmptyValues.isEmpty(value) ? null : List.of(value.toString().trim());
        }
        List<String> result = list.stream()
            .filter(item -> !EmptyValues.isEmpty(item))
            .map(RenderCvDocumentMapper::flatten)
            .toList();
        return result.isEmpty() ? null : result;
    }

    private static String joined(Object value) {
        List<String> items = strings(value);
        return items == null ? "" : String.join(", ", items);
    }

    private static String joinNonNull(String first, String second) {
        return joinWith(", ", first, second);
    }

    private static String joinWith(String separator, String... parts) {
        String joined = Arrays.stream(parts)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(separator));
        return joined.isEmpty() ? null : joined;
    }

    private static String firstText(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            String value = text(map, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null || value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) {
            out.put(key, value);
        }
    }

    private static List<Object> concat(Object first, Object second) {
        List<Object> merged = new ArrayList<>((List<?>) first);
        merged.addAll((List<?>) second);
        return merged;
    }
}
