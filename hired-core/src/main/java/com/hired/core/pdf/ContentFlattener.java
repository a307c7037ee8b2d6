package com.hired.core.pdf;

import com.hired.core.context.RenderedExtraSection;
import com.hired.core.context.TemplateContext;
import com.hired.core.model.ResumeSection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Produces text fragments straight from a template context, without markup.
 *
 * <p>Layout: name as heading, label, a contact line and the summary; then each
 * section as a heading followed by one subheading per entry (headline and
 * dates), its descriptive text and its list fields as bullets; extra sections
 * last, in their original order.
 */
public final class ContentFlattener {

    private static final List<String> HEADLINE_KEYS = List.of(
        "position", "studyType", "area", "name", "title", "institution", "organization",
        "awarder", "issuer", "publisher", "language", "fluency", "level");
    private static final List<String> TEXT_KEYS = List.of("summary", "description", "reference");
    private static final List<String> CONTACT_KEYS = List.of("email", "phone", "url");

    private ContentFlattener() {
        // Utility class
    }

    /**
     * Flattens a context into fragments.
     *
     * @param context template context
     * @return fragments in reading order
     */
    public static List<TextFragment> flatten(TemplateContext context) {
        List<TextFragment> fragments = new ArrayList<>();
        addBasics(fragments, context);

        context.sections().forEach((section, entries) -> {
            fragments.add(TextFragment.heading(section.title()));
            for (Map<String, Object> entry : entries) {
                addEntry(fragments, section, entry);
            }
        });

        for (RenderedExtraSection extra : context.extraSections()) {
            fragments.add(TextFragment.heading(extra.title()));
            addValue(fragments, extra.value());
        }
        return fragments;
    }

    private static void addBasics(List<TextFragment> fragments, TemplateContext context) {
        Map<String, Object> basics = context.basics();
        addIfPresent(fragments, TextFragment.heading(context.basic("name")));
        addIfPresent(fragments, TextFragment.subheading(context.basic("label")));

        StringJoiner contact = new StringJoiner(" | ");
        CONTACT_KEYS.stream().map(basics::get).filter(Objects::nonNull).map(Object::toString).forEach(contact::add);
        String location = context.location();
        if (location != null) {
            contact.add(location);
        }
        addIfPresent(fragments, TextFragment.body(contact.toString()));

        for (Map<String, Object> profile : context.profiles()) {
            Object url = profile.get("url");
            String label = profile.get("label").toString();
            addIfPresent(fragments, TextFragment.body(url == null || label.contains(url.toString()) ? label : label + " (" + url + ")"));
        }
        addIfPresent(fragments, TextFragment.body(context.basic("summary")));
    }

    private static void addEntry(List<TextFragment> fragments, ResumeSection section, Map<String, Object> entry) {
        StringJoiner headline = new StringJoiner(" - ");
        for (String key : HEADLINE_KEYS) {
            Object value = entry.get(key);
            if (value != null && !(value instanceof Collection<?>) && !(value instanceof Map<?, ?>)) {
                headline.add(value.toString());
            }
        }
        String dates = dates(entry);
        String title = dates.isEmpty() ? headline.toString() : headline + " (" + dates + ")";
        addIfPresent(fragments, new TextFragment(title, section == ResumeSection.SKILLS ? TextStyle.BODY : TextStyle.SUBHEADING));

        for (String key : TEXT_KEYS) {
            Object value = entry.get(key);
            if (value != null) {
                addIfPresent(fragments, TextFragment.body(inline(value)));
            }
        }
        entry.forEach((key, value) -> {
            if (value instanceof Collection<?> items) {
                if (section == ResumeSection.SKILLS) {
                    addIfPresent(fragments, TextFragment.body(inline(items)));
                } else {
                    items.forEach(item -> addIfPresent(fragments, TextFragment.bullet(inline(item))));
                }
            }
        });
    }

    private static String dates(Map<String, Object> entry) {
        Object start = entry.get("startDate");
        Object end = entry.get("endDate");
        Object single = entry.containsKey("date") ? entry.get("date") : entry.get("releaseDate");
        if (start != null) {
            return start + " - " + (end != null ? end : "Present");
        }
        return single != null ? single.toString() : "";
    }

    private static void addValue(List<TextFragment> fragments, Object value) {
        if (value instanceof Collection<?> items) {
            items.forEach(item -> addIfPresent(fragments, TextFragment.bullet(inline(item))));
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((key, child) -> addIfPresent(fragments, TextFragment.body(key + ": " + inline(child))));
        } else {
            addIfPresent(fragments, TextFragment.body(inline(value)));
        }
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
        return value == null ? "" : value.toString();
    }

    private static void addIfPresent(List<TextFragment> fragments, TextFragment fragment) {
        if (!fragment.text().isBlank()) {
            fragments.add(fragment);
        }
    }
}
