package com.hired.core.context;

import com.hired.core.model.ExtraSection;
import com.hired.core.model.ResumeContent;
import com.hired.core.model.ResumeSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unbescape.html.HtmlEscape;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns resume content into a {@link TemplateContext}.
 *
 * <p>The builder never fails: missing or malformed optional data degrades to
 * omission. It
 * <ol>
 *   <li>prunes absent, blank and empty values recursively ({@link EmptyValues})</li>
 *   <li>drops sections left with no entries, so no empty heading is rendered</li>
 *   <li>renders each extra section to a minimal markup fragment, keeping encounter order</li>
 * </ol>
 *
 * <p>Fragments: a string becomes {@code <p>}, a list {@code <ul>}, a map
 * {@code <dl>}; other values are shown preformatted. All text is escaped.
 */
public class ContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    /**
     * Builds the template context.
     *
     * @param content resume content
     * @return pruned context
     */
    public TemplateContext build(ResumeContent content) {
        Map<String, Object> basics = EmptyValues.pruneMap(content.basics());

        Map<ResumeSection, List<Map<String, Object>>> sections = new EnumMap<>(ResumeSection.class);
        content.sections().forEach((section, entries) -> {
            List<Map<String, Object>> kept = pruneEntries(entries);
            if (kept.isEmpty()) {
                log.debug("Omitting empty section: {}", section.key());
            } else {
                sections.put(section, kept);
            }
        });

        List<RenderedExtraSection> extras = new ArrayList<>();
        for (ExtraSection extra : content.extraSections()) {
            Object value = EmptyValues.prune(extra.value());
            if (value == null) {
                log.debug("Omitting empty extra section: {}", extra.key());
                continue;
            }
            extras.add(new RenderedExtraSection(extra.key(), extra.title(), value, fragment(value)));
        }

        log.debug("Built context with {} sections and {} extra sections", sections.size(), extras.size());
        return new TemplateContext(basics, sections, extras);
    }

    private static List<Map<String, Object>> pruneEntries(List<Map<String, Object>> entries) {
        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            Map<String, Object> pruned = EmptyValues.pruneMap(entry);
            if (!pruned.isEmpty()) {
                kept.add(pruned);
            }
        }
        return kept;
    }

    /**
     * Renders a pruned value as a block-level fragment.
     *
     * @param value pruned, non-empty value
     * @return markup fragment
     */
    static String fragment(Object value) {
        StringBuilder html = new StringBuilder();
        appendBlock(html, value);
        return html.toString();
    }

    private static void appendBlock(StringBuilder html, Object value) {
        if (value instanceof Map<?, ?> map) {
            html.append("<dl>");
            map.forEach((key, child) -> {
                html.append("<dt>").append(escape(key)).append("</dt><dd>");
                appendInline(html, child);
                html.append("</dd>");
            });
            html.append("</dl>");
        } else if (value instanceof Collection<?> items) {
            html.append("<ul>");
            for (Object item : items) {
                html.append("<li>");
                appendInline(html, item);
                html.append("</li>");
            }
            html.append("</ul>");
        } else if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            html.append("<p>").append(escape(value)).append("</p>");
        } else {
            html.append("<pre>").append(escape(value)).append("</pre>");
        }
    }

    private static void appendInline(StringBuilder html, Object value) {
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            appendBlock(html, value);
        } else {
            html.append(escape(value));
        }
    }

    private static String escape(Object value) {
        return HtmlEscape.escapeHtml5Xml(String.valueOf(value));
    }
}
