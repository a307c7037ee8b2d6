package com.hired.core.pdf;

import org.unbescape.html.HtmlEscape;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips markup down to styled text fragments.
 *
 * <p>Headings {@code h1}-{@code h2} become {@link TextStyle#HEADING},
 * {@code h3}-{@code h6} and {@code dt} become {@link TextStyle#SUBHEADING},
 * {@code li} becomes {@link TextStyle#BULLET} and all other text is
 * {@link TextStyle#BODY}. Block-level tags end the current fragment; inline
 * tags are dropped. Document head, scripts, styles and comments are removed,
 * entities are unescaped and whitespace is collapsed.
 */
public final class MarkupFlattener {

    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern NON_CONTENT = Pattern.compile(
        "<(head|script|style|title)\\b[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern DECLARATION = Pattern.compile("<![^>]*>|<\\?.*?\\?>", Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<(/?)([a-zA-Z][a-zA-Z0-9]*)\\b[^>]*?(/?)>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> BLOCK_TAGS = Set.of(
        "address", "article", "aside", "blockquote", "body", "br", "dd", "div", "dl", "fieldset",
        "figcaption", "figure", "footer", "form", "header", "hr", "html", "main", "nav", "ol",
        "p", "pre", "section", "table", "tbody", "td", "tfoot", "th", "thead", "tr", "ul");

    private MarkupFlattener() {
        // Utility class
    }

    /**
     * Flattens markup into fragments in document order.
     *
     * @param markup markup text, may be null
     * @return non-empty text fragments
     */
    public static List<TextFragment> flatten(String markup) {
        List<TextFragment> fragments = new ArrayList<>();
        if (markup == null || markup.isBlank()) {
            return fragments;
        }

        String cleaned = COMMENT.matcher(markup).replaceAll(" ");
        cleaned = NON_CONTENT.matcher(cleaned).replaceAll(" ");
        cleaned = DECLARATION.matcher(cleaned).replaceAll(" ");

        Deque<String> open = new ArrayDeque<>();
        StringBuilder text = new StringBuilder();
        Matcher tag = TAG.matcher(cleaned);
        int last = 0;
        while (tag.find()) {
            text.append(cleaned, last, tag.start());
            last = tag.end();

            String name = tag.group(2).toLowerCase(Locale.ROOT);
            boolean closing = !tag.group(1).isEmpty();
            boolean selfClosing = !tag.group(3).isEmpty();

            if (styleOf(name) != null) {
                flush(fragments, text, currentStyle(open));
                if (closing) {
                    close(open, name);
                } else if (!selfClosing) {
                    open.push(name);
                }
            } else if (BLOCK_TAGS.contains(name)) {
                flush(fragments, text, currentStyle(open));
            }
        }
        text.append(cleaned, last, cleaned.length());
        flush(fragments, text, currentStyle(open));
        return fragments;
    }

    private static TextStyle styleOf(String tagName) {
        return switch (tagName) {
            case "h1", "h2" -> TextStyle.HEADING;
            case "h3", "h4", "h5", "h6", "dt" -> TextStyle.SUBHEADING;
            case "li" -> TextStyle.BULLET;
            default -> null;
        };
    }

    private static TextStyle currentStyle(Deque<String> open) {
        return open.isEmpty() ? TextStyle.BODY : styleOf(open.peek());
    }

    private static void close(Deque<String> open, String name) {
        if (!open.contains(name)) {
            return;
        }
        String popped;
        do {
            popped = open.pop();
        } while (!popped.equals(name));
    }

    private static void flush(List<TextFragment> fragments, StringBuilder text, TextStyle style) {
        String plain = WHITESPACE.matcher(HtmlEscape.unescapeHtml(text.toString())).replaceAll(" ").strip();
        text.setLength(0);
        if (!plain.isEmpty()) {
            fragments.add(new TextFragment(plain, style));
        }
    }
}
