package com.hired.core.pdf;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Greedy word wrapper working on estimated glyph widths.
 *
 * <p>Words are never split. A word wider than the available width is placed
 * alone on its own line rather than truncated.
 */
public final class WordWrapper {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private WordWrapper() {
        // Utility class
    }

    /**
     * Wraps text into lines no wider than {@code maxWidth} (except single over-wide words).
     *
     * @param text text to wrap
     * @param style style used to estimate widths
     * @param maxWidth available width in points
     * @return wrapped lines; empty when the text has no words
     */
    public static List<String> wrap(String text, TextStyle style, double maxWidth) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return lines;
        }

        StringBuilder current = new StringBuilder();
        for (String word : WHITESPACE.split(text.strip())) {
            if (current.length() == 0) {
                current.append(word);
                continue;
            }
            String candidate = current + " " + word;
            if (style.estimateWidth(candidate) <= maxWidth) {
                current.append(' ').append(word);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        lines.add(current.toString());
        return lines;
    }

    /**
     * Wraps a fragment using the usable width of a page profile, minus the style indent.
     *
     * @param fragment fragment to wrap
     * @param profile page profile
     * @return wrapped lines
     */
    public static List<String> wrap(TextFragment fragment, PageProfile profile) {
        return wrap(fragment.text(), fragment.style(), availableWidth(fragment.style(), profile));
    }

    /**
     * Width available to a style on a page.
     *
     * @param style text style
     * @param profile page profile
     * @return usable width minus the style indent
     */
    public static double availableWidth(TextStyle style, PageProfile profile) {
        return profile.usableWidth() - style.indent();
    }
}
