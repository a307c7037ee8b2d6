package com.hired.core.pdf;

import java.util.Objects;

/**
 * A run of text with a style hint, produced by flattening markup or content.
 *
 * @param text plain text, whitespace already collapsed
 * @param style style hint selecting font size, leading and indent
 */
public record TextFragment(
    String text,
    TextStyle style
) {
    public TextFragment {
        text = text == null ? "" : text;
        Objects.requireNonNull(style, "style must not be null");
    }

    public static TextFragment heading(String text) {
        return new TextFragment(text, TextStyle.HEADING);
    }

    public static TextFragment subheading(String text) {
        return new TextFragment(text, TextStyle.SUBHEADING);
    }

    public static TextFragment body(String text) {
        return new TextFragment(text, TextStyle.BODY);
    }

    public static TextFragment bullet(String text) {
        return new TextFragment(text, TextStyle.BULLET);
    }
}
