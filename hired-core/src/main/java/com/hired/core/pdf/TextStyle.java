package com.hired.core.pdf;

/**
 * Built-in text styles of the default layout.
 *
 * <p>Every style uses the single Helvetica font of the document. Widths are
 * estimated with a fixed average glyph width of half the font size, which is
 * close to Helvetica's mean advance for mixed-case Latin text.
 */
public enum TextStyle {
    HEADING(16, 22, 0),
    SUBHEADING(12, 17, 0),
    BODY(10, 14, 0),
    BULLET(10, 14, 14);

    /** Average glyph width as a fraction of the font size. */
    public static final double AVERAGE_GLYPH_WIDTH = 0.5;

    private final int fontSize;
    private final int leading;
    private final int indent;

    TextStyle(int fontSize, int leading, int indent) {
        this.fontSize = fontSize;
        this.leading = leading;
        this.indent = indent;
    }

    public int fontSize() {
        return fontSize;
    }

    /**
     * Vertical distance consumed by one line of this style.
     *
     * @return line height in points
     */
    public int leading() {
        return leading;
    }

    /**
     * Left indent applied to every line of this style.
     *
     * @return indent in points
     */
    public int indent() {
        return indent;
    }

    public double averageCharWidth() {
        return fontSize * AVERAGE_GLYPH_WIDTH;
    }

    /**
     * Estimates the rendered width of a string in this style.
     *
     * @param text text to measure
     * @return estimated width in points
     */
    public double estimateWidth(String text) {
        return text.codePointCount(0, text.length()) * averageCharWidth();
    }
}
