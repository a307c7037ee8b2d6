package com.hired.core.pdf;

/**
 * A wrapped line placed on a page.
 *
 * @param text line text
 * @param style style of the fragment the line came from
 * @param x left edge of the text, in points
 * @param y baseline, in points from the bottom of the page
 * @param bulletMarker whether a bullet glyph is drawn before this line
 */
public record PositionedLine(
    String text,
    TextStyle style,
    double x,
    double y,
    boolean bulletMarker
) {
}
