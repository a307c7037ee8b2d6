package com.hired.core.pdf;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Page sizes supported by the PDF serializer, in PDF points (1/72 inch).
 *
 * <p>All profiles use the same fixed 72pt (one inch) margin on every side; the
 * usable area is what remains for text.
 */
public enum PageProfile {
    /** US Letter, 8.5 x 11 in. */
    LETTER(612, 792),
    /** ISO A4, 210 x 297 mm, rounded to whole points. */
    A4(595, 842);

    /** Margin applied on all four sides. */
    public static final int MARGIN = 72;

    private final int width;
    private final int height;

    PageProfile(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Horizontal space available for text.
     *
     * @return page width minus left and right margins
     */
    public int usableWidth() {
        return width - 2 * MARGIN;
    }

    /**
     * Vertical space available for text.
     *
     * @return page height minus top and bottom margins
     */
    public int usableHeight() {
        return height - 2 * MARGIN;
    }

    /**
     * Y coordinate of the top margin (PDF origin is bottom-left).
     *
     * @return top edge of the text area
     */
    public int top() {
        return height - MARGIN;
    }

    /**
     * Parses a profile name case-insensitively.
     *
     * @param name profile name such as {@code letter} or {@code A4}
     * @return matching profile, or empty if unknown
     */
    public static Optional<PageProfile> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.name().equals(normalized)).findFirst();
    }
}
