package com.hired.core.pdf;

import java.util.List;

/**
 * The lines placed on one sealed page.
 *
 * @param lines positioned lines, top to bottom; empty for a blank page
 */
public record PageLayout(
    List<PositionedLine> lines
) {
    public PageLayout {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
