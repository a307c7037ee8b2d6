package com.hired.core.pdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays wrapped lines out onto pages.
 *
 * <p>Lines are stacked from the top margin down. When the next line's leading
 * would overflow the usable page height, the current page is sealed and a new
 * page starts at the top margin. There is no page limit, and at least one
 * (possibly blank) page is always produced.
 */
public final class Paginator {

    private static final Logger log = LoggerFactory.getLogger(Paginator.class);

    /** Horizontal offset of the bullet glyph, left of the bullet text. */
    static final int BULLET_MARKER_OFFSET = 10;

    private Paginator() {
        // Utility class
    }

    /**
     * Wraps and paginates fragments.
     *
     * @param fragments flattened text fragments in reading order
     * @param profile page profile
     * @return sealed pages, never empty
     */
    public static List<PageLayout> paginate(List<TextFragment> fragments, PageProfile profile) {
        List<PageLayout> pages = new ArrayList<>();
        List<PositionedLine> current = new ArrayList<>();
        double used = 0;

        for (TextFragment fragment : fragments) {
            TextStyle style = fragment.style();
            List<String> lines = WordWrapper.wrap(fragment, profile);
            for (int i = 0; i < lines.size(); i++) {
                if (used + style.leading() > profile.usableHeight() && !current.isEmpty()) {
                    pages.add(new PageLayout(current));
                    current = new ArrayList<>();
                    used = 0;
                }
                double x = PageProfile.MARGIN + style.indent();
                double baseline = profile.top() - used - style.fontSize();
                boolean marker = style == TextStyle.BULLET && i == 0;
                current.add(new PositionedLine(lines.get(i), style, x, baseline, marker));
                used += style.leading();
            }
        }

        if (!current.isEmpty() || pages.isEmpty()) {
            pages.add(new PageLayout(current));
        }
        log.debug("Laid out {} fragments onto {} pages", fragments.size(), pages.size());
        return pages;
    }
}
