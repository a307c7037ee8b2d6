package com.hired.core.pdf;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class PaginatorTest {

    @Test
    void paginate_noFragmentsYieldsOneBlankPage() {
        List<PageLayout> pages = Paginator.paginate(List.of(), PageProfile.LETTER);

        assertThat(pages).hasSize(1);
        assertThat(pages.get(0).isEmpty()).isTrue();
    }

    @Test
    void paginate_placesFirstLineBelowTopMargin() {
        List<PageLayout> pages = Paginator.paginate(List.of(TextFragment.heading("Alice")), PageProfile.LETTER);

        PositionedLine line = pages.get(0).lines().get(0);
        assertThat(line.x()).isEqualTo(72.0);
        assertThat(line.y()).isEqualTo(720.0 - 16);
        assertThat(line.bulletMarker()).isFalse();
    }

    @Test
    void paginate_marksOnlyFirstLineOfBullet() {
        String text = "word ".repeat(60);

        List<PositionedLine> lines = Paginator.paginate(List.of(TextFragment.bullet(text)), PageProfile.LETTER)
            .get(0).lines();

        assertThat(lines).hasSizeGreaterThan(1);
        assertThat(lines.get(0).bulletMarker()).isTrue();
        assertThat(lines.subList(1, lines.size())).noneMatch(PositionedLine::bulletMarker);
        assertThat(lines).allSatisfy(line -> assertThat(line.x()).isEqualTo(86.0));
    }

    @Test
    void paginate_baselinesDecreaseWithinPage() {
        List<PageLayout> pages = Paginator.paginate(mixedFragments(80), PageProfile.A4);

        for (PageLayout page : pages) {
            List<PositionedLine> lines = page.lines();
            for (int i = 1; i < lines.size(); i++) {
                assertThat(lines.get(i).y()).isLessThan(lines.get(i - 1).y());
            }
            assertThat(lines).allSatisfy(line -> assertThat(line.y()).isGreaterThanOrEqualTo(PageProfile.MARGIN));
        }
    }

    @Test
    void paginate_sealsPageWhenHeightRunsOut() {
        List<TextFragment> fragments = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            fragments.add(TextFragment.body("Line " + i));
        }

        List<PageLayout> pages = Paginator.paginate(fragments, PageProfile.LETTER);

        // 648pt usable height / 14pt leading
        assertThat(pages).extracting(page -> page.lines().size()).containsExactly(46, 46, 8);
        assertThat(pages.get(1).lines().get(0).text()).isEqualTo("Line 46");
        assertThat(pages.get(1).lines().get(0).y()).isEqualTo(710.0);
    }

    @Test
    void paginate_hasNoPageLimit() {
        List<PageLayout> pages = Paginator.paginate(mixedFragments(2000), PageProfile.LETTER);

        assertThat(pages).hasSizeGreaterThan(50);
        assertThat(pages).noneMatch(PageLayout::isEmpty);
    }

    @Test
    void paginate_pageCountNeverDecreasesAsContentGrows() {
        Random random = new Random(42);
        for (int run = 0; run < 20; run++) {
            List<TextFragment> fragments = new ArrayList<>();
            int previous = 1;
            for (int i = 0; i < 150; i++) {
                String text = "word ".repeat(1 + random.nextInt(40));
                fragments.add(switch (random.nextInt(4)) {
                    case 0 -> TextFragment.heading(text);
                    case 1 -> TextFragment.subheading(text);
                    case 2 -> TextFragment.body(text);
                    default -> TextFragment.bullet(text);
                });

                int pages = Paginator.paginate(fragments, PageProfile.LETTER).size();

                assertThat(pages).as("run %d, %d fragments", run, fragments.size()).isGreaterThanOrEqualTo(previous);
                previous = pages;
            }
        }
    }

    private static List<TextFragment> mixedFragments(int count) {
        List<TextFragment> fragments = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            fragments.add(switch (i % 4) {
                case 0 -> TextFragment.heading("Section " + i);
                case 1 -> TextFragment.subheading("Entry " + i);
                case 2 -> TextFragment.body("Some body text that goes on for a while. ".repeat(4));
                default -> TextFragment.bullet("A highlight " + i);
            });
        }
        return fragments;
    }
}
