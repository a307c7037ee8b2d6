package com.hired.core.pdf;

import com.hired.core.ResumeFixtures;
import com.hired.core.context.ContextBuilder;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PdfSerializer}.
 *
 * <p>Output is decoded as ISO-8859-1 so that string indexes equal byte offsets.
 */
class PdfSerializerTest {

    private static final String MARKUP = "<h1>Alice</h1><p>Software Engineer</p>"
        + "<h2>Experience</h2><h3>Engineer - Acme Corp</h3><ul><li>Shipped (billing) \\ service</li></ul>";

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-31T12:00:00Z"), ZoneOffset.UTC);

    private final PdfSerializer serializer = new PdfSerializer(FIXED_CLOCK);

    @Test
    void serialize_hasHeaderAndEofMarker() {
        byte[] pdf = serializer.serialize(MARKUP, PageProfile.LETTER);
        String text = latin1(pdf);

        assertThat(text).startsWith("%PDF-1.4\n%");
        assertThat(pdf[10] & 0xFF).isGreaterThan(127);
        assertThat(text).endsWith("%%EOF");
    }

    @Test
    void serialize_crossReferenceOffsetsPointAtObjects() {
        byte[] pdf = serializer.serialize(MARKUP, PageProfile.LETTER);
        String text = latin1(pdf);

        int startxref = startxref(text);
        assertThat(text.startsWith("xref\n", startxref)).isTrue();

        List<Long> offsets = xrefOffsets(text, startxref);
        assertThat(offsets).isNotEmpty();
        for (int id = 1; id <= offsets.size(); id++) {
            int offset = Math.toIntExact(offsets.get(id - 1));
            assertThat(text.startsWith(id + " 0 obj\n", offset))
                .as("object %d at offset %d", id, offset)
                .isTrue();
        }
    }

    @Test
    void serialize_trailerSizeCountsObjectsPlusFreeEntry() {
        List<TextFragment> fragments = MarkupFlattener.flatten(MARKUP);
        int objects = serializer.layout(fragments, PageProfile.LETTER).objects().size();

        String text = latin1(serializer.serialize(fragments, PageProfile.LETTER));

        assertThat(objects).isEqualTo(3 + 2 + 1);
        assertThat(text).contains("/Size " + (objects + 1) + " ");
        assertThat(text).contains("0 " + (objects + 1) + "\n0000000000 65535 f \n");
    }

    @Test
    void serialize_everyReferenceResolves() {
        String text = latin1(serializer.serialize(manyFragments(150), PageProfile.A4));
        int objectCount = xrefOffsets(text, startxref(text)).size();

        Matcher reference = Pattern.compile("(\\d+) 0 R").matcher(text);
        int found = 0;
        while (reference.find()) {
            found++;
            assertThat(Integer.parseInt(reference.group(1))).isBetween(1, objectCount);
        }
        assertThat(found).isGreaterThan(0);
    }

    @Test
    void serialize_objectGraphOrder() {
        PdfDocumentGraph graph = serializer.layout(manyFragments(100), PageProfile.LETTER);

        assertThat(graph.pageCount()).isGreaterThan(1);
        assertThat(graph.objects()).extracting(PdfObject::id)
            .startsWith(1, 2, 3, 4, 5, 6, 7)
            .isSorted()
            .doesNotHaveDuplicates();
        assertThat(graph.infoId()).isEqualTo(graph.objects().size());
        assertThat(PdfDocumentGraph.pageId(1)).isEqualTo(6);
        assertThat(PdfDocumentGraph.contentId(1)).isEqualTo(7);
    }

    @Test
    void serialize_pagesKidsInPageOrder() {
        String text = latin1(serializer.serialize(manyFragments(100), PageProfile.LETTER));

        Matcher pages = Pattern.compile("/Kids \\[([^\\]]*)\\] /Count (\\d+)").matcher(text);
        assertThat(pages.find()).isTrue();
        int count = Integer.parseInt(pages.group(2));
        StringBuilder expected = new StringBuilder();
        for (int i = 0; i < count; i++) {
            expected.append(i > 0 ? " " : "").append(PdfDocumentGraph.pageId(i)).append(" 0 R");
        }
        assertThat(pages.group(1)).isEqualTo(expected.toString());
    }

    @Test
    void serialize_isDeterministicWithFixedClock() {
        byte[] first = serializer.serialize(MARKUP, PageProfile.LETTER);
        byte[] second = new PdfSerializer(FIXED_CLOCK).serialize(MARKUP, PageProfile.LETTER);

        assertThat(first).isEqualTo(second);
        assertThat(latin1(first)).contains("/CreationDate (D:20240131120000Z)");
    }

    @Test
    void withoutTimestamp_omitsCreationDate() {
        byte[] first = PdfSerializer.withoutTimestamp().serialize(MARKUP, PageProfile.LETTER);
        byte[] second = PdfSerializer.withoutTimestamp().serialize(MARKUP, PageProfile.LETTER);

        assertThat(first).isEqualTo(second);
        assertThat(latin1(first))
            .doesNotContain("/CreationDate")
            .contains("/Producer (Hired) /Title (Alice)");
    }

    @Test
    void serialize_escapesTextOperands() {
        String text = latin1(serializer.serialize(MARKUP, PageProfile.LETTER));

        assertThat(text).contains("(Shipped \\(billing\\) \\\\ service) Tj");
    }

    @Test
    void serialize_emptyMarkupStillProducesOnePage() throws Exception {
        byte[] pdf = serializer.serialize("", PageProfile.LETTER);

        try (PDDocument document = PDDocument.load(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
        }
        assertThat(latin1(pdf)).doesNotContain("/Title");
    }

    @Test
    void serialize_isReadableByPdfBox() throws Exception {
        byte[] pdf = serializer.serialize(MARKUP, PageProfile.A4);

        try (PDDocument document = PDDocument.load(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
            assertThat(document.getPage(0).getMediaBox().getWidth()).isEqualTo(595f);
            assertThat(document.getDocumentInformation().getTitle()).isEqualTo("Alice");

            String extracted = new PDFTextStripper().getText(document);
            assertThat(extracted).contains("Alice", "Experience", "Acme Corp");
        }
    }

    @Test
    void serialize_manyPages() throws Exception {
        byte[] pdf = serializer.serialize(manyFragments(600), PageProfile.LETTER);

        try (PDDocument document = PDDocument.load(pdf)) {
            assertThat(document.getNumberOfPages()).isGreaterThan(5);
            PDFTextStripper lastPage = new PDFTextStripper();
            lastPage.setStartPage(document.getNumberOfPages());
            assertThat(lastPage.getText(document)).contains("Fragment 599");
        }
    }

    @Test
    void serialize_context() throws Exception {
        byte[] pdf = serializer.serialize(new ContextBuilder().build(ResumeFixtures.complete()), PageProfile.LETTER);

        try (PDDocument document = PDDocument.load(pdf)) {
            String extracted = new PDFTextStripper().getText(document);
            assertThat(extracted).contains("Bob Builder", "Initech", "TU Berlin", "Side Projects", "Birdhouse");
        }
    }

    @Test
    void write_matchesSerialize() throws Exception {
        List<TextFragment> fragments = manyFragments(20);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        serializer.write(fragments, PageProfile.LETTER, out);

        assertThat(out.toByteArray()).isEqualTo(serializer.serialize(fragments, PageProfile.LETTER));
    }

    private static List<TextFragment> manyFragments(int count) {
        List<TextFragment> fragments = new ArrayList<>();
        fragments.add(TextFragment.heading("Many"));
        for (int i = 0; i < count; i++) {
            fragments.add(TextFragment.body("Fragment " + i));
        }
        return fragments;
    }

    private static String latin1(byte[] bytes) {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    private static int startxref(String text) {
        int keyword = text.lastIndexOf("startxref\n");
        int start = keyword + "startxref\n".length();
        return Integer.parseInt(text.substring(start, text.indexOf('\n', start)));
    }

    private static List<Long> xrefOffsets(String text, int startxref) {
        String[] lines = text.substring(startxref).split("\n");
        int entries = Integer.parseInt(lines[1].split(" ")[1]);
        List<Long> offsets = new ArrayList<>();
        // lines[2] is the free entry for object 0
        for (int i = 3; i < 2 + entries; i++) {
            assertThat(lines[i]).hasSize(19).endsWith(" n ");
            offsets.add(Long.parseLong(lines[i].substring(0, 10)));
        }
        return offsets;
    }
}
