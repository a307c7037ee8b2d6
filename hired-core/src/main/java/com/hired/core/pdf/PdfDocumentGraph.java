package com.hired.core.pdf;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The object graph of a serialized document.
 *
 * <p>Object numbers are assigned in a fixed order so that identical input always
 * yields identical bytes:
 * <ol>
 *   <li>Catalog</li>
 *   <li>Pages</li>
 *   <li>Font (Helvetica, not embedded)</li>
 *   <li>Page / content stream pairs, in page order</li>
 *   <li>Info dictionary</li>
 * </ol>
 */
public final class PdfDocumentGraph {

    public static final int CATALOG_ID = 1;
    public static final int PAGES_ID = 2;
    public static final int FONT_ID = 3;
    public static final int FIRST_PAGE_ID = 4;

    static final String FONT_RESOURCE = "F1";

    private final List<PdfObject> objects;
    private final int pageCount;
    private final int infoId;

    private PdfDocumentGraph(List<PdfObject> objects, int pageCount, int infoId) {
        this.objects = Collections.unmodifiableList(objects);
        this.pageCount = pageCount;
        this.infoId = infoId;
    }

    /**
     * Builds the object graph for laid-out pages.
     *
     * @param pages sealed pages, at least one
     * @param profile page profile giving the media box
     * @param info document information
     * @return object graph
     */
    public static PdfDocumentGraph build(List<PageLayout> pages, PageProfile profile, DocumentInfo info) {
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("A document needs at least one page");
        }
        List<PdfObject> objects = new ArrayList<>();

        objects.add(new PdfObject(CATALOG_ID, PdfSyntax.ascii(
            "<< /Type /Catalog /Pages " + PdfObject.reference(PAGES_ID) + " >>")));

        StringBuilder kids = new StringBuilder();
        for (int i = 0; i < pages.size(); i++) {
            if (i > 0) {
                kids.append(' ');
            }
            kids.append(PdfObject.reference(pageId(i)));
        }
        objects.add(new PdfObject(PAGES_ID, PdfSyntax.ascii(
            "<< /Type /Pages /Kids [" + kids + "] /Count " + pages.size() + " >>")));

        objects.add(new PdfObject(FONT_ID, PdfSyntax.ascii(
            "<< /Type /Font /Subtype /Type1 /BaseFont /Helvetica /Encoding /WinAnsiEncoding >>")));

        String mediaBox = "[0 0 " + profile.width() + " " + profile.height() + "]";
        for (int i = 0; i < pages.size(); i++) {
            objects.add(new PdfObject(pageId(i), PdfSyntax.ascii(
                "<< /Type /Page /Parent " + PdfObject.reference(PAGES_ID)
                    + " /MediaBox " + mediaBox
                    + " /Resources << /Font << /" + FONT_RESOURCE + " " + PdfObject.reference(FONT_ID) + " >> >>"
                    + " /Contents " + PdfObject.reference(contentId(i)) + " >>")));
            objects.add(new PdfObject(contentId(i), contentStream(pages.get(i))));
        }

        int infoId = 0;
        if (info != null) {
            infoId = objects.size() + 1;
            objects.add(new PdfObject(infoId, infoDictionary(info)));
        }
        return new PdfDocumentGraph(objects, pages.size(), infoId);
    }

    /**
     * Object number of the page at a zero-based index.
     *
     * @param pageIndex zero-based page index
     * @return page object id
     */
    public static int pageId(int pageIndex) {
        return FIRST_PAGE_ID + 2 * pageIndex;
    }

    /**
     * Object number of the content stream of the page at a zero-based index.
     *
     * @param pageIndex zero-based page index
     * @return content stream object id
     */
    public static int contentId(int pageIndex) {
        return pageId(pageIndex) + 1;
    }

    public List<PdfObject> objects() {
        return objects;
    }

    public int pageCount() {
        return pageCount;
    }

    public int rootId() {
        return CATALOG_ID;
    }

    /**
     * Returns the info dictionary object number.
     *
     * @return info object id, or 0 when the document has no info dictionary
     */
    public int infoId() {
        return infoId;
    }

    private static byte[] contentStream(PageLayout page) {
        ByteArrayOutputStream data = new ByteArrayOutputStream();
        for (PositionedLine line : page.lines()) {
            if (line.bulletMarker()) {
                showText(data, line.style(), line.x() - Paginator.BULLET_MARKER_OFFSET, line.y(),
                    PdfSyntax.literal(String.valueOf((char) 0x2022)));
            }
            showText(data, line.style(), line.x(), line.y(), PdfSyntax.literal(line.text()));
        }
        byte[] content = data.toByteArray();

        ByteArrayOutputStream body = new ByteArrayOutputStream(content.length + 48);
        body.writeBytes(PdfSyntax.ascii("<< /Length " + content.length + " >>\nstream\n"));
        body.writeBytes(content);
        body.writeBytes(PdfSyntax.ascii("\nendstream"));
        return body.toByteArray();
    }

    private static void showText(ByteArrayOutputStream data, TextStyle style, double x, double y, byte[] literal) {
        data.writeBytes(PdfSyntax.ascii("BT /" + FONT_RESOURCE + " " + style.fontSize() + " Tf "
            + PdfSyntax.number(x) + " " + PdfSyntax.number(y) + " Td "));
        data.writeBytes(literal);
        data.writeBytes(PdfSyntax.ascii(" Tj ET\n"));
    }

    private static byte[] infoDictionary(DocumentInfo info) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(PdfSyntax.ascii("<< /Producer "));
        body.writeBytes(PdfSyntax.literal(info.producer() == null ? "" : info.producer()));
        if (info.title() != null && !info.title().isBlank()) {
            body.writeBytes(PdfSyntax.ascii(" /Title "));
            body.writeBytes(PdfSyntax.literal(info.title()));
        }
        if (info.creationDate() != null) {
            body.writeBytes(PdfSyntax.ascii(" /CreationDate " + PdfSyntax.date(info.creationDate())));
        }
        body.writeBytes(PdfSyntax.ascii(" >>"));
        return body.toByteArray();
    }
}
