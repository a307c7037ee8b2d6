package com.hired.core.pdf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Byte offsets of the objects of a document, in object number order.
 *
 * <p>Entry 0 is the head of the free list; objects 1..n are recorded in order
 * as they are written, so the table holds an entry for every object and only
 * for the objects written.
 */
public final class CrossReferenceTable {

    private final List<Long> offsets = new ArrayList<>();

    /**
     * Records the offset of the next object.
     *
     * @param objectId object number, must be the next in sequence
     * @param offset byte offset of the {@code obj} keyword line
     * @throws IllegalStateException if objects are recorded out of order
     */
    public void record(int objectId, long offset) {
        int expected = offsets.size() + 1;
        if (objectId != expected) {
            throw new IllegalStateException("Expected object " + expected + " but got " + objectId);
        }
        offsets.add(offset);
    }

    /**
     * Returns the recorded offset of an object.
     *
     * @param objectId 1-based object number
     * @return byte offset
     */
    public long offsetOf(int objectId) {
        return offsets.get(objectId - 1);
    }

    /**
     * Number of in-use objects recorded.
     *
     * @return object count
     */
    public int objectCount() {
        return offsets.size();
    }

    /**
     * Number of table entries including the free entry for object 0; the
     * trailer's {@code /Size}.
     *
     * @return entry count
     */
    public int size() {
        return offsets.size() + 1;
    }

    void writeTo(PdfWriter writer) throws IOException {
        StringBuilder table = new StringBuilder(32 + 20 * size());
        table.append("xref\n")
            .append("0 ").append(size()).append('\n')
            .append("0000000000 65535 f \n");
        for (long offset : offsets) {
            table.append(String.format(Locale.ROOT, "%010d 00000 n \n", offset));
        }
        writer.write(table.toString());
    }

    void writeTrailer(PdfWriter writer, int rootId, int infoId, long tableOffset) throws IOException {
        StringBuilder trailer = new StringBuilder("trailer\n<< /Size ")
            .append(size())
            .append(" /Root ").append(PdfObject.reference(rootId));
        if (infoId > 0) {
            trailer.append(" /Info ").append(PdfObject.reference(infoId));
        }
        trailer.append(" >>\n")
            .append("startxref\n")
            .append(tableOffset).append('\n')
            .append(PdfSerializer.EOF_MARKER);
        writer.write(trailer.toString());
    }
}
