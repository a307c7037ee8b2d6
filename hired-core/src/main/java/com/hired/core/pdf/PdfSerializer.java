package com.hired.core.pdf;

import com.hired.core.context.TemplateContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Self-contained PDF serializer.
 *
 * <p>Produces a minimal, standards-conforming PDF 1.4 document without any
 * document-generation library:
 * <ol>
 *   <li>flatten markup (or content) to styled fragments</li>
 *   <li>word-wrap to the usable page width</li>
 *   <li>paginate to the usable page height</li>
 *   <li>build the object graph (catalog, pages, font, page/content pairs, info)</li>
 *   <li>emit header, objects, cross-reference table and trailer</li>
 * </ol>
 *
 * <p>Output is byte-for-byte deterministic for identical input, except for the
 * info dictionary's {@code /CreationDate}, which is taken from the configured
 * {@link Clock}. Use {@link #withoutTimestamp()} or a fixed clock for
 * reproducible output.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PdfSerializer serializer = new PdfSerializer();
 * byte[] pdf = serializer.serialize("<h1>Alice</h1><p>Engineer</p>", PageProfile.LETTER);
 * }</pre>
 */
public class PdfSerializer {

    private static final Logger log = LoggerFactory.getLogger(PdfSerializer.class);

    public static final String HEADER = "%PDF-1.4";
    public static final String EOF_MARKER = "%%EOF";
    public static final String PRODUCER = "Hired";

    /** Binary comment marking the file as binary for transfer tools. */
    private static final byte[] BINARY_COMMENT = {'%', (byte) 0xE2, (byte) 0xE3, (byte) 0xCF, (byte) 0xD3, '\n'};

    private final Clock clock;

    /**
     * Creates a serializer stamping documents with the current UTC time.
     */
    public PdfSerializer() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a serializer stamping documents from a clock.
     *
     * @param clock clock for the creation date, or null to omit it
     */
    public PdfSerializer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates a serializer that omits the creation date, making output fully deterministic.
     *
     * @return serializer without timestamps
     */
    public static PdfSerializer withoutTimestamp() {
        return new PdfSerializer(null);
    }

    /**
     * Serializes markup.
     *
     * @param markup markup text
     * @param profile page profile
     * @return PDF bytes
     */
    public byte[] serialize(String markup, PageProfile profile) {
        return serialize(MarkupFlattener.flatten(markup), profile);
    }

    /**
     * Serializes a template context directly, without markup.
     *
     * @param context template context
     * @param profile page profile
     * @return PDF bytes
     */
    public byte[] serialize(TemplateContext context, PageProfile profile) {
        return serialize(ContentFlattener.flatten(context), profile);
    }

    /**
     * Serializes text fragments.
     *
     * @param fragments fragments in reading order
     * @param profile page profile
     * @return PDF bytes
     */
    public byte[] serialize(List<TextFragment> fragments, PageProfile profile) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            write(fragments, profile, buffer);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }

    /**
     * Serializes text fragments to a stream.
     *
     * @param fragments fragments in reading order
     * @param profile page profile
     * @param out destination stream, not closed
     * @throws IOException if writing to the destination fails
     */
    public void write(List<TextFragment> fragments, PageProfile profile, OutputStream out) throws IOException {
        PdfDocumentGraph graph = layout(fragments, profile);
        PdfWriter writer = new PdfWriter(out);
        CrossReferenceTable xref = new CrossReferenceTable();

        writer.write(HEADER + "\n");
        writer.write(BINARY_COMMENT);

        for (PdfObject object : graph.objects()) {
            xref.record(object.id(), writer.position());
            writer.write(object.id() + " 0 obj\n");
            writer.write(object.body());
            writer.write("\nendobj\n");
        }

        long tableOffset = writer.position();
        xref.writeTo(writer);
        xref.writeTrailer(writer, graph.rootId(), graph.infoId(), tableOffset);
        writer.flush();

        log.debug("Serialized {} pages, {} objects, {} bytes",
            graph.pageCount(), xref.objectCount(), writer.position());
    }

    /**
     * Lays out fragments and builds the object graph.
     *
     * @param fragments fragments in reading order
     * @param profile page profile
     * @return object graph
     */
    public PdfDocumentGraph layout(List<TextFragment> fragments, PageProfile profile) {
        List<PageLayout> pages = Paginator.paginate(fragments, profile);
        return PdfDocumentGraph.build(pages, profile, documentInfo(fragments));
    }

    private DocumentInfo documentInfo(List<TextFragment> fragments) {
        String title = fragments.stream()
            .filter(fragment -> fragment.style() == TextStyle.HEADING)
            .map(TextFragment::text)
            .findFirst()
            .orElse(null);
        ZonedDateTime created = clock == null ? null : ZonedDateTime.now(clock);
        return new DocumentInfo(title, PRODUCER, created);
    }
}
