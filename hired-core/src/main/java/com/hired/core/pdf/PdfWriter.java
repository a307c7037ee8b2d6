package com.hired.core.pdf;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Output wrapper that tracks the byte position of everything written.
 *
 * <p>Positions are counted from the first header byte, so they are exactly the
 * offsets recorded in the cross-reference table.
 */
final class PdfWriter {

    private final OutputStream out;
    private long position;

    PdfWriter(OutputStream out) {
        this.out = out;
    }

    void write(byte[] bytes) throws IOException {
        out.write(bytes);
        position += bytes.length;
    }

    void write(String ascii) throws IOException {
        write(PdfSyntax.ascii(ascii));
    }

    long position() {
        return position;
    }

    void flush() throws IOException {
        out.flush();
    }
}
