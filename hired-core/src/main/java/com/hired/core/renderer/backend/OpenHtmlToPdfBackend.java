package com.hired.core.renderer.backend;

import com.hired.core.pdf.PageProfile;
import com.openhtmltopdf.outputdevice.helper.BaseRendererBuilder;
import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * {@link NativeBackend} backed by openhtmltopdf with its PDFBox output device.
 *
 * <p>openhtmltopdf is an optional dependency. Availability is decided by loading
 * the builder class by name, and all references to the library live in a nested
 * class that is only initialized once the library is known to be present.
 */
public class OpenHtmlToPdfBackend implements NativeBackend {

    public static final String ID = "openhtmltopdf";

    private static final String BUILDER_CLASS = "com.openhtmltopdf.pdfboxout.PdfRendererBuilder";
    private static final float POINTS_PER_INCH = 72f;

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName(BUILDER_CLASS, false, OpenHtmlToPdfBackend.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    @Override
    public byte[] render(String markup, PageProfile profile) throws IOException {
        return PdfBoxOutput.render(markup, profile);
    }

    private static final class PdfBoxOutput {

        private PdfBoxOutput() {
        }

        static byte[] render(String markup, PageProfile profile) throws IOException {
            try (var out = new ByteArrayOutputStream()) {
                var builder = new PdfRendererBuilder();
                builder.useFastMode();
                builder.useDefaultPageSize(
                    profile.width() / POINTS_PER_INCH,
                    profile.height() / POINTS_PER_INCH,
                    BaseRendererBuilder.PageSizeUnits.INCHES);
                builder.withHtmlContent(markup, null);
                builder.toStream(out);
                builder.run();
                return out.toByteArray();
            }
        }
    }
}
