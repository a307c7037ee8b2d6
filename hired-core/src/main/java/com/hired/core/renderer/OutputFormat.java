package com.hired.core.renderer;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Output formats shipped with the library.
 *
 * <p>Other formats can be added at runtime with
 * {@link RendererRegistry#register(String, RendererFactory)}; format names are
 * plain strings so that registration stays open.
 */
public enum OutputFormat {
    /** Themed HTML document */
    HTML("html", "text/html"),
    /** Paged document from the native backend or the built-in serializer */
    PDF("pdf", "application/pdf"),
    /** PDF produced by the external RenderCV toolchain */
    RENDERCV("rendercv", "application/pdf");

    private final String id;
    private final String mediaType;

    OutputFormat(String id, String mediaType) {
        this.id = id;
        this.mediaType = mediaType;
    }

    public String id() {
        return id;
    }

    public String mediaType() {
        return mediaType;
    }

    /**
     * Looks up a built-in format by id, ignoring case.
     *
     * @param id format id
     * @return matching format, or empty if the id is not a built-in format
     */
    public static Optional<OutputFormat> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(format -> format.id.equals(normalized))
            .findFirst();
    }
}
