package com.hired.core.pdf;

import java.util.Objects;

/**
 * An indirect object of the document graph.
 *
 * @param id 1-based object number
 * @param body serialized object body, without the {@code obj}/{@code endobj} wrapper
 */
public record PdfObject(
    int id,
    byte[] body
) {
    public PdfObject {
        if (id < 1) {
            throw new IllegalArgumentException("Object ids are 1-based, got " + id);
        }
        Objects.requireNonNull(body, "body must not be null");
    }

    /**
     * Formats an indirect reference to an object.
     *
     * @param id referenced object number
     * @return reference token, e.g. {@code 3 0 R}
     */
    public static String reference(int id) {
        return id + " 0 R";
    }
}
