package com.hired.core.renderer.backend;

import com.hired.core.pdf.PageProfile;

import java.io.IOException;

/**
 * A markup-to-PDF converter that may or may not be present at runtime.
 *
 * <p>{@link #isAvailable()} is asked on every render, so a backend whose
 * libraries are missing is skipped without ever being invoked.
 */
public interface NativeBackend {

    /**
     * Returns unique identifier for this backend.
     *
     * @return backend identifier
     */
    String getId();

    /**
     * Checks whether the backend can run in this process.
     *
     * @return true if the backend's libraries are loadable
     */
    boolean isAvailable();

    /**
     * Converts markup to a PDF document.
     *
     * @param markup well-formed XHTML
     * @param profile page dimensions
     * @return PDF bytes
     * @throws IOException if conversion fails
     */
    byte[] render(String markup, PageProfile profile) throws IOException;
}
