package com.hired.core.renderer;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when no renderer is registered for a requested format.
 */
public class UnknownFormatException extends RenderException {

    private final String format;
    private final List<String> availableFormats;

    /**
     * Creates the exception.
     *
     * @param format the requested format name
     * @param availableFormats formats that are registered
     */
    public UnknownFormatException(String format, Collection<String> availableFormats) {
        super("No renderer registered for format '" + format + "'. Available formats: " + availableFormats);
        this.format = format;
        this.availableFormats = List.copyOf(availableFormats);
    }

    public String getFormat() {
        return format;
    }

    public List<String> getAvailableFormats() {
        return availableFormats;
    }
}
