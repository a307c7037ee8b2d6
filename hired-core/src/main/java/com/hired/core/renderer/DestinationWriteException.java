package com.hired.core.renderer;

import java.nio.file.Path;

/**
 * Thrown when rendered output cannot be written to its destination.
 * No partial file is left behind at the destination.
 */
public class DestinationWriteException extends RenderException {

    private final Path destination;

    public DestinationWriteException(Path destination, Throwable cause) {
        super("Failed to write rendered output to: " + destination, cause);
        this.destination = destination;
    }

    public Path getDestination() {
        return destination;
    }
}
