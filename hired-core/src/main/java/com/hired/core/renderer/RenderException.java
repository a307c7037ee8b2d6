package com.hired.core.renderer;

/**
 * Base exception for failures surfaced by the rendering pipeline.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
