package com.hired.core.renderer;

/**
 * Thrown when an available rendering backend fails to convert a document.
 *
 * <p>Backend failures are never masked by falling back to a degraded renderer.
 */
public class BackendFailureException extends RenderException {

    private final String backendId;

    public BackendFailureException(String backendId, String message) {
        super(message);
        this.backendId = backendId;
    }

    public BackendFailureException(String backendId, String message, Throwable cause) {
        super(message, cause);
        this.backendId = backendId;
    }

    /**
     * Returns the identifier of the backend that failed.
     *
     * @return backend id, e.g. {@code openhtmltopdf} or {@code rendercv}
     */
    public String getBackendId() {
        return backendId;
    }
}
