package com.hired.core.renderer.backend;

import java.util.Objects;

/**
 * Result of asking a native backend to render.
 *
 * <p>Unavailability is a normal outcome, not an error; only {@link Status#FAILURE}
 * carries a cause.
 *
 * @param status outcome kind
 * @param bytes rendered document for {@link Status#SUCCESS}, otherwise null
 * @param cause error for {@link Status#FAILURE}, otherwise null
 * @param backendId backend that produced the outcome, or null if none was configured
 */
public record BackendOutcome(
    Status status,
    byte[] bytes,
    Throwable cause,
    String backendId
) {
    public enum Status {
        /** No backend could run; the caller should use its fallback */
        UNAVAILABLE,
        /** The backend produced a document */
        SUCCESS,
        /** The backend ran and failed */
        FAILURE
    }

    public BackendOutcome {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.SUCCESS && bytes == null) {
            throw new IllegalArgumentException("SUCCESS outcome requires bytes");
        }
        if (status == Status.FAILURE && cause == null) {
            throw new IllegalArgumentException("FAILURE outcome requires a cause");
        }
    }

    public static BackendOutcome unavailable(String backendId) {
        return new BackendOutcome(Status.UNAVAILABLE, null, null, backendId);
    }

    public static BackendOutcome success(String backendId, byte[] bytes) {
        return new BackendOutcome(Status.SUCCESS, bytes, null, backendId);
    }

    public static BackendOutcome failure(String backendId, Throwable cause) {
        return new BackendOutcome(Status.FAILURE, null, cause, backendId);
    }
}
