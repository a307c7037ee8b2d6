package com.hired.core.renderer.backend;

import com.hired.core.renderer.RenderingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Wraps an optional {@link NativeBackend} and reports what happened as a
 * {@link BackendOutcome}.
 *
 * <p>The backend is probed on every call. A disabled adapter, a missing backend
 * or one whose libraries are not on the classpath yields
 * {@link BackendOutcome.Status#UNAVAILABLE}. Any error raised by an available
 * backend yields {@link BackendOutcome.Status#FAILURE}; the adapter itself never
 * throws for backend errors.
 */
public class NativeBackendAdapter {

    private static final Logger log = LoggerFactory.getLogger(NativeBackendAdapter.class);

    private final NativeBackend backend;
    private final boolean enabled;

    /**
     * Creates an adapter.
     *
     * @param backend backend to wrap, may be null
     * @param enabled whether the backend may be used at all
     */
    public NativeBackendAdapter(NativeBackend backend, boolean enabled) {
        this.backend = backend;
        this.enabled = enabled;
    }

    /**
     * Creates an adapter around the bundled openhtmltopdf backend.
     *
     * @param enabled whether the backend may be used
     * @return adapter
     */
    public static NativeBackendAdapter openHtmlToPdf(boolean enabled) {
        return new NativeBackendAdapter(new OpenHtmlToPdfBackend(), enabled);
    }

    /**
     * Creates an adapter that always reports {@link BackendOutcome.Status#UNAVAILABLE}.
     *
     * @return disabled adapter
     */
    public static NativeBackendAdapter disabled() {
        return new NativeBackendAdapter(null, false);
    }

    /**
     * Attempts to render markup with the native backend.
     *
     * @param markup well-formed XHTML
     * @param config rendering options; only the page size is used
     * @return outcome of the attempt
     */
    public BackendOutcome tryRender(String markup, RenderingConfig config) {
        if (!enabled || backend == null) {
            log.debug("Native backend disabled");
            return BackendOutcome.unavailable(backend == null ? null : backend.getId());
        }
        String backendId = backend.getId();
        if (!backend.isAvailable()) {
            log.debug("Native backend '{}' not available on the classpath", backendId);
            return BackendOutcome.unavailable(backendId);
        }

        try {
            byte[] bytes = backend.render(markup, config.pageSize());
            if (bytes == null || bytes.length == 0) {
                return BackendOutcome.failure(backendId,
                    new IOException("Backend '" + backendId + "' produced no output"));
            }
            log.debug("Native backend '{}' produced {} bytes", backendId, bytes.length);
            return BackendOutcome.success(backendId, bytes);
        } catch (IOException | RuntimeException | LinkageError e) {
            log.debug("Native backend '{}' failed: {}", backendId, e.getMessage());
            return BackendOutcome.failure(backendId, e);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}
