package com.hired.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps format names to renderers.
 *
 * <p>Each registration holds a factory and a lazily created renderer instance
 * that is reused for the lifetime of the registration. Registering a name that
 * is already present replaces the whole registration, so the next lookup gets a
 * renderer from the new factory while a lookup already in flight keeps the
 * instance it obtained. Instances are created at most once per registration,
 * and no reader ever sees a partially constructed renderer.
 *
 * <p>Lookups never substitute a different format: an unregistered name raises
 * {@link UnknownFormatException} listing the registered names.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RendererRegistry registry = new RendererRegistry();
 * registry.register("txt", PlainTextRenderer::new);
 *
 * Renderer renderer = registry.get("txt");
 * byte[] bytes = renderer.render(content, config);
 * }</pre>
 */
public class RendererRegistry {

    private static final Logger log = LoggerFactory.getLogger(RendererRegistry.class);

    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    /**
     * Registers a renderer factory for a format, replacing any earlier registration.
     *
     * <p>A replaced format keeps its original position in {@link #list()}.
     *
     * @param format format name
     * @param factory factory invoked on first lookup
     */
    public void register(String format, RendererFactory factory) {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (format.isBlank()) {
            throw new IllegalArgumentException("format must not be blank");
        }
        Registration previous;
        synchronized (registrations) {
            previous = registrations.put(format, new Registration(format, factory));
        }
        if (previous != null) {
            log.debug("Replaced renderer registration for format '{}'", format);
        } else {
            log.debug("Registered renderer for format '{}'", format);
        }
    }

    /**
     * Returns the renderer for a format, creating it on first use.
     *
     * @param format format name
     * @return shared renderer instance
     * @throws UnknownFormatException if no renderer is registered for the format
     * @throws RenderException if the factory fails or returns null
     */
    public Renderer get(String format) {
        Registration registration;
        synchronized (registrations) {
            registration = format == null ? null : registrations.get(format);
        }
        if (registration == null) {
            throw new UnknownFormatException(format, list());
        }
        return registration.instance();
    }

    /**
     * Returns the registered format names in registration order.
     *
     * @return snapshot of format names
     */
    public List<String> list() {
        synchronized (registrations) {
            return List.copyOf(registrations.keySet());
        }
    }

    public boolean isRegistered(String format) {
        if (format == null) {
            return false;
        }
        synchronized (registrations) {
            return registrations.containsKey(format);
        }
    }

    /**
     * One factory and its memoized renderer.
     */
    private static final class Registration {

        private final String format;
        private final RendererFactory factory;
        private volatile Renderer instance;

        private Registration(String format, RendererFactory factory) {
            this.format = format;
            this.factory = factory;
        }

        private Renderer instance() {
            Renderer result = instance;
            if (result == null) {
                synchronized (this) {
                    result = instance;
                    if (result == null) {
                        result = create();
                        instance = result;
                    }
                }
            }
            return result;
        }

        private Renderer create() {
            Renderer renderer;
            try {
                renderer = factory.create();
            } catch (RenderException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new RenderException("Failed to create renderer for format '" + format + "'", e);
            }
            if (renderer == null) {
                throw new RenderException("Renderer factory for format '" + format + "' returned null");
            }
            log.debug("Created renderer {} for format '{}'", renderer.getClass().getSimpleName(), format);
            return renderer;
        }
    }
}
