package com.hired.core.renderer;

/**
 * Creates a {@link Renderer} on first use of its format.
 */
@FunctionalInterface
public interface RendererFactory {

    /**
     * Creates the renderer.
     *
     * @return new renderer, never null
     */
    Renderer create();
}
