package com.hired.core.renderer;

import com.hired.core.model.ResumeContent;

/**
 * Converts resume content into the bytes of one output format.
 *
 * <p>Renderers are registered by format name in a {@link RendererRegistry} and
 * created lazily through a {@link RendererFactory}. A renderer instance is shared
 * by every caller of the registry, so implementations must be safe for concurrent
 * {@link #render} calls.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PlainTextRenderer implements Renderer {
 *     @Override
 *     public String getId() {
 *         return "txt";
 *     }
 *
 *     @Override
 *     public byte[] render(ResumeContent content, RenderingConfig config) {
 *         return content.name().getBytes(StandardCharsets.UTF_8);
 *     }
 * }
 * }</pre>
 *
 * @see RendererRegistry
 * @see RenderingConfig
 */
public interface Renderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Should be lowercase (e.g., "html", "pdf", "rendercv").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders resume content.
     *
     * @param content content to render
     * @param config rendering options
     * @return rendered document bytes
     * @throws RenderException if the document cannot be produced
     */
    byte[] render(ResumeContent content, RenderingConfig config);
}
