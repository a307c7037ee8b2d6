package com.hired.core.renderer.impl;

import com.hired.core.config.HiredConfig;
import com.hired.core.context.ContextBuilder;
import com.hired.core.pdf.PdfSerializer;
import com.hired.core.renderer.OutputFormat;
import com.hired.core.renderer.RendererRegistry;
import com.hired.core.renderer.backend.NativeBackendAdapter;
import com.hired.core.rendercv.RenderCvDocumentMapper;
import com.hired.core.template.ThymeleafTemplateEngine;
import com.hired.core.theme.ThemeResolver;

import java.time.Duration;

/**
 * Registers the renderers shipped with the library.
 *
 * <p>Factories are lazy: a renderer and its collaborators are only built on the
 * first lookup of its format.
 */
public final class BuiltinRenderers {

    private BuiltinRenderers() {
        // Utility class
    }

    /**
     * Registers {@code html}, {@code pdf} and {@code rendercv}.
     *
     * @param registry registry to populate
     * @param themeResolver theme resolver shared by the markup-based renderers
     * @param config loaded configuration
     */
    public static void registerAll(RendererRegistry registry, ThemeResolver themeResolver, HiredConfig config) {
        registry.register(OutputFormat.HTML.id(), () -> markupRenderer(themeResolver));
        registry.register(OutputFormat.PDF.id(), () -> binaryRenderer(themeResolver, config.pdf()));
        registry.register(OutputFormat.RENDERCV.id(), () -> externalToolchainRenderer(config.rendercv()));
    }

    static MarkupRenderer markupRenderer(ThemeResolver themeResolver) {
        return new MarkupRenderer(new ContextBuilder(), themeResolver, new ThymeleafTemplateEngine());
    }

    static BinaryRenderer binaryRenderer(ThemeResolver themeResolver, HiredConfig.PdfSettings pdf) {
        PdfSerializer serializer = pdf.timestamp() ? new PdfSerializer() : PdfSerializer.withoutTimestamp();
        return new BinaryRenderer(
            new ContextBuilder(),
            markupRenderer(themeResolver),
            NativeBackendAdapter.openHtmlToPdf(pdf.nativeBackend()),
            serializer);
    }

    static ExternalToolchainRenderer externalToolchainRenderer(HiredConfig.RenderCvSettings rendercv) {
        return new ExternalToolchainRenderer(
            new RenderCvDocumentMapper(rendercv.theme()),
            rendercv.executable(),
            Duration.ofSeconds(rendercv.timeoutSeconds()));
    }
}
