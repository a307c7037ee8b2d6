package com.hired.core.renderer.impl;

import com.hired.core.context.ContextBuilder;
import com.hired.core.context.TemplateContext;
import com.hired.core.model.ResumeContent;
import com.hired.core.pdf.PdfSerializer;
import com.hired.core.renderer.BackendFailureException;
import com.hired.core.renderer.OutputFormat;
import com.hired.core.renderer.Renderer;
import com.hired.core.renderer.RenderingConfig;
import com.hired.core.renderer.backend.BackendOutcome;
import com.hired.core.renderer.backend.NativeBackendAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders resume content into a PDF document.
 *
 * <p>The themed markup is first offered to the native backend. If the backend
 * is unavailable the built-in {@link PdfSerializer} paginates the same markup.
 * A backend that is available but fails is reported as a
 * {@link BackendFailureException}; it never silently degrades to the fallback.
 */
public class BinaryRenderer implements Renderer {

    private static final Logger log = LoggerFactory.getLogger(BinaryRenderer.class);

    private final ContextBuilder contextBuilder;
    private final MarkupRenderer markupRenderer;
    private final NativeBackendAdapter nativeBackend;
    private final PdfSerializer serializer;

    public BinaryRenderer(ContextBuilder contextBuilder,
                          MarkupRenderer markupRenderer,
                          NativeBackendAdapter nativeBackend,
                          PdfSerializer serializer) {
        this.contextBuilder = contextBuilder;
        this.markupRenderer = markupRenderer;
        this.nativeBackend = nativeBackend;
        this.serializer = serializer;
    }

    @Override
    public String getId() {
        return OutputFormat.PDF.id();
    }

    @Override
    public byte[] render(ResumeContent content, RenderingConfig config) {
        TemplateContext context = contextBuilder.build(content);
        String markup = markupRenderer.renderMarkup(context, config);

        BackendOutcome outcome = nativeBackend.tryRender(markup, config);
        return switch (outcome.status()) {
            case SUCCESS -> outcome.bytes();
            case FAILURE -> throw new BackendFailureException(
                outcome.backendId(),
                "Native PDF backend '" + outcome.backendId() + "' failed: " + describe(outcome.cause()),
                outcome.cause());
            case UNAVAILABLE -> {
                log.debug("Native PDF backend unavailable, using built-in serializer ({} page size)", config.pageSize());
                yield serializer.serialize(markup, config.pageSize());
            }
        };
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }
}
