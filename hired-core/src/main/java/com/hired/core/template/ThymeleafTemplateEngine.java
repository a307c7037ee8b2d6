package com.hired.core.template;

import com.hired.core.context.TemplateContext;
import com.hired.core.renderer.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.Locale;
import java.util.Map;

/**
 * Thymeleaf implementation of {@link MarkupTemplateEngine}.
 *
 * <p>Templates are passed as text and resolved with a {@link StringTemplateResolver}
 * in HTML mode, so theme files and caller-supplied templates go through the same
 * path. Parsed templates are not cached.
 *
 * <p><b>Template variables:</b> {@code basics}, {@code work}, {@code education},
 * {@code projects}, {@code skills}, {@code sections}, {@code extraSections}, plus
 * any extra variables passed by the caller (the renderers add {@code css}).
 * Sections that were pruned away are absent, so templates guard them with
 * {@code th:if="${work}"}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MarkupTemplateEngine engine = new ThymeleafTemplateEngine();
 * String html = engine.process("<h1 th:text=\"${basics.name}\">Name</h1>", context);
 * }</pre>
 */
public class ThymeleafTemplateEngine implements MarkupTemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(ThymeleafTemplateEngine.class);

    private final TemplateEngine templateEngine;

    public ThymeleafTemplateEngine() {
        var resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCacheable(false);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
    }

    @Override
    public String process(String templateText, TemplateContext context, Map<String, Object> extraVariables) {
        if (templateText == null || templateText.isBlank()) {
            throw new RenderException("Template text must not be empty");
        }
        var thymeleafContext = new Context(Locale.ROOT);
        thymeleafContext.setVariables(context.toVariables());
        if (extraVariables != null) {
            thymeleafContext.setVariables(extraVariables);
        }

        try {
            String markup = templateEngine.process(templateText, thymeleafContext);
            log.debug("Processed template ({} chars) into {} chars of markup", templateText.length(), markup.length());
            return markup;
        } catch (TemplateEngineException e) {
            throw new RenderException("Failed to process template: " + e.getMessage(), e);
        }
    }
}
