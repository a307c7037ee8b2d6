package com.hired.core.renderer.impl;

import com.hired.core.context.ContextBuilder;
import com.hired.core.context.TemplateContext;
import com.hired.core.model.ResumeContent;
import com.hired.core.renderer.Renderer;
import com.hired.core.renderer.RenderingConfig;
import com.hired.core.renderer.OutputFormat;
import com.hired.core.template.MarkupTemplateEngine;
import com.hired.core.theme.Theme;
import com.hired.core.theme.ThemeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Renders resume content into a themed HTML document.
 *
 * <p>Pipeline: {@link ContextBuilder} prunes the content, {@link ThemeResolver}
 * picks the template text, and the {@link MarkupTemplateEngine} fills it in.
 * The stylesheet exposed to templates as {@code css} is the caller's custom CSS
 * if given, otherwise the theme's own. A custom template gets only custom CSS.
 * A stylesheet the template never references is injected as a {@code <style>}
 * element at the end of {@code <head>}, so {@code --css} always takes effect.
 */
public class MarkupRenderer implements Renderer {

    private static final Logger log = LoggerFactory.getLogger(MarkupRenderer.class);

    private final ContextBuilder contextBuilder;
    private final ThemeResolver themeResolver;
    private final MarkupTemplateEngine templateEngine;

    public MarkupRenderer(ContextBuilder contextBuilder, ThemeResolver themeResolver, MarkupTemplateEngine templateEngine) {
        this.contextBuilder = contextBuilder;
        this.themeResolver = themeResolver;
        this.templateEngine = templateEngine;
    }

    @Override
    public String getId() {
        return OutputFormat.HTML.id();
    }

    @Override
    public byte[] render(ResumeContent content, RenderingConfig config) {
        return renderMarkup(content, config).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Renders content to markup text.
     *
     * @param content resume content
     * @param config rendering options
     * @return generated markup
     */
    public String renderMarkup(ResumeContent content, RenderingConfig config) {
        return renderMarkup(contextBuilder.build(content), config);
    }

    /**
     * Renders an already built context to markup text.
     *
     * @param context pruned resume context
     * @param config rendering options
     * @return generated markup
     */
    public String renderMarkup(TemplateContext context, RenderingConfig config) {
        String template;
        String css;
        if (config.hasCustomTemplate()) {
            template = themeResolver.resolve(config.theme(), config.customTemplate());
            css = hasText(config.customCss()) ? config.customCss() : "";
        } else {
            Theme theme = themeResolver.resolveTheme(config.theme());
            template = theme.template();
            css = hasText(config.customCss()) ? config.customCss() : theme.css();
            log.debug("Rendering markup with theme '{}'", theme.name());
        }
        String markup = templateEngine.process(template, context, Map.of("css", css));
        return hasText(css) ? ensureStylesheet(markup, css) : markup;
    }

    static String ensureStylesheet(String markup, String css) {
        String stylesheet = css.strip();
        if (markup.contains(stylesheet)) {
            return markup;
        }
        log.debug("Template does not reference the stylesheet, injecting it into <head>");
        String style = "<style>" + stylesheet + "</style>";
        String lower = markup.toLowerCase(Locale.ROOT);
        int headEnd = lower.indexOf("</head>");
        if (headEnd >= 0) {
            return markup.substring(0, headEnd) + style + markup.substring(headEnd);
        }
        int bodyStart = lower.indexOf("<body");
        if (bodyStart >= 0) {
            return markup.substring(0, bodyStart) + "<head>" + style + "</head>" + markup.substring(bodyStart);
        }
        return style + markup;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
