package com.hired.core.template;

import com.hired.core.context.TemplateContext;

import java.util.Map;

/**
 * Fills template text with values from a {@link TemplateContext}.
 */
public interface MarkupTemplateEngine {

    /**
     * Processes template text.
     *
     * @param templateText template source
     * @param context resume context
     * @param extraVariables additional variables such as {@code css}, may be empty
     * @return generated markup
     * @throws com.hired.core.renderer.RenderException if the template cannot be processed
     */
    String process(String templateText, TemplateContext context, Map<String, Object> extraVariables);

    /**
     * Processes template text with only the context variables.
     *
     * @param templateText template source
     * @param context resume context
     * @return generated markup
     */
    default String process(String templateText, TemplateContext context) {
        return process(templateText, context, Map.of());
    }
}
