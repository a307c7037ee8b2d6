package com.hired.core.theme;

import java.util.Objects;

/**
 * A named layout template.
 *
 * @param name theme name used in configuration
 * @param template template text
 * @param css stylesheet text, empty if the theme has none
 */
public record Theme(
    String name,
    String template,
    String css
) {
    public Theme {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(template, "template must not be null");
        if (css == null) {
            css = "";
        }
    }
}
