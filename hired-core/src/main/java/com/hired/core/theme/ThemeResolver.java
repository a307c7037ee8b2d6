package com.hired.core.theme;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a theme name, or an explicit custom template, to template text.
 *
 * <p>A non-empty custom template is returned verbatim and bypasses theme
 * lookup. An unknown theme name is not an error: a warning naming the
 * available themes is logged and the default theme is used.
 */
public class ThemeResolver {

    private static final Logger log = LoggerFactory.getLogger(ThemeResolver.class);

    private final ThemeRegistry themes;

    public ThemeResolver(ThemeRegistry themes) {
        if (!themes.contains(ThemeRegistry.DEFAULT_THEME)) {
            throw new IllegalArgumentException(
                "Theme registry must contain the '" + ThemeRegistry.DEFAULT_THEME + "' theme, found: " + themes.names());
        }
        this.themes = themes;
    }

    /**
     * Resolves template text.
     *
     * @param themeName requested theme, may be null
     * @param customTemplate literal template text, may be null
     * @return template text
     */
    public String resolve(String themeName, String customTemplate) {
        if (customTemplate != null && !customTemplate.isBlank()) {
            log.debug("Using caller-supplied template ({} chars)", customTemplate.length());
            return customTemplate;
        }
        return resolveTheme(themeName).template();
    }

    /**
     * Looks up a theme, falling back to the default theme.
     *
     * @param themeName requested theme, may be null
     * @return requested theme or the default theme
     */
    public Theme resolveTheme(String themeName) {
        if (themeName == null || themeName.isBlank()) {
            return defaultTheme();
        }
        return themes.find(themeName).orElseGet(() -> {
            log.warn("Unknown theme '{}'. Available themes: {}. Falling back to '{}'.",
                themeName, themes.names(), ThemeRegistry.DEFAULT_THEME);
            return defaultTheme();
        });
    }

    public ThemeRegistry registry() {
        return themes;
    }

    private Theme defaultTheme() {
        return themes.find(ThemeRegistry.DEFAULT_THEME).orElseThrow();
    }
}
