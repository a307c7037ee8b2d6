package com.hired.core.renderer;

import com.hired.core.config.HiredConfig;
import com.hired.core.pdf.PageProfile;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for a single render call.
 *
 * <p>{@code customTemplate} takes precedence over {@code theme}; {@code customCss}
 * takes precedence over the theme's stylesheet. Use {@link #defaults()} and the
 * {@code with*} methods rather than the canonical constructor.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RenderingConfig config = RenderingConfig.defaults()
 *     .withFormat("pdf")
 *     .withTheme("minimal")
 *     .withPageSize(PageProfile.A4);
 * }</pre>
 *
 * @param format output format id
 * @param theme theme name
 * @param customTemplate literal template text, or null
 * @param customCss literal stylesheet text, or null
 * @param outputPath destination file, or null to only return bytes
 * @param pageSize page dimensions for paged formats
 */
public record RenderingConfig(
    String format,
    String theme,
    String customTemplate,
    String customCss,
    Path outputPath,
    PageProfile pageSize
) {
    public static final String DEFAULT_FORMAT = OutputFormat.HTML.id();
    public static final String DEFAULT_THEME = "default";

    public RenderingConfig {
        Objects.requireNonNull(format, "format must not be null");
        if (format.isBlank()) {
            throw new IllegalArgumentException("format must not be blank");
        }
        if (theme == null || theme.isBlank()) {
            theme = DEFAULT_THEME;
        }
        if (pageSize == null) {
            pageSize = PageProfile.LETTER;
        }
    }

    /**
     * Creates the default configuration: HTML with the default theme on letter paper.
     *
     * @return default configuration
     */
    public static RenderingConfig defaults() {
        return new RenderingConfig(DEFAULT_FORMAT, DEFAULT_THEME, null, null, null, PageProfile.LETTER);
    }

    /**
     * Creates a configuration from the {@code rendering} block of a loaded config file.
     *
     * @param config loaded configuration
     * @return rendering configuration
     */
    public static RenderingConfig from(HiredConfig config) {
        HiredConfig.RenderingSettings rendering = config.rendering();
        return new RenderingConfig(
            rendering.format(),
            rendering.theme(),
            null,
            null,
            null,
            PageProfile.fromName(rendering.pageSize()).orElse(PageProfile.LETTER)
        );
    }

    public RenderingConfig withFormat(String format) {
        return new RenderingConfig(format, theme, customTemplate, customCss, outputPath, pageSize);
    }

    public RenderingConfig withTheme(String theme) {
        return new RenderingConfig(format, theme, customTemplate, customCss, outputPath, pageSize);
    }

    public RenderingConfig withCustomTemplate(String customTemplate) {
        return new RenderingConfig(format, theme, customTemplate, customCss, outputPath, pageSize);
    }

    public RenderingConfig withCustomCss(String customCss) {
        return new RenderingConfig(format, theme, customTemplate, customCss, outputPath, pageSize);
    }

    public RenderingConfig withOutputPath(Path outputPath) {
        return new RenderingConfig(format, theme, customTemplate, customCss, outputPath, pageSize);
    }

    public RenderingConfig withPageSize(PageProfile pageSize) {
        return new RenderingConfig(format, theme, customTemplate, customCss, outputPath, pageSize);
    }

    /**
     * Whether a caller-supplied template replaces the theme.
     *
     * @return true if {@code customTemplate} is non-blank
     */
    public boolean hasCustomTemplate() {
        return customTemplate != null && !customTemplate.isBlank();
    }
}
