package com.hired.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for the rendering pipeline.
 *
 * <p>Loaded from {@code hired.yaml}. Every block is optional; missing blocks and
 * fields take the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * rendering:
 *   format: pdf
 *   theme: minimal
 *   pageSize: A4
 *
 * pdf:
 *   nativeBackend: false
 *   timestamp: false
 *
 * rendercv:
 *   executable: rendercv
 *   theme: classic
 *   timeoutSeconds: 120
 *
 * themes:
 *   directory: ./my-themes
 * }</pre>
 *
 * @param rendering default rendering options
 * @param pdf binary document options
 * @param rendercv external toolchain options
 * @param themes theme loading options
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HiredConfig(
    @JsonProperty("rendering") RenderingSettings rendering,
    @JsonProperty("pdf") PdfSettings pdf,
    @JsonProperty("rendercv") RenderCvSettings rendercv,
    @JsonProperty("themes") ThemeSettings themes
) {
    public HiredConfig {
        if (rendering == null) {
            rendering = RenderingSettings.defaults();
        }
        if (pdf == null) {
            pdf = PdfSettings.defaults();
        }
        if (rendercv == null) {
            rendercv = RenderCvSettings.defaults();
        }
        if (themes == null) {
            themes = ThemeSettings.defaults();
        }
    }

    /**
     * Creates the default configuration: HTML output with the default theme,
     * native PDF backend enabled, timestamps on.
     *
     * @return default configuration
     */
    public static HiredConfig defaults() {
        return new HiredConfig(null, null, null, null);
    }

    /**
     * Default rendering options.
     *
     * @param format output format id
     * @param theme theme name
     * @param pageSize page size name ({@code LETTER} or {@code A4})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderingSettings(
        @JsonProperty("format") String format,
        @JsonProperty("theme") String theme,
        @JsonProperty("pageSize") String pageSize
    ) {
        public RenderingSettings {
            if (format == null || format.isBlank()) {
                format = "html";
            }
            if (theme == null || theme.isBlank()) {
                theme = "default";
            }
            if (pageSize == null || pageSize.isBlank()) {
                pageSize = "LETTER";
            }
        }

        public static RenderingSettings defaults() {
            return new RenderingSettings(null, null, null);
        }
    }

    /**
     * Binary document options.
     *
     * @param nativeBackend whether to try the native HTML-to-PDF backend first
     * @param timestamp whether fallback documents carry a creation date
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PdfSettings(
        @JsonProperty("nativeBackend") Boolean nativeBackend,
        @JsonProperty("timestamp") Boolean timestamp
    ) {
        public PdfSettings {
            if (nativeBackend == null) {
                nativeBackend = Boolean.TRUE;
            }
            if (timestamp == null) {
                timestamp = Boolean.TRUE;
            }
        }

        public static PdfSettings defaults() {
            return new PdfSettings(null, null);
        }
    }

    /**
     * External toolchain options.
     *
     * @param executable command used to invoke RenderCV
     * @param theme RenderCV design theme
     * @param timeoutSeconds maximum run time of one invocation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderCvSettings(
        @JsonProperty("executable") String executable,
        @JsonProperty("theme") String theme,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        public RenderCvSettings {
            if (executable == null || executable.isBlank()) {
                executable = "rendercv";
            }
            if (theme == null || theme.isBlank()) {
                theme = "classic";
            }
            if (timeoutSeconds == null || timeoutSeconds <= 0) {
                timeoutSeconds = 120;
            }
        }

        public static RenderCvSettings defaults() {
            return new RenderCvSettings(null, null, null);
        }
    }

    /**
     * Theme loading options.
     *
     * @param directory optional directory of additional themes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThemeSettings(
        @JsonProperty("directory") String directory
    ) {
        public static ThemeSettings defaults() {
            return new ThemeSettings(null);
        }
    }
}
