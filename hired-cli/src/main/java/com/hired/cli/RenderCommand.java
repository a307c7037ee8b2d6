package com.hired.cli;

import com.hired.core.ResumeRenderer;
import com.hired.core.config.ConfigLoader;
import com.hired.core.config.HiredConfig;
import com.hired.core.content.ResumeContentLoader;
import com.hired.core.model.ResumeContent;
import com.hired.core.pdf.PageProfile;
import com.hired.core.renderer.OutputFormat;
import com.hired.core.renderer.RenderingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to render a resume file.
 *
 * <p>Options given on the command line override the {@code rendering} block of
 * the configuration file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # HTML next to the input file (resume.html)
 * hired render resume.json
 *
 * # PDF with a custom template and stylesheet
 * hired render resume.yaml -f pdf --template my.html --css my.css -o out/resume.pdf
 *
 * # Deterministic PDF from the built-in serializer
 * hired render resume.yaml -f pdf --no-native
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a resume file to HTML or PDF",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Parameters(index = "0", description = "Resume content file (.json, .yaml, .yml)")
    private Path contentFile;

    @Option(names = {"-f", "--format"}, description = "Output format: html, pdf, rendercv")
    private String format;

    @Option(names = {"-t", "--theme"}, description = "Theme name (see 'hired list themes')")
    private String theme;

    @Option(names = "--template", description = "Custom template file, overrides the theme")
    private Path templateFile;

    @Option(names = "--css", description = "Custom stylesheet file, overrides the theme's stylesheet")
    private Path cssFile;

    @Option(names = "--page-size", description = "Page size for PDF output: ${COMPLETION-CANDIDATES}")
    private PageProfile pageSize;

    @Option(names = {"-o", "--output"}, description = "Output file (default: content file name with the format's extension)")
    private Path output;

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Option(names = "--no-native", description = "Always use the built-in PDF serializer")
    private boolean noNative;

    @Override
    public Integer call() {
        try {
            HiredConfig config = ConfigLoader.load(configFile);
            if (noNative) {
                config = new HiredConfig(
                    config.rendering(),
                    new HiredConfig.PdfSettings(false, config.pdf().timestamp()),
                    config.rendercv(),
                    config.themes());
            }

            RenderingConfig renderingConfig = buildRenderingConfig(config);
            Path destination = output != null ? output : defaultOutput(contentFile, renderingConfig.format());

            ResumeContent content = ResumeContentLoader.load(contentFile);
            ResumeRenderer renderer = ResumeRenderer.create(config);
            renderer.render(content, renderingConfig, destination);

            System.out.println("✓ Rendered " + renderingConfig.format() + " to: " + destination.toAbsolutePath());
            return 0;
        } catch (Exception e) {
            log.error("Render failed", e);
            System.err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }

    RenderingConfig buildRenderingConfig(HiredConfig config) throws IOException {
        RenderingConfig renderingConfig = RenderingConfig.from(config);
        if (format != null) {
            renderingConfig = renderingConfig.withFormat(format.trim().toLowerCase(Locale.ROOT));
        }
        if (theme != null) {
            renderingConfig = renderingConfig.withTheme(theme);
        }
        if (templateFile != null) {
            renderingConfig = renderingConfig.withCustomTemplate(Files.readString(templateFile, StandardCharsets.UTF_8));
        }
        if (cssFile != null) {
            renderingConfig = renderingConfig.withCustomCss(Files.readString(cssFile, StandardCharsets.UTF_8));
        }
        if (pageSize != null) {
            renderingConfig = renderingConfig.withPageSize(pageSize);
        }
        return renderingConfig;
    }

    /**
     * Derives the output file from the content file: {@code resume.json} becomes
     * {@code resume.html} or {@code resume.pdf}.
     */
    static Path defaultOutput(Path contentFile, String format) {
        String extension = OutputFormat.fromId(format)
            .map(known -> known == OutputFormat.HTML ? "html" : "pdf")
            .orElse(format);
        String fileName = contentFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return contentFile.resolveSibling(base + "." + extension);
    }
}
