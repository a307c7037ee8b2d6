package com.hired.core;

import com.hired.core.config.HiredConfig;
import com.hired.core.content.ContentSource;
import com.hired.core.content.ResumeContentLoader;
import com.hired.core.model.ResumeContent;
import com.hired.core.renderer.DestinationWriteException;
import com.hired.core.renderer.Renderer;
import com.hired.core.renderer.RendererFactory;
import com.hired.core.renderer.RendererRegistry;
import com.hired.core.renderer.RenderingConfig;
import com.hired.core.renderer.impl.BuiltinRenderers;
import com.hired.core.theme.ThemeRegistry;
import com.hired.core.theme.ThemeResolver;
import com.hired.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the rendering pipeline.
 *
 * <p>Looks up the renderer for the requested format, renders, and optionally
 * writes the result. Writes are atomic: the destination either keeps its
 * previous content or receives the complete document.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ResumeRenderer renderer = ResumeRenderer.withDefaults();
 * ResumeContent content = ResumeContentLoader.load(Path.of("resume.json"));
 *
 * byte[] html = renderer.render(content, RenderingConfig.defaults());
 * renderer.render(content, RenderingConfig.defaults().withFormat("pdf"), Path.of("resume.pdf"));
 * }</pre>
 */
public class ResumeRenderer {

    private static final Logger log = LoggerFactory.getLogger(ResumeRenderer.class);

    private final RendererRegistry registry;
    private final ThemeRegistry themes;

    public ResumeRenderer(RendererRegistry registry, ThemeRegistry themes) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.themes = Objects.requireNonNull(themes, "themes must not be null");
    }

    /**
     * Creates a renderer with the built-in themes and formats and default settings.
     *
     * @return renderer
     */
    public static ResumeRenderer withDefaults() {
        return create(HiredConfig.defaults());
    }

    /**
     * Creates a renderer from loaded configuration.
     *
     * @param config loaded configuration
     * @return renderer with {@code html}, {@code pdf} and {@code rendercv} registered
     */
    public static ResumeRenderer create(HiredConfig config) {
        ThemeRegistry themes = ThemeRegistry.builtins();
        String directory = config.themes().directory();
        if (directory != null && !directory.isBlank()) {
            themes = themes.withDirectory(Path.of(directory));
        }
        RendererRegistry registry = new RendererRegistry();
        BuiltinRenderers.registerAll(registry, new ThemeResolver(themes), config);
        return new ResumeRenderer(registry, themes);
    }

    /**
     * Renders content, writing it to {@link RenderingConfig#outputPath()} when set.
     *
     * @param content resume content
     * @param config rendering options
     * @return rendered bytes
     * @throws com.hired.core.renderer.UnknownFormatException if the format is not registered
     * @throws DestinationWriteException if the output cannot be written
     */
    public byte[] render(ResumeContent content, RenderingConfig config) {
        Renderer renderer = registry.get(config.format());
        byte[] bytes = renderer.render(content, config);
        log.debug("Rendered {} bytes as '{}'", bytes.length, config.format());
        if (config.outputPath() != null) {
            write(config.outputPath(), bytes);
        }
        return bytes;
    }

    /**
     * Renders content and writes it to a destination file.
     *
     * @param content resume content
     * @param config rendering options; its output path is ignored
     * @param destination target file
     * @return the destination
     * @throws DestinationWriteException if the output cannot be written
     */
    public Path render(ResumeContent content, RenderingConfig config, Path destination) {
        Objects.requireNonNull(destination, "destination must not be null");
        render(content, config.withOutputPath(destination));
        return destination;
    }

    /**
     * Loads content from a source and renders it.
     *
     * @param source content source
     * @param config rendering options
     * @return rendered bytes
     */
    public byte[] render(ContentSource source, RenderingConfig config) {
        return render(ResumeContentLoader.load(source), config);
    }

    /**
     * Registers or replaces the renderer for a format.
     *
     * @param format format name
     * @param factory renderer factory
     */
    public void registerRenderer(String format, RendererFactory factory) {
        registry.register(format, factory);
    }

    public List<String> formats() {
        return registry.list();
    }

    public Set<String> themes() {
        return themes.names();
    }

    public RendererRegistry registry() {
        return registry;
    }

    private static void write(Path destination, byte[] bytes) {
        try {
            FileUtils.writeAtomically(destination, bytes);
            log.info("Wrote {} bytes to {}", bytes.length, destination);
        } catch (IOException e) {
            throw new DestinationWriteException(destination, e);
        }
    }
}
