package com.hired.core.theme;

import com.hired.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Immutable set of named themes.
 *
 * <p>Built-in themes are bundled under {@code themes/} on the classpath as
 * {@code <name>.html} with an optional {@code <name>.css}. Additional themes
 * can be loaded once from a directory with the same layout; a directory theme
 * with a built-in's name replaces it. Registries are never mutated after
 * construction; {@link #withTheme(Theme)} returns a new registry.
 */
public final class ThemeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ThemeRegistry.class);

    public static final String DEFAULT_THEME = "default";

    /** Names of the themes bundled with the library. */
    public static final List<String> BUILTIN_THEMES = List.of(DEFAULT_THEME, "minimal", "classic");

    private static final String RESOURCE_PREFIX = "themes/";

    private final Map<String, Theme> themes;

    private ThemeRegistry(Map<String, Theme> themes) {
        this.themes = Collections.unmodifiableMap(new LinkedHashMap<>(themes));
    }

    /**
     * Creates a registry from explicit themes.
     *
     * @param themes themes, in listing order
     * @return registry
     */
    public static ThemeRegistry of(Theme... themes) {
        Map<String, Theme> byName = new LinkedHashMap<>();
        for (Theme theme : themes) {
            byName.put(theme.name(), theme);
        }
        return new ThemeRegistry(byName);
    }

    /**
     * Loads the bundled themes from the classpath.
     *
     * @return registry of built-in themes
     * @throws IllegalStateException if a bundled theme is missing from the classpath
     */
    public static ThemeRegistry builtins() {
        Map<String, Theme> byName = new LinkedHashMap<>();
        for (String name : BUILTIN_THEMES) {
            String template = readResource(RESOURCE_PREFIX + name + ".html")
                .orElseThrow(() -> new IllegalStateException("Bundled theme missing from classpath: " + name));
            String css = readResource(RESOURCE_PREFIX + name + ".css").orElse("");
            byName.put(name, new Theme(name, template, css));
        }
        log.debug("Loaded {} built-in themes", byName.size());
        return new ThemeRegistry(byName);
    }

    /**
     * Returns a registry that also contains the themes found in a directory.
     *
     * <p>Every {@code *.html} file becomes a theme named after the file; a sibling
     * {@code .css} file with the same base name is its stylesheet. A missing
     * directory is logged and ignored.
     *
     * @param directory theme directory
     * @return new registry
     * @throws IllegalStateException if the directory cannot be read
     */
    public ThemeRegistry withDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Theme directory not found: {}. Using bundled themes only.", directory);
            return this;
        }
        Map<String, Theme> byName = new LinkedHashMap<>(themes);
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                if (!"html".equals(FileUtils.extension(file))) {
                    continue;
                }
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - ".html".length());
                Path cssFile = file.resolveSibling(name + ".css");
                String css = Files.exists(cssFile) ? Files.readString(cssFile, StandardCharsets.UTF_8) : "";
                byName.put(name, new Theme(name, Files.readString(file, StandardCharsets.UTF_8), css));
                log.debug("Loaded theme '{}' from {}", name, file);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load themes from: " + directory, e);
        }
        return new ThemeRegistry(byName);
    }

    /**
     * Returns a registry with one more (or one replaced) theme.
     *
     * @param theme theme to add
     * @return new registry
     */
    public ThemeRegistry withTheme(Theme theme) {
        Map<String, Theme> byName = new LinkedHashMap<>(themes);
        byName.put(theme.name(), theme);
        return new ThemeRegistry(byName);
    }

    public Optional<Theme> find(String name) {
        return Optional.ofNullable(name == null ? null : themes.get(name));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * Returns the theme names in listing order.
     *
     * @return theme names
     */
    public Set<String> names() {
        return themes.keySet();
    }

    private static Optional<String> readResource(String path) {
        ClassLoader loader = ThemeRegistry.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(path)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read theme resource: " + path, e);
        }
    }
}
