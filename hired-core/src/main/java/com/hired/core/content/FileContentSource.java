package com.hired.core.content;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hired.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ContentSource} reading a JSON or YAML file.
 *
 * <p>The format is chosen by extension: {@code .json}, {@code .yaml} or
 * {@code .yml}. Key order from the file is preserved.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ContentSource source = new FileContentSource(Path.of("resume.yaml"));
 * ResumeContent content = ResumeContentLoader.load(source);
 * }</pre>
 */
public class FileContentSource implements ContentSource {

    private static final Logger log = LoggerFactory.getLogger(FileContentSource.class);

    /** File extensions this source can read. */
    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("json", "yaml", "yml");

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Path path;

    /**
     * Creates a source for a file.
     *
     * @param path JSON or YAML file
     * @throws IllegalArgumentException if the extension is not supported
     */
    public FileContentSource(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String extension = FileUtils.extension(path);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new IllegalArgumentException(
                "Unsupported content file type '" + path.getFileName() + "'. Expected one of: .json, .yaml, .yml");
        }
        this.path = path;
    }

    @Override
    public Map<String, Object> read() {
        ObjectMapper mapper = "json".equals(FileUtils.extension(path)) ? JSON_MAPPER : YAML_MAPPER;
        try {
            log.debug("Reading resume content from: {}", path);
            LinkedHashMap<String, Object> data = mapper.readValue(path.toFile(), MAP_TYPE);
            return data == null ? new LinkedHashMap<>() : data;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read resume content from: " + path, e);
        }
    }

    @Override
    public String describe() {
        return path.toString();
    }

    public Path getPath() {
        return path;
    }
}
