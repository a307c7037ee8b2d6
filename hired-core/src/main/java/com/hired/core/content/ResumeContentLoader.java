package com.hired.core.content;

import com.hired.core.model.ResumeContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Loads {@link ResumeContent} from a {@link ContentSource}.
 */
public final class ResumeContentLoader {

    private static final Logger log = LoggerFactory.getLogger(ResumeContentLoader.class);

    private ResumeContentLoader() {
        // Utility class
    }

    /**
     * Reads and structures resume data.
     *
     * @param source content source
     * @return structured content
     * @throws IllegalStateException if the source cannot be read
     */
    public static ResumeContent load(ContentSource source) {
        ResumeContent content = ResumeContent.fromMap(source.read());
        log.debug("Loaded content from {}: {} core sections, {} extra sections",
            source.describe(), content.sections().size(), content.extraSections().size());
        return content;
    }

    /**
     * Reads resume data from a JSON or YAML file.
     *
     * @param path content file
     * @return structured content
     * @throws IllegalArgumentException if the file type is not supported
     * @throws IllegalStateException if the file cannot be read
     */
    public static ResumeContent load(Path path) {
        return load(new FileContentSource(path));
    }
}
