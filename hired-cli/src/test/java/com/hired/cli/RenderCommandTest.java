package com.hired.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RenderCommandTest {

    @Test
    void defaultOutput_usesFormatExtension() {
        Path content = Path.of("cv", "alice.resume.yaml");

        assertThat(RenderCommand.defaultOutput(content, "html")).isEqualTo(Path.of("cv", "alice.resume.html"));
        assertThat(RenderCommand.defaultOutput(content, "pdf")).isEqualTo(Path.of("cv", "alice.resume.pdf"));
        assertThat(RenderCommand.defaultOutput(content, "rendercv")).isEqualTo(Path.of("cv", "alice.resume.pdf"));
        assertThat(RenderCommand.defaultOutput(content, "markdown")).isEqualTo(Path.of("cv", "alice.resume.markdown"));
    }

    @Test
    void defaultOutput_fileWithoutExtension() {
        assertThat(RenderCommand.defaultOutput(Path.of("resume"), "html")).isEqualTo(Path.of("resume.html"));
    }
}
