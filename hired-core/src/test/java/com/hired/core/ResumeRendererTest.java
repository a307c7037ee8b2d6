package com.hired.core;

import com.hired.core.config.HiredConfig;
import com.hired.core.content.MapContentSource;
import com.hired.core.model.ResumeContent;
import com.hired.core.pdf.PdfSerializer;
import com.hired.core.renderer.DestinationWriteException;
import com.hired.core.renderer.Renderer;
import com.hired.core.renderer.RenderingConfig;
import com.hired.core.renderer.UnknownFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResumeRenderer}.
 */
class ResumeRendererTest {

    @TempDir
    Path tempDir;

    private final ResumeRenderer renderer = ResumeRenderer.withDefaults();

    @Test
    void withDefaults_registersBuiltins() {
        assertThat(renderer.formats()).containsExactly("html", "pdf", "rendercv");
        assertThat(renderer.themes()).containsExactly("default", "minimal", "classic");
    }

    @Test
    void render_html() {
        byte[] html = renderer.render(ResumeFixtures.alice(), RenderingConfig.defaults());

        assertThat(new String(html, StandardCharsets.UTF_8)).contains("<h1>Alice</h1>");
    }

    @Test
    void render_fromContentSource() {
        byte[] html = renderer.render(new MapContentSource(ResumeFixtures.aliceRaw()), RenderingConfig.defaults());

        assertThat(new String(html, StandardCharsets.UTF_8)).contains("Red Cross");
    }

    @Test
    void render_unknownFormat_failsBeforeWriting() {
        Path destination = tempDir.resolve("resume.docx");

        assertThatThrownBy(() -> renderer.render(ResumeFixtures.alice(), RenderingConfig.defaults().withFormat("docx"), destination))
            .isInstanceOf(UnknownFormatException.class)
            .hasMessageContaining("docx")
            .hasMessageContaining("html, pdf, rendercv");
        assertThat(destination).doesNotExist();
    }

    @Test
    void render_writesDestination() throws IOException {
        Path destination = tempDir.resolve("out/resume.html");

        Path written = renderer.render(ResumeFixtures.alice(), RenderingConfig.defaults(), destination);

        assertThat(written).isEqualTo(destination);
        assertThat(Files.readString(destination)).contains("Alice");
        assertThat(names(destination.getParent())).containsExactly("resume.html");
    }

    @Test
    void render_outputPathInConfig() {
        Path destination = tempDir.resolve("resume.pdf");
        ResumeRenderer offline = ResumeRenderer.create(
            new HiredConfig(null, new HiredConfig.PdfSettings(false, false), null, null));

        byte[] bytes = offline.render(ResumeFixtures.alice(), RenderingConfig.defaults().withFormat("pdf").withOutputPath(destination));

        assertThat(destination).hasBinaryContent(bytes);
        assertThat(new String(bytes, 0, 8, StandardCharsets.US_ASCII)).isEqualTo(PdfSerializer.HEADER);
    }

    @Test
    void render_unwritableDestination_raisesAndLeavesNoTempFile() throws IOException {
        Path destination = Files.createDirectory(tempDir.resolve("occupied"));
        Files.writeString(destination.resolve("keep.txt"), "keep");

        assertThatThrownBy(() -> renderer.render(ResumeFixtures.alice(), RenderingConfig.defaults(), destination))
            .isInstanceOf(DestinationWriteException.class)
            .hasMessageContaining("occupied")
            .hasCauseInstanceOf(IOException.class);
        assertThat(names(tempDir)).containsExactly("occupied");
    }

    @Test
    void registerRenderer_overridesBuiltin() {
        renderer.registerRenderer("html", () -> new Renderer() {
            @Override
            public String getId() {
                return "html";
            }

            @Override
            public byte[] render(ResumeContent content, RenderingConfig config) {
                return "custom".getBytes(StandardCharsets.UTF_8);
            }
        });

        assertThat(renderer.render(ResumeFixtures.alice(), RenderingConfig.defaults())).asString().isEqualTo("custom");
        assertThat(renderer.formats()).containsExactly("html", "pdf", "rendercv");
    }

    @Test
    void create_loadsThemeDirectory() throws IOException {
        Path themes = Files.createDirectory(tempDir.resolve("themes"));
        Files.writeString(themes.resolve("plain.html"), "<p th:text=\"${basics.name}\">n</p>");
        ResumeRenderer custom = ResumeRenderer.create(
            new HiredConfig(null, null, null, new HiredConfig.ThemeSettings(themes.toString())));

        byte[] html = custom.render(ResumeFixtures.alice(), RenderingConfig.defaults().withTheme("plain"));

        assertThat(custom.themes()).contains("default", "plain");
        assertThat(new String(html, StandardCharsets.UTF_8)).isEqualTo("<p>Alice</p>");
    }

    private static List<String> names(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }
}
