package com.hired.core.renderer.impl;

import com.hired.core.model.ResumeContent;
import com.hired.core.renderer.BackendFailureException;
import com.hired.core.renderer.OutputFormat;
import com.hired.core.renderer.Renderer;
import com.hired.core.renderer.RenderingConfig;
import com.hired.core.rendercv.RenderCvDocument;
import com.hired.core.rendercv.RenderCvDocumentMapper;
import com.hired.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Renders resume content through the RenderCV command line tool.
 *
 * <p>Each call works in its own temporary directory: the content is written as
 * RenderCV YAML, {@code rendercv render <file> --pdf-path <out>} is run, and the
 * resulting PDF is read back. The directory is removed afterwards.
 *
 * <p>A missing executable, a non-zero exit, a timeout or a missing output file
 * all raise {@link BackendFailureException}.
 */
public class ExternalToolchainRenderer implements Renderer {

    private static final Logger log = LoggerFactory.getLogger(ExternalToolchainRenderer.class);

    public static final String BACKEND_ID = "rendercv";
    static final String INSTALL_HINT = "Install it with: pip install \"rendercv[full]\"";

    private static final int MAX_OUTPUT_IN_MESSAGE = 2000;

    private final RenderCvDocumentMapper mapper;
    private final String executable;
    private final Duration timeout;

    /**
     * Creates the renderer.
     *
     * @param mapper content to RenderCV document mapper
     * @param executable command used to invoke RenderCV
     * @param timeout maximum run time of one invocation
     */
    public ExternalToolchainRenderer(RenderCvDocumentMapper mapper, String executable, Duration timeout) {
        this.mapper = mapper;
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public String getId() {
        return OutputFormat.RENDERCV.id();
    }

    @Override
    public byte[] render(ResumeContent content, RenderingConfig config) {
        RenderCvDocument document = mapper.map(content);
        for (String warning : document.warnings()) {
            log.warn("RenderCV data warning: {}", warning);
        }
        String yaml = mapper.toYaml(document);

        Path workDir;
        try {
            workDir = Files.createTempDirectory("hired-rendercv-");
        } catch (IOException e) {
            throw new BackendFailureException(BACKEND_ID, "Failed to create RenderCV working directory", e);
        }

        try {
            return run(workDir, yaml);
        } finally {
            cleanup(workDir);
        }
    }

    private byte[] run(Path workDir, String yaml) {
        Path input = workDir.resolve("resume.yaml");
        Path output = workDir.resolve("resume.pdf");
        Path logFile = workDir.resolve("rendercv.log");

        List<String> command = List.of(executable, "render", input.toString(), "--pdf-path", output.toString());
        try {
            Files.writeString(input, yaml, StandardCharsets.UTF_8);
            Process process = start(command, workDir, logFile);

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new BackendFailureException(BACKEND_ID,
                    "RenderCV did not finish within " + timeout.toSeconds() + " seconds");
            }

            String processOutput = readOutput(logFile);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new BackendFailureException(BACKEND_ID,
                    "RenderCV exited with code " + exitCode + ": " + processOutput);
            }
            if (!Files.isRegularFile(output)) {
                throw new BackendFailureException(BACKEND_ID,
                    "RenderCV finished without creating a PDF: " + processOutput);
            }
            byte[] bytes = Files.readAllBytes(output);
            log.debug("RenderCV produced {} bytes", bytes.length);
            return bytes;
        } catch (IOException e) {
            throw new BackendFailureException(BACKEND_ID, "RenderCV I/O failure: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendFailureException(BACKEND_ID, "Interrupted while waiting for RenderCV", e);
        }
    }

    private Process start(List<String> command, Path workDir, Path logFile) {
        log.debug("Running: {}", String.join(" ", command));
        try {
            return new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile())
                .start();
        } catch (IOException e) {
            throw new BackendFailureException(BACKEND_ID,
                "RenderCV executable '" + executable + "' could not be started. " + INSTALL_HINT, e);
        }
    }

    private static String readOutput(Path logFile) throws IOException {
        if (!Files.exists(logFile)) {
            return "";
        }
        String output = new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8).strip();
        return output.length() > MAX_OUTPUT_IN_MESSAGE ? output.substring(0, MAX_OUTPUT_IN_MESSAGE) + "..." : output;
    }

    private static void cleanup(Path workDir) {
        try {
            FileUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            log.warn("Failed to remove RenderCV working directory {}: {}", workDir, e.getMessage());
        }
    }
}
