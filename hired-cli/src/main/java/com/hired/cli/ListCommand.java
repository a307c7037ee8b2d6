package com.hired.cli;

import com.hired.core.ResumeRenderer;
import com.hired.core.config.ConfigLoader;
import com.hired.core.renderer.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available output formats or themes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all formats
 * hired list formats
 *
 * # List all themes, including those from the configured theme directory
 * hired list themes -c hired.yaml
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available formats or themes",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: formats or themes"
    )
    private String type;

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "formats", "format" -> listFormats();
            case "themes", "theme" -> listThemes();
            default -> {
                log.error("Unknown type: {}. Use: formats or themes", type);
                System.err.println("✗ Unknown type: " + type + ". Use: formats or themes");
                yield 1;
            }
        };
    }

    private int listFormats() {
        System.out.println("Available Formats:");
        System.out.println();

        for (String format : renderer().formats()) {
            String mediaType = OutputFormat.fromId(format).map(OutputFormat::mediaType).orElse("custom");
            System.out.printf("  • %s (%s)%n", format, mediaType);
        }
        return 0;
    }

    private int listThemes() {
        System.out.println("Available Themes:");
        System.out.println();

        for (String theme : renderer().themes()) {
            System.out.printf("  • %s%n", theme);
        }
        return 0;
    }

    private ResumeRenderer renderer() {
        return ResumeRenderer.create(ConfigLoader.load(configFile));
    }
}
