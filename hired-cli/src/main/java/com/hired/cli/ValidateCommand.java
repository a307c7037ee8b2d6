package com.hired.cli;

import com.hired.core.content.ResumeContentLoader;
import com.hired.core.context.ContextBuilder;
import com.hired.core.context.RenderedExtraSection;
import com.hired.core.context.TemplateContext;
import com.hired.core.model.ExtraSection;
import com.hired.core.model.ResumeContent;
import com.hired.core.model.ResumeSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to check a resume file and report what will be rendered.
 *
 * <p>Reports the sections that carry content, the sections that are present
 * but empty (and will be omitted), and the extra sections outside the schema.
 */
@Command(
    name = "validate",
    description = "Check a resume file and report which sections will be rendered",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Resume content file (.json, .yaml, .yml)")
    private Path contentFile;

    @Override
    public Integer call() {
        try {
            log.info("Validating resume content: {}", contentFile);
            ResumeContent content = ResumeContentLoader.load(contentFile);
            TemplateContext context = new ContextBuilder().build(content);

            System.out.println("Resume: " + (content.name().isBlank() ? "(no name)" : content.name()));
            System.out.println();

            System.out.println("Sections:");
            for (ResumeSection section : content.sections().keySet()) {
                if (context.hasSection(section)) {
                    System.out.printf("  ✓ %s (%d entries)%n", section.title(), context.sections().get(section).size());
                } else {
                    System.out.printf("  ⚠ %s is empty and will be omitted%n", section.title());
                }
            }

            if (!content.extraSections().isEmpty()) {
                Set<String> rendered = context.extraSections().stream()
                    .map(RenderedExtraSection::id)
                    .collect(Collectors.toSet());
                System.out.println();
                System.out.println("Extra sections:");
                for (ExtraSection extra : content.extraSections()) {
                    if (rendered.contains(extra.key())) {
                        System.out.printf("  ✓ %s%n", extra.title());
                    } else {
                        System.out.printf("  ⚠ %s is empty and will be omitted%n", extra.title());
                    }
                }
            }

            System.out.println();
            System.out.println("✓ Validation complete");
            return 0;
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
