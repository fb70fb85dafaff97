package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.extractor.Extractor;
import com.codegraph.core.extractor.ExtractorRegistry;
import com.codegraph.core.renderer.OutputRenderer;
import com.codegraph.core.renderer.OutputRenderers;
import com.codegraph.core.report.ReportGenerator;
import com.codegraph.core.report.ReportGenerators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Lists stored projects, or the available extractors, generators or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codegraph list
 * codegraph list extractors
 * codegraph list generators
 * }</pre>
 */
@Command(
    name = "list",
    description = "List projects, extractors, generators or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", defaultValue = "projects",
        description = "What to list: projects, extractors, generators or renderers (default: ${DEFAULT-VALUE})")
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        switch (type.toLowerCase(Locale.ROOT)) {
            case "projects", "project" -> JsonOutput.print(out, parent.engine().listProjects());
            case "extractors", "extractor" -> listExtractors(out);
            case "generators", "generator" -> listGenerators(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: projects, extractors, generators or renderers", type);
                return ExitCodes.ERROR;
            }
        }
        out.flush();
        return ExitCodes.OK;
    }

    private void listExtractors(PrintWriter out) {
        out.println("Available Extractors:");
        for (Extractor extractor : ExtractorRegistry.loadDefault().all()) {
            out.printf("  %s (ID: %s)%n", extractor.getDisplayName(), extractor.getId());
            out.printf("    Languages: %s%n", extractor.getSupportedLanguages());
            out.printf("    Extensions: %s%n", extractor.getSupportedExtensions());
            out.printf("    Confidence: %s%n", extractor.getConfidence().getDescription());
        }
    }

    private void listGenerators(PrintWriter out) {
        out.println("Available Generators:");
        for (ReportGenerator generator : ReportGenerators.loadAll()) {
            out.printf("  %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    Report Types: %s%n", generator.getSupportedReportTypes());
        }
    }

    private void listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        for (OutputRenderer renderer : OutputRenderers.loadAll()) {
            out.printf("  %s%n", renderer.getId());
        }
    }
}
