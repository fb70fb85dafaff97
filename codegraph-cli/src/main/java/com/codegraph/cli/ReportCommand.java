package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.quality.QualityAnalyzer;
import com.codegraph.core.renderer.GeneratedFile;
import com.codegraph.core.renderer.GeneratedOutput;
import com.codegraph.core.renderer.OutputRenderer;
import com.codegraph.core.renderer.OutputRenderers;
import com.codegraph.core.renderer.RenderContext;
import com.codegraph.core.renderer.impl.ConsoleRenderer;
import com.codegraph.core.report.GeneratedReport;
import com.codegraph.core.report.ReportConfig;
import com.codegraph.core.report.ReportData;
import com.codegraph.core.report.ReportGenerator;
import com.codegraph.core.report.ReportGenerators;
import com.codegraph.core.report.ReportType;
import com.codegraph.core.report.impl.MarkdownReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Generates Markdown and Mermaid reports for a project.
 *
 * <p>Without {@code --output} the reports are printed; with it they are written below the
 * directory, one subdirectory per generator, next to an {@code index.md}.
 */
@Command(
    name = "report",
    description = "Generate Markdown and Mermaid reports",
    mixinStandardHelpOptions = true
)
public class ReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @Option(names = {"-f", "--format"}, description = "markdown, mermaid or all (default: ${DEFAULT-VALUE})")
    private String format = "all";

    @Option(names = {"-o", "--output"}, description = "Output directory; prints to the console when absent")
    private Path outputDir;

    @Option(names = "--max-rows", description = "Maximum rows per table (default: ${DEFAULT-VALUE})")
    private int maxRows = ReportConfig.defaults().maxRows();

    @Override
    public Integer call() {
        List<ReportGenerator> generators = selectGenerators();
        if (generators.isEmpty()) {
            spec.commandLine().getErr().println("Unknown report format: " + format);
            return ExitCodes.ERROR;
        }

        ReportData data = ReportData.collect(parent.engine(), projectId, QualityAnalyzer.DEFAULT_HOTSPOTS);
        ReportConfig config = new ReportConfig(maxRows);
        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile("index.md", new MarkdownReportGenerator().generateIndex(data),
            GeneratedFile.MARKDOWN));
        for (ReportGenerator generator : generators) {
            log.info("Running generator: {} ({})", generator.getDisplayName(), generator.getId());
            List<ReportType> types = generator.getSupportedReportTypes().stream()
                .sorted(Comparator.naturalOrder())
                .toList();
            for (ReportType type : types) {
                GeneratedReport report = generator.generate(data, type, config);
                files.add(GeneratedFile.of(generator.getId(), report));
            }
        }
        GeneratedOutput output = new GeneratedOutput(files);

        if (outputDir != null) {
            OutputRenderer renderer = OutputRenderers.find("filesystem")
                .orElseThrow(() -> new IllegalStateException("Filesystem renderer not found"));
            renderer.render(output, new RenderContext(outputDir, Map.of()));
            spec.commandLine().getOut().println("Wrote " + files.size() + " files to " + outputDir.toAbsolutePath());
        } else {
            printToConsole(output);
        }
        return ExitCodes.OK;
    }

    private List<ReportGenerator> selectGenerators() {
        if ("all".equalsIgnoreCase(format)) {
            return ReportGenerators.loadAll();
        }
        return ReportGenerators.find(format).map(List::of).orElse(List.of());
    }

    private void printToConsole(GeneratedOutput output) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream stream = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            OutputRenderer renderer = new ConsoleRenderer(stream);
            renderer.render(output, new RenderContext(Path.of("."), Map.of()));
        }
        spec.commandLine().getOut().print(buffer.toString(StandardCharsets.UTF_8));
        spec.commandLine().getOut().flush();
    }
}
