package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.config.EngineConfig;
import com.codegraph.core.engine.AnalysisReport;
import com.codegraph.core.engine.AnalysisSession;
import com.codegraph.core.engine.CodeGraphEngine;
import com.codegraph.core.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Analyses a source tree into the store and prints the analysis report as JSON.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codegraph analyze ./src --project shop --language java --language python --exclude "generated/**"
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyse a source tree into the code graph",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Root directory of the source tree")
    private Path root;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @Option(names = {"-l", "--language"}, description = "Language to analyse (repeatable; default: configuration or all)")
    private List<String> languages = new ArrayList<>();

    @Option(names = {"-e", "--exclude"}, description = "Glob pattern of files to skip (repeatable)")
    private List<String> excludes = new ArrayList<>();

    @Override
    public Integer call() {
        try {
            CodeGraphEngine engine = parent.engine();
            EngineConfig.AnalysisConfig analysis = engine.getConfig().analysis();
            Set<Language> filter = languages.isEmpty() ? analysis.languageFilter() : parseLanguages(languages);
            List<String> patterns = new ArrayList<>(analysis.exclude());
            patterns.addAll(excludes);

            AnalysisSession session = engine.newSession(projectId);
            AnalysisReport report = engine.analyze(session, root, filter, patterns);
            JsonOutput.print(spec.commandLine().getOut(), report);
            return ExitCodes.of(report);
        } catch (RuntimeException e) {
            log.error("Analysis of {} failed: {}", root, e.getMessage(), e);
            spec.commandLine().getErr().println("Analysis failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    static Set<Language> parseLanguages(List<String> ids) {
        Set<Language> filter = new LinkedHashSet<>();
        for (String id : ids) {
            filter.add(Language.fromId(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + id)));
        }
        return filter;
    }
}
