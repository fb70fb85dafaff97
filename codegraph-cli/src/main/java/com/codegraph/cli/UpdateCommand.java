package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.engine.AnalysisReport;
import com.codegraph.core.engine.CodeGraphEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Re-analyses changed files of a previously analysed project.
 *
 * <p>Deleted files are passed like any other; their entities are removed.
 */
@Command(
    name = "update",
    description = "Re-analyse added, modified or deleted files",
    mixinStandardHelpOptions = true
)
public class UpdateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(UpdateCommand.class);

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Root directory of the source tree")
    private Path root;

    @Parameters(index = "1..*", arity = "1..*", description = "Changed files, relative to the root or absolute")
    private List<String> files;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @Override
    public Integer call() {
        try {
            CodeGraphEngine engine = parent.engine();
            AnalysisReport report = engine.update(engine.newSession(projectId), root, files);
            JsonOutput.print(spec.commandLine().getOut(), report);
            return ExitCodes.of(report);
        } catch (RuntimeException e) {
            log.error("Update of {} failed: {}", projectId, e.getMessage(), e);
            spec.commandLine().getErr().println("Update failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
