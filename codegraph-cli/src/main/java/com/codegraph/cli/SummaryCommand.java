package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.query.GroupBy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Prints the architecture summary of a project.
 */
@Command(
    name = "summary",
    description = "Summarise modules, entity counts and coupling",
    mixinStandardHelpOptions = true
)
public class SummaryCommand implements Callable<Integer> {

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @Option(names = "--group-by", description = "DIRECTORY or FILE (default: ${DEFAULT-VALUE})")
    private GroupBy groupBy = GroupBy.DIRECTORY;

    @Override
    public Integer call() {
        JsonOutput.print(spec.commandLine().getOut(), parent.engine().summarizeArchitecture(projectId, groupBy));
        return ExitCodes.OK;
    }
}
