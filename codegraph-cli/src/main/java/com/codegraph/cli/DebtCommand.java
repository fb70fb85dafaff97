package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.engine.CodeGraphEngine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Prints the current debt score, the debt hotspots or the debt trend.
 */
@Command(
    name = "debt",
    description = "Show technical debt, hotspots or the debt trend",
    mixinStandardHelpOptions = true
)
public class DebtCommand implements Callable<Integer> {

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @Option(names = "--hotspots", description = "Print the N files with the highest debt")
    private Integer hotspots;

    @Option(names = "--trend", description = "Print the debt snapshots")
    private boolean trend;

    @Option(names = "--since", description = "Earliest snapshot of the trend, ISO-8601 instant")
    private Instant since;

    @Override
    public Integer call() {
        CodeGraphEngine engine = parent.engine();
        try {
            if (hotspots != null) {
                JsonOutput.print(spec.commandLine().getOut(), engine.identifyHotspots(projectId, hotspots));
            } else if (trend || since != null) {
                JsonOutput.print(spec.commandLine().getOut(), engine.getDebtTrend(projectId, since));
            } else {
                JsonOutput.print(spec.commandLine().getOut(), engine.computeDebt(projectId));
            }
            return ExitCodes.OK;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
