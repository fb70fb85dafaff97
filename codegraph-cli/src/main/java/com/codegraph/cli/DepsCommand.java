package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.query.DependencyResult;
import com.codegraph.core.store.Direction;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Prints what an entity depends on, or what depends on it.
 */
@Command(
    name = "deps",
    description = "Find the dependencies or dependents of an entity",
    mixinStandardHelpOptions = true
)
public class DepsCommand implements Callable<Integer> {

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @Parameters(index = "0", description = "Entity id or qualified name")
    private String entity;

    @Option(names = "--direction", description = "OUT (dependencies), IN (dependents) or BOTH (default: ${DEFAULT-VALUE})")
    private Direction direction = Direction.OUT;

    @Option(names = {"-t", "--transitive"}, description = "Follow dependencies transitively")
    private boolean transitive;

    @Override
    public Integer call() {
        try {
            DependencyResult result = parent.engine().findDependencies(projectId, entity, direction, transitive);
            JsonOutput.print(spec.commandLine().getOut(), result);
            return ExitCodes.OK;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
