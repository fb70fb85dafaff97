package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.config.EngineConfig;
import com.codegraph.core.engine.CodeGraphEngine;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.query.CallChainResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints the call tree and call paths starting at an entity.
 */
@Command(
    name = "trace",
    description = "Trace the call chain of an entity",
    mixinStandardHelpOptions = true
)
public class TraceCommand implements Callable<Integer> {

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @Parameters(index = "0", description = "Entity id or qualified name")
    private String entity;

    @Option(names = {"-d", "--depth"}, description = "Maximum depth (default: configuration)")
    private Integer maxDepth;

    @Option(names = {"-n", "--max-nodes"}, description = "Maximum tree nodes (default: configuration)")
    private Integer maxNodes;

    @Option(names = {"-r", "--relation"}, description = "Relation type to follow (repeatable; default: CALLS)")
    private List<RelationType> relationTypes = List.of();

    @Override
    public Integer call() {
        try {
            CodeGraphEngine engine = parent.engine();
            EngineConfig.QueryConfig query = engine.getConfig().query();
            CallChainResult result = engine.traceCallChain(projectId, entity,
                maxDepth != null ? maxDepth : query.maxDepth(),
                maxNodes != null ? maxNodes : query.maxNodes(),
                relationTypes.isEmpty() ? EnumSet.of(RelationType.CALLS) : EnumSet.copyOf(relationTypes));
            JsonOutput.print(spec.commandLine().getOut(), result);
            return ExitCodes.OK;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
