package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.query.QueryEngine;
import com.codegraph.core.query.SearchHit;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Searches entities by name, qualified name and docstring.
 */
@Command(
    name = "search",
    description = "Search entities by keywords",
    mixinStandardHelpOptions = true
)
public class SearchCommand implements Callable<Integer> {

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @Parameters(arity = "1..*", description = "Search keywords")
    private List<String> keywords;

    @Option(names = {"-k", "--kind"}, description = "Entity kind to include (repeatable)")
    private List<EntityKind> kinds = List.of();

    @Option(names = "--limit", description = "Maximum hits (default: ${DEFAULT-VALUE})")
    private int limit = QueryEngine.DEFAULT_SEARCH_LIMIT;

    @Override
    public Integer call() {
        try {
            Set<EntityKind> kindFilter = kinds.isEmpty() ? Set.of() : EnumSet.copyOf(kinds);
            List<SearchHit> hits = parent.engine().searchEntities(projectId, String.join(" ", keywords),
                kindFilter, limit);
            JsonOutput.print(spec.commandLine().getOut(), hits);
            return ExitCodes.OK;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
