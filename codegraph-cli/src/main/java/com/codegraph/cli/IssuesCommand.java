package com.codegraph.cli;

import com.codegraph.CodeGraphCLI;
import com.codegraph.core.engine.CodeGraphEngine;
import com.codegraph.core.model.IssueStatus;
import com.codegraph.core.model.Severity;
import com.codegraph.core.store.IssueFilter;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists quality issues, or changes the status of one issue.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codegraph issues --project shop --severity HIGH --severity CRITICAL
 * codegraph issues --project shop --resolve 3f9c...
 * codegraph issues --project shop --ignore 3f9c...
 * }</pre>
 */
@Command(
    name = "issues",
    description = "List, resolve or ignore quality issues",
    mixinStandardHelpOptions = true
)
public class IssuesCommand implements Callable<Integer> {

    @ParentCommand
    private CodeGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    private String projectId;

    @ArgGroup(exclusive = true)
    private Transition transition;

    @Option(names = {"-s", "--severity"}, description = "Severity to include (repeatable)")
    private List<Severity> severities = List.of();

    @Option(names = "--status", description = "Issue status to include (repeatable)")
    private List<IssueStatus> statuses = List.of();

    @Option(names = {"-a", "--all"}, description = "Include resolved, ignored and no longer detected issues")
    private boolean all;

    static class Transition {
        @Option(names = "--resolve", description = "Mark the issue with this id resolved")
        String resolveId;

        @Option(names = "--ignore", description = "Mark the issue with this id ignored")
        String ignoreId;
    }

    @Override
    public Integer call() {
        CodeGraphEngine engine = parent.engine();
        try {
            if (transition != null && transition.resolveId != null) {
                JsonOutput.print(spec.commandLine().getOut(), engine.resolveIssue(projectId, transition.resolveId));
                return ExitCodes.OK;
            }
            if (transition != null && transition.ignoreId != null) {
                JsonOutput.print(spec.commandLine().getOut(), engine.ignoreIssue(projectId, transition.ignoreId));
                return ExitCodes.OK;
            }
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return ExitCodes.ERROR;
        }

        IssueFilter filter = all || !statuses.isEmpty() ? IssueFilter.all() : IssueFilter.openAndActive();
        if (!statuses.isEmpty()) {
            filter = filter.withStatuses(EnumSet.copyOf(statuses));
        }
        if (!severities.isEmpty()) {
            filter = filter.withSeverities(EnumSet.copyOf(severities));
        }
        JsonOutput.print(spec.commandLine().getOut(), engine.listIssues(projectId, filter));
        return ExitCodes.OK;
    }
}
