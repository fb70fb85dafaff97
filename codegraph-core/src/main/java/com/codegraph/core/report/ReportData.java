package com.codegraph.core.report;

import com.codegraph.core.engine.CodeGraphEngine;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.quality.DebtScore;
import com.codegraph.core.quality.FileDebt;
import com.codegraph.core.query.ArchitectureSummary;
import com.codegraph.core.query.GroupBy;
import com.codegraph.core.store.IssueFilter;

import java.util.List;
import java.util.Objects;

/**
 * Everything a report generator reads about one project.
 *
 * @param projectId project the data belongs to
 * @param summary module summary grouped by directory
 * @param issues open, active quality issues
 * @param debt current debt score
 * @param hotspots files with the highest debt
 */
public record ReportData(
    String projectId,
    ArchitectureSummary summary,
    List<QualityIssue> issues,
    DebtScore debt,
    List<FileDebt> hotspots
) {
    public ReportData {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(debt, "debt must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        hotspots = hotspots == null ? List.of() : List.copyOf(hotspots);
    }

    /**
     * Reads the report data of a project through the engine.
     *
     * @param engine engine holding the project
     * @param projectId project to report on
     * @param topHotspots number of hotspot files to include
     */
    public static ReportData collect(CodeGraphEngine engine, String projectId, int topHotspots) {
        return new ReportData(
            projectId,
            engine.summarizeArchitecture(projectId, GroupBy.DIRECTORY),
            engine.listIssues(projectId, IssueFilter.openAndActive()),
            engine.computeDebt(projectId),
            engine.identifyHotspots(projectId, topHotspots)
        );
    }
}
