package com.codegraph.core.report;

import com.codegraph.core.GraphFixtures;
import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.Severity;
import com.codegraph.core.quality.DebtScore;
import com.codegraph.core.quality.FileDebt;
import com.codegraph.core.query.ArchitectureSummary;
import com.codegraph.core.query.GroupBy;
import com.codegraph.core.query.ModuleSummary;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Report data of a small two-module project.
 */
public final class ReportFixtures {

    public static final String PROJECT = "shop";

    private ReportFixtures() {
        // Utility class
    }

    public static ReportData sampleData() {
        ModuleSummary app = new ModuleSummary("app", Set.of("python"), 2,
            Map.of(EntityKind.MODULE, 2, EntityKind.FUNCTION, 3), 1, 3, 5, Set.of("lib"));
        ModuleSummary lib = new ModuleSummary("lib|core", Set.of("python"), 1,
            Map.of(EntityKind.MODULE, 1, EntityKind.FUNCTION, 1), 3, 2, 0, Set.of());
        ArchitectureSummary summary = new ArchitectureSummary(PROJECT, GroupBy.DIRECTORY, 3, 7, 10,
            Map.of(EntityKind.MODULE, 3, EntityKind.FUNCTION, 4), Map.of("python", 7), List.of(lib, app));

        CodeEntity main = GraphFixtures.module(PROJECT, "app/main.py");
        QualityIssue cycle = GraphFixtures.issue(main, IssueType.CIRCULAR_DEPENDENCY, Severity.HIGH);
        QualityIssue longFunction = GraphFixtures.issue(main, IssueType.LONG_FUNCTION, Severity.MEDIUM);
        FileDebt hotspot = new FileDebt("app/main.py", 3.0, 7.0, 2, 6, List.of(cycle, longFunction), Severity.MEDIUM);
        DebtScore debt = new DebtScore(PROJECT, 3.0, 8.5, Map.of("codeQuality", 9.7),
            Map.of(Severity.HIGH, 1, Severity.MEDIUM, 1), 2, 6, 0.75, List.of(hotspot));

        return new ReportData(PROJECT, summary, List.of(longFunction, cycle), debt, List.of(hotspot));
    }

    public static ReportData emptyData() {
        ArchitectureSummary summary = new ArchitectureSummary(PROJECT, GroupBy.DIRECTORY, 0, 0, 0,
            Map.of(), Map.of(), List.of());
        DebtScore debt = new DebtScore(PROJECT, 0.0, 10.0, Map.of("codeQuality", 10.0), Map.of(), 0, 0, 0.0,
            List.of());
        return new ReportData(PROJECT, summary, List.of(), debt, List.of());
    }
}
