package com.codegraph.core.quality;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.IssueStatus;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.store.GraphStore;
import com.codegraph.core.store.IssueFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the quality detectors over a stored project and maintains its issue records.
 *
 * <p>Issue ids are derived from the problem they describe. When a run detects a problem
 * that is already recorded, the record is refreshed but keeps its status and first
 * detection time, so a resolved or ignored issue stays resolved or ignored. Records no
 * longer detected are kept with {@code active=false}.
 */
public class QualityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(QualityAnalyzer.class);

    public static final int DEFAULT_HOTSPOTS = 10;

    private final GraphStore store;
    private final CycleDetector cycleDetector;
    private final OversizedEntityDetector oversizedDetector;
    private final CouplingDetector couplingDetector;
    private final Clock clock;

    public QualityAnalyzer(GraphStore store, QualityThresholds thresholds) {
        this(store, thresholds, Clock.systemUTC());
    }

    public QualityAnalyzer(GraphStore store, QualityThresholds thresholds, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        QualityThresholds effective = thresholds == null ? QualityThresholds.defaults() : thresholds;
        this.cycleDetector = new CycleDetector();
        this.oversizedDetector = new OversizedEntityDetector(effective);
        this.couplingDetector = new CouplingDetector(effective);
        this.clock = clock;
    }

    /**
     * Runs every detector and reconciles the results with the stored issues.
     *
     * @param projectId project to analyse
     * @return issues detected by this run, in their stored form
     */
    public List<QualityIssue> analyze(String projectId) {
        Instant now = clock.instant();
        List<CodeEntity> entities = store.listEntities(projectId);
        List<CodeRelation> relations = store.listRelations(projectId);

        List<QualityIssue> detected = new ArrayList<>();
        detected.addAll(cycleDetector.detect(projectId, entities, relations, now));
        detected.addAll(oversizedDetector.detect(projectId, entities, now));
        detected.addAll(couplingDetector.detect(projectId, entities, relations, now));

        Map<String, QualityIssue> existing = new LinkedHashMap<>();
        store.listIssues(projectId, IssueFilter.all()).forEach(issue -> existing.put(issue.id(), issue));

        Map<String, QualityIssue> changes = new LinkedHashMap<>();
        for (QualityIssue issue : detected) {
            QualityIssue previous = existing.get(issue.id());
            changes.put(issue.id(), previous == null ? issue : refresh(previous, issue, now));
        }
        int deactivated = 0;
        for (QualityIssue previous : existing.values()) {
            if (previous.active() && !changes.containsKey(previous.id())) {
                changes.put(previous.id(), previous.withActive(false, now));
                deactivated++;
            }
        }
        if (!changes.isEmpty()) {
            store.saveIssues(projectId, new ArrayList<>(changes.values()));
        }
        log.info("Quality analysis of {}: {} issues detected, {} no longer detected",
            projectId, detected.size(), deactivated);

        List<QualityIssue> current = new ArrayList<>();
        for (QualityIssue issue : detected) {
            current.add(changes.get(issue.id()));
        }
        return current;
    }

    private static QualityIssue refresh(QualityIssue previous, QualityIssue detected, Instant now) {
        boolean changed = !previous.active() || previous.severity() != detected.severity()
            || !Objects.equals(previous.metadata(), detected.metadata())
            || previous.lineNumber() != detected.lineNumber();
        return new QualityIssue(previous.id(), previous.projectId(), detected.issueType(), detected.severity(),
            detected.entityId(), detected.filePath(), detected.lineNumber(), detected.title(),
            detected.description(), detected.suggestion(), previous.status(), true, detected.metadata(),
            previous.detectedAt(), changed ? now : previous.updatedAt());
    }

    // ==================== Individual Detectors ====================

    public List<QualityIssue> detectCycles(String projectId) {
        return cycleDetector.detect(projectId, store.listEntities(projectId), store.listRelations(projectId),
            clock.instant());
    }

    public List<QualityIssue> detectOversized(String projectId) {
        return oversizedDetector.detect(projectId, store.listEntities(projectId), clock.instant());
    }

    public List<QualityIssue> detectCoupling(String projectId) {
        return couplingDetector.detect(projectId, store.listEntities(projectId), store.listRelations(projectId),
            clock.instant());
    }

    // ==================== Debt ====================

    public DebtScore computeDebtScore(String projectId, ExternalScores externalScores) {
        return DebtCalculator.score(projectId, store.listIssues(projectId, IssueFilter.openAndActive()),
            externalScores);
    }

    /**
     * Returns the files with the highest debt.
     *
     * @param topK maximum number of files
     */
    public List<FileDebt> identifyHotspots(String projectId, int topK) {
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be >= 0");
        }
        List<FileDebt> files = DebtCalculator.fileDebts(store.listIssues(projectId, IssueFilter.openAndActive()));
        return files.size() > topK ? List.copyOf(files.subList(0, topK)) : files;
    }

    /**
     * Computes the current debt and appends it to the project's snapshot history.
     */
    public DebtSnapshot createSnapshot(String projectId, ExternalScores externalScores) {
        DebtSnapshot snapshot = DebtCalculator.snapshot(computeDebtScore(projectId, externalScores), clock.instant());
        store.appendSnapshot(snapshot);
        log.info("Debt snapshot for {}: score {}, {} issues, {} days to fix",
            projectId, snapshot.overallScore(), snapshot.issuesCount(), snapshot.estimatedDaysToFix());
        return snapshot;
    }

    /**
     * Returns snapshots created at or after {@code since}, oldest first.
     *
     * @param since lower bound, or null for the whole history
     */
    public List<DebtSnapshot> getDebtTrend(String projectId, Instant since) {
        return store.listSnapshots(projectId).stream()
            .filter(snapshot -> since == null || !snapshot.createdAt().isBefore(since))
            .toList();
    }

    // ==================== Issue Lifecycle ====================

    public List<QualityIssue> listIssues(String projectId, IssueFilter filter) {
        return store.listIssues(projectId, filter);
    }

    public QualityIssue resolveIssue(String projectId, String issueId) {
        return transition(projectId, issueId, IssueStatus.RESOLVED);
    }

    public QualityIssue ignoreIssue(String projectId, String issueId) {
        return transition(projectId, issueId, IssueStatus.IGNORED);
    }

    private QualityIssue transition(String projectId, String issueId, IssueStatus status) {
        QualityIssue updated = store.updateIssueStatus(projectId, issueId, status)
            .orElseThrow(() -> new IllegalArgumentException("Unknown issue in project " + projectId + ": " + issueId));
        log.info("Issue {} of {} marked {}", issueId, projectId, status);
        return updated;
    }
}
