package com.codegraph.core.engine;

import com.codegraph.core.extractor.ExtractionStatistics;
import com.codegraph.core.model.AnalysisStatus;
import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.ParseError;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of an analysis or update run.
 *
 * @param projectId analysed project
 * @param status completed, cancelled or failed
 * @param filesDiscovered files selected for analysis
 * @param filesAnalyzed files whose content was committed
 * @param entitiesAdded entities whose id was not stored before the run
 * @param relationsAdded relations written by the run
 * @param entitiesRemoved previously stored entities that no longer exist
 * @param unresolvedRelations relations left external by name resolution
 * @param batchesCommitted store batches applied
 * @param errors per-file parse errors
 * @param warnings normalization and storage warnings
 * @param statistics extraction statistics
 * @param debtSnapshot snapshot appended by a completed full analysis, otherwise null
 * @param duration wall-clock time of the run
 */
public record AnalysisReport(
    String projectId,
    AnalysisStatus status,
    int filesDiscovered,
    int filesAnalyzed,
    int entitiesAdded,
    int relationsAdded,
    int entitiesRemoved,
    int unresolvedRelations,
    int batchesCommitted,
    List<ParseError> errors,
    List<String> warnings,
    ExtractionStatistics statistics,
    DebtSnapshot debtSnapshot,
    Duration duration
) {
    public AnalysisReport {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        statistics = statistics == null ? ExtractionStatistics.empty() : statistics;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public boolean isCompleted() {
        return status == AnalysisStatus.COMPLETED;
    }

    public String getSummary() {
        return String.format("%s: %s, %d/%d files, +%d entities, -%d entities, %d relations, %d unresolved, "
                + "%d batches, %d errors in %d ms",
            projectId, status, filesAnalyzed, filesDiscovered, entitiesAdded, entitiesRemoved, relationsAdded,
            unresolvedRelations, batchesCommitted, errors.size(), duration.toMillis());
    }
}
