package com.codegraph.core.engine;

import com.codegraph.core.config.EngineConfig;
import com.codegraph.core.extractor.ExtractionResult;
import com.codegraph.core.extractor.ExtractorRegistry;
import com.codegraph.core.model.AnalysisStatus;
import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.Language;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.normalize.NormalizationResult;
import com.codegraph.core.normalize.Normalizer;
import com.codegraph.core.quality.DebtScore;
import com.codegraph.core.quality.ExternalScores;
import com.codegraph.core.quality.FileDebt;
import com.codegraph.core.quality.QualityAnalyzer;
import com.codegraph.core.query.ArchitectureSummary;
import com.codegraph.core.query.CallChainResult;
import com.codegraph.core.query.DependencyResult;
import com.codegraph.core.query.GroupBy;
import com.codegraph.core.query.QueryEngine;
import com.codegraph.core.query.SearchHit;
import com.codegraph.core.store.Direction;
import com.codegraph.core.store.GraphStore;
import com.codegraph.core.store.IssueFilter;
import com.codegraph.core.store.StorageWriteException;
import com.codegraph.core.store.WriteBatch;
import com.codegraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Library entry point: analyses source trees into a {@link GraphStore} and answers queries.
 *
 * <p>A full analysis runs discovery, parallel extraction, normalization, batched commits,
 * removal of files that disappeared, quality analysis and a debt snapshot. An update
 * re-analyses only the given files in one atomic batch. Both hold the project's write
 * lock for their duration; queries read the store's published snapshot without locking.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeGraphEngine engine = new CodeGraphEngine(EngineConfig.defaults(), new InMemoryGraphStore());
 * AnalysisReport report = engine.analyze(engine.newSession("shop"), Path.of("src"));
 * List<SearchHit> hits = engine.searchEntities("shop", "order service");
 * }</pre>
 */
public class CodeGraphEngine {

    private static final Logger log = LoggerFactory.getLogger(CodeGraphEngine.class);

    private final EngineConfig config;
    private final GraphStore store;
    private final ExtractorRegistry registry;
    private final FileDiscovery discovery;
    private final ParallelExtractor extractor;
    private final IncrementalUpdater updater;
    private final QueryEngine queryEngine;
    private final QualityAnalyzer qualityAnalyzer;
    private final ProjectLocks locks = new ProjectLocks();
    private final Function<String, ExternalScores> externalScores;

    public CodeGraphEngine(EngineConfig config, GraphStore store) {
        this(config, store, ExtractorRegistry.loadDefault(), projectId -> ExternalScores.none());
    }

    /**
     * Creates an engine.
     *
     * @param config engine configuration
     * @param store graph store
     * @param registry extractors to use
     * @param externalScores supplies test, documentation, dependency and TODO scores per project
     */
    public CodeGraphEngine(EngineConfig config, GraphStore store, ExtractorRegistry registry,
                           Function<String, ExternalScores> externalScores) {
        this.config = config == null ? EngineConfig.defaults() : config;
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.externalScores = externalScores == null ? projectId -> ExternalScores.none() : externalScores;
        EngineConfig.AnalysisConfig analysis = this.config.analysis();
        this.discovery = new FileDiscovery(registry, analysis.maxFileSizeBytes());
        this.extractor = new ParallelExtractor(registry, analysis.parallelism(), analysis.fileTimeout());
        this.updater = new IncrementalUpdater(store);
        this.queryEngine = new QueryEngine(store, this.config.query().maxDepth(), this.config.query().maxNodes());
        this.qualityAnalyzer = new QualityAnalyzer(store, this.config.quality());
    }

    public EngineConfig getConfig() {
        return config;
    }

    public GraphStore getStore() {
        return store;
    }

    public ExtractorRegistry getRegistry() {
        return registry;
    }

    // ==================== Sessions ====================

    public AnalysisSession newSession(String projectId) {
        return new AnalysisSession(projectId);
    }

    /**
     * Requests cancellation of a running session. Batches already committed stay committed.
     */
    public void cancel(AnalysisSession session) {
        session.cancel();
        log.info("Cancellation requested for session {} of {}", session.getId(), session.getProjectId());
    }

    // ==================== Analysis ====================

    /**
     * Analyses a source tree with the languages and excludes of the configuration.
     */
    public AnalysisReport analyze(AnalysisSession session, Path root) {
        EngineConfig.AnalysisConfig analysis = config.analysis();
        return analyze(session, root, analysis.languageFilter(), analysis.exclude());
    }

    /**
     * Analyses every supported file below {@code root} and makes the project match it.
     *
     * <p>Files stored for the project but no longer discovered are removed. Files whose
     * extraction produced nothing (unreadable, timed out) keep their previously stored content.
     *
     * @param session run state, used for one run only
     * @param root source tree
     * @param languageFilter languages to analyse; null or empty means all
     * @param excludePatterns glob patterns of files to skip
     * @return report of the run
     * @throws UncheckedIOException if the tree cannot be walked
     */
    public AnalysisReport analyze(AnalysisSession session, Path root, Set<Language> languageFilter,
                                  List<String> excludePatterns) {
        session.begin();
        String projectId = session.getProjectId();
        long started = System.nanoTime();
        ReentrantLock lock = locks.lockFor(projectId);
        lock.lock();
        try {
            List<DiscoveredFile> files;
            try {
                files = discovery.discover(root, languageFilter, excludePatterns);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot walk " + root, e);
            }
            session.statistics().filesDiscovered(files.size());
            log.info("Analyzing {} files of project {} under {}", files.size(), projectId, root);

            Set<String> before = entityIds(projectId);
            List<ExtractionResult> results = extractor.extract(files, session);
            Extracted extracted = record(session, results);
            if (session.isCancelled()) {
                return report(session, AnalysisStatus.CANCELLED, files.size(), 0, before, 0, 0, 0, null, started);
            }

            List<CodeEntity> preservedEntities = new ArrayList<>();
            for (String file : extracted.preservedFiles()) {
                preservedEntities.addAll(store.listEntitiesInFile(projectId, file));
            }
            NormalizationResult normalized = new Normalizer(projectId).normalize(extracted.usable(), preservedEntities);
            normalized.warnings().forEach(session::addWarning);

            List<String> order = extracted.usable().stream().map(ExtractionResult::filePath).toList();
            List<WriteBatch> batches = new ArrayList<>(
                updater.plan(order, normalized.entities(), normalized.relations(), config.analysis().batchSize()));
            int plannedBatches = batches.size();

            Set<String> discovered = files.stream().map(DiscoveredFile::relativePath).collect(Collectors.toSet());
            Set<String> stale = new TreeSet<>(store.listFiles(projectId));
            stale.removeAll(discovered);
            if (!stale.isEmpty()) {
                log.info("Removing {} files of {} that no longer exist", stale.size(), projectId);
                batches.add(WriteBatch.removeFiles(stale));
            }

            IncrementalUpdater.CommitOutcome outcome = updater.commit(session, batches);
            int filesAnalyzed = 0;
            for (int b = 0; b < Math.min(outcome.batchesCommitted(), plannedBatches); b++) {
                filesAnalyzed += batches.get(b).replacedFiles().size();
            }

            AnalysisStatus status = outcome.status();
            DebtSnapshot snapshot = null;
            if (status == AnalysisStatus.FAILED) {
                session.addWarning("StorageWriteException: " + outcome.failure());
            } else if (status == AnalysisStatus.COMPLETED) {
                try {
                    qualityAnalyzer.analyze(projectId);
                    snapshot = qualityAnalyzer.createSnapshot(projectId, externalScores.apply(projectId));
                } catch (StorageWriteException e) {
                    log.error("Storing quality results of {} failed: {}", projectId, e.getMessage(), e);
                    session.addWarning("StorageWriteException: " + e.getMessage());
                    status = AnalysisStatus.FAILED;
                }
            }
            return report(session, status, files.size(), filesAnalyzed, before, outcome.relationsWritten(),
                normalized.unresolvedRelations(), outcome.batchesCommitted(), snapshot, started);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-analyses a set of changed files in one atomic batch.
     *
     * <p>Paths may be absolute or relative to {@code root}. A path that no longer exists, or is
     * no longer supported, removes the file's entities. Entities of all other files keep their
     * ids and content. Quality issues are refreshed; no debt snapshot is written.
     *
     * @param session run state, used for one run only
     * @param root source tree the paths belong to
     * @param changedFiles added, modified or deleted files
     * @return report of the run
     */
    public AnalysisReport update(AnalysisSession session, Path root, Collection<String> changedFiles) {
        session.begin();
        String projectId = session.getProjectId();
        long started = System.nanoTime();
        ReentrantLock lock = locks.lockFor(projectId);
        lock.lock();
        try {
            Set<String> changed = new TreeSet<>();
            for (String path : changedFiles) {
                changed.add(toRelative(root, path));
            }
            List<DiscoveredFile> toExtract = new ArrayList<>();
            Set<String> removed = new TreeSet<>();
            for (String relative : changed) {
                Path absolute = root.resolve(relative);
                Optional<DiscoveredFile> file = Optional.empty();
                if (Files.isRegularFile(absolute)) {
                    file = discovery.select(absolute, relative, sizeOf(absolute), null, List.of());
                }
                if (file.isPresent()) {
                    toExtract.add(file.get());
                } else {
                    removed.add(relative);
                }
            }
            session.statistics().filesDiscovered(toExtract.size());
            log.info("Updating {} changed and {} removed files of project {}", toExtract.size(), removed.size(), projectId);

            Set<String> before = entityIds(projectId);
            Extracted extracted = record(session, extractor.extract(toExtract, session));
            if (session.isCancelled()) {
                return report(session, AnalysisStatus.CANCELLED, toExtract.size(), 0, before, 0, 0, 0, null, started);
            }

            Set<String> replaced = new LinkedHashSet<>(removed);
            extracted.usable().forEach(result -> replaced.add(result.filePath()));
            List<CodeEntity> context = store.listEntities(projectId).stream()
                .filter(entity -> !replaced.contains(entity.filePath()))
                .toList();
            NormalizationResult normalized = new Normalizer(projectId).normalize(extracted.usable(), context);
            normalized.warnings().forEach(session::addWarning);

            WriteBatch batch = new WriteBatch(replaced, normalized.entities(), normalized.relations());
            IncrementalUpdater.CommitOutcome outcome = batch.isEmpty()
                ? new IncrementalUpdater.CommitOutcome(AnalysisStatus.COMPLETED, 0, 0, 0, null)
                : updater.commit(session, List.of(batch));

            AnalysisStatus status = outcome.status();
            if (status == AnalysisStatus.FAILED) {
                session.addWarning("StorageWriteException: " + outcome.failure());
            } else if (status == AnalysisStatus.COMPLETED) {
                try {
                    qualityAnalyzer.analyze(projectId);
                } catch (StorageWriteException e) {
                    log.error("Storing quality results of {} failed: {}", projectId, e.getMessage(), e);
                    session.addWarning("StorageWriteException: " + e.getMessage());
                    status = AnalysisStatus.FAILED;
                }
            }
            int filesAnalyzed = outcome.batchesCommitted() > 0 ? extracted.usable().size() : 0;
            return report(session, status, toExtract.size(), filesAnalyzed, before, outcome.relationsWritten(),
                normalized.unresolvedRelations(), outcome.batchesCommitted(), null, started);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Extraction results split into files with content and files that produced nothing.
     */
    private record Extracted(List<ExtractionResult> usable, Set<String> preservedFiles) {
    }

    private static Extracted record(AnalysisSession session, List<ExtractionResult> results) {
        List<ExtractionResult> usable = new ArrayList<>();
        Set<String> preserved = new TreeSet<>();
        for (ExtractionResult result : results) {
            session.statistics().record(result);
            result.errors().forEach(error -> {
                log.warn("Parse error: {}", error);
                session.addError(error);
            });
            if (result.entities().isEmpty()) {
                preserved.add(result.filePath());
            } else {
                usable.add(result);
            }
        }
        return new Extracted(usable, preserved);
    }

    private AnalysisReport report(AnalysisSession session, AnalysisStatus status, int filesDiscovered,
                                  int filesAnalyzed, Set<String> before, int relationsWritten, int unresolved,
                                  int batches, DebtSnapshot snapshot, long startedNanos) {
        Set<String> after = entityIds(session.getProjectId());
        int added = 0;
        for (String id : after) {
            if (!before.contains(id)) {
                added++;
            }
        }
        int removed = 0;
        for (String id : before) {
            if (!after.contains(id)) {
                removed++;
            }
        }
        AnalysisReport report = new AnalysisReport(session.getProjectId(), status, filesDiscovered, filesAnalyzed,
            added, relationsWritten, removed, unresolved, batches, session.getErrors(), session.getWarnings(),
            session.statistics().build(), snapshot, Duration.ofNanos(System.nanoTime() - startedNanos));
        log.info(report.getSummary());
        return report;
    }

    private Set<String> entityIds(String projectId) {
        Set<String> ids = new HashSet<>();
        store.listEntities(projectId).forEach(entity -> ids.add(entity.id()));
        return ids;
    }

    private static String toRelative(Path root, String path) {
        Path candidate = Path.of(path);
        if (candidate.isAbsolute()) {
            return FileUtils.relativePath(root, candidate);
        }
        String relative = FileUtils.toUnixPath(path);
        while (relative.startsWith("./")) {
            relative = relative.substring(2);
        }
        return relative;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.warn("Cannot determine size of {}: {}", file, e.getMessage());
            return 0;
        }
    }

    // ==================== Queries ====================

    public CodeEntity getEntity(String projectId, String idOrQualifiedName) {
        return queryEngine.getEntity(projectId, idOrQualifiedName);
    }

    public CallChainResult traceCallChain(String projectId, String startId) {
        return queryEngine.traceCallChain(projectId, startId);
    }

    public CallChainResult traceCallChain(String projectId, String startId, int maxDepth, int maxNodes,
                                          Set<RelationType> relationTypes) {
        return queryEngine.traceCallChain(projectId, startId, maxDepth, maxNodes, relationTypes);
    }

    public DependencyResult findDependencies(String projectId, String entityId, Direction direction,
                                             boolean transitive) {
        return queryEngine.findDependencies(projectId, entityId, direction, transitive);
    }

    public List<SearchHit> searchEntities(String projectId, String query) {
        return queryEngine.searchEntities(projectId, query);
    }

    public List<SearchHit> searchEntities(String projectId, String query, Set<EntityKind> kindFilter, int limit) {
        return queryEngine.searchEntities(projectId, query, kindFilter, limit);
    }

    public ArchitectureSummary summarizeArchitecture(String projectId, GroupBy groupBy) {
        return queryEngine.summarizeArchitecture(projectId, groupBy);
    }

    public Set<String> listProjects() {
        return store.listProjects();
    }

    // ==================== Quality ====================

    public List<QualityIssue> listIssues(String projectId, IssueFilter filter) {
        return qualityAnalyzer.listIssues(projectId, filter);
    }

    public QualityIssue resolveIssue(String projectId, String issueId) {
        return qualityAnalyzer.resolveIssue(projectId, issueId);
    }

    public QualityIssue ignoreIssue(String projectId, String issueId) {
        return qualityAnalyzer.ignoreIssue(projectId, issueId);
    }

    public List<DebtSnapshot> getDebtTrend(String projectId, Instant since) {
        return qualityAnalyzer.getDebtTrend(projectId, since);
    }

    public List<FileDebt> identifyHotspots(String projectId, int topK) {
        return qualityAnalyzer.identifyHotspots(projectId, topK);
    }

    public DebtScore computeDebt(String projectId) {
        return qualityAnalyzer.computeDebtScore(projectId, externalScores.apply(projectId));
    }
}
