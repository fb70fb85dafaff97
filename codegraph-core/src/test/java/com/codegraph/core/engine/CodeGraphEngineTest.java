package com.codegraph.core.engine;

import com.codegraph.core.config.EngineConfig;
import com.codegraph.core.model.AnalysisStatus;
import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.Language;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.query.DependencyResult;
import com.codegraph.core.store.Direction;
import com.codegraph.core.store.IssueFilter;
import com.codegraph.core.store.StorageWriteException;
import com.codegraph.core.store.WriteBatch;
import com.codegraph.core.store.impl.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link CodeGraphEngine} over small source trees.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Full analysis of a mixed Python and JavaScript tree</li>
 *   <li>Idempotent re-analysis and removal of vanished files</li>
 *   <li>Incremental updates of modified and deleted files</li>
 *   <li>Language filters, excludes and parse errors</li>
 *   <li>Cancellation, session reuse and storage failures</li>
 * </ul>
 */
class CodeGraphEngineTest {

    private static final String PROJECT = "shop";

    @TempDir
    Path root;

    private InMemoryGraphStore store;
    private CodeGraphEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        write("pkg/util.py", """
            def helper(x):
                return x + 1
            """);
        write("pkg/service.py", """
            from pkg.util import helper

            class Service:
                def run(self, value):
                    return helper(value)
            """);
        write("web/app.js", """
            export function start() {
              return 1;
            }
            """);
        write("node_modules/lib/index.js", """
            export function ignored() {}
            """);
        write("README.md", "# Shop\n");

        store = new InMemoryGraphStore();
        engine = new CodeGraphEngine(config(1), store);
    }

    @Test
    void analyze_withMixedTree_buildsGraphAndSnapshot() {
        // When
        AnalysisReport report = engine.analyze(engine.newSession(PROJECT), root);

        // Then
        assertThat(report.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(report.filesDiscovered()).isEqualTo(3);
        assertThat(report.filesAnalyzed()).isEqualTo(3);
        assertThat(report.batchesCommitted()).isEqualTo(3);
        assertThat(report.entitiesRemoved()).isZero();
        assertThat(report.entitiesAdded()).isEqualTo(store.listEntities(PROJECT).size());
        assertThat(report.statistics().filesByLanguage())
            .containsEntry(Language.PYTHON.getId(), 2)
            .containsEntry(Language.JAVASCRIPT.getId(), 1);
        assertThat(store.listFiles(PROJECT)).containsExactly("pkg/service.py", "pkg/util.py", "web/app.js");

        CodeEntity run = engine.getEntity(PROJECT, "pkg.service.Service.run");
        CodeEntity helper = engine.getEntity(PROJECT, "pkg.util.helper");
        assertThat(callsFrom(run)).extracting(CodeRelation::targetId).containsExactly(helper.id());

        assertThat(report.debtSnapshot()).isNotNull();
        assertThat(engine.getDebtTrend(PROJECT, Instant.EPOCH)).containsExactly(report.debtSnapshot());
        assertThat(engine.listProjects()).containsExactly(PROJECT);
    }

    @Test
    void analyze_twice_keepsIdsAndAddsNothing() {
        // Given
        engine.analyze(engine.newSession(PROJECT), root);
        Set<String> firstIds = ids(store.listEntities(PROJECT));
        Set<String> firstRelations = store.listRelations(PROJECT).stream()
            .map(CodeRelation::id).collect(Collectors.toSet());

        // When
        AnalysisReport second = engine.analyze(engine.newSession(PROJECT), root);

        // Then
        assertThat(second.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(second.entitiesAdded()).isZero();
        assertThat(second.entitiesRemoved()).isZero();
        assertThat(ids(store.listEntities(PROJECT))).isEqualTo(firstIds);
        assertThat(store.listRelations(PROJECT)).extracting(CodeRelation::id)
            .containsExactlyInAnyOrderElementsOf(firstRelations);
        assertThat(engine.getDebtTrend(PROJECT, Instant.EPOCH)).hasSize(2);
    }

    @Test
    void analyze_afterFileDeleted_removesItsEntities() throws IOException {
        // Given
        engine.analyze(engine.newSession(PROJECT), root);
        Files.delete(root.resolve("web/app.js"));

        // When
        AnalysisReport report = engine.analyze(engine.newSession(PROJECT), root);

        // Then
        assertThat(report.entitiesRemoved()).isPositive();
        assertThat(store.listFiles(PROJECT)).containsExactly("pkg/service.py", "pkg/util.py");
        assertThat(store.listEntitiesInFile(PROJECT, "web/app.js")).isEmpty();
    }

    @Test
    void update_withModifiedFile_leavesOtherFilesUntouched() throws IOException {
        // Given
        engine.analyze(engine.newSession(PROJECT), root);
        List<CodeEntity> serviceBefore = store.listEntitiesInFile(PROJECT, "pkg/service.py");
        CodeEntity helperBefore = engine.getEntity(PROJECT, "pkg.util.helper");
        write("pkg/util.py", """
            def helper(x):
                return x + 1

            def other():
                return helper(2)
            """);

        // When
        AnalysisReport report = engine.update(engine.newSession(PROJECT), root, List.of("pkg/util.py"));

        // Then
        assertThat(report.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(report.filesAnalyzed()).isEqualTo(1);
        assertThat(report.batchesCommitted()).isEqualTo(1);
        assertThat(report.entitiesAdded()).isEqualTo(1);
        assertThat(report.entitiesRemoved()).isZero();
        assertThat(report.debtSnapshot()).isNull();

        assertThat(store.listEntitiesInFile(PROJECT, "pkg/service.py")).isEqualTo(serviceBefore);
        assertThat(engine.getEntity(PROJECT, "pkg.util.helper").id()).isEqualTo(helperBefore.id());
        CodeEntity run = engine.getEntity(PROJECT, "pkg.service.Service.run");
        assertThat(callsFrom(run)).extracting(CodeRelation::targetId).containsExactly(helperBefore.id());
        assertThat(engine.getDebtTrend(PROJECT, Instant.EPOCH)).hasSize(1);
    }

    @Test
    void update_withDeletedFile_removesEntitiesAndExternalizesCallers() throws IOException {
        // Given
        engine.analyze(engine.newSession(PROJECT), root);
        Files.delete(root.resolve("pkg/util.py"));

        // When
        AnalysisReport report = engine.update(engine.newSession(PROJECT), root,
            List.of(root.resolve("pkg/util.py").toString()));

        // Then
        assertThat(report.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(report.entitiesRemoved()).isEqualTo(2);
        assertThat(store.listFiles(PROJECT)).doesNotContain("pkg/util.py");
        CodeEntity run = engine.getEntity(PROJECT, "pkg.service.Service.run");
        assertThat(callsFrom(run)).singleElement().satisfies(call -> assertThat(call.isExternal()).isTrue());
    }

    @Test
    void analyze_withLanguageFilterAndExclude_selectsMatchingFiles() {
        // When
        AnalysisReport report = engine.analyze(engine.newSession(PROJECT), root, Set.of(Language.PYTHON),
            List.of("**/util.py"));

        // Then
        assertThat(report.filesDiscovered()).isEqualTo(1);
        assertThat(store.listFiles(PROJECT)).containsExactly("pkg/service.py");
        assertThat(report.unresolvedRelations()).isPositive();
    }

    @Test
    void analyze_withSyntaxError_reportsErrorAndContinues() throws IOException {
        // Given
        write("pkg/broken.py", """
            def broken(x)
                return x

            def ok():
                return 1
            """);

        // When
        AnalysisReport report = engine.analyze(engine.newSession(PROJECT), root);

        // Then
        assertThat(report.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(report.errors()).isNotEmpty()
            .allSatisfy(error -> assertThat(error.filePath()).isEqualTo("pkg/broken.py"));
        assertThat(report.statistics().filesParsedWithFallback()).isEqualTo(1);
        assertThat(store.findByQualifiedName(PROJECT, "pkg.broken.ok")).hasSize(1);
        assertThat(store.listFiles(PROJECT)).hasSize(4);
    }

    @Test
    void analyze_withImportCycle_reportsCircularDependency() throws IOException {
        // Given
        write("pkg/a.py", """
            import pkg.b
            """);
        write("pkg/b.py", """
            import pkg.a
            """);

        // When
        engine.analyze(engine.newSession(PROJECT), root);

        // Then
        List<QualityIssue> cycles = engine.listIssues(PROJECT, IssueFilter.openAndActive()).stream()
            .filter(issue -> issue.issueType() == IssueType.CIRCULAR_DEPENDENCY)
            .toList();
        assertThat(cycles).isNotEmpty();
        assertThat(cycles).extracting(QualityIssue::filePath).isSubsetOf("pkg/a.py", "pkg/b.py");
        assertThat(engine.identifyHotspots(PROJECT, 5)).isNotEmpty();
    }

    @Test
    void analyze_withCancelledSession_commitsNothing() {
        // Given
        AnalysisSession session = engine.newSession(PROJECT);
        engine.cancel(session);

        // When
        AnalysisReport report = engine.analyze(session, root);

        // Then
        assertThat(report.status()).isEqualTo(AnalysisStatus.CANCELLED);
        assertThat(report.batchesCommitted()).isZero();
        assertThat(report.debtSnapshot()).isNull();
        assertThat(store.listFiles(PROJECT)).isEmpty();
    }

    @Test
    void analyze_withReusedSession_throws() {
        // Given
        AnalysisSession session = engine.newSession(PROJECT);
        engine.analyze(session, root);

        // When / Then
        assertThatThrownBy(() -> engine.update(session, root, List.of("pkg/util.py")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void analyze_withFailingStore_reportsFailure() {
        // Given: A store whose writes always fail
        InMemoryGraphStore failing = new InMemoryGraphStore() {
            @Override
            public void apply(String projectId, WriteBatch batch) {
                throw new StorageWriteException("disk full");
            }
        };
        CodeGraphEngine failingEngine = new CodeGraphEngine(config(10), failing);

        // When
        AnalysisReport report = failingEngine.analyze(failingEngine.newSession(PROJECT), root);

        // Then
        assertThat(report.status()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(report.batchesCommitted()).isZero();
        assertThat(report.warnings()).anySatisfy(warning -> assertThat(warning).contains("disk full"));
        assertThat(report.getSummary()).startsWith("shop: FAILED");
    }

    @Test
    void findDependencies_afterAnalyze_followsImports() {
        // Given
        engine.analyze(engine.newSession(PROJECT), root);
        CodeEntity service = engine.getEntity(PROJECT, "pkg.service");

        // When
        DependencyResult dependencies = engine.findDependencies(PROJECT, service.id(), Direction.OUT, false);

        // Then
        assertThat(dependencies.nodes()).isNotEmpty();
    }

    private EngineConfig config(int batchSize) {
        return EngineConfig.defaults()
            .withAnalysis(new EngineConfig.AnalysisConfig(2, 0, batchSize, 0, null, null))
            .withStorage(new EngineConfig.StorageConfig(root.resolve(".codegraph").toString()));
    }

    private List<CodeRelation> callsFrom(CodeEntity entity) {
        return store.getRelations(PROJECT, entity.id(), Set.of(RelationType.CALLS), Direction.OUT);
    }

    private static Set<String> ids(List<CodeEntity> entities) {
        return entities.stream().map(CodeEntity::id).collect(Collectors.toSet());
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
