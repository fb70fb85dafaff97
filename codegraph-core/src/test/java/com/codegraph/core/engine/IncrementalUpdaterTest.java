package com.codegraph.core.engine;

import com.codegraph.core.GraphFixtures;
import com.codegraph.core.model.AnalysisStatus;
import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.store.StorageWriteException;
import com.codegraph.core.store.WriteBatch;
import com.codegraph.core.store.impl.InMemoryGraphStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IncrementalUpdater} batch planning and commits.
 */
class IncrementalUpdaterTest {

    private static final String PROJECT = "shop";

    private final CodeEntity a = GraphFixtures.module(PROJECT, "a.py");
    private final CodeEntity b = GraphFixtures.module(PROJECT, "b.py");
    private final CodeEntity c = GraphFixtures.module(PROJECT, "c.py");
    private final List<String> files = List.of("a.py", "b.py", "c.py");

    @Test
    void plan_withForwardRelation_placesItInTheLaterBatch() {
        // Given
        CodeRelation forward = GraphFixtures.relation(a, c, RelationType.IMPORTS);
        CodeRelation backward = GraphFixtures.relation(c, a, RelationType.IMPORTS);
        CodeRelation external = GraphFixtures.external(a, "os", RelationType.IMPORTS);

        // When
        List<WriteBatch> batches = new IncrementalUpdater(new InMemoryGraphStore())
            .plan(files, List.of(a, b, c), List.of(forward, backward, external), 2);

        // Then
        assertThat(batches).hasSize(2);
        assertThat(batches.get(0).replacedFiles()).containsExactlyInAnyOrder("a.py", "b.py");
        assertThat(batches.get(0).entities()).containsExactly(a, b);
        assertThat(batches.get(0).relations()).containsExactly(external);
        assertThat(batches.get(1).replacedFiles()).containsExactly("c.py");
        assertThat(batches.get(1).relations()).containsExactlyInAnyOrder(forward, backward);
    }

    @Test
    void plan_withEntityOfUnplannedFile_throws() {
        CodeEntity stray = GraphFixtures.module(PROJECT, "d.py");

        assertThatThrownBy(() -> new IncrementalUpdater(new InMemoryGraphStore())
            .plan(files, List.of(a, stray), List.of(), 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("d.py");
    }

    @Test
    void plan_withInvalidBatchSize_throws() {
        assertThatThrownBy(() -> new IncrementalUpdater(new InMemoryGraphStore()).plan(files, List.of(), List.of(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void commit_withTransientFailure_retriesOnce() {
        // Given: A store failing only on its first write
        AtomicInteger attempts = new AtomicInteger();
        InMemoryGraphStore flaky = new InMemoryGraphStore() {
            @Override
            public void apply(String projectId, WriteBatch batch) {
                if (attempts.getAndIncrement() == 0) {
                    throw new StorageWriteException("busy");
                }
                super.apply(projectId, batch);
            }
        };
        IncrementalUpdater updater = new IncrementalUpdater(flaky);
        List<WriteBatch> batches = updater.plan(files, List.of(a, b, c), List.of(), 1);

        // When
        IncrementalUpdater.CommitOutcome outcome = updater.commit(new AnalysisSession(PROJECT), batches);

        // Then
        assertThat(outcome.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(outcome.batchesCommitted()).isEqualTo(3);
        assertThat(outcome.entitiesWritten()).isEqualTo(3);
        assertThat(attempts).hasValue(4);
        assertThat(flaky.listFiles(PROJECT)).containsExactly("a.py", "b.py", "c.py");
    }

    @Test
    void commit_withRepeatedFailure_stopsAfterCommittedPrefix() {
        // Given: A store rejecting every write after the first batch
        AtomicInteger attempts = new AtomicInteger();
        InMemoryGraphStore failing = new InMemoryGraphStore() {
            @Override
            public void apply(String projectId, WriteBatch batch) {
                if (attempts.getAndIncrement() > 0) {
                    throw new StorageWriteException("disk full");
                }
                super.apply(projectId, batch);
            }
        };
        IncrementalUpdater updater = new IncrementalUpdater(failing);

        // When
        IncrementalUpdater.CommitOutcome outcome = updater.commit(new AnalysisSession(PROJECT),
            updater.plan(files, List.of(a, b, c), List.of(), 1));

        // Then
        assertThat(outcome.status()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(outcome.batchesCommitted()).isEqualTo(1);
        assertThat(outcome.failure()).isEqualTo("disk full");
        assertThat(failing.listFiles(PROJECT)).containsExactly("a.py");
    }

    @Test
    void commit_withCancelledSession_commitsNothing() {
        // Given
        InMemoryGraphStore store = new InMemoryGraphStore();
        IncrementalUpdater updater = new IncrementalUpdater(store);
        AnalysisSession session = new AnalysisSession(PROJECT);
        session.cancel();

        // When
        IncrementalUpdater.CommitOutcome outcome = updater.commit(session,
            updater.plan(files, List.of(a, b, c), List.of(), 2));

        // Then
        assertThat(outcome.status()).isEqualTo(AnalysisStatus.CANCELLED);
        assertThat(outcome.batchesCommitted()).isZero();
        assertThat(store.listFiles(PROJECT)).isEmpty();
    }
}
