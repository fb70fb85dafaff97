package com.codegraph.core.store.impl;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.IssueStatus;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.model.Severity;
import com.codegraph.core.store.Direction;
import com.codegraph.core.store.IssueFilter;
import com.codegraph.core.store.StorageWriteException;
import com.codegraph.core.store.WriteBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.codegraph.core.GraphFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link InMemoryGraphStore}.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Batch writes and relation lookups by direction and type</li>
 *   <li>File replacement, including relations into and out of replaced files</li>
 *   <li>Atomicity of failing batches</li>
 *   <li>Project isolation</li>
 *   <li>Issue status updates and snapshot ordering</li>
 * </ul>
 */
class InMemoryGraphStoreTest {

    private static final String PROJECT = "shop";

    private InMemoryGraphStore store;
    private CodeEntity orders;
    private CodeEntity place;
    private CodeEntity billing;
    private CodeEntity charge;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        orders = module(PROJECT, "orders.py");
        place = entity(PROJECT, "orders.place", EntityKind.FUNCTION, "orders.py", 3, 9, orders);
        billing = module(PROJECT, "billing.py");
        charge = entity(PROJECT, "billing.charge", EntityKind.FUNCTION, "billing.py", 1, 4, billing);
    }

    private void writeBoth() {
        store.apply(PROJECT, new WriteBatch(Set.of("orders.py", "billing.py"),
            List.of(orders, place, billing, charge),
            List.of(relation(orders, place, RelationType.CONTAINS), relation(place, charge, RelationType.CALLS),
                external(place, "logging.info", RelationType.CALLS))));
    }

    @Test
    void apply_writesEntitiesAndIndexesRelations() {
        // When
        writeBoth();

        // Then
        assertThat(store.getEntity(PROJECT, place.id())).contains(place);
        assertThat(store.findByQualifiedName(PROJECT, "billing.charge")).containsExactly(charge);
        assertThat(store.listFiles(PROJECT)).containsExactly("billing.py", "orders.py");
        assertThat(store.listEntitiesInFile(PROJECT, "orders.py")).containsExactly(orders, place);
        assertThat(store.getRelations(PROJECT, place.id(), Set.of(RelationType.CALLS), Direction.OUT))
            .extracting(CodeRelation::targetName)
            .containsExactlyInAnyOrder("billing.charge", "logging.info");
        assertThat(store.getRelations(PROJECT, charge.id(), null, Direction.IN))
            .extracting(CodeRelation::sourceId)
            .containsExactly(place.id());
        assertThat(store.getRelations(PROJECT, place.id(), Set.of(), Direction.BOTH)).hasSize(3);
        assertThat(store.listProjects()).containsExactly(PROJECT);
    }

    @Test
    void apply_withReplacedFile_removesOldContentAndExternalizesIncoming() {
        // Given
        writeBoth();

        // When: billing.py is deleted
        store.apply(PROJECT, WriteBatch.removeFiles(Set.of("billing.py")));

        // Then: The call into it survives as an external relation
        assertThat(store.listFiles(PROJECT)).containsExactly("orders.py");
        assertThat(store.getEntity(PROJECT, charge.id())).isEmpty();
        List<CodeRelation> calls = store.getRelations(PROJECT, place.id(), Set.of(RelationType.CALLS), Direction.OUT);
        CodeRelation toCharge = calls.stream()
            .filter(r -> r.targetName().equals("billing.charge"))
            .findFirst()
            .orElseThrow();
        assertThat(toCharge.isExternal()).isTrue();
        assertThat(store.listRelations(PROJECT))
            .noneMatch(r -> charge.id().equals(r.targetId()) || r.sourceId().equals(billing.id()));
    }

    @Test
    void apply_withRestoredFile_resolvesExternalRelationAgain() {
        // Given: billing.py was deleted, leaving an external call
        writeBoth();
        store.apply(PROJECT, WriteBatch.removeFiles(Set.of("billing.py")));

        // When: It comes back
        store.apply(PROJECT, new WriteBatch(Set.of("billing.py"), List.of(billing, charge), List.of()));

        // Then: The call points at the entity again, with its original id
        assertThat(store.getRelations(PROJECT, charge.id(), Set.of(RelationType.CALLS), Direction.IN))
            .extracting(CodeRelation::id)
            .containsExactly(relation(place, charge, RelationType.CALLS).id());
    }

    @Test
    void apply_withReplacedFile_dropsRelationsSourcedThere() {
        // Given
        writeBoth();
        CodeEntity ship = entity(PROJECT, "orders.ship", EntityKind.FUNCTION, "orders.py", 11, 12, orders);

        // When: orders.py is re-analysed without the call
        store.apply(PROJECT, new WriteBatch(Set.of("orders.py"), List.of(orders, place, ship),
            List.of(relation(orders, place, RelationType.CONTAINS), relation(orders, ship, RelationType.CONTAINS))));

        // Then
        assertThat(store.getRelations(PROJECT, place.id(), Set.of(RelationType.CALLS), Direction.OUT)).isEmpty();
        assertThat(store.listEntitiesInFile(PROJECT, "orders.py")).containsExactly(orders, place, ship);
        assertThat(store.listEntitiesInFile(PROJECT, "billing.py")).containsExactly(billing, charge);
    }

    @Test
    void apply_withMissingSource_rejectsWholeBatch() {
        // Given
        writeBoth();
        List<CodeRelation> before = store.listRelations(PROJECT);
        CodeEntity ghost = entity(PROJECT, "ghost.run", EntityKind.FUNCTION, "ghost.py", 1, 2, null);
        CodeEntity extra = entity(PROJECT, "billing.refund", EntityKind.FUNCTION, "billing.py", 6, 8, billing);

        // When / Then
        assertThatThrownBy(() -> store.apply(PROJECT, new WriteBatch(Set.of("billing.py"),
            List.of(billing, extra), List.of(relation(ghost, extra, RelationType.CALLS)))))
            .isInstanceOf(StorageWriteException.class)
            .hasMessageContaining("missing source");

        assertThat(store.listEntitiesInFile(PROJECT, "billing.py")).containsExactly(billing, charge);
        assertThat(store.listRelations(PROJECT)).isEqualTo(before);
    }

    @Test
    void apply_whenPersistenceFails_leavesPublishedGraphUnchanged() {
        // Given: A store whose persistence fails after the first write
        InMemoryGraphStore failing = new InMemoryGraphStore() {
            private int writes;

            @Override
            protected void persist(String projectId, ProjectGraph graph) {
                if (++writes > 1) {
                    throw new StorageWriteException("disk full");
                }
            }
        };
        failing.upsertEntities(PROJECT, List.of(orders, place));

        // When / Then
        assertThatThrownBy(() -> failing.upsertEntities(PROJECT, List.of(billing)))
            .isInstanceOf(StorageWriteException.class);
        assertThat(failing.listEntities(PROJECT)).containsExactly(orders, place);
    }

    @Test
    void apply_withMissingTarget_storesRelationAsExternal() {
        // Given
        store.upsertEntities(PROJECT, List.of(orders, place));

        // When
        store.upsertRelations(PROJECT, List.of(relation(place, charge, RelationType.CALLS)));

        // Then
        assertThat(store.listRelations(PROJECT))
            .singleElement()
            .satisfies(r -> {
                assertThat(r.isExternal()).isTrue();
                assertThat(r.targetName()).isEqualTo("billing.charge");
            });
    }

    @Test
    void upsertReplaceEntitiesForFiles_dropsPreviousContentOfThoseFiles() {
        // Given
        writeBoth();
        CodeEntity cancel = entity(PROJECT, "orders.cancel", EntityKind.FUNCTION, "orders.py", 2, 5, orders);

        // When
        store.upsertReplaceEntitiesForFiles(PROJECT, Set.of("orders.py"),
            List.of(orders, cancel), List.of(relation(orders, cancel, RelationType.CONTAINS)));

        // Then
        assertThat(store.getEntity(PROJECT, place.id())).isEmpty();
        assertThat(store.listEntitiesInFile(PROJECT, "orders.py")).containsExactlyInAnyOrder(orders, cancel);
        assertThat(store.getRelations(PROJECT, charge.id(), null, Direction.IN)).isEmpty();
        assertThat(store.listEntitiesInFile(PROJECT, "billing.py")).containsExactlyInAnyOrder(billing, charge);
    }

    @Test
    void apply_withForeignProjectEntity_isRejected() {
        CodeEntity foreign = module("other", "x.py");

        assertThatThrownBy(() -> store.upsertEntities(PROJECT, List.of(foreign)))
            .isInstanceOf(StorageWriteException.class)
            .hasMessageContaining("belongs to project other");
        assertThat(store.listEntities(PROJECT)).isEmpty();
    }

    @Test
    void reads_areIsolatedPerProject() {
        // Given: The same file in two projects
        writeBoth();
        CodeEntity otherOrders = module("other", "orders.py");
        store.upsertEntities("other", List.of(otherOrders));

        // Then
        assertThat(store.listEntities("other")).containsExactly(otherOrders);
        assertThat(store.getEntity("other", orders.id())).isEmpty();
        assertThat(store.listEntities("unknown")).isEmpty();
        assertThat(store.listProjects()).containsExactly("other", PROJECT);
        assertThatThrownBy(() -> store.listEntities(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void issues_canBeFilteredAndUpdated() {
        // Given
        writeBoth();
        QualityIssue longFunction = issue(place, IssueType.LONG_FUNCTION, Severity.MEDIUM);
        QualityIssue coupling = issue(charge, IssueType.TIGHT_COUPLING, Severity.HIGH);
        store.saveIssues(PROJECT, List.of(longFunction, coupling));

        // When
        Optional<QualityIssue> ignored = store.updateIssueStatus(PROJECT, longFunction.id(), IssueStatus.IGNORED);

        // Then
        assertThat(ignored).map(QualityIssue::status).contains(IssueStatus.IGNORED);
        assertThat(store.listIssues(PROJECT, IssueFilter.all()))
            .extracting(QualityIssue::id)
            .containsExactly(coupling.id(), longFunction.id());
        assertThat(store.listIssues(PROJECT, IssueFilter.openAndActive()))
            .containsExactly(coupling);
        assertThat(store.listIssues(PROJECT, IssueFilter.all().withSeverities(Set.of(Severity.MEDIUM))))
            .extracting(QualityIssue::status)
            .containsExactly(IssueStatus.IGNORED);
        assertThat(store.updateIssueStatus(PROJECT, "nope", IssueStatus.RESOLVED)).isEmpty();
    }

    @Test
    void saveIssues_withIssueAlreadyIgnored_keepsStoredStatus() {
        // Given
        writeBoth();
        QualityIssue longFunction = issue(place, IssueType.LONG_FUNCTION, Severity.MEDIUM);
        store.saveIssues(PROJECT, List.of(longFunction));
        store.updateIssueStatus(PROJECT, longFunction.id(), IssueStatus.IGNORED);

        // When: The same issue is written again as detected, with severity raised
        store.saveIssues(PROJECT, List.of(issue(place, IssueType.LONG_FUNCTION, Severity.HIGH)));

        // Then
        assertThat(store.listIssues(PROJECT, IssueFilter.all()))
            .singleElement()
            .satisfies(stored -> {
                assertThat(stored.status()).isEqualTo(IssueStatus.IGNORED);
                assertThat(stored.severity()).isEqualTo(Severity.HIGH);
            });
    }

    @Test
    void snapshots_areListedChronologically() {
        // Given
        DebtSnapshot later = snapshot("b", Instant.parse("2026-03-02T00:00:00Z"));
        DebtSnapshot earlier = snapshot("a", Instant.parse("2026-03-01T00:00:00Z"));

        // When
        store.appendSnapshot(later);
        store.appendSnapshot(earlier);

        // Then
        assertThat(store.listSnapshots(PROJECT)).containsExactly(earlier, later);
    }

    private static DebtSnapshot snapshot(String id, Instant createdAt) {
        return new DebtSnapshot(id, PROJECT, 9.0, Map.of("code_quality", 9.0), Map.of(Severity.LOW, 1), 1, 0.1,
            createdAt);
    }
}
