package com.codegraph.core.quality;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.model.Severity;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.codegraph.core.GraphFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CycleDetector}.
 */
class CycleDetectorTest {

    private static final String PROJECT = "demo";
    private static final Instant NOW = Instant.parse("2026-02-01T12:00:00Z");

    private final CycleDetector detector = new CycleDetector();

    private final CodeEntity a = module(PROJECT, "a.py");
    private final CodeEntity b = module(PROJECT, "b.py");
    private final CodeEntity c = module(PROJECT, "c.py");

    @Test
    void findCycles_withTriangle_reportsOneCanonicalCycle() {
        // Given: a -> b -> c -> a, entered from every node
        List<CodeRelation> relations = List.of(
            relation(a, b, RelationType.IMPORTS),
            relation(b, c, RelationType.USES),
            relation(c, a, RelationType.IMPORTS));

        // When
        List<List<String>> cycles = detector.findCycles(relations);

        // Then
        assertThat(cycles).singleElement().satisfies(cycle -> {
            assertThat(cycle).containsExactlyInAnyOrder(a.id(), b.id(), c.id());
            assertThat(cycle.get(0)).isEqualTo(min(a.id(), b.id(), c.id()));
        });
    }

    @Test
    void findCycles_ignoresSelfLoopsCallsAndExternals() {
        List<CodeRelation> relations = List.of(
            relation(a, a, RelationType.IMPORTS),
            relation(a, b, RelationType.CALLS),
            relation(b, a, RelationType.CALLS),
            external(a, "a", RelationType.IMPORTS));

        assertThat(detector.findCycles(relations)).isEmpty();
    }

    @Test
    void findCycles_withTwoSeparateCycles_reportsBoth() {
        CodeEntity d = module(PROJECT, "d.py");
        List<CodeRelation> relations = List.of(
            relation(a, b, RelationType.IMPORTS),
            relation(b, a, RelationType.IMPORTS),
            relation(c, d, RelationType.IMPORTS),
            relation(d, c, RelationType.IMPORTS));

        List<List<String>> cycles = detector.findCycles(relations);

        assertThat(cycles).hasSize(2).allMatch(cycle -> cycle.size() == 2);
    }

    @Test
    void findCycles_withLongChain_doesNotOverflowStack() {
        // Given: A ring of 20,000 nodes
        int size = 20_000;
        List<CodeRelation> relations = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            String source = String.format("n%05d", i);
            String target = String.format("n%05d", (i + 1) % size);
            relations.add(new CodeRelation("r" + i, PROJECT, source, target, target, RelationType.IMPORTS, 1.0,
                Map.of()));
        }

        // When
        List<List<String>> cycles = detector.findCycles(relations);

        // Then
        assertThat(cycles).singleElement().satisfies(cycle -> {
            assertThat(cycle).hasSize(size);
            assertThat(cycle.get(0)).isEqualTo("n00000");
        });
    }

    @ParameterizedTest
    @CsvSource({"2, MEDIUM", "3, HIGH", "4, HIGH", "5, CRITICAL", "12, CRITICAL"})
    void severityOf_growsWithCycleLength(int length, Severity expected) {
        assertThat(CycleDetector.severityOf(length)).isEqualTo(expected);
    }

    @Test
    void canonical_rotatesToSmallestId() {
        assertThat(CycleDetector.canonical(List.of("c", "a", "b"))).containsExactly("a", "b", "c");
    }

    @Test
    void detect_createsIssueWithCycleMetadata() {
        // Given
        CodeEntity fn = entity(PROJECT, "a.run", EntityKind.FUNCTION, "a.py", 2, 3, a);
        List<CodeRelation> relations = List.of(relation(a, b, RelationType.IMPORTS), relation(b, a, RelationType.IMPORTS));

        // When
        List<QualityIssue> first = detector.detect(PROJECT, List.of(a, b, fn), relations, NOW);
        List<QualityIssue> second = detector.detect(PROJECT, List.of(b, a), relations, NOW.plusSeconds(60));

        // Then
        assertThat(first).singleElement().satisfies(issue -> {
            assertThat(issue.issueType()).isEqualTo(IssueType.CIRCULAR_DEPENDENCY);
            assertThat(issue.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(issue.metadata()).containsEntry("length", 2);
            assertThat(issue.metadata().get("files")).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactlyInAnyOrder("a.py", "b.py");
            assertThat(issue.description()).startsWith("Dependency cycle of 2 entities").contains(" -> ");
            assertThat(issue.detectedAt()).isEqualTo(NOW);
        });
        assertThat(second).extracting(QualityIssue::id).containsExactly(first.get(0).id());
    }

    private static String min(String... ids) {
        String min = ids[0];
        for (String id : ids) {
            if (id.compareTo(min) < 0) {
                min = id;
            }
        }
        return min;
    }
}
