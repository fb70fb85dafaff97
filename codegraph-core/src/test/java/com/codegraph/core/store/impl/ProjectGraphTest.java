package com.codegraph.core.store.impl;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.model.Severity;
import org.junit.jupiter.api.Test;

import static com.codegraph.core.GraphFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ProjectGraphTest {

    private static final String PROJECT = "shop";

    @Test
    void copy_tracksOnlySectionsItModifies() {
        // Given
        CodeEntity orders = module(PROJECT, "orders.py");
        CodeEntity place = entity(PROJECT, "orders.place", EntityKind.FUNCTION, "orders.py", 3, 9, orders);
        ProjectGraph origin = new ProjectGraph();
        origin.putEntity(orders);
        origin.putEntity(place);
        origin.putRelation(relation(orders, place, RelationType.CONTAINS));

        // When
        ProjectGraph copy = origin.copy();
        copy.putIssue(issue(place, IssueType.LONG_FUNCTION, Severity.MEDIUM));

        // Then
        assertThat(copy.changedSections()).containsExactly(ProjectGraph.Section.ISSUES);
        assertThat(origin.allIssues()).isEmpty();
        assertThat(copy.allEntities()).containsExactly(orders, place);
    }

    @Test
    void copy_modifyingEntities_leavesOriginIndicesIntact() {
        // Given
        CodeEntity orders = module(PROJECT, "orders.py");
        ProjectGraph origin = new ProjectGraph();
        origin.putEntity(orders);

        // When
        ProjectGraph copy = origin.copy();
        copy.removeEntity(orders.id());
        copy.removeEntity("missing");

        // Then
        assertThat(copy.changedSections()).containsExactly(ProjectGraph.Section.ENTITIES);
        assertThat(copy.files()).isEmpty();
        assertThat(origin.files()).containsExactly("orders.py");
        assertThat(origin.entitiesByQualifiedName("orders")).containsExactly(orders);
        assertThat(new ProjectGraph().changedSections()).containsExactlyInAnyOrder(ProjectGraph.Section.values());
    }
}
