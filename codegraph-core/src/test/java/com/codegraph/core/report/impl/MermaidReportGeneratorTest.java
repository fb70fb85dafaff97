package com.codegraph.core.report.impl;

import com.codegraph.core.report.GeneratedReport;
import com.codegraph.core.report.ReportConfig;
import com.codegraph.core.report.ReportFixtures;
import com.codegraph.core.report.ReportType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MermaidReportGenerator}.
 */
class MermaidReportGeneratorTest {

    private final MermaidReportGenerator generator = new MermaidReportGenerator();

    @Test
    void generate_dependencyGraph_drawsModulesAndEdges() {
        // When
        GeneratedReport report = generator.generate(ReportFixtures.sampleData(), ReportType.DEPENDENCY_GRAPH,
            ReportConfig.defaults());

        // Then
        assertThat(report.fileName()).isEqualTo("dependency-graph.md");
        assertThat(report.content())
            .startsWith("# Module Dependencies of shop")
            .contains("```mermaid\ngraph LR\n")
            .contains("[\"app (5)\"]")
            .contains("[\"lib|core (2)\"]")
            .endsWith("```\n");
    }

    @Test
    void generate_dependencyGraphWithNodeLimit_dropsEdgesToHiddenModules() {
        // Given: The app module depends on "lib", which is not among the shown modules
        ReportConfig config = new ReportConfig(1);

        // When
        String content = generator.generate(ReportFixtures.sampleData(), ReportType.DEPENDENCY_GRAPH, config)
            .content();

        // Then
        assertThat(content).contains("app (5)").doesNotContain("lib|core").doesNotContain("-->");
    }

    @Test
    void generate_quality_drawsSeverityPie() {
        // When
        GeneratedReport report = generator.generate(ReportFixtures.sampleData(), ReportType.QUALITY,
            ReportConfig.defaults());

        // Then
        assertThat(report.name()).isEqualTo("quality-chart");
        assertThat(report.content())
            .contains("pie showData")
            .contains("\"HIGH\" : 1")
            .contains("\"MEDIUM\" : 1")
            .doesNotContain("\"LOW\"");
    }

    @Test
    void generate_withEmptyData_drawsPlaceholders() {
        assertThat(generator.generate(ReportFixtures.emptyData(), ReportType.DEPENDENCY_GRAPH,
            ReportConfig.defaults()).content()).contains("No modules found");
        assertThat(generator.generate(ReportFixtures.emptyData(), ReportType.QUALITY,
            ReportConfig.defaults()).content()).contains("\"No open issues\" : 1");
    }

    @Test
    void generate_overview_isUnsupported() {
        assertThatThrownBy(() -> generator.generate(ReportFixtures.emptyData(), ReportType.OVERVIEW,
            ReportConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
