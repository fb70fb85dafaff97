package com.codegraph.core.report.impl;

import com.codegraph.core.report.GeneratedReport;
import com.codegraph.core.report.ReportConfig;
import com.codegraph.core.report.ReportData;
import com.codegraph.core.report.ReportFixtures;
import com.codegraph.core.report.ReportGenerators;
import com.codegraph.core.report.ReportType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Functional tests for {@link MarkdownReportGenerator}.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Overview, quality and hotspot documents</li>
 *   <li>Row limits and escaping of table cells</li>
 *   <li>Placeholder text for empty projects</li>
 * </ul>
 */
class MarkdownReportGeneratorTest {

    private MarkdownReportGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new MarkdownReportGenerator();
    }

    @Test
    void getMetadata_returnsMarkdownIdentity() {
        assertThat(generator.getId()).isEqualTo("markdown");
        assertThat(generator.getFileExtension()).isEqualTo("md");
        assertThat(generator.getSupportedReportTypes())
            .containsExactlyInAnyOrder(ReportType.OVERVIEW, ReportType.QUALITY, ReportType.HOTSPOTS);
        assertThat(ReportGenerators.find("MARKDOWN"))
            .hasValueSatisfying(found -> assertThat(found).isInstanceOf(MarkdownReportGenerator.class));
    }

    @Test
    void generate_overview_listsModulesLargestFirst() {
        // When
        GeneratedReport report = generator.generate(ReportFixtures.sampleData(), ReportType.OVERVIEW,
            ReportConfig.defaults());

        // Then
        assertThat(report.fileName()).isEqualTo("overview.md");
        String content = report.content();
        assertThat(content).startsWith("# Architecture Overview");
        assertThat(content).contains("| FUNCTION | 4 |");
        assertThat(content).contains("| `app` | python | 2 | 5 | 1 | 3 | 0.8 |");
        assertThat(content).contains("`lib\\|core`");
        assertThat(content.indexOf("`app`")).isLessThan(content.indexOf("`lib"));
    }

    @Test
    void generate_qualityWithRowLimit_sortsBySeverityAndTruncates() {
        // When
        GeneratedReport report = generator.generate(ReportFixtures.sampleData(), ReportType.QUALITY,
            new ReportConfig(1));

        // Then
        String content = report.content();
        assertThat(content).contains("| Overall | 8.5 |");
        assertThat(content).contains("| codeQuality | 9.7 |");
        assertThat(content).contains("| HIGH | 1 |").contains("| CRITICAL | 0 |");
        assertThat(content).contains("| HIGH | Circular dependency | `app/main.py:1` |");
        assertThat(content).doesNotContain("| MEDIUM | Long function |");
        assertThat(content).contains("_1 more not shown._");
    }

    @Test
    void generate_hotspots_showsHealthAndMainIssues() {
        // When
        GeneratedReport report = generator.generate(ReportFixtures.sampleData(), ReportType.HOTSPOTS,
            ReportConfig.defaults());

        // Then
        assertThat(report.content())
            .startsWith("# Debt Hotspots")
            .contains("| `app/main.py` | 3.0 | 7.0/10 | 2 | 6 | MEDIUM |")
            .contains("Circular dependency in app.main<br>Long function in app.main");
    }

    @Test
    void generate_withEmptyData_writesPlaceholders() {
        // Given
        ReportData data = ReportFixtures.emptyData();

        // When
        String overview = generator.generate(data, ReportType.OVERVIEW, ReportConfig.defaults()).content();
        String quality = generator.generate(data, ReportType.QUALITY, ReportConfig.defaults()).content();
        String hotspots = generator.generate(data, ReportType.HOTSPOTS, ReportConfig.defaults()).content();

        // Then
        assertThat(overview).contains("No entities found.").contains("No modules found.");
        assertThat(quality).contains("No open issues found.");
        assertThat(hotspots).contains("No files with open issues found.");
    }

    @Test
    void generate_withUnsupportedType_throws() {
        assertThatThrownBy(() -> generator.generate(ReportFixtures.sampleData(), ReportType.DEPENDENCY_GRAPH,
            ReportConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("DEPENDENCY_GRAPH");
    }

    @Test
    void generateIndex_linksAllReports() {
        // When
        String index = generator.generateIndex(ReportFixtures.sampleData());

        // Then
        assertThat(index).startsWith("# shop - Code Graph Report");
        assertThat(index).contains("| Entities | 7 |").contains("| Open Issues | 2 |");
        assertThat(index).contains("(overview.md)", "(quality.md)", "(hotspots.md)", "(dependency-graph.md)");
    }
}
