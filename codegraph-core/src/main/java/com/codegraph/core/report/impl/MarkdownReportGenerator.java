package com.codegraph.core.report.impl;

import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.Severity;
import com.codegraph.core.quality.DebtScore;
import com.codegraph.core.quality.FileDebt;
import com.codegraph.core.query.ArchitectureSummary;
import com.codegraph.core.query.ModuleSummary;
import com.codegraph.core.report.GeneratedReport;
import com.codegraph.core.report.ReportConfig;
import com.codegraph.core.report.ReportData;
import com.codegraph.core.report.ReportGenerator;
import com.codegraph.core.report.ReportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates Markdown documents: an architecture overview, a quality report and a hotspot list.
 *
 * <p>Tables are capped at {@link ReportConfig#maxRows()} rows. Pipes and line breaks in
 * names are escaped so that table cells stay intact.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MarkdownReportGenerator generator = new MarkdownReportGenerator();
 * ReportData data = ReportData.collect(engine, "shop", 10);
 * GeneratedReport quality = generator.generate(data, ReportType.QUALITY, ReportConfig.defaults());
 * String index = generator.generateIndex(data);
 * }</pre>
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String CODE = "`";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";

    private static final String NO_FOUND = "No %s found.";
    private static final String DASH_VALUE = "-";
    private static final String TRUNCATED = "_%d more not shown._";

    private static final String METRIC = "Metric";
    private static final String VALUE = "Value";
    private static final String MODULE = "Module";
    private static final String LANGUAGES = "Languages";
    private static final String FILES = "Files";
    private static final String ENTITIES = "Entities";
    private static final String FAN_IN = "Fan-in";
    private static final String FAN_OUT = "Fan-out";
    private static final String INSTABILITY = "Instability";
    private static final String SEVERITY = "Severity";
    private static final String TYPE = "Type";
    private static final String LOCATION = "Location";
    private static final String TITLE = "Title";
    private static final String SUGGESTION = "Suggestion";
    private static final String FILE = "File";
    private static final String DEBT = "Debt";
    private static final String HEALTH = "Health";
    private static final String ISSUES = "Issues";
    private static final String HOURS = "Hours";
    private static final String PRIORITY = "Priority";
    private static final String MAIN_ISSUES = "Main Issues";

    private static final String OVERVIEW_LINK = "- [Architecture Overview](overview.md)";
    private static final String QUALITY_LINK = "- [Quality Report](quality.md)";
    private static final String HOTSPOTS_LINK = "- [Debt Hotspots](hotspots.md)";
    private static final String DEPENDENCY_LINK = "- [Module Dependencies](dependency-graph.md)";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Report Generator";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public Set<ReportType> getSupportedReportTypes() {
        return Set.of(ReportType.OVERVIEW, ReportType.QUALITY, ReportType.HOTSPOTS);
    }

    @Override
    public GeneratedReport generate(ReportData data, ReportType type, ReportConfig config) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedReportTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }

        log.debug("Generating Markdown report {} for {}", type, data.projectId());

        String content = switch (type) {
            case OVERVIEW -> generateOverview(data, config);
            case QUALITY -> generateQuality(data, config);
            case HOTSPOTS -> generateHotspots(data, config);
            default -> throw new IllegalArgumentException("Unsupported report type: " + type);
        };

        String name = type.name().toLowerCase(Locale.ROOT).replace('_', '-');
        log.info("Generated Markdown report: {}", name);
        return new GeneratedReport(name, content, getFileExtension());
    }

    /**
     * Generates the index page linking the other reports.
     *
     * @param data project data
     * @return Markdown index page
     */
    public String generateIndex(ReportData data) {
        StringBuilder sb = new StringBuilder();
        ArchitectureSummary summary = data.summary();
        DebtScore debt = data.debt();

        appendHeader(sb, 1, data.projectId() + " - Code Graph Report");

        appendHeader(sb, 2, "Statistics");
        appendTableRow(sb, METRIC, VALUE);
        appendTableDivider(sb, 2);
        appendTableRow(sb, FILES, String.valueOf(summary.totalFiles()));
        appendTableRow(sb, ENTITIES, String.valueOf(summary.totalEntities()));
        appendTableRow(sb, "Relations", String.valueOf(summary.totalRelations()));
        appendTableRow(sb, "Modules", String.valueOf(summary.modules().size()));
        appendTableRow(sb, "Open Issues", String.valueOf(debt.issuesCount()));
        appendTableRow(sb, "Overall Score", format(debt.overallScore()) + " / 10");
        appendTableRow(sb, "Estimated Days To Fix", format(debt.estimatedDaysToFix()));
        sb.append(NEWLINE);

        appendHeader(sb, 2, "Reports");
        sb.append(OVERVIEW_LINK).append(NEWLINE)
            .append(QUALITY_LINK).append(NEWLINE)
            .append(HOTSPOTS_LINK).append(NEWLINE)
            .append(DEPENDENCY_LINK).append(NEWLINE);
        return sb.toString();
    }

    private String generateOverview(ReportData data, ReportConfig config) {
        StringBuilder sb = new StringBuilder();
        ArchitectureSummary summary = data.summary();
        appendHeader(sb, 1, "Architecture Overview");

        appendHeader(sb, 2, "Entities by Kind");
        if (!appendEmptyMessage(sb, summary.entitiesByKind().isEmpty(), "entities")) {
            appendTableRow(sb, TYPE, ENTITIES);
            appendTableDivider(sb, 2);
            for (Map.Entry<EntityKind, Integer> entry : summary.entitiesByKind().entrySet()) {
                appendTableRow(sb, entry.getKey().name(), String.valueOf(entry.getValue()));
            }
            sb.append(NEWLINE);
        }

        appendHeader(sb, 2, "Modules");
        if (appendEmptyMessage(sb, summary.modules().isEmpty(), "modules")) {
            return sb.toString();
        }
        List<ModuleSummary> modules = summary.modules().stream()
            .sorted(Comparator.comparingInt(ModuleSummary::totalEntities).reversed()
                .thenComparing(ModuleSummary::name))
            .toList();
        appendTableRow(sb, MODULE, LANGUAGES, FILES, ENTITIES, FAN_IN, FAN_OUT, INSTABILITY);
        appendTableDivider(sb, 7);
        for (ModuleSummary module : limit(modules, config)) {
            appendTableRow(sb,
                CODE + escapeMarkdown(module.name()) + CODE,
                String.join(", ", module.languages()),
                String.valueOf(module.fileCount()),
                String.valueOf(module.totalEntities()),
                String.valueOf(module.inDegree()),
                String.valueOf(module.outDegree()),
                format(module.instability()));
        }
        appendTruncation(sb, modules.size(), config);
        return sb.toString();
    }

    private String generateQuality(ReportData data, ReportConfig config) {
        StringBuilder sb = new StringBuilder();
        DebtScore debt = data.debt();
        appendHeader(sb, 1, "Quality Report");

        appendHeader(sb, 2, "Scores");
        appendTableRow(sb, METRIC, VALUE);
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Overall", format(debt.overallScore()));
        for (Map.Entry<String, Double> entry : debt.categoryScores().entrySet()) {
            appendTableRow(sb, entry.getKey(), format(entry.getValue()));
        }
        appendTableRow(sb, "Total Debt", format(debt.totalDebt()));
        appendTableRow(sb, "Estimated Hours", String.valueOf(debt.estimatedHours()));
        sb.append(NEWLINE);

        appendHeader(sb, 2, "Issues by Severity");
        appendTableRow(sb, SEVERITY, ISSUES);
        appendTableDivider(sb, 2);
        for (Severity severity : Severity.values()) {
            appendTableRow(sb, severity.name(),
                String.valueOf(debt.issueCountsBySeverity().getOrDefault(severity, 0)));
        }
        sb.append(NEWLINE);

        appendHeader(sb, 2, "Open Issues");
        if (appendEmptyMessage(sb, data.issues().isEmpty(), "open issues")) {
            return sb.toString();
        }
        List<QualityIssue> issues = data.issues().stream()
            .sorted(Comparator.comparing(QualityIssue::severity).reversed()
                .thenComparing(QualityIssue::filePath, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparingInt(QualityIssue::lineNumber))
            .toList();
        appendTableRow(sb, SEVERITY, TYPE, LOCATION, TITLE, SUGGESTION);
        appendTableDivider(sb, 5);
        for (QualityIssue issue : limit(issues, config)) {
            appendTableRow(sb,
                issue.severity().name(),
                issue.issueType().getTitle(),
                CODE + escapeMarkdown(location(issue)) + CODE,
                escapeMarkdown(issue.title()),
                escapeMarkdown(nullSafeValue(issue.suggestion())));
        }
        appendTruncation(sb, issues.size(), config);
        return sb.toString();
    }

    private String generateHotspots(ReportData data, ReportConfig config) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, 1, "Debt Hotspots");
        if (appendEmptyMessage(sb, data.hotspots().isEmpty(), "files with open issues")) {
            return sb.toString();
        }
        appendTableRow(sb, FILE, DEBT, HEALTH, ISSUES, HOURS, PRIORITY, MAIN_ISSUES);
        appendTableDivider(sb, 7);
        for (FileDebt file : limit(data.hotspots(), config)) {
            String mainIssues = file.mainIssues().stream()
                .map(issue -> escapeMarkdown(issue.title()))
                .collect(Collectors.joining("<br>"));
            appendTableRow(sb,
                CODE + escapeMarkdown(file.filePath()) + CODE,
                format(file.debtScore()),
                file.getFormattedHealth(),
                String.valueOf(file.issuesCount()),
                String.valueOf(file.estimatedHours()),
                file.priority().name(),
                mainIssues.isEmpty() ? DASH_VALUE : mainIssues);
        }
        appendTruncation(sb, data.hotspots().size(), config);
        return sb.toString();
    }

    // ==================== Formatting Helpers ====================

    private static <T> List<T> limit(List<T> rows, ReportConfig config) {
        return rows.size() > config.maxRows() ? rows.subList(0, config.maxRows()) : rows;
    }

    private void appendTruncation(StringBuilder sb, int total, ReportConfig config) {
        if (total > config.maxRows()) {
            sb.append(NEWLINE).append(String.format(TRUNCATED, total - config.maxRows())).append(NEWLINE);
        }
    }

    private void appendHeader(StringBuilder sb, int level, String title) {
        String prefix = switch (level) {
            case 1 -> H1;
            case 2 -> H2;
            case 3 -> H3;
            default -> "";
        };
        sb.append(prefix).append(title).append(DOUBLE_NEWLINE);
    }

    private boolean appendEmptyMessage(StringBuilder sb, boolean isEmpty, String itemType) {
        if (isEmpty) {
            sb.append(String.format(NO_FOUND, itemType)).append(DOUBLE_NEWLINE);
            return true;
        }
        return false;
    }

    private void appendTableRow(StringBuilder sb, String... columns) {
        sb.append(PIPE);
        for (String column : columns) {
            sb.append(' ').append(column).append(' ').append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendTableDivider(StringBuilder sb, int columnCount) {
        sb.append(PIPE);
        for (int i = 0; i < columnCount; i++) {
            sb.append("--------").append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private static String location(QualityIssue issue) {
        if (issue.filePath() == null) {
            return DASH_VALUE;
        }
        return issue.lineNumber() > 0 ? issue.filePath() + ":" + issue.lineNumber() : issue.filePath();
    }

    private static String nullSafeValue(String value) {
        return value == null || value.isBlank() ? DASH_VALUE : value;
    }

    private static String escapeMarkdown(String text) {
        if (text == null) {
            return DASH_VALUE;
        }
        return text.replace("|", "\\|").replace("\r", "").replace("\n", " ");
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
