package com.codegraph.core.report.impl;

import com.codegraph.core.model.Severity;
import com.codegraph.core.query.ModuleSummary;
import com.codegraph.core.report.GeneratedReport;
import com.codegraph.core.report.ReportConfig;
import com.codegraph.core.report.ReportData;
import com.codegraph.core.report.ReportGenerator;
import com.codegraph.core.report.ReportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Generates Mermaid diagrams embedded in Markdown.
 *
 * <p>{@link ReportType#DEPENDENCY_GRAPH} draws the module dependency graph; the largest
 * modules are kept when the graph exceeds {@link ReportConfig#maxRows()} nodes.
 * {@link ReportType#QUALITY} draws a pie chart of open issues by severity.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidReportGenerator.class);

    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    private static final String GRAPH_LR = "graph LR\n";
    private static final String PIE = "pie showData\n";

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    private static final String NO_MODULES_NODE = "  A[No modules found]\n";
    private static final String NO_ISSUES_SLICE = "  \"No open issues\" : 1\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<ReportType> getSupportedReportTypes() {
        return Set.of(ReportType.DEPENDENCY_GRAPH, ReportType.QUALITY);
    }

    @Override
    public GeneratedReport generate(ReportData data, ReportType type, ReportConfig config) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedReportTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }

        log.debug("Generating Mermaid diagram {} for {}", type, data.projectId());

        String content = switch (type) {
            case DEPENDENCY_GRAPH -> generateDependencyGraph(data, config);
            case QUALITY -> generateSeverityChart(data);
            default -> throw new IllegalArgumentException("Unsupported report type: " + type);
        };

        String name = type == ReportType.QUALITY
            ? "quality-chart"
            : type.name().toLowerCase(Locale.ROOT).replace('_', '-');
        log.info("Generated Mermaid diagram: {}", name);
        return new GeneratedReport(name, content, getFileExtension());
    }

    private String generateDependencyGraph(ReportData data, ReportConfig config) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Module Dependencies of " + data.projectId(), GRAPH_LR);

        List<ModuleSummary> modules = data.summary().modules().stream()
            .sorted(Comparator.comparingInt(ModuleSummary::totalEntities).reversed()
                .thenComparing(ModuleSummary::name))
            .limit(config.maxRows())
            .toList();
        if (modules.isEmpty()) {
            sb.append(NO_MODULES_NODE);
        } else {
            Set<String> shown = new HashSet<>();
            for (ModuleSummary module : modules) {
                shown.add(module.name());
                sb.append("  ").append(sanitizeId(module.name()))
                    .append("[\"").append(escapeLabel(module.name())).append(" (")
                    .append(module.totalEntities()).append(")\"]").append(MARKDOWN_NEWLINE);
            }
            for (ModuleSummary module : modules) {
                for (String target : module.dependsOn()) {
                    if (shown.contains(target)) {
                        sb.append("  ").append(sanitizeId(module.name())).append(" --> ")
                            .append(sanitizeId(target)).append(MARKDOWN_NEWLINE);
                    }
                }
            }
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    private String generateSeverityChart(ReportData data) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Open Issues by Severity", PIE);
        sb.append("  title ").append(escapeLabel(data.projectId())).append(MARKDOWN_NEWLINE);

        boolean any = false;
        for (Severity severity : Severity.values()) {
            int count = data.debt().issueCountsBySeverity().getOrDefault(severity, 0);
            if (count > 0) {
                any = true;
                sb.append("  \"").append(severity.name()).append("\" : ").append(count).append(MARKDOWN_NEWLINE);
            }
        }
        if (!any) {
            sb.append(NO_ISSUES_SLICE);
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    private void appendDiagramHeader(StringBuilder sb, String title, String diagramType) {
        sb.append(MARKDOWN_HEADER_PREFIX).append(title).append(MARKDOWN_NEWLINE).append(MARKDOWN_NEWLINE);
        sb.append(CODE_BLOCK_START).append(diagramType);
    }

    private void appendDiagramFooter(StringBuilder sb) {
        sb.append(CODE_BLOCK_END);
    }

    /**
     * Turns a module path into a Mermaid node id. A hash suffix keeps paths that differ
     * only in punctuation apart.
     */
    private String sanitizeId(String name) {
        if (name == null || name.isEmpty()) {
            return "root";
        }
        return "m_" + name.replaceAll(ID_SANITIZATION_PATTERN, "_") + "_" + Integer.toHexString(name.hashCode());
    }

    private String escapeLabel(String text) {
        if (text == null || text.isEmpty()) {
            return "(root)";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
