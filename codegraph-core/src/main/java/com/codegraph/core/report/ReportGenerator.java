package com.codegraph.core.report;

import java.util.Set;

/**
 * Turns project data into a document format.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.codegraph.core.report.ReportGenerator}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CsvReportGenerator implements ReportGenerator {
 *     public String getId() { return "csv"; }
 *     public String getDisplayName() { return "CSV Report Generator"; }
 *     public String getFileExtension() { return "csv"; }
 *     public Set<ReportType> getSupportedReportTypes() { return Set.of(ReportType.HOTSPOTS); }
 *
 *     public GeneratedReport generate(ReportData data, ReportType type, ReportConfig config) {
 *         StringBuilder sb = new StringBuilder("file,debt\n");
 *         data.hotspots().forEach(f -> sb.append(f.filePath()).append(',').append(f.debtScore()).append('\n'));
 *         return new GeneratedReport("hotspots", sb.toString(), "csv");
 *     }
 * }
 * }</pre>
 */
public interface ReportGenerator {

    /**
     * Returns the lowercase identifier used to select this generator (e.g. "markdown").
     */
    String getId();

    String getDisplayName();

    /**
     * @return file extension without leading dot
     */
    String getFileExtension();

    Set<ReportType> getSupportedReportTypes();

    /**
     * Generates one report.
     *
     * <p>Empty data produces a placeholder document rather than an error.
     *
     * @param data project data
     * @param type report to generate
     * @param config generation settings
     * @return generated document
     * @throws IllegalArgumentException if the type is not supported
     */
    GeneratedReport generate(ReportData data, ReportType type, ReportConfig config);
}
