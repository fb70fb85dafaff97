package com.codegraph.core.report;

/**
 * Settings for report generation.
 *
 * @param maxRows maximum rows per table or nodes per diagram; negative means unlimited
 */
public record ReportConfig(
    int maxRows
) {
    public ReportConfig {
        if (maxRows < 0) {
            maxRows = Integer.MAX_VALUE;
        }
    }

    public static ReportConfig defaults() {
        return new ReportConfig(50);
    }
}
