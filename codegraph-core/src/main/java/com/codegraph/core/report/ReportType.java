package com.codegraph.core.report;

/**
 * Kinds of report that can be generated for a project.
 */
public enum ReportType {
    /** Module table with entity counts and degrees */
    OVERVIEW,

    /** Open quality issues and debt scores */
    QUALITY,

    /** Files with the highest debt */
    HOTSPOTS,

    /** Dependencies between modules */
    DEPENDENCY_GRAPH
}
