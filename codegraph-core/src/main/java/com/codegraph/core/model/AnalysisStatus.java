package com.codegraph.core.model;

/**
 * Outcome of an analysis or update run.
 */
public enum AnalysisStatus {
    /** Every batch was committed. */
    COMPLETED,
    /** The caller cancelled the run; committed batches remain. */
    CANCELLED,
    /** A storage write failed twice; committed batches remain. */
    FAILED
}
