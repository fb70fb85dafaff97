package com.codegraph.cli;

import com.codegraph.core.engine.AnalysisReport;
import com.codegraph.core.model.AnalysisStatus;

/**
 * Process exit codes of the commands.
 */
final class ExitCodes {

    static final int OK = 0;
    static final int ERROR = 1;
    static final int CANCELLED = 2;

    private ExitCodes() {
        // Utility class
    }

    static int of(AnalysisReport report) {
        if (report.isCompleted()) {
            return OK;
        }
        return report.status() == AnalysisStatus.CANCELLED ? CANCELLED : ERROR;
    }
}
