package com.codegraph.core.extractor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected while extracting the files of one analysis run.
 *
 * <p>Provides transparency into parsing success rates, per language and per error type.
 *
 * @param filesDiscovered files selected for analysis
 * @param filesScanned files handed to an extractor
 * @param filesParsedSuccessfully files parsed without any error
 * @param filesParsedWithFallback files that produced structure despite errors
 * @param filesFailed files that produced no structure at all
 * @param filesByLanguage scanned files per language id
 * @param errorCounts occurrences per error type
 * @param topErrors first error messages (max 10)
 */
public record ExtractionStatistics(
    int filesDiscovered,
    int filesScanned,
    int filesParsedSuccessfully,
    int filesParsedWithFallback,
    int filesFailed,
    Map<String, Integer> filesByLanguage,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    private static final int MAX_TOP_ERRORS = 10;

    public ExtractionStatistics {
        filesDiscovered = Math.max(0, filesDiscovered);
        filesScanned = Math.max(0, filesScanned);
        filesParsedSuccessfully = Math.max(0, filesParsedSuccessfully);
        filesParsedWithFallback = Math.max(0, filesParsedWithFallback);
        filesFailed = Math.max(0, filesFailed);
        filesByLanguage = filesByLanguage == null ? Map.of() : Map.copyOf(filesByLanguage);
        errorCounts = errorCounts == null ? Map.of() : Map.copyOf(errorCounts);
        topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    public static ExtractionStatistics empty() {
        return new ExtractionStatistics(0, 0, 0, 0, 0, Map.of(), Map.of(), List.of());
    }

    /**
     * Calculates the share of files parsed without errors.
     *
     * @return success rate as percentage (0.0 to 100.0), or 0 if no files scanned
     */
    public double getSuccessRate() {
        if (filesScanned == 0) {
            return 0.0;
        }
        return (filesParsedSuccessfully * 100.0) / filesScanned;
    }

    /**
     * Calculates the share of files that produced structure (clean or partial).
     *
     * @return parse rate as percentage (0.0 to 100.0), or 0 if no files scanned
     */
    public double getOverallParseRate() {
        if (filesScanned == 0) {
            return 0.0;
        }
        return ((filesParsedSuccessfully + filesParsedWithFallback) * 100.0) / filesScanned;
    }

    public double getFailureRate() {
        if (filesScanned == 0) {
            return 0.0;
        }
        return (filesFailed * 100.0) / filesScanned;
    }

    public boolean hasFailures() {
        return filesFailed > 0;
    }

    public String getSummary() {
        return String.format(
            "Discovered: %d, Scanned: %d, Success: %d (%.1f%%), Partial: %d, Failed: %d (%.1f%%)",
            filesDiscovered,
            filesScanned,
            filesParsedSuccessfully,
            getSuccessRate(),
            filesParsedWithFallback,
            filesFailed,
            getFailureRate()
        );
    }

    /**
     * Builder for constructing statistics incrementally. Not thread-safe; the engine
     * records results from a single thread after collecting futures.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesScanned = 0;
        private int filesParsedSuccessfully = 0;
        private int filesParsedWithFallback = 0;
        private int filesFailed = 0;
        private final Map<String, Integer> filesByLanguage = new HashMap<>();
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        /**
         * Records the outcome of one extracted file.
         *
         * @param result extraction result of the file
         */
        public Builder record(ExtractionResult result) {
            filesScanned++;
            filesByLanguage.merge(result.language().getId(), 1, Integer::sum);
            if (!result.hasErrors()) {
                filesParsedSuccessfully++;
            } else if (result.entities().size() > 1) {
                filesParsedWithFallback++;
            } else {
                filesFailed++;
            }
            result.errors().forEach(error -> addError(error.kind().name(), error.toString()));
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ExtractionStatistics build() {
            return new ExtractionStatistics(
                filesDiscovered,
                filesScanned,
                filesParsedSuccessfully,
                filesParsedWithFallback,
                filesFailed,
                filesByLanguage,
                errorCounts,
                topErrors
            );
        }
    }
}
