package com.codegraph.core.config;

import com.codegraph.core.model.Language;
import com.codegraph.core.quality.QualityThresholds;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration of the engine.
 *
 * <p>Loaded from {@code codegraph.yaml}. Every section and key is optional; missing
 * values take the defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   parallelism: 4
 *   fileTimeoutMillis: 10000
 *   batchSize: 200
 *   maxFileSizeBytes: 1048576
 *   exclude:
 *     - "*.min.js"
 *     - "generated/**"
 *   languages: [java, python]
 *
 * query:
 *   maxDepth: 5
 *   maxNodes: 500
 *
 * quality:
 *   longFunctionMedium: 60
 *   couplingMedium: 12
 *
 * storage:
 *   directory: ".codegraph"
 * }</pre>
 *
 * @param analysis analysis pipeline settings
 * @param query query limits
 * @param quality quality thresholds
 * @param storage storage settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("analysis") AnalysisConfig analysis,
    @JsonProperty("query") QueryConfig query,
    @JsonProperty("quality") QualityThresholds quality,
    @JsonProperty("storage") StorageConfig storage
) {
    public EngineConfig {
        analysis = analysis == null ? AnalysisConfig.defaults() : analysis;
        query = query == null ? QueryConfig.defaults() : query;
        quality = quality == null ? QualityThresholds.defaults() : quality;
        storage = storage == null ? StorageConfig.defaults() : storage;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null);
    }

    public EngineConfig withAnalysis(AnalysisConfig newAnalysis) {
        return new EngineConfig(newAnalysis, query, quality, storage);
    }

    public EngineConfig withStorage(StorageConfig newStorage) {
        return new EngineConfig(analysis, query, quality, newStorage);
    }

    /**
     * Analysis pipeline settings.
     *
     * @param parallelism extraction threads; defaults to the number of processors
     * @param fileTimeoutMillis time budget per file
     * @param batchSize files committed per store batch
     * @param maxFileSizeBytes larger files are skipped
     * @param exclude glob patterns of files to skip
     * @param languages language ids to analyse; empty means all
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisConfig(
        @JsonProperty("parallelism") int parallelism,
        @JsonProperty("fileTimeoutMillis") long fileTimeoutMillis,
        @JsonProperty("batchSize") int batchSize,
        @JsonProperty("maxFileSizeBytes") long maxFileSizeBytes,
        @JsonProperty("exclude") List<String> exclude,
        @JsonProperty("languages") List<String> languages
    ) {
        public static final long DEFAULT_FILE_TIMEOUT_MILLIS = 10_000;
        public static final int DEFAULT_BATCH_SIZE = 200;
        public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 1024 * 1024;

        public AnalysisConfig {
            parallelism = parallelism > 0 ? parallelism : Math.max(1, Runtime.getRuntime().availableProcessors());
            fileTimeoutMillis = fileTimeoutMillis > 0 ? fileTimeoutMillis : DEFAULT_FILE_TIMEOUT_MILLIS;
            batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
            maxFileSizeBytes = maxFileSizeBytes > 0 ? maxFileSizeBytes : DEFAULT_MAX_FILE_SIZE_BYTES;
            exclude = exclude == null ? List.of() : List.copyOf(exclude);
            languages = languages == null ? List.of() : List.copyOf(languages);
        }

        public static AnalysisConfig defaults() {
            return new AnalysisConfig(0, 0, 0, 0, null, null);
        }

        public Duration fileTimeout() {
            return Duration.ofMillis(fileTimeoutMillis);
        }

        /**
         * Resolves the configured language ids.
         *
         * @return languages to analyse; empty means all
         * @throws IllegalArgumentException if an id is unknown
         */
        public Set<Language> languageFilter() {
            Set<Language> filter = new LinkedHashSet<>();
            for (String id : languages) {
                filter.add(Language.fromId(id)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + id)));
            }
            return filter;
        }
    }

    /**
     * Default traversal limits of the query engine.
     *
     * @param maxDepth call chain depth
     * @param maxNodes call chain node budget
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryConfig(
        @JsonProperty("maxDepth") int maxDepth,
        @JsonProperty("maxNodes") int maxNodes
    ) {
        public QueryConfig {
            maxDepth = maxDepth > 0 ? maxDepth : 5;
            maxNodes = maxNodes > 0 ? maxNodes : 500;
        }

        public static QueryConfig defaults() {
            return new QueryConfig(0, 0);
        }
    }

    /**
     * Storage settings.
     *
     * @param directory directory of the JSON store; relative paths resolve against the working directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StorageConfig(
        @JsonProperty("directory") String directory
    ) {
        public static final String DEFAULT_DIRECTORY = ".codegraph";

        public StorageConfig {
            directory = directory == null || directory.isBlank() ? DEFAULT_DIRECTORY : directory;
        }

        public static StorageConfig defaults() {
            return new StorageConfig(null);
        }

        public Path path() {
            return Path.of(directory);
        }
    }
}
