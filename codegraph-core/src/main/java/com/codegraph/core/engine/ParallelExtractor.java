package com.codegraph.core.engine;

import com.codegraph.core.extractor.ExtractionResult;
import com.codegraph.core.extractor.Extractor;
import com.codegraph.core.extractor.ExtractorRegistry;
import com.codegraph.core.model.ParseError;
import com.codegraph.core.model.ParseErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Extracts files on a fixed thread pool with a time budget per file.
 *
 * <p>Results are returned in the order of the input. A file that exceeds its budget, cannot
 * be read or makes its extractor fail yields a result holding only a {@link ParseError};
 * the other files are unaffected.
 */
class ParallelExtractor {

    private static final Logger log = LoggerFactory.getLogger(ParallelExtractor.class);

    private final ExtractorRegistry registry;
    private final int parallelism;
    private final Duration fileTimeout;

    ParallelExtractor(ExtractorRegistry registry, int parallelism, Duration fileTimeout) {
        this.registry = registry;
        this.parallelism = Math.max(1, parallelism);
        this.fileTimeout = fileTimeout;
    }

    List<ExtractionResult> extract(List<DiscoveredFile> files, AnalysisSession session) {
        if (files.isEmpty()) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, files.size()),
            extractorThreads(session.getProjectId()));
        try {
            List<Future<ExtractionResult>> futures = new ArrayList<>(files.size());
            AtomicLongArray startedAt = new AtomicLongArray(files.size());
            for (int i = 0; i < files.size(); i++) {
                DiscoveredFile file = files.get(i);
                int index = i;
                futures.add(pool.submit(() -> {
                    startedAt.set(index, System.nanoTime());
                    return extractOne(file);
                }));
            }
            List<ExtractionResult> results = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                DiscoveredFile file = files.get(i);
                if (session.isCancelled()) {
                    log.info("Extraction cancelled after {} of {} files", i, files.size());
                    break;
                }
                results.add(await(futures.get(i), file, startedAt.get(i)));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Waits for one file. The budget counts from the moment the file started extracting,
     * or from now if it is still queued.
     */
    private ExtractionResult await(Future<ExtractionResult> future, DiscoveredFile file, long startedNanos) {
        long budget = fileTimeout.toNanos();
        long remaining = startedNanos == 0 ? budget : budget - (System.nanoTime() - startedNanos);
        try {
            return future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Extraction of {} exceeded {} ms", file.relativePath(), fileTimeout.toMillis());
            return ExtractionResult.failed(file.relativePath(), file.language(),
                ParseError.timeout(file.relativePath(), fileTimeout.toMillis()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Extractor failed on {}: {}", file.relativePath(), cause.getMessage(), cause);
            return ExtractionResult.failed(file.relativePath(), file.language(),
                new ParseError(file.relativePath(), ParseErrorKind.SYNTAX, "Extractor failed: " + cause, 0));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ExtractionResult.failed(file.relativePath(), file.language(),
                ParseError.timeout(file.relativePath(), fileTimeout.toMillis()));
        }
    }

    /**
     * Reads and parses one file.
     */
    ExtractionResult extractOne(DiscoveredFile file) {
        Optional<Extractor> extractor = registry.forFile(file.relativePath());
        if (extractor.isEmpty()) {
            return ExtractionResult.failed(file.relativePath(), file.language(),
                new ParseError(file.relativePath(), ParseErrorKind.UNSUPPORTED, "No extractor for file", 0));
        }
        String source;
        try {
            source = Files.readString(file.path(), StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            log.debug("{} is not valid UTF-8, reading as ISO-8859-1", file.relativePath());
            try {
                source = Files.readString(file.path(), StandardCharsets.ISO_8859_1);
            } catch (IOException retry) {
                return ioFailure(file, retry);
            }
        } catch (IOException e) {
            return ioFailure(file, e);
        }
        return extractor.get().parse(source, file.relativePath());
    }

    private static ExtractionResult ioFailure(DiscoveredFile file, IOException e) {
        log.warn("Cannot read {}: {}", file.relativePath(), e.getMessage());
        return ExtractionResult.failed(file.relativePath(), file.language(),
            ParseError.io(file.relativePath(), "Cannot read file: " + e.getMessage()));
    }

    private static ThreadFactory extractorThreads(String projectId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "codegraph-extract-" + projectId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
