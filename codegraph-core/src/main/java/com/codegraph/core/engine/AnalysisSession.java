package com.codegraph.core.engine;

import com.codegraph.core.extractor.ExtractionStatistics;
import com.codegraph.core.model.ParseError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one analysis or update run.
 *
 * <p>The caller creates the session, may cancel it from another thread, and passes it to
 * exactly one run. Cancellation takes effect at the next batch boundary.
 */
public class AnalysisSession {

    private final String id;
    private final String projectId;
    private final Instant createdAt;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();
    private final List<ParseError> errors = Collections.synchronizedList(new ArrayList<>());
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
    private final ExtractionStatistics.Builder statistics = new ExtractionStatistics.Builder();

    public AnalysisSession(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be blank");
        }
        this.id = UUID.randomUUID().toString();
        this.projectId = projectId;
        this.createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getProjectId() {
        return projectId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Marks the session as used by a run.
     *
     * @throws IllegalStateException if a run already used this session
     */
    void begin() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Session " + id + " was already used for a run");
        }
    }

    void addError(ParseError error) {
        errors.add(error);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    public List<ParseError> getErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    public List<String> getWarnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    ExtractionStatistics.Builder statistics() {
        return statistics;
    }
}
