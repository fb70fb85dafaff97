package com.codegraph.core.store.impl;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.store.StorageWriteException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Graph store that mirrors every project to JSON files.
 *
 * <p>Layout: {@code <directory>/<projectId>/entities.json}, {@code relations.json},
 * {@code quality_issues.json} and {@code debt_snapshots.json}. A write rewrites only the
 * tables it changed, and replaces them together or not at all; the new graph is published
 * only after the files are in place. Existing projects are loaded when the store is created,
 * after rolling back any write that was interrupted.
 */
public class JsonFileGraphStore extends InMemoryGraphStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileGraphStore.class);

    static final String ENTITIES_FILE = "entities.json";
    static final String RELATIONS_FILE = "relations.json";
    static final String ISSUES_FILE = "quality_issues.json";
    static final String SNAPSHOTS_FILE = "debt_snapshots.json";
    static final String JOURNAL_FILE = "commit.journal";
    static final String BACKUP_SUFFIX = ".bak";
    static final String TEMP_SUFFIX = ".tmp";

    private static final List<String> TABLES = List.of(ENTITIES_FILE, RELATIONS_FILE, ISSUES_FILE, SNAPSHOTS_FILE);

    private static final Pattern SAFE_PROJECT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path directory;
    private final ObjectMapper objectMapper;

    /**
     * Creates a store rooted at {@code directory}, loading any projects found there.
     *
     * @param directory storage directory, created if missing
     * @throws StorageWriteException if the directory cannot be created or a project cannot be read
     */
    public JsonFileGraphStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageWriteException("Cannot create store directory " + directory, e);
        }
        loadAll();
    }

    public Path getDirectory() {
        return directory;
    }

    private void loadAll() {
        try (Stream<Path> children = Files.list(directory)) {
            List<Path> projectDirs = children.filter(Files::isDirectory).sorted().toList();
            for (Path projectDir : projectDirs) {
                String projectId = projectDir.getFileName().toString();
                if (!SAFE_PROJECT_ID.matcher(projectId).matches()) {
                    continue;
                }
                recover(projectDir);
                if (TABLES.stream().anyMatch(table -> Files.exists(projectDir.resolve(table)))) {
                    load(projectId, readProject(projectDir));
                    log.info("Loaded project {} from {}", projectId, projectDir);
                }
            }
        } catch (IOException e) {
            throw new StorageWriteException("Cannot read store directory " + directory, e);
        }
    }

    private ProjectGraph readProject(Path projectDir) throws IOException {
        ProjectGraph graph = new ProjectGraph();
        for (CodeEntity entity : readTable(projectDir.resolve(ENTITIES_FILE), new TypeReference<List<CodeEntity>>() {})) {
            graph.putEntity(entity);
        }
        for (CodeRelation relation : readTable(projectDir.resolve(RELATIONS_FILE), new TypeReference<List<CodeRelation>>() {})) {
            graph.putRelation(relation);
        }
        for (QualityIssue issue : readTable(projectDir.resolve(ISSUES_FILE), new TypeReference<List<QualityIssue>>() {})) {
            graph.putIssue(issue);
        }
        for (DebtSnapshot snapshot : readTable(projectDir.resolve(SNAPSHOTS_FILE), new TypeReference<List<DebtSnapshot>>() {})) {
            graph.addSnapshot(snapshot);
        }
        return graph;
    }

    private <T> List<T> readTable(Path file, TypeReference<List<T>> type) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        return objectMapper.readValue(file.toFile(), type);
    }

    @Override
    protected void persist(String projectId, ProjectGraph graph) {
        if (!SAFE_PROJECT_ID.matcher(projectId).matches()) {
            throw new IllegalArgumentException("Project id not usable as directory name: " + projectId);
        }
        Set<ProjectGraph.Section> changed = graph.changedSections();
        Map<String, List<?>> tables = new LinkedHashMap<>();
        if (changed.contains(ProjectGraph.Section.ENTITIES)) {
            tables.put(ENTITIES_FILE, graph.allEntities());
        }
        if (changed.contains(ProjectGraph.Section.RELATIONS)) {
            tables.put(RELATIONS_FILE, graph.allRelations());
        }
        if (changed.contains(ProjectGraph.Section.ISSUES)) {
            tables.put(ISSUES_FILE, graph.allIssues());
        }
        if (changed.contains(ProjectGraph.Section.SNAPSHOTS)) {
            tables.put(SNAPSHOTS_FILE, graph.allSnapshots());
        }
        if (tables.isEmpty()) {
            return;
        }
        Path projectDir = directory.resolve(projectId);
        try {
            Files.createDirectories(projectDir);
            commit(projectDir, tables);
        } catch (IOException e) {
            throw new StorageWriteException("Failed to persist project " + projectId + " to " + projectDir, e);
        }
    }

    /**
     * Replaces the given tables as one unit.
     *
     * <p>New content is staged in temporary files and the current tables are backed up. A
     * journal listing the tables is written before the first table is replaced and deleted
     * after the last one; its deletion is the commit point. When a replacement fails, the
     * backups are restored before the exception propagates, and a journal found at start-up
     * is rolled back the same way.
     */
    private void commit(Path projectDir, Map<String, List<?>> tables) throws IOException {
        Map<String, Path> staged = new LinkedHashMap<>();
        Path journal = projectDir.resolve(JOURNAL_FILE);
        boolean journalWritten = false;
        try {
            for (Map.Entry<String, List<?>> table : tables.entrySet()) {
                Path temp = Files.createTempFile(projectDir, table.getKey(), TEMP_SUFFIX);
                staged.put(table.getKey(), temp);
                objectMapper.writeValue(temp.toFile(), table.getValue());
            }
            for (String fileName : staged.keySet()) {
                Path target = projectDir.resolve(fileName);
                Path backup = projectDir.resolve(fileName + BACKUP_SUFFIX);
                if (Files.isRegularFile(target)) {
                    Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.deleteIfExists(backup);
                }
            }
            Path journalTemp = Files.createTempFile(projectDir, JOURNAL_FILE, TEMP_SUFFIX);
            staged.put(JOURNAL_FILE, journalTemp);
            objectMapper.writeValue(journalTemp.toFile(), List.copyOf(tables.keySet()));
            moveAtomically(journalTemp, journal);
            journalWritten = true;

            for (String fileName : tables.keySet()) {
                moveAtomically(staged.get(fileName), projectDir.resolve(fileName));
            }
            Files.delete(journal);
        } catch (IOException e) {
            if (journalWritten) {
                try {
                    rollBack(projectDir, List.copyOf(tables.keySet()));
                } catch (IOException restoreFailure) {
                    log.error("Could not restore tables in {} after a failed write", projectDir, restoreFailure);
                    e.addSuppressed(restoreFailure);
                }
            }
            throw e;
        } finally {
            for (Path temp : staged.values()) {
                Files.deleteIfExists(temp);
            }
        }
        for (String fileName : tables.keySet()) {
            deleteBackup(projectDir.resolve(fileName + BACKUP_SUFFIX));
        }
    }

    /**
     * Puts back the tables listed in an unfinished journal: backed-up tables are restored
     * and tables that did not exist before are removed.
     */
    private void rollBack(Path projectDir, List<String> fileNames) throws IOException {
        for (String fileName : fileNames) {
            Path target = projectDir.resolve(fileName);
            Path backup = projectDir.resolve(fileName + BACKUP_SUFFIX);
            if (Files.exists(backup)) {
                moveAtomically(backup, target);
            } else if (Files.isRegularFile(target)) {
                Files.delete(target);
            }
        }
        Files.deleteIfExists(projectDir.resolve(JOURNAL_FILE));
    }

    private void recover(Path projectDir) throws IOException {
        Path journal = projectDir.resolve(JOURNAL_FILE);
        if (Files.exists(journal)) {
            List<String> fileNames = objectMapper.readValue(journal.toFile(), new TypeReference<List<String>>() {});
            log.warn("Rolling back unfinished write of {} in {}", fileNames, projectDir);
            rollBack(projectDir, fileNames);
        }
        try (Stream<Path> leftovers = Files.list(projectDir)) {
            for (Path leftover : leftovers.toList()) {
                String name = leftover.getFileName().toString();
                if (name.endsWith(BACKUP_SUFFIX) || name.endsWith(TEMP_SUFFIX)) {
                    Files.deleteIfExists(leftover);
                }
            }
        }
    }

    private void deleteBackup(Path backup) {
        try {
            Files.deleteIfExists(backup);
        } catch (IOException e) {
            log.warn("Could not delete backup {}; it is removed on next start", backup, e);
        }
    }

    private void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported, replacing {}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
