package com.codegraph.core.query;

/**
 * Thrown when a query names an entity that does not exist in the project.
 */
public class EntityNotFoundException extends IllegalArgumentException {

    private final String projectId;
    private final String entityRef;

    public EntityNotFoundException(String projectId, String entityRef) {
        super("Entity not found in project " + projectId + ": " + entityRef);
        this.projectId = projectId;
        this.entityRef = entityRef;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getEntityRef() {
        return entityRef;
    }
}
