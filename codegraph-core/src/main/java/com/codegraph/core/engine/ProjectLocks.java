package com.codegraph.core.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One write lock per project. Analysis and update runs of the same project are
 * serialized; runs of different projects proceed independently. Queries never lock.
 */
public class ProjectLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String projectId) {
        return locks.computeIfAbsent(projectId, key -> new ReentrantLock());
    }
}
