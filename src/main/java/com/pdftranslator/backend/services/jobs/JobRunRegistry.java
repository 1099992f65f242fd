package com.pdftranslator.backend.services.jobs;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Job ids with an execution in progress in this process.
 */
@Component
public class JobRunRegistry {

    private final Set<UUID> running = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(UUID jobId) {
        return running.add(jobId);
    }

    public void release(UUID jobId) {
        running.remove(jobId);
    }

    public boolean isRunning(UUID jobId) {
        return running.contains(jobId);
    }

    public int size() {
        return running.size();
    }
}
