package com.pdftranslator.backend.services.jobs;

import java.util.UUID;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import com.pdftranslator.backend.config.AsyncExecutorConfig;
import com.pdftranslator.backend.exceptions.JobAlreadyRunningException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands jobs to the bounded job executor. When the queue is full the proxy throws
 * {@link org.springframework.core.task.TaskRejectedException} to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TranslationJobRunner {

    private final TranslationJobOrchestrator orchestrator;

    @Async(AsyncExecutorConfig.JOB_EXECUTOR)
    public void start(UUID jobId) {
        if (jobId == null) return;
        try {
            orchestrator.run(jobId);
        } catch (JobAlreadyRunningException e) {
            log.warn("[Job] Dropping duplicate run request jobId={}", jobId);
        }
    }
}
