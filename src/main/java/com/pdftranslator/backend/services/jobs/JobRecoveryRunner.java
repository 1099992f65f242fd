package com.pdftranslator.backend.services.jobs;

import java.util.EnumSet;
import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.repositories.TranslationJobRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-queues jobs a previous process left in a pipeline state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobRecoveryRunner implements ApplicationRunner {

    private static final EnumSet<JobStatus> UNFINISHED = EnumSet.of(
            JobStatus.CREATED,
            JobStatus.VALIDATING,
            JobStatus.EXTRACTING,
            JobStatus.TRANSLATING,
            JobStatus.RECONSTRUCTING
    );

    private final TranslationJobRepository jobRepository;
    private final TranslationJobRunner runner;
    private final TranslatorProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getWorker().isRecoverOnStartup()) {
            return;
        }
        List<TranslationJob> unfinished = jobRepository.findByStatusIn(UNFINISHED);
        if (unfinished.isEmpty()) {
            return;
        }

        log.info("[Recovery] Re-queueing {} unfinished jobs", unfinished.size());
        for (TranslationJob job : unfinished) {
            try {
                runner.start(job.getId());
            } catch (TaskRejectedException e) {
                log.warn("[Recovery] Queue full, leaving jobId={} in {} for the next start", job.getId(), job.getStatus());
            }
        }
    }
}
