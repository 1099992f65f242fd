package com.pdftranslator.backend.services.jobs;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.UUID;
import java.util.function.Consumer;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.FailureReason;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.exceptions.ResourceNotFoundException;
import com.pdftranslator.backend.repositories.TranslationJobRepository;
import com.pdftranslator.backend.services.credits.CreditLedgerService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists job transitions, one transaction each. Every method reloads the job so callers never
 * work on a stale copy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobTransitionService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final TranslationJobRepository jobRepository;
    private final JobStateMachine stateMachine;
    private final CreditLedgerService creditLedger;
    private final Clock clock;

    @Transactional
    public TranslationJob beginValidation(UUID jobId) {
        TranslationJob job = load(jobId);
        job.setRunAttempts(job.getRunAttempts() + 1);
        if (job.getStatus() == JobStatus.CREATED) {
            stateMachine.transition(job, JobStatus.VALIDATING);
            log.info("[Job] Validating jobId={} attempt={}", jobId, job.getRunAttempts());
        }
        return jobRepository.save(job);
    }

    /**
     * Debits one credit per page and moves the job to {@code EXTRACTING} in the same commit.
     * On insufficient credits nothing is written.
     */
    @Transactional
    public TranslationJob acceptAndDebit(UUID jobId, int pageCount) {
        TranslationJob job = load(jobId);
        job.setPageCount(pageCount);
        job.setCreditsCharged(pageCount);

        creditLedger.debit(job.getOwnerId(), pageCount, jobId);
        stateMachine.transition(job, JobStatus.EXTRACTING);

        TranslationJob saved = jobRepository.save(job);
        log.info("[Job] Accepted jobId={} ownerId={} pages={} credits={}", jobId, job.getOwnerId(), pageCount, pageCount);
        return saved;
    }

    /**
     * Resumes at the next run: counts the attempt without touching the status.
     */
    @Transactional
    public TranslationJob beginResume(UUID jobId) {
        TranslationJob job = load(jobId);
        job.setRunAttempts(job.getRunAttempts() + 1);
        job.setUpdatedAt(LocalDateTime.now(clock));
        return jobRepository.save(job);
    }

    @Transactional
    public TranslationJob advance(UUID jobId, JobStatus to, Consumer<TranslationJob> changes) {
        TranslationJob job = load(jobId);
        changes.accept(job);
        stateMachine.transition(job, to);
        log.info("[Job] jobId={} -> {}", jobId, to);
        return jobRepository.save(job);
    }

    @Transactional
    public TranslationJob complete(UUID jobId, String artifactRef, Consumer<TranslationJob> changes) {
        TranslationJob job = load(jobId);
        changes.accept(job);
        job.setArtifactRef(artifactRef);
        stateMachine.transition(job, JobStatus.COMPLETED);
        log.info("[Job] Completed jobId={} pages={} warnings={} failedBlocks={} clippedBlocks={}",
                jobId, job.getPageCount(), job.getWarningCount(), job.getFailedBlockCount(), job.getClippedBlockCount());
        return jobRepository.save(job);
    }

    /**
     * Fails the job and refunds its debit, if any, in one commit. A job that is already terminal
     * is returned unchanged.
     */
    @Transactional
    public TranslationJob fail(UUID jobId, FailureReason reason, String message) {
        TranslationJob job = load(jobId);
        if (job.getStatus().isTerminal()) {
            log.info("[Job] Not failing jobId={} already {}", jobId, job.getStatus());
            return job;
        }

        job.setFailureReason(reason);
        job.setErrorMessage(trimError(message));
        stateMachine.transition(job, JobStatus.FAILED);
        creditLedger.refund(jobId);

        log.warn("[Job] Failed jobId={} reason={} message={}", jobId, reason, job.getErrorMessage());
        return jobRepository.save(job);
    }

    /**
     * Marks a job expired. A job still in the pipeline is failed (and refunded) first.
     */
    @Transactional
    public TranslationJob expire(UUID jobId) {
        TranslationJob job = load(jobId);
        if (job.getStatus() == JobStatus.EXPIRED) {
            return job;
        }
        if (!job.getStatus().isTerminal()) {
            job.setFailureReason(FailureReason.EXPIRED);
            job.setErrorMessage("Retention window ended before the job finished");
            stateMachine.transition(job, JobStatus.FAILED);
            creditLedger.refund(jobId);
        }
        stateMachine.transition(job, JobStatus.EXPIRED);
        log.info("[Job] Expired jobId={}", jobId);
        return jobRepository.save(job);
    }

    @Transactional
    public TranslationJob markCleaned(UUID jobId) {
        TranslationJob job = load(jobId);
        job.setCleanedAt(LocalDateTime.now(clock));
        job.setUpdatedAt(job.getCleanedAt());
        return jobRepository.save(job);
    }

    @Transactional
    public boolean requestCancel(UUID jobId) {
        return jobRepository.markCancelRequested(jobId, EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.EXPIRED)) > 0;
    }

    @Transactional(readOnly = true)
    public boolean isCancelRequested(UUID jobId) {
        return load(jobId).isCancelRequested();
    }

    private TranslationJob load(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    static String trimError(String message) {
        if (message == null) return null;
        String m = message.trim();
        if (m.length() <= MAX_ERROR_LENGTH) return m;
        return m.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
