package com.pdftranslator.backend.services.jobs;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.FailureReason;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.exceptions.BadRequestException;
import com.pdftranslator.backend.exceptions.ConflictException;
import com.pdftranslator.backend.exceptions.ForbiddenException;
import com.pdftranslator.backend.exceptions.JobAlreadyRunningException;
import com.pdftranslator.backend.exceptions.JobExpiredException;
import com.pdftranslator.backend.exceptions.ResourceNotFoundException;
import com.pdftranslator.backend.exceptions.UnsupportedDocumentException;
import com.pdftranslator.backend.exceptions.UnsupportedLanguagePairException;
import com.pdftranslator.backend.repositories.TranslationJobRepository;
import com.pdftranslator.backend.services.Sha256;
import com.pdftranslator.backend.services.storage.ArtifactStorage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for job requests: submission, lookup, download, cancellation and resumption.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationJobService {

    public static final String INPUT_NAME = "input.pdf";

    private final TranslationJobRepository jobRepository;
    private final TranslationJobOrchestrator orchestrator;
    private final TranslationJobRunner runner;
    private final JobTransitionService transitions;
    private final JobRunRegistry runRegistry;
    private final ArtifactStorage storage;
    private final TranslatorProperties properties;
    private final Clock clock;

    /**
     * Creates a job, validates it and debits its credits, then queues the pipeline. Validation
     * failures are thrown to the caller after the job has been recorded as failed.
     */
    public TranslationJob submit(Long ownerId, String sourceLang, String targetLang, String filename, byte[] bytes) {
        if (ownerId == null) {
            throw new BadRequestException("ownerId is required");
        }
        TranslatorProperties.Limits limits = properties.getLimits();
        if (bytes == null || bytes.length == 0) {
            throw new UnsupportedDocumentException("Empty file");
        }
        if (bytes.length > limits.maxFileBytes()) {
            throw new UnsupportedDocumentException("File is larger than " + limits.getMaxFileMb() + "MB");
        }
        if (!limits.isSupportedPair(sourceLang, targetLang)) {
            throw new UnsupportedLanguagePairException(sourceLang, targetLang);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        TranslationJob job = new TranslationJob();
        job.setOwnerId(ownerId);
        job.setSourceLang(sourceLang.trim().toLowerCase(Locale.ROOT));
        job.setTargetLang(targetLang.trim().toLowerCase(Locale.ROOT));
        job.setStatus(JobStatus.CREATED);
        job.setOriginalFilename(filename);
        job.setFileSizeBytes(bytes.length);
        job.setFileSha256(Sha256.hex(bytes));
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setExpiresAt(now.plusHours(limits.getRetentionHours()));
        job = jobRepository.save(job);

        job.setInputRef(storage.put(job.getId(), INPUT_NAME, bytes));
        job = jobRepository.save(job);
        log.info("[Job] Created jobId={} ownerId={} {}->{} bytes={}",
                job.getId(), ownerId, job.getSourceLang(), job.getTargetLang(), bytes.length);

        orchestrator.accept(job.getId());
        enqueue(job.getId());
        return get(job.getId());
    }

    public TranslationJob get(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    public StoredArtifact download(UUID jobId, Long ownerId) {
        TranslationJob job = get(jobId);
        requireOwner(job, ownerId);

        if (job.getStatus() == JobStatus.EXPIRED || job.isExpiredAt(LocalDateTime.now(clock))) {
            throw new JobExpiredException(jobId);
        }
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new ConflictException("Job is not completed: " + job.getStatus());
        }

        byte[] bytes = storage.get(job.getArtifactRef());
        return new StoredArtifact(downloadName(job), bytes);
    }

    /**
     * Requests cancellation. A queued job that has not started yet is failed at once; a running
     * one stops at its next stage boundary.
     */
    public TranslationJob cancel(UUID jobId, Long ownerId) {
        TranslationJob job = get(jobId);
        requireOwner(job, ownerId);

        if (job.getStatus().isTerminal()) {
            throw new ConflictException("Job already finished: " + job.getStatus());
        }
        transitions.requestCancel(jobId);
        log.info("[Job] Cancel requested jobId={} status={}", jobId, job.getStatus());

        if (job.getStatus() == JobStatus.CREATED && !runRegistry.isRunning(jobId)) {
            return transitions.fail(jobId, FailureReason.CANCELLED, "Cancelled before start");
        }
        return get(jobId);
    }

    /**
     * Re-queues a job that stopped mid-pipeline. Rejected while the job is running.
     */
    public TranslationJob resume(UUID jobId) {
        TranslationJob job = get(jobId);
        if (runRegistry.isRunning(jobId)) {
            throw new JobAlreadyRunningException(jobId);
        }
        if (job.getStatus().isTerminal()) {
            throw new ConflictException("Job already finished: " + job.getStatus());
        }
        enqueue(jobId);
        return job;
    }

    public List<TranslationJob> recent(int limit) {
        int size = Math.max(1, Math.min(limit, 200));
        return jobRepository.findByOrderByCreatedAtDesc(PageRequest.of(0, size));
    }

    private void enqueue(UUID jobId) {
        try {
            runner.start(jobId);
        } catch (TaskRejectedException e) {
            transitions.fail(jobId, FailureReason.INTERNAL_ERROR, "Job queue is full");
            throw e;
        }
    }

    private static void requireOwner(TranslationJob job, Long ownerId) {
        if (!Objects.equals(job.getOwnerId(), ownerId)) {
            throw new ForbiddenException("Job belongs to another owner");
        }
    }

    private static String downloadName(TranslationJob job) {
        String base = job.getOriginalFilename() == null ? "document" : job.getOriginalFilename();
        if (base.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            base = base.substring(0, base.length() - 4);
        }
        return base.replaceAll("[^A-Za-z0-9._-]", "_") + "." + job.getTargetLang() + ".pdf";
    }
}
