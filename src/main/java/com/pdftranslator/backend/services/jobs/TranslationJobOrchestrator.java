package com.pdftranslator.backend.services.jobs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.FailureReason;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.exceptions.InsufficientCreditsException;
import com.pdftranslator.backend.exceptions.JobAlreadyRunningException;
import com.pdftranslator.backend.exceptions.JobCancelledException;
import com.pdftranslator.backend.exceptions.ProviderException;
import com.pdftranslator.backend.exceptions.ReconstructionException;
import com.pdftranslator.backend.exceptions.ResourceNotFoundException;
import com.pdftranslator.backend.exceptions.TranslationFailedException;
import com.pdftranslator.backend.exceptions.UnsupportedDocumentException;
import com.pdftranslator.backend.exceptions.UnsupportedLanguagePairException;
import com.pdftranslator.backend.repositories.TranslationJobRepository;
import com.pdftranslator.backend.services.extraction.BlockExtractor;
import com.pdftranslator.backend.services.extraction.DocumentInspection;
import com.pdftranslator.backend.services.extraction.ExtractedDocument;
import com.pdftranslator.backend.services.extraction.PageLayout;
import com.pdftranslator.backend.services.layout.LayoutReconstructor;
import com.pdftranslator.backend.services.layout.ReconstructionResult;
import com.pdftranslator.backend.services.ocr.OcrFallbackInvoker;
import com.pdftranslator.backend.services.ocr.PageOcrResult;
import com.pdftranslator.backend.services.storage.ArtifactStorage;
import com.pdftranslator.backend.services.translation.TranslationBatcher;
import com.pdftranslator.backend.services.translation.TranslationOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a job through validation, extraction (with OCR), translation and reconstruction.
 *
 * Stages run one after the other; cancellation is checked between them. A job picked up again
 * after a crash resumes where its status says it stopped: OCR pages and translated batches are
 * read back from their checkpoints and the debit is never repeated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationJobOrchestrator {

    public static final String ARTIFACT_NAME = "translated.pdf";

    private final TranslationJobRepository jobRepository;
    private final JobTransitionService transitions;
    private final JobPageRecorder pageRecorder;
    private final JobRunRegistry runRegistry;
    private final BlockExtractor blockExtractor;
    private final OcrFallbackInvoker ocrInvoker;
    private final TranslationBatcher translationBatcher;
    private final LayoutReconstructor layoutReconstructor;
    private final ArtifactStorage storage;
    private final TranslatorProperties properties;

    /**
     * Validates a new job and debits its credits. On any failure the job is moved to
     * {@code FAILED} and the exception is rethrown to the caller.
     */
    public TranslationJob accept(UUID jobId) {
        if (!runRegistry.tryAcquire(jobId)) {
            throw new JobAlreadyRunningException(jobId);
        }
        try {
            return validateAndDebit(jobId, storage.get(loadJob(jobId).getInputRef()));
        } catch (RuntimeException e) {
            failFor(jobId, e);
            throw e;
        } finally {
            runRegistry.release(jobId);
        }
    }

    /**
     * Runs (or resumes) the pipeline. Failures end in {@code FAILED} and are not rethrown.
     *
     * @throws JobAlreadyRunningException when another execution of the same job is in progress
     */
    public void run(UUID jobId) {
        if (!runRegistry.tryAcquire(jobId)) {
            throw new JobAlreadyRunningException(jobId);
        }
        long startMs = System.currentTimeMillis();
        try {
            execute(jobId);
        } catch (RuntimeException e) {
            failFor(jobId, e);
        } finally {
            runRegistry.release(jobId);
            log.info("[Job] Run finished jobId={} elapsedMs={}", jobId, System.currentTimeMillis() - startMs);
        }
    }

    private void execute(UUID jobId) {
        TranslationJob job = loadJob(jobId);
        if (job.getStatus().isTerminal()) {
            log.info("[Job] Skipping jobId={} already {}", jobId, job.getStatus());
            return;
        }

        byte[] input = storage.get(job.getInputRef());

        if (job.getStatus() == JobStatus.CREATED || job.getStatus() == JobStatus.VALIDATING) {
            job = validateAndDebit(jobId, input);
        } else {
            job = transitions.beginResume(jobId);
            log.info("[Job] Running jobId={} from {} attempt={}", jobId, job.getStatus(), job.getRunAttempts());
        }
        checkCancelled(jobId);

        ExtractedDocument document = extract(job, input);
        if (job.getStatus() == JobStatus.EXTRACTING) {
            int ocrPages = document.pagesNeedingOcr().size();
            int ocrFailed = (int) document.pages().stream().filter(PageLayout::isOcrFailed).count();
            job = transitions.advance(jobId, JobStatus.TRANSLATING, j -> {
                j.setOcrPageCount(ocrPages);
                j.setOcrFailedPages(ocrFailed);
            });
        }
        checkCancelled(jobId);

        TranslationOutcome outcome = translationBatcher.translate(
                jobId, document.allBlocks(), job.getSourceLang(), job.getTargetLang());
        if (job.getStatus() == JobStatus.TRANSLATING) {
            job = transitions.advance(jobId, JobStatus.RECONSTRUCTING, j -> j.setFailedBlockCount(outcome.failedBlocks()));
        }
        checkCancelled(jobId);

        ReconstructionResult result = layoutReconstructor.reconstruct(input, document);
        String artifactRef = storage.put(jobId, ARTIFACT_NAME, result.pdfBytes());
        int degradedPages = pageRecorder.recordOutcomes(jobId, document);
        int failedBlocks = document.pages().stream().mapToInt(PageLayout::failedBlockCount).sum();
        int ocrFailed = (int) document.pages().stream().filter(PageLayout::isOcrFailed).count();

        transitions.complete(jobId, artifactRef, j -> {
            j.setPagesProcessed(document.pageCount());
            j.setOcrFailedPages(ocrFailed);
            j.setFailedBlockCount(failedBlocks);
            j.setClippedBlockCount(result.clippedBlocks());
            j.setWarningCount(degradedPages);
        });
    }

    private TranslationJob validateAndDebit(UUID jobId, byte[] input) {
        TranslationJob job = transitions.beginValidation(jobId);
        checkCancelled(jobId);

        TranslatorProperties.Limits limits = properties.getLimits();
        if (!limits.isSupportedPair(job.getSourceLang(), job.getTargetLang())) {
            throw new UnsupportedLanguagePairException(job.getSourceLang(), job.getTargetLang());
        }
        if (input.length > limits.maxFileBytes()) {
            throw new UnsupportedDocumentException("File is larger than " + limits.getMaxFileMb() + "MB");
        }

        DocumentInspection inspection = blockExtractor.inspect(input, limits.getMaxPages());
        return transitions.acceptAndDebit(jobId, inspection.pageCount());
    }

    private ExtractedDocument extract(TranslationJob job, byte[] input) {
        ExtractedDocument document = blockExtractor.extract(input, properties.getLimits().getMaxPages());
        pageRecorder.recordClassification(job.getId(), document);

        List<PageLayout> pending = new ArrayList<>();
        for (PageLayout page : document.pagesNeedingOcr()) {
            Optional<PageOcrResult> saved = pageRecorder.findOcr(job.getId(), page.getPageIndex());
            if (saved.isPresent()) {
                apply(page, saved.get());
            } else {
                pending.add(page);
            }
        }
        if (pending.size() < document.pagesNeedingOcr().size()) {
            log.info("[OCR] jobId={} reusing {} checkpointed pages", job.getId(), document.pagesNeedingOcr().size() - pending.size());
        }

        List<PageOcrResult> results = ocrInvoker.recognizePages(input, pending, job.getSourceLang(),
                result -> pageRecorder.recordOcr(job.getId(), result));
        for (PageOcrResult result : results) {
            apply(document.page(result.pageIndex()), result);
        }
        return document;
    }

    private void apply(PageLayout page, PageOcrResult result) {
        if (result.failed()) {
            page.markOcrFailed(result.errorTag());
        } else {
            page.attachOcrBlocks(ocrInvoker.toBlocks(page.getPageIndex(), result.spans()));
        }
    }

    private void checkCancelled(UUID jobId) {
        if (transitions.isCancelRequested(jobId)) {
            throw new JobCancelledException(jobId);
        }
    }

    private void failFor(UUID jobId, RuntimeException e) {
        FailureReason reason = reasonOf(e);
        if (reason == FailureReason.INTERNAL_ERROR) {
            log.error("[Job] Unexpected failure jobId={}", jobId, e);
        }
        try {
            transitions.fail(jobId, reason, e.getMessage());
        } catch (ResourceNotFoundException notFound) {
            log.warn("[Job] Cannot record failure, job not found: {}", jobId);
        }
    }

    static FailureReason reasonOf(RuntimeException e) {
        if (e instanceof JobCancelledException) return FailureReason.CANCELLED;
        if (e instanceof UnsupportedLanguagePairException) return FailureReason.UNSUPPORTED_LANGUAGE_PAIR;
        if (e instanceof UnsupportedDocumentException) return FailureReason.UNSUPPORTED_DOCUMENT;
        if (e instanceof InsufficientCreditsException) return FailureReason.INSUFFICIENT_CREDITS;
        if (e instanceof ProviderException) return FailureReason.PROVIDER_ERROR;
        if (e instanceof TranslationFailedException) return FailureReason.TRANSLATION_FAILED;
        if (e instanceof ReconstructionException) return FailureReason.RECONSTRUCTION_ERROR;
        return FailureReason.INTERNAL_ERROR;
    }

    private TranslationJob loadJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }
}
