package com.pdftranslator.backend.services.jobs;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pdftranslator.backend.entities.JobPage;
import com.pdftranslator.backend.enums.PageMode;
import com.pdftranslator.backend.enums.PageOutcome;
import com.pdftranslator.backend.repositories.JobPageRepository;
import com.pdftranslator.backend.services.extraction.ExtractedDocument;
import com.pdftranslator.backend.services.extraction.PageLayout;
import com.pdftranslator.backend.services.ocr.OcrSpan;
import com.pdftranslator.backend.services.ocr.PageOcrResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-page records of a job: classification, OCR checkpoint and final outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobPageRecorder {

    private final JobPageRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Creates the page rows on first extraction. Existing rows keep their classification.
     */
    @Transactional
    public void recordClassification(UUID jobId, ExtractedDocument document) {
        Map<Integer, JobPage> existing = byIndex(jobId);
        LocalDateTime now = LocalDateTime.now(clock);

        for (PageLayout layout : document.pages()) {
            JobPage page = existing.get(layout.getPageIndex());
            if (page != null) {
                if (page.getClassification() != layout.getClassification()) {
                    log.warn("[Job] jobId={} page={} classified {} before, {} now; keeping the first",
                            jobId, layout.getPageIndex(), page.getClassification(), layout.getClassification());
                }
                continue;
            }
            page = new JobPage();
            page.setJobId(jobId);
            page.setPageIndex(layout.getPageIndex());
            page.setClassification(layout.getClassification());
            page.setMode(layout.needsOcr() ? PageMode.OCR : PageMode.TEXT_LAYER);
            page.setOutcome(PageOutcome.PENDING);
            page.setBlockCount(layout.getBlocks().size());
            page.setCreatedAt(now);
            page.setUpdatedAt(now);
            repository.save(page);
        }
    }

    public Optional<PageOcrResult> findOcr(UUID jobId, int pageIndex) {
        return repository.findByJobIdAndPageIndex(jobId, pageIndex)
                .filter(JobPage::isOcrCompleted)
                .map(p -> p.getOutcome() == PageOutcome.OCR_FAILED
                        ? PageOcrResult.failure(pageIndex, p.getErrorTag(), 0)
                        : PageOcrResult.success(pageIndex, readSpans(p), 0));
    }

    @Transactional
    public void recordOcr(UUID jobId, PageOcrResult result) {
        JobPage page = repository.findByJobIdAndPageIndex(jobId, result.pageIndex())
                .orElseThrow(() -> new IllegalStateException("No page record for job " + jobId + " page " + result.pageIndex()));
        page.setOcrCompleted(true);
        page.setOcrSpansJson(writeSpans(result.spans()));
        page.setBlockCount(result.spans().size());
        if (result.failed()) {
            page.setOutcome(PageOutcome.OCR_FAILED);
            page.setErrorTag(result.errorTag());
        }
        page.setUpdatedAt(LocalDateTime.now(clock));
        repository.save(page);
    }

    /**
     * Stores each page's final outcome and returns how many pages finished degraded.
     */
    @Transactional
    public int recordOutcomes(UUID jobId, ExtractedDocument document) {
        Map<Integer, JobPage> pages = byIndex(jobId);
        LocalDateTime now = LocalDateTime.now(clock);
        int degraded = 0;

        for (PageLayout layout : document.pages()) {
            JobPage page = pages.get(layout.getPageIndex());
            if (page == null) continue;

            PageOutcome outcome = outcomeOf(layout);
            if (outcome != PageOutcome.TRANSLATED) degraded++;

            page.setOutcome(outcome);
            page.setBlockCount(layout.getBlocks().size());
            page.setFailedBlockCount(layout.failedBlockCount());
            if (outcome == PageOutcome.PARTIAL || outcome == PageOutcome.UNTRANSLATED) {
                page.setErrorTag(firstErrorTag(layout));
            }
            page.setUpdatedAt(now);
            repository.save(page);
        }
        return degraded;
    }

    public List<JobPage> findAll(UUID jobId) {
        return repository.findByJobIdOrderByPageIndexAsc(jobId);
    }

    static PageOutcome outcomeOf(PageLayout layout) {
        if (layout.isOcrFailed()) return PageOutcome.OCR_FAILED;
        int blocks = layout.getBlocks().size();
        int failed = layout.failedBlockCount();
        if (failed == 0) return PageOutcome.TRANSLATED;
        if (failed == blocks) return PageOutcome.UNTRANSLATED;
        return PageOutcome.PARTIAL;
    }

    private static String firstErrorTag(PageLayout layout) {
        return layout.getBlocks().stream()
                .map(b -> b.getErrorTag())
                .filter(t -> t != null)
                .findFirst()
                .orElse(null);
    }

    private Map<Integer, JobPage> byIndex(UUID jobId) {
        return repository.findByJobIdOrderByPageIndexAsc(jobId).stream()
                .collect(Collectors.toMap(JobPage::getPageIndex, Function.identity()));
    }

    private List<OcrSpan> readSpans(JobPage page) {
        if (page.getOcrSpansJson() == null) return List.of();
        try {
            return List.of(objectMapper.readValue(page.getOcrSpansJson(), OcrSpan[].class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable OCR checkpoint for page " + page.getPageIndex(), e);
        }
    }

    private String writeSpans(List<OcrSpan> spans) {
        try {
            return objectMapper.writeValueAsString(spans);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize OCR spans", e);
        }
    }
}
