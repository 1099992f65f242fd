package com.pdftranslator.backend.dto;

import java.time.LocalDateTime;
import java.util.UUID;

import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.FailureReason;
import com.pdftranslator.backend.enums.JobStatus;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TranslationJobResponseDTO {

    private UUID jobId;
    private Long ownerId;

    /**
     * Status as seen now: a job past its retention window is reported as EXPIRED.
     */
    private JobStatus status;

    private String sourceLang;
    private String targetLang;
    private String originalFilename;
    private int pageCount;
    private int pagesProcessed;
    private int ocrPageCount;
    private int ocrFailedPages;
    private int failedBlockCount;
    private int clippedBlockCount;
    private int warningCount;
    private int creditsCharged;
    private boolean cancelRequested;
    private boolean downloadable;
    private FailureReason failureReason;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private LocalDateTime expiresAt;

    public static TranslationJobResponseDTO from(TranslationJob job, LocalDateTime now) {
        boolean expired = job.getStatus() == JobStatus.EXPIRED || job.isExpiredAt(now);
        JobStatus effective = expired ? JobStatus.EXPIRED : job.getStatus();

        return TranslationJobResponseDTO.builder()
                .jobId(job.getId())
                .ownerId(job.getOwnerId())
                .status(effective)
                .sourceLang(job.getSourceLang())
                .targetLang(job.getTargetLang())
                .originalFilename(job.getOriginalFilename())
                .pageCount(job.getPageCount())
                .pagesProcessed(job.getPagesProcessed())
                .ocrPageCount(job.getOcrPageCount())
                .ocrFailedPages(job.getOcrFailedPages())
                .failedBlockCount(job.getFailedBlockCount())
                .clippedBlockCount(job.getClippedBlockCount())
                .warningCount(job.getWarningCount())
                .creditsCharged(job.getCreditsCharged())
                .cancelRequested(job.isCancelRequested())
                .downloadable(effective == JobStatus.COMPLETED)
                .failureReason(job.getFailureReason())
                .errorMessage(job.getErrorMessage())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .expiresAt(job.getExpiresAt())
                .build();
    }
}
