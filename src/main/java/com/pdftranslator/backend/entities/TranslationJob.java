package com.pdftranslator.backend.entities;

import java.time.LocalDateTime;
import java.util.UUID;

import com.pdftranslator.backend.enums.FailureReason;
import com.pdftranslator.backend.enums.JobStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;

/**
 * One translation request. Status is only changed through
 * {@link com.pdftranslator.backend.services.jobs.JobStateMachine}.
 */
@Entity
@Table(name = "translation_jobs", indexes = {
        @Index(name = "idx_translation_jobs_owner", columnList = "owner_id"),
        @Index(name = "idx_translation_jobs_status", columnList = "status"),
        @Index(name = "idx_translation_jobs_expires_at", columnList = "expires_at")
})
@Getter
@Setter
public class TranslationJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "source_lang", nullable = false, length = 8)
    private String sourceLang;

    @Column(name = "target_lang", nullable = false, length = 8)
    private String targetLang;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status;

    @Column(name = "original_filename")
    private String originalFilename;

    @Column(name = "file_size_bytes", nullable = false)
    private long fileSizeBytes;

    @Column(name = "file_sha256", length = 64)
    private String fileSha256;

    @Column(name = "input_ref", length = 512)
    private String inputRef;

    @Column(name = "artifact_ref", length = 512)
    private String artifactRef;

    @Column(name = "page_count", nullable = false)
    private int pageCount;

    @Column(name = "pages_processed", nullable = false)
    private int pagesProcessed;

    @Column(name = "ocr_page_count", nullable = false)
    private int ocrPageCount;

    @Column(name = "ocr_failed_pages", nullable = false)
    private int ocrFailedPages;

    @Column(name = "failed_block_count", nullable = false)
    private int failedBlockCount;

    @Column(name = "clipped_block_count", nullable = false)
    private int clippedBlockCount;

    @Column(name = "warning_count", nullable = false)
    private int warningCount;

    @Column(name = "credits_charged", nullable = false)
    private int creditsCharged;

    @Column(name = "run_attempts", nullable = false)
    private int runAttempts;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 64)
    private FailureReason failureReason;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "cleaned_at")
    private LocalDateTime cleanedAt;

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && now != null && !now.isBefore(expiresAt);
    }
}
