package com.pdftranslator.backend.entities;

import java.time.LocalDateTime;
import java.util.UUID;

import com.pdftranslator.backend.enums.PageClassification;
import com.pdftranslator.backend.enums.PageMode;
import com.pdftranslator.backend.enums.PageOutcome;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "job_pages", uniqueConstraints = {
        @UniqueConstraint(name = "uk_job_pages_job_page", columnNames = {"job_id", "page_index"})
})
@Getter
@Setter
public class JobPage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "page_index", nullable = false)
    private int pageIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "classification", nullable = false, length = 32)
    private PageClassification classification;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 16)
    private PageMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 32)
    private PageOutcome outcome;

    @Column(name = "block_count", nullable = false)
    private int blockCount;

    @Column(name = "failed_block_count", nullable = false)
    private int failedBlockCount;

    /**
     * Recognised spans of an OCR page (JSON), kept so a resumed job does not call OCR again.
     */
    @Column(name = "ocr_spans_json", length = 1_000_000)
    private String ocrSpansJson;

    @Column(name = "ocr_completed", nullable = false)
    private boolean ocrCompleted;

    @Column(name = "error_tag", length = 500)
    private String errorTag;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
