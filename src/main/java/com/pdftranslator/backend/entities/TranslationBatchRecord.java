package com.pdftranslator.backend.entities;

import java.time.LocalDateTime;
import java.util.UUID;

import com.pdftranslator.backend.enums.BatchStatus;

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

/**
 * Checkpoint of one translation batch. Succeeded batches whose content hash still matches are
 * reused when a job is resumed.
 */
@Entity
@Table(name = "translation_batches", uniqueConstraints = {
        @UniqueConstraint(name = "uk_translation_batches_job_batch", columnNames = {"job_id", "batch_index"})
})
@Getter
@Setter
public class TranslationBatchRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "batch_index", nullable = false)
    private int batchIndex;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private BatchStatus status;

    @Column(name = "model", length = 200)
    private String model;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "translations_json", length = 1_000_000)
    private String translationsJson;

    @Column(name = "error_tag", length = 500)
    private String errorTag;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
