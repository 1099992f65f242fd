package com.pdftranslator.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.pdftranslator.backend.entities.TranslationBatchRecord;

public interface TranslationBatchRecordRepository extends JpaRepository<TranslationBatchRecord, UUID> {

    Optional<TranslationBatchRecord> findByJobIdAndBatchIndex(UUID jobId, int batchIndex);

    List<TranslationBatchRecord> findByJobIdOrderByBatchIndexAsc(UUID jobId);
}
