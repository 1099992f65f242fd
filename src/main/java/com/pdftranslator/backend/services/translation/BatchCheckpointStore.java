package com.pdftranslator.backend.services.translation;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pdftranslator.backend.entities.TranslationBatchRecord;
import com.pdftranslator.backend.enums.BatchStatus;
import com.pdftranslator.backend.repositories.TranslationBatchRecordRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists the result of each batch so a resumed job skips batches that already succeeded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchCheckpointStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final TranslationBatchRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Translations of a succeeded batch with the same content, if any.
     */
    public Optional<List<String>> findSucceeded(UUID jobId, BatchRequest batch) {
        if (jobId == null) return Optional.empty();
        return repository.findByJobIdAndBatchIndex(jobId, batch.batchIndex())
                .filter(r -> r.getStatus() == BatchStatus.SUCCEEDED)
                .filter(r -> batch.contentHash().equals(r.getContentHash()))
                .flatMap(this::readTranslations)
                .filter(list -> list.size() == batch.segments().size());
    }

    @Transactional
    public void recordSuccess(UUID jobId, BatchRequest batch, String model, int attempts, double confidence, List<String> translations) {
        if (jobId == null) return;
        TranslationBatchRecord record = loadOrCreate(jobId, batch);
        record.setStatus(BatchStatus.SUCCEEDED);
        record.setModel(model);
        record.setAttempts(record.getAttempts() + attempts);
        record.setConfidence(confidence);
        record.setTranslationsJson(writeTranslations(translations));
        record.setErrorTag(null);
        record.setUpdatedAt(LocalDateTime.now(clock));
        repository.save(record);
    }

    @Transactional
    public void recordFailure(UUID jobId, BatchRequest batch, String model, int attempts, String errorTag) {
        if (jobId == null) return;
        TranslationBatchRecord record = loadOrCreate(jobId, batch);
        record.setStatus(BatchStatus.FAILED);
        record.setModel(model);
        record.setAttempts(record.getAttempts() + attempts);
        record.setConfidence(null);
        record.setTranslationsJson(null);
        record.setErrorTag(trim(errorTag));
        record.setUpdatedAt(LocalDateTime.now(clock));
        repository.save(record);
    }

    public List<TranslationBatchRecord> findAll(UUID jobId) {
        return repository.findByJobIdOrderByBatchIndexAsc(jobId);
    }

    private TranslationBatchRecord loadOrCreate(UUID jobId, BatchRequest batch) {
        TranslationBatchRecord record = repository.findByJobIdAndBatchIndex(jobId, batch.batchIndex())
                .orElseGet(() -> {
                    TranslationBatchRecord r = new TranslationBatchRecord();
                    r.setJobId(jobId);
                    r.setBatchIndex(batch.batchIndex());
                    r.setCreatedAt(LocalDateTime.now(clock));
                    return r;
                });
        if (!batch.contentHash().equals(record.getContentHash())) {
            // Different input under the same index: earlier attempts no longer apply.
            record.setAttempts(0);
        }
        record.setContentHash(batch.contentHash());
        return record;
    }

    private Optional<List<String>> readTranslations(TranslationBatchRecord record) {
        if (record.getTranslationsJson() == null) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(record.getTranslationsJson(), STRING_LIST));
        } catch (JsonProcessingException e) {
            log.warn("[Translate] Unreadable checkpoint jobId={} batch={}: {}",
                    record.getJobId(), record.getBatchIndex(), e.getMessage());
            return Optional.empty();
        }
    }

    private String writeTranslations(List<String> translations) {
        try {
            return objectMapper.writeValueAsString(translations);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize batch translations", e);
        }
    }

    private static String trim(String message) {
        if (message == null) return null;
        String m = message.trim();
        return m.length() <= 500 ? m : m.substring(0, 497) + "...";
    }
}
