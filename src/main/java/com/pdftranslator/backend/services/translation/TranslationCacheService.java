package com.pdftranslator.backend.services.translation;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.entities.TranslationCacheEntry;
import com.pdftranslator.backend.repositories.TranslationCacheRepository;
import com.pdftranslator.backend.services.Sha256;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Segment-level translation cache shared by all jobs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationCacheService {

    private final TranslationCacheRepository repository;
    private final TranslatorProperties properties;
    private final Clock clock;

    public Optional<String> lookup(String sourceLang, String targetLang, String text) {
        if (!properties.getTranslation().isCacheEnabled()) return Optional.empty();
        return repository.findById(key(sourceLang, targetLang, text))
                .map(TranslationCacheEntry::getTranslatedText)
                .filter(t -> !t.isBlank());
    }

    public void store(String sourceLang, String targetLang, String text, String translated, String model) {
        if (!properties.getTranslation().isCacheEnabled()) return;
        if (translated == null || translated.isBlank()) return;

        String key = key(sourceLang, targetLang, text);
        if (repository.existsById(key)) return;

        TranslationCacheEntry entry = new TranslationCacheEntry();
        entry.setCacheKey(key);
        entry.setSourceLang(sourceLang);
        entry.setTargetLang(targetLang);
        entry.setTranslatedText(translated);
        entry.setModel(model);
        entry.setCreatedAt(LocalDateTime.now(clock));
        try {
            repository.save(entry);
        } catch (DataIntegrityViolationException e) {
            // Another batch stored the same segment first.
            log.debug("[Translate] Cache entry already present key={}", key);
        }
    }

    static String key(String sourceLang, String targetLang, String text) {
        return Sha256.hex(sourceLang + "|" + targetLang + "|" + text);
    }
}
