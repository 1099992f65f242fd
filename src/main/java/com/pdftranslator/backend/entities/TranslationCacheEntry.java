package com.pdftranslator.backend.entities;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "translation_cache")
@Getter
@Setter
public class TranslationCacheEntry {

    /**
     * SHA-256 of "source|target|text".
     */
    @Id
    @Column(name = "cache_key", length = 64)
    private String cacheKey;

    @Column(name = "source_lang", nullable = false, length = 8)
    private String sourceLang;

    @Column(name = "target_lang", nullable = false, length = 8)
    private String targetLang;

    @Column(name = "translated_text", nullable = false, length = 1_000_000)
    private String translatedText;

    @Column(name = "model", length = 200)
    private String model;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
