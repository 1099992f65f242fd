package com.pdftranslator.backend.repositories;

import org.springframework.data.jpa.repository.JpaRepository;

import com.pdftranslator.backend.entities.TranslationCacheEntry;

public interface TranslationCacheRepository extends JpaRepository<TranslationCacheEntry, String> {
}
