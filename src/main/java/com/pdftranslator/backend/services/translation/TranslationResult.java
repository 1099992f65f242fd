package com.pdftranslator.backend.services.translation;

/**
 * Text returned by a translation capability with its self-assessed confidence in 0..1.
 */
public record TranslationResult(String text, double confidence) {
}
