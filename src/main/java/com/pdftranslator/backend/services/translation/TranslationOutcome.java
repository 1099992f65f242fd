package com.pdftranslator.backend.services.translation;

public record TranslationOutcome(int batchCount,
                                 int failedBatchCount,
                                 int translatedBlocks,
                                 int failedBlocks,
                                 int fallbackBatches,
                                 int resumedBatches,
                                 int cachedSegments) {

    public static TranslationOutcome empty() {
        return new TranslationOutcome(0, 0, 0, 0, 0, 0, 0);
    }
}
