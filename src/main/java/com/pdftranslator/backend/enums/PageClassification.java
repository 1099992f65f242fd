package com.pdftranslator.backend.enums;

public enum PageClassification {
    /**
     * Enough extractable glyphs for the text layer to be trusted.
     */
    TEXT,
    /**
     * No usable text layer (image-only page or too sparse).
     */
    SCAN,
    /**
     * Text layer present but mostly unmapped glyphs; handled like a scan.
     */
    LOW_CONFIDENCE_TEXT;

    public boolean needsOcr() {
        return this != TEXT;
    }
}
