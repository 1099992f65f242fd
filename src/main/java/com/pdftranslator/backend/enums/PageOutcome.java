package com.pdftranslator.backend.enums;

public enum PageOutcome {
    PENDING,
    TRANSLATED,
    PARTIAL,
    UNTRANSLATED,
    OCR_FAILED
}
