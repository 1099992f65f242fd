package com.pdftranslator.backend.enums;

/**
 * Where a page's source text came from.
 */
public enum PageMode {
    TEXT_LAYER,
    OCR
}
