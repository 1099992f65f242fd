package com.pdftranslator.backend.services.extraction;

/**
 * Result of the cheap pre-flight check done before a job is billed.
 */
public record DocumentInspection(int pageCount, long sizeBytes) {
}
