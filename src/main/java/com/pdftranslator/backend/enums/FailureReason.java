package com.pdftranslator.backend.enums;

public enum FailureReason {
    UNSUPPORTED_DOCUMENT,
    UNSUPPORTED_LANGUAGE_PAIR,
    INSUFFICIENT_CREDITS,
    PROVIDER_ERROR,
    TRANSLATION_FAILED,
    RECONSTRUCTION_ERROR,
    CANCELLED,
    EXPIRED,
    INTERNAL_ERROR
}
