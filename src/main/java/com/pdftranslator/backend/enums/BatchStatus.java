package com.pdftranslator.backend.enums;

public enum BatchStatus {
    SUCCEEDED,
    FAILED
}
