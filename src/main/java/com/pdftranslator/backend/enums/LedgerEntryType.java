package com.pdftranslator.backend.enums;

public enum LedgerEntryType {
    GRANT,
    DEBIT,
    REFUND
}
