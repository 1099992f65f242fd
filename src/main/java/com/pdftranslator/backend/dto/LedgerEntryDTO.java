package com.pdftranslator.backend.dto;

import java.time.LocalDateTime;
import java.util.UUID;

import com.pdftranslator.backend.entities.CreditLedgerEntry;
import com.pdftranslator.backend.enums.LedgerEntryType;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LedgerEntryDTO {

    private UUID id;
    private LedgerEntryType type;
    private int amount;
    private UUID jobId;
    private String externalRef;
    private String note;
    private LocalDateTime createdAt;

    public static LedgerEntryDTO from(CreditLedgerEntry entry) {
        return LedgerEntryDTO.builder()
                .id(entry.getId())
                .type(entry.getEntryType())
                .amount(entry.getAmount())
                .jobId(entry.getJobId())
                .externalRef(entry.getExternalRef())
                .note(entry.getNote())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
