package com.pdftranslator.backend.dto;

import java.util.List;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CreditBalanceResponseDTO {

    private Long ownerId;
    private int balance;
    private List<LedgerEntryDTO> recentEntries;
}
