package com.pdftranslator.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.pdftranslator.backend.dto.ApiResponse;
import com.pdftranslator.backend.dto.CreditBalanceResponseDTO;
import com.pdftranslator.backend.dto.LedgerEntryDTO;
import com.pdftranslator.backend.services.credits.CreditLedgerService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/v1/credits")
@RequiredArgsConstructor
public class CreditController {

    private final CreditLedgerService creditLedger;

    @GetMapping("/{ownerId}")
    public ResponseEntity<ApiResponse<CreditBalanceResponseDTO>> balance(@PathVariable Long ownerId) {
        CreditBalanceResponseDTO payload = CreditBalanceResponseDTO.builder()
                .ownerId(ownerId)
                .balance(creditLedger.balance(ownerId))
                .recentEntries(creditLedger.history(ownerId).stream().map(LedgerEntryDTO::from).toList())
                .build();
        return ResponseEntity.ok(ApiResponse.success(payload, "Credit balance"));
    }
}
