package com.pdftranslator.backend.controllers.admin;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.pdftranslator.backend.dto.AdminGrantRequestDTO;
import com.pdftranslator.backend.dto.ApiResponse;
import com.pdftranslator.backend.dto.CreditBalanceResponseDTO;
import com.pdftranslator.backend.dto.JobStatsDTO;
import com.pdftranslator.backend.dto.LedgerEntryDTO;
import com.pdftranslator.backend.dto.TranslationJobResponseDTO;
import com.pdftranslator.backend.services.admin.AdminStatsService;
import com.pdftranslator.backend.services.credits.CreditLedgerService;
import com.pdftranslator.backend.services.jobs.TranslationJobService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
@Validated
public class AdminController {

    private final CreditLedgerService creditLedger;
    private final AdminStatsService statsService;
    private final TranslationJobService jobService;
    private final Clock clock;

    @PostMapping("/credits/grant")
    public ResponseEntity<ApiResponse<CreditBalanceResponseDTO>> grant(@Valid @RequestBody AdminGrantRequestDTO request) {
        LedgerEntryDTO entry = LedgerEntryDTO.from(
                creditLedger.grant(request.getOwnerId(), request.getPages(), request.getNote(), request.getExternalRef()));

        CreditBalanceResponseDTO payload = CreditBalanceResponseDTO.builder()
                .ownerId(request.getOwnerId())
                .balance(creditLedger.balance(request.getOwnerId()))
                .recentEntries(List.of(entry))
                .build();
        return ResponseEntity.ok(ApiResponse.success(payload, "Credits granted"));
    }

    @GetMapping("/jobs/stats")
    public ResponseEntity<ApiResponse<JobStatsDTO>> stats() {
        return ResponseEntity.ok(ApiResponse.success(statsService.stats(), "Job statistics"));
    }

    @GetMapping("/jobs")
    public ResponseEntity<ApiResponse<List<TranslationJobResponseDTO>>> recentJobs(
            @RequestParam(defaultValue = "50") int limit
    ) {
        return ResponseEntity.ok(ApiResponse.success(statsService.recentJobs(limit), "Recent jobs"));
    }

    @PostMapping("/jobs/{id}/resume")
    public ResponseEntity<ApiResponse<TranslationJobResponseDTO>> resume(@PathVariable UUID id) {
        TranslationJobResponseDTO payload = TranslationJobResponseDTO.from(jobService.resume(id), LocalDateTime.now(clock));
        return ResponseEntity.accepted().body(ApiResponse.success(payload, "Job re-queued"));
    }
}
