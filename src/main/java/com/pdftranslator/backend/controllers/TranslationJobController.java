package com.pdftranslator.backend.controllers;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.pdftranslator.backend.dto.ApiResponse;
import com.pdftranslator.backend.dto.TranslationJobResponseDTO;
import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.exceptions.UnsupportedDocumentException;
import com.pdftranslator.backend.services.jobs.StoredArtifact;
import com.pdftranslator.backend.services.jobs.TranslationJobService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/v1/jobs")
@RequiredArgsConstructor
@Slf4j
public class TranslationJobController {

    private final TranslationJobService jobService;
    private final Clock clock;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<TranslationJobResponseDTO>> submit(
            @RequestParam("file") MultipartFile file,
            @RequestParam("sourceLang") String sourceLang,
            @RequestParam("targetLang") String targetLang,
            @RequestParam("ownerId") Long ownerId
    ) {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("File is missing or empty"));
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new UnsupportedDocumentException("Could not read uploaded file", e);
        }
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.pdf";

        TranslationJob job = jobService.submit(ownerId, sourceLang, targetLang, filename, bytes);
        return ResponseEntity.accepted().body(ApiResponse.success(map(job), "Job accepted"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<TranslationJobResponseDTO>> status(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(map(jobService.get(id)), "Job status"));
    }

    @GetMapping("/{id}/download")
    public ResponseEntity<byte[]> download(@PathVariable UUID id, @RequestParam("ownerId") Long ownerId) {
        StoredArtifact artifact = jobService.download(id, ownerId);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.filename()).build().toString())
                .body(artifact.bytes());
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<TranslationJobResponseDTO>> cancel(
            @PathVariable UUID id,
            @RequestParam("ownerId") Long ownerId
    ) {
        TranslationJob job = jobService.cancel(id, ownerId);
        return ResponseEntity.accepted().body(ApiResponse.success(map(job), "Cancellation requested"));
    }

    private TranslationJobResponseDTO map(TranslationJob job) {
        return TranslationJobResponseDTO.from(job, LocalDateTime.now(clock));
    }
}
