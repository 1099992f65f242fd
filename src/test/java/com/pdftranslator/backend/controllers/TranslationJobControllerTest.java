package com.pdftranslator.backend.controllers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDateTime;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.exceptions.ForbiddenException;
import com.pdftranslator.backend.exceptions.InsufficientCreditsException;
import com.pdftranslator.backend.exceptions.JobExpiredException;
import com.pdftranslator.backend.exceptions.ResourceNotFoundException;
import com.pdftranslator.backend.exceptions.UnsupportedLanguagePairException;
import com.pdftranslator.backend.services.jobs.StoredArtifact;
import com.pdftranslator.backend.services.jobs.TranslationJobService;

@SpringBootTest
@AutoConfigureMockMvc
class TranslationJobControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    TranslationJobService jobService;

    @Test
    void submit_validFile_returnsAcceptedAndJob() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobService.submit(eq(3L), eq("tr"), eq("en"), eq("rapor.pdf"), any(byte[].class)))
                .thenReturn(job(jobId, JobStatus.EXTRACTING));

        mockMvc.perform(multipart("/v1/jobs")
                        .file(pdf("dummy".getBytes()))
                        .param("sourceLang", "tr")
                        .param("targetLang", "en")
                        .param("ownerId", "3"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Job accepted"))
                .andExpect(jsonPath("$.data.jobId").value(jobId.toString()))
                .andExpect(jsonPath("$.data.status").value("EXTRACTING"))
                .andExpect(jsonPath("$.data.creditsCharged").value(4));
    }

    @Test
    void submit_emptyFile_returnsBadRequest() throws Exception {
        mockMvc.perform(multipart("/v1/jobs")
                        .file(pdf(new byte[0]))
                        .param("sourceLang", "tr")
                        .param("targetLang", "en")
                        .param("ownerId", "3"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("File is missing or empty"))
                .andExpect(jsonPath("$.errors[0]").value("File is missing or empty"))
                .andExpect(jsonPath("$.data").doesNotExist());

        verify(jobService, never()).submit(anyLong(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void submit_missingOwner_returnsBadRequest() throws Exception {
        mockMvc.perform(multipart("/v1/jobs")
                        .file(pdf("dummy".getBytes()))
                        .param("sourceLang", "tr")
                        .param("targetLang", "en"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void submit_rejectedRequests_mapToClientErrors() throws Exception {
        when(jobService.submit(eq(3L), eq("tr"), eq("de"), anyString(), any(byte[].class)))
                .thenThrow(new UnsupportedLanguagePairException("tr", "de"));
        when(jobService.submit(eq(4L), eq("tr"), eq("en"), anyString(), any(byte[].class)))
                .thenThrow(new InsufficientCreditsException(4L, 12, 2));

        mockMvc.perform(multipart("/v1/jobs")
                        .file(pdf("dummy".getBytes()))
                        .param("sourceLang", "tr")
                        .param("targetLang", "de")
                        .param("ownerId", "3"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(multipart("/v1/jobs")
                        .file(pdf("dummy".getBytes()))
                        .param("sourceLang", "tr")
                        .param("targetLang", "en")
                        .param("ownerId", "4"))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void status_unknownJob_returnsNotFound() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobService.get(jobId)).thenThrow(new ResourceNotFoundException("Job not found: " + jobId));

        mockMvc.perform(get("/v1/jobs/{id}", jobId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: " + jobId));
    }

    @Test
    void status_pastRetention_isReportedAsExpired() throws Exception {
        UUID jobId = UUID.randomUUID();
        TranslationJob job = job(jobId, JobStatus.COMPLETED);
        job.setExpiresAt(LocalDateTime.now().minusMinutes(5));
        when(jobService.get(jobId)).thenReturn(job);

        mockMvc.perform(get("/v1/jobs/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("EXPIRED"))
                .andExpect(jsonPath("$.data.downloadable").value(false));
    }

    @Test
    void download_completedJob_returnsPdfAttachment() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobService.download(jobId, 3L)).thenReturn(new StoredArtifact("rapor.en.pdf", new byte[]{37, 80, 68, 70}));

        mockMvc.perform(get("/v1/jobs/{id}/download", jobId).param("ownerId", "3"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"rapor.en.pdf\""))
                .andExpect(content().bytes(new byte[]{37, 80, 68, 70}));
    }

    @Test
    void download_guards_mapToForbiddenAndGone() throws Exception {
        UUID foreign = UUID.randomUUID();
        UUID expired = UUID.randomUUID();
        when(jobService.download(foreign, 3L)).thenThrow(new ForbiddenException("Job belongs to another owner"));
        when(jobService.download(expired, 3L)).thenThrow(new JobExpiredException(expired));

        mockMvc.perform(get("/v1/jobs/{id}/download", foreign).param("ownerId", "3"))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/v1/jobs/{id}/download", expired).param("ownerId", "3"))
                .andExpect(status().isGone());
    }

    @Test
    void cancel_returnsAccepted() throws Exception {
        UUID jobId = UUID.randomUUID();
        TranslationJob job = job(jobId, JobStatus.TRANSLATING);
        job.setCancelRequested(true);
        when(jobService.cancel(jobId, 3L)).thenReturn(job);

        mockMvc.perform(post("/v1/jobs/{id}/cancel", jobId).param("ownerId", "3"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.cancelRequested").value(true));
    }

    private static MockMultipartFile pdf(byte[] bytes) {
        return new MockMultipartFile("file", "rapor.pdf", "application/pdf", bytes);
    }

    private static TranslationJob job(UUID id, JobStatus status) {
        TranslationJob job = new TranslationJob();
        job.setId(id);
        job.setOwnerId(3L);
        job.setStatus(status);
        job.setSourceLang("tr");
        job.setTargetLang("en");
        job.setPageCount(4);
        job.setCreditsCharged(4);
        job.setCreatedAt(LocalDateTime.now());
        job.setExpiresAt(LocalDateTime.now().plusHours(24));
        return job;
    }
}
