package com.pdftranslator.backend.services.admin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.pdftranslator.backend.dto.JobStatsDTO;
import com.pdftranslator.backend.dto.TranslationJobResponseDTO;
import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.repositories.TranslationJobRepository;
import com.pdftranslator.backend.services.jobs.TranslationJobService;

@ExtendWith(MockitoExtension.class)
class AdminStatsServiceTest {

    @Mock
    TranslationJobRepository jobRepository;

    @Mock
    TranslationJobService jobService;

    private AdminStatsService statsService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        statsService = new AdminStatsService(jobRepository, jobService, clock);
    }

    @Test
    void stats_aggregatesCountsRateAndCost() {
        when(jobRepository.count()).thenReturn(10L);
        when(jobRepository.countByStatus(JobStatus.COMPLETED)).thenReturn(6L);
        when(jobRepository.countByStatus(JobStatus.FAILED)).thenReturn(2L);
        when(jobRepository.countByStatus(JobStatus.EXPIRED)).thenReturn(1L);
        when(jobRepository.averagePageCount()).thenReturn(12.5);
        when(jobRepository.countByFinishedAtIsNotNullAndFailureReasonIsNull()).thenReturn(6L);
        when(jobRepository.countByFinishedAtIsNotNullAndFailureReasonIsNotNull()).thenReturn(2L);

        JobStatsDTO stats = statsService.stats();

        assertEquals(10, stats.getTotalJobs());
        assertEquals(1, stats.getActiveJobs());
        assertEquals(0.75, stats.getSuccessRate(), 1e-9);
        assertEquals(12.5, stats.getAveragePages(), 1e-9);
        assertEquals(0.0275, stats.getEstimatedTokenCostUsd(), 1e-9);
    }

    @Test
    void stats_successRateCountsOutcomesOfJobsThatExpiredSince() {
        when(jobRepository.count()).thenReturn(4L);
        when(jobRepository.countByStatus(JobStatus.COMPLETED)).thenReturn(0L);
        when(jobRepository.countByStatus(JobStatus.FAILED)).thenReturn(0L);
        when(jobRepository.countByStatus(JobStatus.EXPIRED)).thenReturn(4L);
        when(jobRepository.averagePageCount()).thenReturn(3.0);
        when(jobRepository.countByFinishedAtIsNotNullAndFailureReasonIsNull()).thenReturn(3L);
        when(jobRepository.countByFinishedAtIsNotNullAndFailureReasonIsNotNull()).thenReturn(1L);

        JobStatsDTO stats = statsService.stats();

        assertEquals(4, stats.getExpiredJobs());
        assertEquals(0, stats.getActiveJobs());
        assertEquals(0.75, stats.getSuccessRate(), 1e-9);
    }

    @Test
    void stats_noJobs_isAllZero() {
        when(jobRepository.count()).thenReturn(0L);

        JobStatsDTO stats = statsService.stats();

        assertEquals(0.0, stats.getSuccessRate());
        assertEquals(0.0, stats.getAveragePages());
        verify(jobRepository, never()).averagePageCount();
    }

    @Test
    void recentJobs_reportsJobsPastRetentionAsExpired() {
        TranslationJob old = new TranslationJob();
        old.setId(UUID.randomUUID());
        old.setStatus(JobStatus.COMPLETED);
        old.setExpiresAt(LocalDateTime.of(2026, 3, 1, 9, 0));
        when(jobService.recent(20)).thenReturn(List.of(old));

        List<TranslationJobResponseDTO> jobs = statsService.recentJobs(20);

        assertEquals(JobStatus.EXPIRED, jobs.get(0).getStatus());
    }
}
