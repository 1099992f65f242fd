package com.pdftranslator.backend.services.admin;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.pdftranslator.backend.dto.JobStatsDTO;
import com.pdftranslator.backend.dto.TranslationJobResponseDTO;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.repositories.TranslationJobRepository;
import com.pdftranslator.backend.services.jobs.TranslationJobService;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class AdminStatsService {

    /**
     * Rough model cost per translated page, in USD.
     */
    static final double ESTIMATED_COST_PER_PAGE_USD = 0.00022;

    private final TranslationJobRepository jobRepository;
    private final TranslationJobService jobService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public JobStatsDTO stats() {
        long total = jobRepository.count();
        long completed = jobRepository.countByStatus(JobStatus.COMPLETED);
        long failed = jobRepository.countByStatus(JobStatus.FAILED);
        long expired = jobRepository.countByStatus(JobStatus.EXPIRED);
        long active = total - completed - failed - expired;
        double averagePages = total == 0 ? 0.0 : jobRepository.averagePageCount();
        // Outcomes, not current status: the expiry sweep moves finished jobs to EXPIRED.
        long succeeded = jobRepository.countByFinishedAtIsNotNullAndFailureReasonIsNull();
        long finished = succeeded + jobRepository.countByFinishedAtIsNotNullAndFailureReasonIsNotNull();

        return JobStatsDTO.builder()
                .totalJobs(total)
                .completedJobs(completed)
                .failedJobs(failed)
                .expiredJobs(expired)
                .activeJobs(Math.max(0, active))
                .successRate(finished == 0 ? 0.0 : round((double) succeeded / finished))
                .averagePages(round(averagePages))
                .estimatedTokenCostUsd(round(averagePages * total * ESTIMATED_COST_PER_PAGE_USD))
                .build();
    }

    @Transactional(readOnly = true)
    public List<TranslationJobResponseDTO> recentJobs(int limit) {
        LocalDateTime now = LocalDateTime.now(clock);
        return jobService.recent(limit).stream()
                .map(job -> TranslationJobResponseDTO.from(job, now))
                .toList();
    }

    private static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
