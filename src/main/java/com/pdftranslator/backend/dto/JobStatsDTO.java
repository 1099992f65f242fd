package com.pdftranslator.backend.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class JobStatsDTO {

    private long totalJobs;
    private long completedJobs;
    private long failedJobs;
    private long expiredJobs;
    private long activeJobs;
    private double successRate;
    private double averagePages;
    private double estimatedTokenCostUsd;
}
