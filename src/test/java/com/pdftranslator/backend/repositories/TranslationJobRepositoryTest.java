package com.pdftranslator.backend.repositories;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.FailureReason;
import com.pdftranslator.backend.enums.JobStatus;

@DataJpaTest
class TranslationJobRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Autowired
    TranslationJobRepository jobRepository;

    @Test
    void outcomeCounts_keepJobsThatWereExpiredAfterFinishing() {
        jobRepository.save(job(JobStatus.COMPLETED, NOW, null));
        jobRepository.save(job(JobStatus.EXPIRED, NOW.minusDays(2), null));
        jobRepository.save(job(JobStatus.EXPIRED, NOW.minusDays(2), FailureReason.PROVIDER_ERROR));
        jobRepository.save(job(JobStatus.FAILED, NOW, FailureReason.CANCELLED));
        jobRepository.save(job(JobStatus.TRANSLATING, null, null));

        assertEquals(2, jobRepository.countByFinishedAtIsNotNullAndFailureReasonIsNull());
        assertEquals(2, jobRepository.countByFinishedAtIsNotNullAndFailureReasonIsNotNull());
        assertEquals(2, jobRepository.countByStatus(JobStatus.EXPIRED));
    }

    private static TranslationJob job(JobStatus status, LocalDateTime finishedAt, FailureReason reason) {
        TranslationJob job = new TranslationJob();
        job.setOwnerId(77L);
        job.setSourceLang("tr");
        job.setTargetLang("en");
        job.setStatus(status);
        job.setFinishedAt(finishedAt);
        job.setFailureReason(reason);
        job.setCreatedAt(NOW.minusDays(3));
        job.setUpdatedAt(NOW);
        job.setExpiresAt(NOW.plusDays(1));
        return job;
    }
}
