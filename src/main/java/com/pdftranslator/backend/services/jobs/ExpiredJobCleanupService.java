package com.pdftranslator.backend.services.jobs;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.repositories.TranslationJobRepository;
import com.pdftranslator.backend.services.storage.ArtifactStorage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves jobs past their retention window to {@code EXPIRED} and deletes their files.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpiredJobCleanupService {

    private final TranslationJobRepository jobRepository;
    private final JobTransitionService transitions;
    private final JobRunRegistry runRegistry;
    private final ArtifactStorage storage;
    private final TranslatorProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${translator.cleanup.fixed-delay-ms:900000}",
            initialDelayString = "${translator.cleanup.fixed-delay-ms:900000}")
    public void scheduledSweep() {
        if (!properties.getCleanup().isEnabled()) {
            return;
        }
        sweep();
    }

    /**
     * @return number of jobs expired in this pass
     */
    public int sweep() {
        List<TranslationJob> due = jobRepository.findByExpiresAtLessThanEqualAndCleanedAtIsNull(LocalDateTime.now(clock));
        int expired = 0;

        for (TranslationJob job : due) {
            // picked up again on the next pass once the run ends
            if (runRegistry.isRunning(job.getId())) {
                continue;
            }
            try {
                transitions.expire(job.getId());
                storage.delete(job.getInputRef());
                storage.delete(job.getArtifactRef());
                transitions.markCleaned(job.getId());
                expired++;
            } catch (RuntimeException e) {
                log.warn("[Cleanup] Failed to expire jobId={}: {}", job.getId(), e.getMessage());
            }
        }

        if (expired > 0) {
            log.info("[Cleanup] Expired {} jobs", expired);
        }
        return expired;
    }
}
