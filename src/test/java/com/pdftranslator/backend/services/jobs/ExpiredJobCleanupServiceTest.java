package com.pdftranslator.backend.services.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
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

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.exceptions.ResourceNotFoundException;
import com.pdftranslator.backend.repositories.TranslationJobRepository;
import com.pdftranslator.backend.services.storage.ArtifactStorage;

@ExtendWith(MockitoExtension.class)
class ExpiredJobCleanupServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 12, 0);

    @Mock
    TranslationJobRepository jobRepository;

    @Mock
    JobTransitionService transitions;

    @Mock
    ArtifactStorage storage;

    private final JobRunRegistry runRegistry = new JobRunRegistry();
    private final TranslatorProperties properties = new TranslatorProperties();
    private ExpiredJobCleanupService cleanup;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T12:00:00Z"), ZoneOffset.UTC);
        cleanup = new ExpiredJobCleanupService(jobRepository, transitions, runRegistry, storage, properties, clock);
    }

    @Test
    void sweep_expiresDueJobs_andDeletesTheirFiles() {
        TranslationJob completed = job(JobStatus.COMPLETED, "a/input.pdf", "a/translated.pdf");
        TranslationJob failed = job(JobStatus.FAILED, "b/input.pdf", null);
        when(jobRepository.findByExpiresAtLessThanEqualAndCleanedAtIsNull(NOW)).thenReturn(List.of(completed, failed));

        int expired = cleanup.sweep();

        assertEquals(2, expired);
        verify(transitions).expire(completed.getId());
        verify(transitions).expire(failed.getId());
        verify(storage).delete("a/input.pdf");
        verify(storage).delete("a/translated.pdf");
        verify(storage).delete("b/input.pdf");
        verify(transitions).markCleaned(completed.getId());
        verify(transitions).markCleaned(failed.getId());
    }

    @Test
    void sweep_skipsJobsStillRunning() {
        TranslationJob running = job(JobStatus.TRANSLATING, "c/input.pdf", null);
        runRegistry.tryAcquire(running.getId());
        when(jobRepository.findByExpiresAtLessThanEqualAndCleanedAtIsNull(NOW)).thenReturn(List.of(running));

        assertEquals(0, cleanup.sweep());
        verify(transitions, never()).expire(any());
        verify(storage, never()).delete(any());
    }

    @Test
    void sweep_oneBrokenJob_doesNotStopTheRest() {
        TranslationJob broken = job(JobStatus.COMPLETED, "d/input.pdf", "d/translated.pdf");
        TranslationJob fine = job(JobStatus.COMPLETED, "e/input.pdf", "e/translated.pdf");
        when(jobRepository.findByExpiresAtLessThanEqualAndCleanedAtIsNull(NOW)).thenReturn(List.of(broken, fine));
        when(transitions.expire(broken.getId())).thenThrow(new ResourceNotFoundException("gone"));

        assertEquals(1, cleanup.sweep());
        verify(transitions, never()).markCleaned(broken.getId());
        verify(transitions).markCleaned(fine.getId());
    }

    @Test
    void scheduledSweep_disabled_doesNothing() {
        properties.getCleanup().setEnabled(false);

        cleanup.scheduledSweep();

        verify(jobRepository, never()).findByExpiresAtLessThanEqualAndCleanedAtIsNull(any());
    }

    private static TranslationJob job(JobStatus status, String inputRef, String artifactRef) {
        TranslationJob job = new TranslationJob();
        job.setId(UUID.randomUUID());
        job.setStatus(status);
        job.setInputRef(inputRef);
        job.setArtifactRef(artifactRef);
        job.setExpiresAt(NOW.minusHours(1));
        return job;
    }
}
