package com.pdftranslator.backend.services.jobs;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.core.task.TaskRejectedException;

import com.pdftranslator.backend.config.TranslatorProperties;
import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.JobStatus;
import com.pdftranslator.backend.repositories.TranslationJobRepository;

@ExtendWith(MockitoExtension.class)
class JobRecoveryRunnerTest {

    @Mock
    TranslationJobRepository jobRepository;

    @Mock
    TranslationJobRunner runner;

    private final TranslatorProperties properties = new TranslatorProperties();

    @Test
    void run_requeuesEveryUnfinishedJob_evenWhenOneIsRejected() {
        TranslationJob first = job(JobStatus.TRANSLATING);
        TranslationJob second = job(JobStatus.VALIDATING);
        when(jobRepository.findByStatusIn(any())).thenReturn(List.of(first, second));
        doThrow(new TaskRejectedException("full")).when(runner).start(first.getId());

        new JobRecoveryRunner(jobRepository, runner, properties).run(new DefaultApplicationArguments());

        verify(runner).start(first.getId());
        verify(runner).start(second.getId());
    }

    @Test
    void run_disabled_touchesNothing() {
        properties.getWorker().setRecoverOnStartup(false);

        new JobRecoveryRunner(jobRepository, runner, properties).run(new DefaultApplicationArguments());

        verifyNoInteractions(jobRepository, runner);
    }

    @Test
    void run_nothingUnfinished_startsNothing() {
        when(jobRepository.findByStatusIn(any())).thenReturn(List.of());

        new JobRecoveryRunner(jobRepository, runner, properties).run(new DefaultApplicationArguments());

        verify(runner, never()).start(any());
    }

    private static TranslationJob job(JobStatus status) {
        TranslationJob job = new TranslationJob();
        job.setId(UUID.randomUUID());
        job.setStatus(status);
        return job;
    }
}
