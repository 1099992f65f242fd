package com.pdftranslator.backend.services.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.FailureReason;
import com.pdftranslator.backend.enums.JobStatus;

class JobStateMachineTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final JobStateMachine stateMachine = new JobStateMachine(clock);

    @Test
    void canTransition_pipelineAdvancesOneStepAtATime() {
        assertThat(JobStateMachine.canTransition(JobStatus.CREATED, JobStatus.VALIDATING)).isTrue();
        assertThat(JobStateMachine.canTransition(JobStatus.VALIDATING, JobStatus.EXTRACTING)).isTrue();
        assertThat(JobStateMachine.canTransition(JobStatus.EXTRACTING, JobStatus.TRANSLATING)).isTrue();
        assertThat(JobStateMachine.canTransition(JobStatus.TRANSLATING, JobStatus.RECONSTRUCTING)).isTrue();
        assertThat(JobStateMachine.canTransition(JobStatus.RECONSTRUCTING, JobStatus.COMPLETED)).isTrue();

        assertThat(JobStateMachine.canTransition(JobStatus.CREATED, JobStatus.EXTRACTING)).isFalse();
        assertThat(JobStateMachine.canTransition(JobStatus.TRANSLATING, JobStatus.EXTRACTING)).isFalse();
        assertThat(JobStateMachine.canTransition(JobStatus.VALIDATING, JobStatus.CREATED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"CREATED", "VALIDATING", "EXTRACTING", "TRANSLATING", "RECONSTRUCTING"})
    void canTransition_failedReachableFromEveryPipelineState(JobStatus from) {
        assertThat(JobStateMachine.canTransition(from, JobStatus.FAILED)).isTrue();
    }

    @Test
    void canTransition_terminalStatesOnlyMoveToExpired() {
        for (JobStatus terminal : new JobStatus[]{JobStatus.COMPLETED, JobStatus.FAILED}) {
            for (JobStatus to : JobStatus.values()) {
                assertThat(JobStateMachine.canTransition(terminal, to)).isEqualTo(to == JobStatus.EXPIRED);
            }
        }
        for (JobStatus to : JobStatus.values()) {
            assertThat(JobStateMachine.canTransition(JobStatus.EXPIRED, to)).isFalse();
        }
    }

    @Test
    void transition_stampsStartAndFinishTimes() {
        TranslationJob job = job(JobStatus.CREATED);

        stateMachine.transition(job, JobStatus.VALIDATING);
        assertThat(job.getStartedAt()).isEqualTo(LocalDateTime.of(2026, 3, 1, 10, 0));

        job.setFailureReason(FailureReason.UNSUPPORTED_DOCUMENT);
        stateMachine.transition(job, JobStatus.FAILED);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getFinishedAt()).isNotNull();
    }

    @Test
    void transition_completedRequiresArtifact_failedRequiresReason() {
        TranslationJob reconstructing = job(JobStatus.RECONSTRUCTING);
        assertThatThrownBy(() -> stateMachine.transition(reconstructing, JobStatus.COMPLETED))
                .isInstanceOf(IllegalStateException.class);

        TranslationJob extracting = job(JobStatus.EXTRACTING);
        assertThatThrownBy(() -> stateMachine.transition(extracting, JobStatus.FAILED))
                .isInstanceOf(IllegalStateException.class);

        reconstructing.setArtifactRef("job/translated.pdf");
        stateMachine.transition(reconstructing, JobStatus.COMPLETED);
        assertThat(reconstructing.getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void transition_illegalMove_leavesJobUntouched() {
        TranslationJob job = job(JobStatus.COMPLETED);
        job.setArtifactRef("job/translated.pdf");

        assertThatThrownBy(() -> stateMachine.transition(job, JobStatus.TRANSLATING))
                .isInstanceOf(IllegalStateException.class);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    private static TranslationJob job(JobStatus status) {
        TranslationJob job = new TranslationJob();
        job.setId(UUID.randomUUID());
        job.setStatus(status);
        return job;
    }
}
