package com.pdftranslator.backend.services.jobs;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Component;

import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.JobStatus;

import lombok.RequiredArgsConstructor;

/**
 * The only place a job's status changes.
 *
 * Pipeline states advance one step at a time and never go back. {@code FAILED} can be entered from
 * any non-terminal state, {@code EXPIRED} from any state but itself. {@code COMPLETED} needs an
 * artifact reference and {@code FAILED} a failure reason, so neither is ever observed without them.
 */
@Component
@RequiredArgsConstructor
public class JobStateMachine {

    private final Clock clock;

    public static boolean canTransition(JobStatus from, JobStatus to) {
        if (from == null || to == null || from == to) return false;
        return switch (to) {
            case CREATED -> false;
            case FAILED -> !from.isTerminal();
            case EXPIRED -> true;
            default -> !from.isTerminal() && to.rank() == from.rank() + 1;
        };
    }

    public void transition(TranslationJob job, JobStatus to) {
        JobStatus from = job.getStatus();
        if (!canTransition(from, to)) {
            throw new IllegalStateException("Illegal job transition " + from + " -> " + to + " for job " + job.getId());
        }
        if (to == JobStatus.COMPLETED && (job.getArtifactRef() == null || job.getArtifactRef().isBlank())) {
            throw new IllegalStateException("Job " + job.getId() + " cannot complete without an artifact");
        }
        if (to == JobStatus.FAILED && job.getFailureReason() == null) {
            throw new IllegalStateException("Job " + job.getId() + " cannot fail without a reason");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        job.setStatus(to);
        job.setUpdatedAt(now);
        if (to == JobStatus.VALIDATING && job.getStartedAt() == null) {
            job.setStartedAt(now);
        }
        if ((to == JobStatus.COMPLETED || to == JobStatus.FAILED) && job.getFinishedAt() == null) {
            job.setFinishedAt(now);
        }
    }
}
