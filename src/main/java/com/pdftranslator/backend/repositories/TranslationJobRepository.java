package com.pdftranslator.backend.repositories;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.pdftranslator.backend.entities.TranslationJob;
import com.pdftranslator.backend.enums.JobStatus;

public interface TranslationJobRepository extends JpaRepository<TranslationJob, UUID> {

    List<TranslationJob> findByStatusIn(Collection<JobStatus> statuses);

    List<TranslationJob> findByOrderByCreatedAtDesc(Pageable pageable);

    List<TranslationJob> findByExpiresAtLessThanEqualAndCleanedAtIsNull(LocalDateTime now);

    long countByStatus(JobStatus status);

    /**
     * Jobs that reached COMPLETED, whatever their status now. Expiry keeps {@code finishedAt} and
     * a completed job never has a failure reason.
     */
    long countByFinishedAtIsNotNullAndFailureReasonIsNull();

    /**
     * Jobs that reached FAILED, including the ones expired afterwards.
     */
    long countByFinishedAtIsNotNullAndFailureReasonIsNotNull();

    @Query("select coalesce(avg(j.pageCount), 0) from TranslationJob j")
    double averagePageCount();

    /**
     * Flags a job for cancellation without touching its version, so a running pipeline step does
     * not fail on an optimistic lock because of it.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update TranslationJob j
            set j.cancelRequested = true
            where j.id = :id
            and j.status not in :terminal
            """)
    int markCancelRequested(@Param("id") UUID id, @Param("terminal") Collection<JobStatus> terminal);
}
