package com.pdftranslator.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.pdftranslator.backend.entities.JobPage;

public interface JobPageRepository extends JpaRepository<JobPage, UUID> {

    List<JobPage> findByJobIdOrderByPageIndexAsc(UUID jobId);

    Optional<JobPage> findByJobIdAndPageIndex(UUID jobId, int pageIndex);
}
