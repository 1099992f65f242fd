package com.pdftranslator.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.pdftranslator.backend.entities.CreditLedgerEntry;
import com.pdftranslator.backend.enums.LedgerEntryType;

public interface CreditLedgerEntryRepository extends JpaRepository<CreditLedgerEntry, UUID> {

    Optional<CreditLedgerEntry> findByJobIdAndEntryType(UUID jobId, LedgerEntryType entryType);

    boolean existsByJobIdAndEntryType(UUID jobId, LedgerEntryType entryType);

    List<CreditLedgerEntry> findTop20ByOwnerIdOrderByCreatedAtDesc(Long ownerId);
}
