package com.pdftranslator.backend.entities;

import java.time.LocalDateTime;
import java.util.UUID;

import com.pdftranslator.backend.enums.LedgerEntryType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "credit_ledger",
        uniqueConstraints = {
                // At most one debit and one refund per job.
                @UniqueConstraint(name = "uk_credit_ledger_job_type", columnNames = {"job_id", "entry_type"})
        },
        indexes = {
                @Index(name = "idx_credit_ledger_owner", columnList = "owner_id")
        })
@Getter
@Setter
public class CreditLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 16)
    private LedgerEntryType entryType;

    @Column(name = "amount", nullable = false)
    private int amount;

    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "external_ref")
    private String externalRef;

    @Column(name = "note", length = 500)
    private String note;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
