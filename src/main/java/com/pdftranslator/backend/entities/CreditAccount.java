package com.pdftranslator.backend.entities;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-owner page credit balance. Balance changes only through the ledger's conditional update
 * queries, never by setting the field on a loaded entity.
 */
@Entity
@Table(name = "credit_accounts")
@Getter
@Setter
public class CreditAccount {

    @Id
    @Column(name = "owner_id")
    private Long ownerId;

    @Column(name = "balance", nullable = false)
    private int balance;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
