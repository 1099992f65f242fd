package com.pdftranslator.backend.repositories;

import java.time.LocalDateTime;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.pdftranslator.backend.entities.CreditAccount;

public interface CreditAccountRepository extends JpaRepository<CreditAccount, Long> {

    /**
     * Conditional debit; returns 0 when the balance would go negative.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CreditAccount a
            set a.balance = a.balance - :amount, a.updatedAt = :now
            where a.ownerId = :ownerId
            and a.balance >= :amount
            """)
    int debitIfSufficient(@Param("ownerId") Long ownerId, @Param("amount") int amount, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CreditAccount a
            set a.balance = a.balance + :amount, a.updatedAt = :now
            where a.ownerId = :ownerId
            """)
    int credit(@Param("ownerId") Long ownerId, @Param("amount") int amount, @Param("now") LocalDateTime now);
}
