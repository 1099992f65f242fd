package com.pdftranslator.backend.services.credits;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.pdftranslator.backend.entities.CreditAccount;
import com.pdftranslator.backend.entities.CreditLedgerEntry;
import com.pdftranslator.backend.enums.LedgerEntryType;
import com.pdftranslator.backend.exceptions.BadRequestException;
import com.pdftranslator.backend.exceptions.InsufficientCreditsException;
import com.pdftranslator.backend.repositories.CreditAccountRepository;
import com.pdftranslator.backend.repositories.CreditLedgerEntryRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-owner credit balances. The balance only changes together with a ledger entry, and a job can
 * have at most one debit and one refund no matter how often either is requested.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditLedgerService {

    private final CreditAccountRepository accountRepository;
    private final CreditLedgerEntryRepository ledgerRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public int balance(Long ownerId) {
        return accountRepository.findById(ownerId).map(CreditAccount::getBalance).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<CreditLedgerEntry> history(Long ownerId) {
        return ledgerRepository.findTop20ByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    @Transactional(readOnly = true)
    public boolean isDebited(UUID jobId) {
        return ledgerRepository.existsByJobIdAndEntryType(jobId, LedgerEntryType.DEBIT);
    }

    @Transactional(readOnly = true)
    public boolean isRefunded(UUID jobId) {
        return ledgerRepository.existsByJobIdAndEntryType(jobId, LedgerEntryType.REFUND);
    }

    @Transactional
    public CreditLedgerEntry grant(Long ownerId, int amount, String note, String externalRef) {
        if (ownerId == null) {
            throw new BadRequestException("ownerId is required");
        }
        if (amount <= 0) {
            throw new BadRequestException("Grant amount must be positive");
        }

        ensureAccount(ownerId);
        accountRepository.credit(ownerId, amount, now());

        CreditLedgerEntry entry = newEntry(ownerId, LedgerEntryType.GRANT, amount, null);
        entry.setNote(note);
        entry.setExternalRef(externalRef);
        CreditLedgerEntry saved = ledgerRepository.save(entry);
        log.info("[Credits] Granted ownerId={} amount={} externalRef={}", ownerId, amount, externalRef);
        return saved;
    }

    /**
     * Debits {@code amount} for a job. Joins the caller's transaction so the debit commits together
     * with the job's acceptance. A second call for the same job returns the existing entry.
     */
    @Transactional
    public CreditLedgerEntry debit(Long ownerId, int amount, UUID jobId) {
        Optional<CreditLedgerEntry> existing = ledgerRepository.findByJobIdAndEntryType(jobId, LedgerEntryType.DEBIT);
        if (existing.isPresent()) {
            log.info("[Credits] Debit already recorded jobId={} amount={}", jobId, existing.get().getAmount());
            return existing.get();
        }

        int updated = accountRepository.debitIfSufficient(ownerId, amount, now());
        if (updated == 0) {
            throw new InsufficientCreditsException(ownerId, amount, balance(ownerId));
        }

        CreditLedgerEntry saved = ledgerRepository.saveAndFlush(newEntry(ownerId, LedgerEntryType.DEBIT, amount, jobId));
        log.info("[Credits] Debited ownerId={} amount={} jobId={}", ownerId, amount, jobId);
        return saved;
    }

    /**
     * Returns a job's debit to its owner. No-op when nothing was debited or the refund already exists.
     */
    @Transactional
    public Optional<CreditLedgerEntry> refund(UUID jobId) {
        Optional<CreditLedgerEntry> debit = ledgerRepository.findByJobIdAndEntryType(jobId, LedgerEntryType.DEBIT);
        if (debit.isEmpty()) {
            return Optional.empty();
        }

        Optional<CreditLedgerEntry> existing = ledgerRepository.findByJobIdAndEntryType(jobId, LedgerEntryType.REFUND);
        if (existing.isPresent()) {
            log.info("[Credits] Refund already recorded jobId={}", jobId);
            return existing;
        }

        CreditLedgerEntry d = debit.get();
        accountRepository.credit(d.getOwnerId(), d.getAmount(), now());
        CreditLedgerEntry saved = ledgerRepository.saveAndFlush(newEntry(d.getOwnerId(), LedgerEntryType.REFUND, d.getAmount(), jobId));
        log.info("[Credits] Refunded ownerId={} amount={} jobId={}", d.getOwnerId(), d.getAmount(), jobId);
        return Optional.of(saved);
    }

    @Transactional
    public CreditAccount ensureAccount(Long ownerId) {
        return accountRepository.findById(ownerId).orElseGet(() -> {
            CreditAccount account = new CreditAccount();
            account.setOwnerId(ownerId);
            account.setBalance(0);
            account.setCreatedAt(now());
            account.setUpdatedAt(now());
            return accountRepository.saveAndFlush(account);
        });
    }

    private CreditLedgerEntry newEntry(Long ownerId, LedgerEntryType type, int amount, UUID jobId) {
        CreditLedgerEntry entry = new CreditLedgerEntry();
        entry.setOwnerId(ownerId);
        entry.setEntryType(type);
        entry.setAmount(amount);
        entry.setJobId(jobId);
        entry.setCreatedAt(now());
        return entry;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
