package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.exception.ConstraintViolations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Claim} and {@link ClaimEntity}. Only joins a transaction
 * opened by the claims engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimPersistenceService {

    static final String ACTIVE_LEDGER_ENTRY_CONSTRAINT = "uq_claims_active_ledger_entry";

    private final ClaimRepository claimRepository;

    /**
     * Inserts and flushes immediately so a second open claim on the same
     * ledger entry fails here, inside the engine, rather than at commit.
     *
     * @throws TransactionAlreadyClaimedException if the one-claim-per-entry index rejects the row
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Claim insert(Claim claim) {
        try {
            ClaimEntity saved = claimRepository.saveAndFlush(ClaimEntity.fromDomain(claim));
            log.debug("Inserted claim {}", saved.getId());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolations.isViolationOf(e, ACTIVE_LEDGER_ENTRY_CONSTRAINT)) {
                throw new TransactionAlreadyClaimedException(claim.getLedgerEntryId(), e);
            }
            throw e;
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Claim update(Claim claim) {
        ClaimEntity existing = claimRepository.findById(claim.getId())
            .orElseThrow(() -> new ClaimNotFoundException(claim.getId()));
        existing.updateFromDomain(claim);
        ClaimEntity updated = claimRepository.save(existing);
        log.debug("Updated claim {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    /**
     * Loads the claim with a row lock held until the caller commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Claim> findForUpdate(UUID claimId) {
        return claimRepository.findByIdForUpdate(claimId).map(ClaimEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Claim> findById(UUID claimId) {
        return claimRepository.findById(claimId).map(ClaimEntity::toDomain);
    }

    /**
     * Early answer for one-claim-per-entry. Not a guarantee: two callers can
     * both see false, and the unique index then rejects the second insert.
     */
    @Transactional(readOnly = true)
    public boolean hasActiveClaimOn(UUID ledgerEntryId) {
        return claimRepository.existsByLedgerEntryIdAndStatusNot(ledgerEntryId, ClaimStatus.REJECTED);
    }

    /**
     * Approved or paid claims of the subject under the policy decided at or
     * after {@code since}.
     */
    @Transactional(readOnly = true)
    public long countTowardsLimitSince(UUID tenantId, UUID subjectId, UUID policyId, Instant since) {
        return claimRepository.countDecidedSince(tenantId, subjectId, policyId,
                ClaimStatus.countedTowardsLimit(), since);
    }

    @Transactional(readOnly = true)
    public BigDecimal sumApprovedSince(UUID tenantId, UUID subjectId, UUID policyId, Instant since) {
        BigDecimal sum = claimRepository.sumApprovedSince(tenantId, subjectId, policyId,
                ClaimStatus.countedTowardsLimit(), since);
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public List<Claim> findByStatus(UUID tenantId, ClaimStatus status) {
        return claimRepository.findByTenantIdAndStatusOrderByFiledDateAsc(tenantId, status)
            .stream()
            .map(ClaimEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Claim> findBySubject(UUID tenantId, UUID subjectId) {
        return claimRepository.findByTenantIdAndSubjectIdOrderByFiledDateDesc(tenantId, subjectId)
            .stream()
            .map(ClaimEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> findAwaitingPayout(int limit) {
        return claimRepository.findAwaitingPayoutIds(PageRequest.of(0, limit));
    }
}
