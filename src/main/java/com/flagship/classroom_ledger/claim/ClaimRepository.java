package com.flagship.classroom_ledger.claim;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ClaimRepository extends JpaRepository<ClaimEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ClaimEntity c WHERE c.id = :id")
    Optional<ClaimEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Early check for an open or paid claim on the entry. The partial unique
     * index decides; this only gives a clearer answer before the insert.
     */
    boolean existsByLedgerEntryIdAndStatusNot(UUID ledgerEntryId, ClaimStatus status);

    boolean existsByPolicyId(UUID policyId);

    /**
     * Claims of the subject under the policy decided inside the rolling
     * window with one of the given statuses.
     */
    @Query("SELECT COUNT(c) FROM ClaimEntity c " +
           "WHERE c.tenantId = :tenantId AND c.subjectId = :subjectId AND c.policyId = :policyId " +
           "AND c.status IN :statuses AND c.decisionDate >= :since")
    long countDecidedSince(@Param("tenantId") UUID tenantId,
                           @Param("subjectId") UUID subjectId,
                           @Param("policyId") UUID policyId,
                           @Param("statuses") Collection<ClaimStatus> statuses,
                           @Param("since") Instant since);

    @Query("SELECT COALESCE(SUM(c.approvedAmount), 0) FROM ClaimEntity c " +
           "WHERE c.tenantId = :tenantId AND c.subjectId = :subjectId AND c.policyId = :policyId " +
           "AND c.status IN :statuses AND c.decisionDate >= :since")
    BigDecimal sumApprovedSince(@Param("tenantId") UUID tenantId,
                                @Param("subjectId") UUID subjectId,
                                @Param("policyId") UUID policyId,
                                @Param("statuses") Collection<ClaimStatus> statuses,
                                @Param("since") Instant since);

    List<ClaimEntity> findByTenantIdAndStatusOrderByFiledDateAsc(UUID tenantId, ClaimStatus status);

    List<ClaimEntity> findByTenantIdAndSubjectIdOrderByFiledDateDesc(UUID tenantId, UUID subjectId);

    /**
     * Monetary claims approved without a payout. Spans all tenants; used
     * only by the recovery job.
     */
    @Query("SELECT c.id FROM ClaimEntity c " +
           "WHERE c.status = com.flagship.classroom_ledger.claim.ClaimStatus.APPROVED " +
           "AND c.claimType <> com.flagship.classroom_ledger.policy.ClaimType.NON_MONETARY " +
           "AND c.payoutEntryId IS NULL ORDER BY c.decisionDate")
    List<UUID> findAwaitingPayoutIds(Pageable pageable);
}
