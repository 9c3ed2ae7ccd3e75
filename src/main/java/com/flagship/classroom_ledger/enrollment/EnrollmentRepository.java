package com.flagship.classroom_ledger.enrollment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EnrollmentRepository extends JpaRepository<EnrollmentEntity, UUID> {

    /**
     * Row lock held until the transaction ends. Serializes billing updates
     * against claim decisions and concurrent approvals under one enrollment.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM EnrollmentEntity e WHERE e.id = :id")
    Optional<EnrollmentEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByTenantIdAndSubjectIdAndPolicyIdAndStatusIn(
            UUID tenantId, UUID subjectId, UUID policyId, Collection<EnrollmentStatus> statuses);

    Optional<EnrollmentEntity> findFirstByTenantIdAndSubjectIdAndPolicyIdAndStatusOrderByCancelDateDesc(
            UUID tenantId, UUID subjectId, UUID policyId, EnrollmentStatus status);

    List<EnrollmentEntity> findByTenantIdAndSubjectIdAndStatus(UUID tenantId, UUID subjectId, EnrollmentStatus status);

    List<EnrollmentEntity> findByTenantIdAndSubjectIdOrderByPurchaseDateDesc(UUID tenantId, UUID subjectId);
}
