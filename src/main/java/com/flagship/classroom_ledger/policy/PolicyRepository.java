package com.flagship.classroom_ledger.policy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PolicyRepository extends JpaRepository<PolicyEntity, UUID> {

    List<PolicyEntity> findByTenantIdAndActiveTrueOrderByTitleAsc(UUID tenantId);

    List<PolicyEntity> findByTenantIdOrderByTitleAsc(UUID tenantId);

    boolean existsByTenantIdAndPolicyCode(UUID tenantId, String policyCode);
}
