package com.flagship.classroom_ledger.tenant;

import com.flagship.classroom_ledger.observability.AuditLogger;
import com.flagship.classroom_ledger.observability.ClaimMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Rejects any read or write whose target lives in another tenant.
 *
 * Every service calls the guard right after loading an entity and before any
 * other validation, so a cross-tenant reference never reaches business rules
 * and never leads to a write. The guard has no side effects besides the audit
 * record and the violation counter.
 */
@Component
@RequiredArgsConstructor
public class TenantGuard {

    private final AuditLogger auditLogger;
    private final ClaimMetrics claimMetrics;

    /**
     * Checks a loaded entity against the caller's scope.
     *
     * @return the same entity, for fluent use after a repository lookup
     * @throws CrossTenantViolationException if the tenants differ
     */
    public <T extends TenantOwned> T check(TenantScope scope, String entityType, T entity) {
        checkTenant(scope, entityType, entity.getId(), entity.getTenantId());
        return entity;
    }

    /**
     * Checks every entity of a relation (claim, enrollment, policy, ledger
     * entry) before anything referencing them is persisted. Null entries are
     * skipped so optional references can be passed as-is.
     */
    public void checkRelated(TenantScope scope, TenantOwned... entities) {
        for (TenantOwned entity : entities) {
            if (entity != null) {
                check(scope, entity.getClass().getSimpleName(), entity);
            }
        }
    }

    /**
     * Checks a raw tenant id, for requests that carry a tenant before any
     * entity exists (appending a ledger entry, creating a policy).
     */
    public void checkTenant(TenantScope scope, String entityType, UUID entityId, UUID storedTenantId) {
        if (scope == null) {
            throw new IllegalArgumentException("Tenant scope is required");
        }
        if (!scope.owns(storedTenantId)) {
            CrossTenantViolationException violation =
                    new CrossTenantViolationException(entityType, entityId, scope.tenantId());
            auditLogger.integrityViolation(violation.getCode(), scope.tenantId(), entityType, entityId,
                    "stored tenant " + storedTenantId);
            claimMetrics.recordIntegrityViolation(violation.getCode());
            throw violation;
        }
    }
}
