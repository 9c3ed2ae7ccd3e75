package com.flagship.classroom_ledger.tenant;

import java.util.Objects;
import java.util.UUID;

/**
 * Tenant (teacher/class) isolation boundary for a single call.
 *
 * Passed explicitly to every ledger, policy, enrollment and claim operation.
 * There is deliberately no thread-local "current tenant": a method that touches
 * tenant data without a scope parameter does not compile.
 *
 * @param tenantId identifier of the teacher/class grouping
 */
public record TenantScope(UUID tenantId) {

    public TenantScope {
        Objects.requireNonNull(tenantId, "tenantId is required");
    }

    public static TenantScope of(UUID tenantId) {
        return new TenantScope(tenantId);
    }

    public boolean owns(UUID otherTenantId) {
        return tenantId.equals(otherTenantId);
    }
}
