package com.flagship.classroom_ledger.tenant;

import com.flagship.classroom_ledger.exception.IntegrityViolationException;
import lombok.Getter;

import java.util.UUID;

/**
 * An operation reached an entity stored under a different tenant than the
 * scope it was invoked with.
 */
@Getter
public class CrossTenantViolationException extends IntegrityViolationException {

    private final String entityType;
    private final UUID entityId;
    private final UUID requestedTenantId;

    public CrossTenantViolationException(String entityType, UUID entityId, UUID requestedTenantId) {
        super(String.format("%s %s is not visible in tenant %s", entityType, entityId, requestedTenantId));
        this.entityType = entityType;
        this.entityId = entityId;
        this.requestedTenantId = requestedTenantId;
    }

    @Override
    public String getCode() {
        return "CROSS_TENANT_VIOLATION";
    }
}
