package com.flagship.classroom_ledger.tenant;

import java.util.UUID;

/**
 * Anything persisted by the ledger core carries the tenant it belongs to.
 */
public interface TenantOwned {

    UUID getId();

    UUID getTenantId();
}
