package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Finds monetary claims left APPROVED without a payout and writes it.
 *
 * The decision itself never leaves this state behind; it only shows up after
 * an interrupted external writer or in imported data. Each claim is resumed
 * in its own transaction so one bad row does not block the rest.
 */
@Component
@ConditionalOnProperty(name = "claims.recovery.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ClaimRecoveryService {

    private final ClaimPersistenceService persistence;
    private final ClaimsEngine claimsEngine;

    @Value("${claims.recovery.batch-size:50}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${claims.recovery.interval-ms:60000}")
    public void resumeStalledPayouts() {
        List<UUID> claimIds;
        try {
            claimIds = persistence.findAwaitingPayout(batchSize);
        } catch (Exception e) {
            log.error("Error scanning for claims awaiting payout", e);
            return;
        }

        if (claimIds.isEmpty()) {
            return;
        }
        log.warn("Found {} approved claims without payout", claimIds.size());

        for (UUID claimId : claimIds) {
            resume(claimId);
        }
    }

    /**
     * @return true if the claim ended up PAID
     */
    public boolean resume(UUID claimId) {
        MDC.put(CorrelationContext.CLAIM_ID_MDC_KEY, claimId.toString());
        try {
            Claim claim = claimsEngine.resumePayout(claimId);
            return claim.getStatus() == ClaimStatus.PAID;
        } catch (Exception e) {
            log.error("Failed to resume payout for claim {}", claimId, e);
            return false;
        } finally {
            MDC.remove(CorrelationContext.CLAIM_ID_MDC_KEY);
        }
    }
}
