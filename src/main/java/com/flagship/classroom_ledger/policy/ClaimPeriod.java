package com.flagship.classroom_ledger.policy;

import java.time.Duration;
import java.time.Instant;

/**
 * Rolling window used to count claims against {@code maxClaimsCount} and
 * payouts against {@code maxPayoutPerPeriod}. Windows end at "now" and are
 * not aligned to calendar months or school terms.
 */
public enum ClaimPeriod {
    MONTH(30),
    SEMESTER(126),
    YEAR(365);

    private final int days;

    ClaimPeriod(int days) {
        this.days = days;
    }

    public Duration length() {
        return Duration.ofDays(days);
    }

    public Instant windowStart(Instant now) {
        return now.minus(length());
    }
}
