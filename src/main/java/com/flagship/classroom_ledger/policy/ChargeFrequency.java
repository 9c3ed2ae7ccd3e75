package com.flagship.classroom_ledger.policy;

import java.time.Duration;

public enum ChargeFrequency {
    WEEKLY(7),
    BIWEEKLY(14),
    MONTHLY(30);

    private final int days;

    ChargeFrequency(int days) {
        this.days = days;
    }

    public Duration interval() {
        return Duration.ofDays(days);
    }
}
