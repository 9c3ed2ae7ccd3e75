package com.flagship.classroom_ledger.ledger;

import java.math.BigDecimal;

/**
 * What produced a ledger entry, and the sign its amount must carry.
 */
public enum EntryKind {
    DEPOSIT(AmountRule.CREDIT),
    PAYROLL(AmountRule.CREDIT),
    BONUS(AmountRule.CREDIT),
    INTEREST(AmountRule.CREDIT),
    PAYOUT(AmountRule.CREDIT),
    FEE(AmountRule.DEBIT),
    PURCHASE(AmountRule.DEBIT),
    INSURANCE_PREMIUM(AmountRule.DEBIT),
    TRANSFER(AmountRule.NON_ZERO),
    ADJUSTMENT(AmountRule.ANY);

    public enum AmountRule {
        /** strictly positive */
        CREDIT,
        /** strictly negative */
        DEBIT,
        /** either sign, never zero */
        NON_ZERO,
        /** zero allowed (corrections that only carry a description) */
        ANY
    }

    private final AmountRule amountRule;

    EntryKind(AmountRule amountRule) {
        this.amountRule = amountRule;
    }

    public AmountRule amountRule() {
        return amountRule;
    }

    /**
     * @return true if {@code amount} has an acceptable sign for this kind
     */
    public boolean accepts(BigDecimal amount) {
        if (amount == null) {
            return false;
        }
        int sign = amount.signum();
        return switch (amountRule) {
            case CREDIT -> sign > 0;
            case DEBIT -> sign < 0;
            case NON_ZERO -> sign != 0;
            case ANY -> true;
        };
    }
}
