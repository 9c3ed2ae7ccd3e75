package com.flagship.classroom_ledger.exception;

/**
 * Base class for data-integrity failures.
 *
 * These indicate a bug or tampering rather than a business rule that the
 * caller can satisfy by changing input, so they short-circuit validation,
 * are always written to the audit log and must not be retried blindly.
 */
public abstract class IntegrityViolationException extends RuntimeException {

    protected IntegrityViolationException(String message) {
        super(message);
    }

    protected IntegrityViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable code reported to callers.
     */
    public abstract String getCode();
}
