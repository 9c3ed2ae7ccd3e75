package com.flagship.classroom_ledger.exception;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * Identifies which database constraint a failed insert or update hit.
 */
public final class ConstraintViolations {

    private ConstraintViolations() {
        // Utility class
    }

    /**
     * @return true if {@code e} was caused by the named unique index or constraint
     */
    public static boolean isViolationOf(DataIntegrityViolationException e, String constraintName) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof org.hibernate.exception.ConstraintViolationException cve
                    && cve.getConstraintName() != null) {
                return cve.getConstraintName().equalsIgnoreCase(constraintName);
            }
            String message = current.getMessage();
            if (message != null && message.contains(constraintName)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
