package com.flagship.classroom_ledger.enrollment;

import lombok.Getter;

import java.util.UUID;

@Getter
public class AlreadyEnrolledException extends RuntimeException {

    private final UUID subjectId;
    private final UUID policyId;

    public AlreadyEnrolledException(UUID subjectId, UUID policyId) {
        super(String.format("Subject %s already holds policy %s", subjectId, policyId));
        this.subjectId = subjectId;
        this.policyId = policyId;
    }
}
