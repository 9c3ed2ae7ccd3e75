package com.flagship.classroom_ledger.claim;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class FileClaimRequest {
    UUID subjectId;
    UUID enrollmentId;
    ClaimDetails details;
    Instant incidentDate;
    String description;
    String comments;
}
