package com.flagship.classroom_ledger.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.enrollment.Enrollment;
import com.flagship.classroom_ledger.enrollment.EnrollmentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EnrollmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("subject_id")
    UUID subjectId;

    @JsonProperty("policy_id")
    UUID policyId;

    @JsonProperty("status")
    EnrollmentStatus status;

    @JsonProperty("purchase_date")
    Instant purchaseDate;

    @JsonProperty("cancel_date")
    Instant cancelDate;

    @JsonProperty("last_payment_date")
    Instant lastPaymentDate;

    @JsonProperty("next_payment_due")
    Instant nextPaymentDue;

    @JsonProperty("coverage_start_date")
    Instant coverageStartDate;

    @JsonProperty("payment_current")
    boolean paymentCurrent;

    @JsonProperty("days_unpaid")
    int daysUnpaid;

    @JsonProperty("premium_entry_id")
    UUID premiumEntryId;

    public static EnrollmentResponse from(Enrollment enrollment) {
        return EnrollmentResponse.builder()
            .id(enrollment.getId())
            .subjectId(enrollment.getSubjectId())
            .policyId(enrollment.getPolicyId())
            .status(enrollment.getStatus())
            .purchaseDate(enrollment.getPurchaseDate())
            .cancelDate(enrollment.getCancelDate())
            .lastPaymentDate(enrollment.getLastPaymentDate())
            .nextPaymentDue(enrollment.getNextPaymentDue())
            .coverageStartDate(enrollment.getCoverageStartDate())
            .paymentCurrent(enrollment.isPaymentCurrent())
            .daysUnpaid(enrollment.getDaysUnpaid())
            .premiumEntryId(enrollment.getPremiumEntryId())
            .build();
    }
}
