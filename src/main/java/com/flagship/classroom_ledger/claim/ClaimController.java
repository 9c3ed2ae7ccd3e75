package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.claim.dto.ClaimDecisionRequest;
import com.flagship.classroom_ledger.claim.dto.ClaimFailureResponse;
import com.flagship.classroom_ledger.claim.dto.ClaimResponse;
import com.flagship.classroom_ledger.claim.dto.CreateClaimRequest;
import com.flagship.classroom_ledger.claim.dto.FulfillmentRequest;
import com.flagship.classroom_ledger.observability.ClaimMetrics;
import com.flagship.classroom_ledger.observability.CorrelationContext;
import com.flagship.classroom_ledger.tenant.TenantScope;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Claim filing for students and review endpoints for teachers.
 *
 * Rule failures are answered with 422 and the full list of failure codes;
 * integrity violations and stale references go through the exception handler.
 */
@RestController
@RequestMapping("/api/claims")
@RequiredArgsConstructor
@Slf4j
public class ClaimController {

    private static final String TENANT_HEADER = "X-Tenant-ID";

    private final ClaimsEngine claimsEngine;
    private final ClaimMetrics metrics;

    @PostMapping
    public ResponseEntity<?> fileClaim(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Valid @RequestBody CreateClaimRequest request) {

        long startTime = System.currentTimeMillis();
        try {
            FileClaimRequest fileRequest = FileClaimRequest.builder()
                .subjectId(request.getSubjectId())
                .enrollmentId(request.getEnrollmentId())
                .details(request.toDetails())
                .incidentDate(request.getIncidentDate())
                .description(request.getDescription())
                .comments(request.getComments())
                .build();

            ClaimResult result = claimsEngine.file(fileRequest, TenantScope.of(tenantId));
            if (!result.isSuccess()) {
                return ResponseEntity.unprocessableEntity()
                    .body(ClaimFailureResponse.from("Claim cannot be filed", result));
            }

            MDC.put(CorrelationContext.CLAIM_ID_MDC_KEY, result.getClaim().getId().toString());
            log.info("Claim filed via API");
            return ResponseEntity.status(HttpStatus.CREATED).body(ClaimResponse.from(result.getClaim()));

        } finally {
            metrics.recordLatency("claim_file", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.CLAIM_ID_MDC_KEY);
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<ClaimResponse> getClaim(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID claimId) {
        return ResponseEntity.ok(ClaimResponse.from(claimsEngine.get(claimId, TenantScope.of(tenantId))));
    }

    /**
     * Lists claims of a subject when {@code subject_id} is given, otherwise
     * the claims in the given status (default PENDING, the review queue).
     */
    @GetMapping
    public ResponseEntity<List<ClaimResponse>> listClaims(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestParam(value = "status", defaultValue = "PENDING") ClaimStatus status,
            @RequestParam(value = "subject_id", required = false) UUID subjectId) {
        TenantScope scope = TenantScope.of(tenantId);
        List<Claim> claims = subjectId != null
            ? claimsEngine.listForSubject(subjectId, scope)
            : claimsEngine.listByStatus(status, scope);
        return ResponseEntity.ok(claims.stream().map(ClaimResponse::from).toList());
    }

    @PostMapping("/{id}/decision")
    public ResponseEntity<?> decide(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID claimId,
            @Valid @RequestBody ClaimDecisionRequest request) {

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.CLAIM_ID_MDC_KEY, claimId.toString());
        try {
            DecideClaimRequest decision = DecideClaimRequest.builder()
                .claimId(claimId)
                .reviewerId(request.getReviewerId())
                .outcome(request.getOutcome())
                .approvedAmount(request.getApprovedAmount())
                .notes(request.getNotes())
                .rejectionReason(request.getRejectionReason())
                .build();

            ClaimResult result = claimsEngine.decide(decision, TenantScope.of(tenantId));
            if (!result.isSuccess()) {
                return ResponseEntity.unprocessableEntity()
                    .body(ClaimFailureResponse.from("Claim cannot be approved", result));
            }
            return ResponseEntity.ok(ClaimResponse.from(result.getClaim()));

        } finally {
            metrics.recordLatency("claim_decide", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.CLAIM_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/fulfillment")
    public ResponseEntity<ClaimResponse> fulfill(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID claimId,
            @Valid @RequestBody FulfillmentRequest request) {
        MDC.put(CorrelationContext.CLAIM_ID_MDC_KEY, claimId.toString());
        try {
            Claim fulfilled = claimsEngine.fulfill(claimId, request.getReviewerId(), TenantScope.of(tenantId));
            return ResponseEntity.ok(ClaimResponse.from(fulfilled));
        } finally {
            MDC.remove(CorrelationContext.CLAIM_ID_MDC_KEY);
        }
    }
}
