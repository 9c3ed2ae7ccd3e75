package com.flagship.classroom_ledger.enrollment;

import com.flagship.classroom_ledger.enrollment.dto.EnrollRequest;
import com.flagship.classroom_ledger.enrollment.dto.EnrollmentResponse;
import com.flagship.classroom_ledger.tenant.TenantScope;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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
 * Purchase and cancellation endpoints, plus manual billing updates for
 * teachers who do not run the billing producer.
 */
@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
public class EnrollmentController {

    private static final String TENANT_HEADER = "X-Tenant-ID";

    private final EnrollmentService enrollmentService;

    @PostMapping
    public ResponseEntity<EnrollmentResponse> enroll(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Valid @RequestBody EnrollRequest request) {
        Enrollment enrollment = enrollmentService.enroll(request.getSubjectId(), request.getPolicyId(),
                TenantScope.of(tenantId));
        return ResponseEntity.status(HttpStatus.CREATED).body(EnrollmentResponse.from(enrollment));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EnrollmentResponse> getEnrollment(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.from(enrollmentService.get(enrollmentId, TenantScope.of(tenantId))));
    }

    @GetMapping
    public ResponseEntity<List<EnrollmentResponse>> listForSubject(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestParam("subject_id") UUID subjectId) {
        return ResponseEntity.ok(enrollmentService.listForSubject(subjectId, TenantScope.of(tenantId))
            .stream()
            .map(EnrollmentResponse::from)
            .toList());
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<EnrollmentResponse> recordPayment(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.from(
                enrollmentService.recordPayment(enrollmentId, TenantScope.of(tenantId))));
    }

    @PostMapping("/{id}/missed-payments")
    public ResponseEntity<EnrollmentResponse> markUnpaid(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.from(
                enrollmentService.markUnpaid(enrollmentId, TenantScope.of(tenantId))));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<EnrollmentResponse> cancel(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.from(
                enrollmentService.cancel(enrollmentId, TenantScope.of(tenantId))));
    }
}
