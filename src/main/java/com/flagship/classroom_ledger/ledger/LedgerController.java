package com.flagship.classroom_ledger.ledger;

import com.flagship.classroom_ledger.ledger.dto.BalanceResponse;
import com.flagship.classroom_ledger.ledger.dto.CreateLedgerEntryRequest;
import com.flagship.classroom_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.classroom_ledger.ledger.dto.VoidEntryRequest;
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
import java.util.Optional;
import java.util.UUID;

/**
 * REST endpoints for the ledger, used by the payroll, store and admin
 * producers.
 *
 * Appends are idempotent when an {@code Idempotency-Key} header is sent: a
 * replay returns 200 with the entry written by the first call.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    static final String TENANT_HEADER = "X-Tenant-ID";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerService ledgerService;
    private final IdempotencyService idempotencyService;
    private final ClaimMetrics metrics;

    @PostMapping("/entries")
    public ResponseEntity<LedgerEntryResponse> appendEntry(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateLedgerEntryRequest request) {

        long startTime = System.currentTimeMillis();
        TenantScope scope = TenantScope.of(tenantId);

        try {
            if (idempotencyKey != null) {
                Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
                if (existingId.isPresent()) {
                    metrics.recordIdempotencyHit();
                    MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, existingId.get().toString());
                    log.info("Idempotency key already used, returning existing entry");
                    return ResponseEntity.ok(LedgerEntryResponse.from(ledgerService.get(existingId.get(), scope)));
                }
                metrics.recordIdempotencyMiss();
            }

            AppendEntryRequest append = AppendEntryRequest.builder()
                .tenantId(request.getTenantId() != null ? request.getTenantId() : tenantId)
                .subjectId(request.getSubjectId())
                .amount(request.getAmount())
                .bucket(request.getBucket() != null ? request.getBucket() : AccountBucket.CHECKING)
                .kind(request.getKind())
                .description(request.getDescription())
                .availableAt(request.getAvailableAt())
                .idempotencyKey(idempotencyKey)
                .build();

            LedgerEntry entry = ledgerService.append(append, scope);
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entry.getId().toString());

            if (idempotencyKey != null) {
                idempotencyService.storeIdempotencyKey(idempotencyKey, entry.getId());
            }

            return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));

        } finally {
            metrics.recordLatency("ledger_append", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    @PostMapping("/entries/{id}/void")
    public ResponseEntity<LedgerEntryResponse> voidEntry(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID entryId,
            @Valid @RequestBody VoidEntryRequest request) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            LedgerEntry voided = ledgerService.voidEntry(entryId, request.getActorId(), TenantScope.of(tenantId));
            return ResponseEntity.ok(LedgerEntryResponse.from(voided));
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    @GetMapping("/entries/{id}")
    public ResponseEntity<LedgerEntryResponse> getEntry(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID entryId) {
        return ResponseEntity.ok(LedgerEntryResponse.from(ledgerService.get(entryId, TenantScope.of(tenantId))));
    }

    @GetMapping("/subjects/{subjectId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("subjectId") UUID subjectId,
            @RequestParam(value = "bucket", defaultValue = "CHECKING") AccountBucket bucket) {
        TenantScope scope = TenantScope.of(tenantId);
        return ResponseEntity.ok(new BalanceResponse(
            subjectId,
            bucket,
            ledgerService.currentBalance(subjectId, bucket, scope),
            ledgerService.availableBalance(subjectId, bucket, scope)
        ));
    }

    @GetMapping("/subjects/{subjectId}/entries")
    public ResponseEntity<List<LedgerEntryResponse>> listEntries(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("subjectId") UUID subjectId) {
        List<LedgerEntryResponse> entries = ledgerService.listForSubject(subjectId, TenantScope.of(tenantId))
            .stream()
            .map(LedgerEntryResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }
}
