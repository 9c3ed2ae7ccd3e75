package com.flagship.classroom_ledger.policy;

import com.flagship.classroom_ledger.policy.dto.PolicyRequest;
import com.flagship.classroom_ledger.policy.dto.PolicyResponse;
import com.flagship.classroom_ledger.tenant.TenantScope;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/policies")
@RequiredArgsConstructor
public class PolicyController {

    private static final String TENANT_HEADER = "X-Tenant-ID";

    private final PolicyCatalogService catalogService;

    @PostMapping
    public ResponseEntity<PolicyResponse> createPolicy(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Valid @RequestBody PolicyRequest request) {
        Policy policy = catalogService.create(request, TenantScope.of(tenantId));
        return ResponseEntity.status(HttpStatus.CREATED).body(PolicyResponse.from(policy));
    }

    @GetMapping
    public ResponseEntity<List<PolicyResponse>> listPolicies(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestParam(value = "include_inactive", defaultValue = "false") boolean includeInactive) {
        TenantScope scope = TenantScope.of(tenantId);
        List<Policy> policies = includeInactive ? catalogService.listAll(scope) : catalogService.listActive(scope);
        return ResponseEntity.ok(policies.stream().map(PolicyResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PolicyResponse> getPolicy(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID policyId) {
        return ResponseEntity.ok(PolicyResponse.from(catalogService.get(policyId, TenantScope.of(tenantId))));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PolicyResponse> updatePolicy(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID policyId,
            @Valid @RequestBody PolicyRequest request) {
        Policy policy = catalogService.updateTerms(policyId, request, TenantScope.of(tenantId));
        return ResponseEntity.ok(PolicyResponse.from(policy));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<PolicyResponse> deactivatePolicy(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("id") UUID policyId) {
        return ResponseEntity.ok(PolicyResponse.from(catalogService.deactivate(policyId, TenantScope.of(tenantId))));
    }
}
