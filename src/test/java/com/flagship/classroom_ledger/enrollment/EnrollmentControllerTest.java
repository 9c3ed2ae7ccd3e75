package com.flagship.classroom_ledger.enrollment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.classroom_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Catalog and enrollment endpoints driven the way a teacher's dashboard
 * would: create a policy, sell it, bill it, cancel it.
 */
class EnrollmentControllerTest extends PostgresIntegrationTest {

    private static final String TENANT_HEADER = "X-Tenant-ID";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String createPolicyViaApi(String code) throws Exception {
        Map<String, Object> body = Map.of(
            "policy_code", code,
            "title", "Field trip cover",
            "premium", "4.00",
            "claim_type", "LEGACY_MONETARY",
            "waiting_period_days", 0,
            "auto_suspend_nonpay_days", 2);

        MvcResult result = mockMvc.perform(post("/api/policies")
                .header(TENANT_HEADER, tenantId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.policy_code").value(code))
            .andExpect(jsonPath("$.active").value(true))
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
    }

    private String enrollViaApi(UUID subjectId, String policyId) throws Exception {
        fund(subjectId, new BigDecimal("4.00"));
        MvcResult result = mockMvc.perform(post("/api/enrollments")
                .header(TENANT_HEADER, tenantId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("subject_id", subjectId, "policy_id", policyId))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.premium_entry_id").isNotEmpty())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
    }

    @Test
    @DisplayName("Policy is created, listed and deactivated through the API")
    void testPolicyEndpoints() throws Exception {
        printTestHeader("Policy Endpoints");

        String policyId = createPolicyViaApi("TRIP-1");

        mockMvc.perform(get("/api/policies").header(TENANT_HEADER, tenantId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(post("/api/policies/{id}/deactivate", policyId).header(TENANT_HEADER, tenantId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/policies").header(TENANT_HEADER, tenantId.toString()))
            .andExpect(jsonPath("$.length()").value(0));
        mockMvc.perform(get("/api/policies")
                .header(TENANT_HEADER, tenantId.toString())
                .param("include_inactive", "true"))
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(post("/api/policies")
                .header(TENANT_HEADER, tenantId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("policy_code", "TRIP-1", "title", "x",
                    "premium", "1.00", "claim_type", "NON_MONETARY"))))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/policies")
                .header(TENANT_HEADER, tenantId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("title", "No code"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.policyCode").exists());
    }

    @Test
    @DisplayName("Enrollment lifecycle: enroll, miss, suspend, pay, cancel")
    void testEnrollmentLifecycle() throws Exception {
        printTestHeader("Enrollment Lifecycle");

        UUID subjectId = UUID.randomUUID();
        String policyId = createPolicyViaApi("TRIP-2");
        String enrollmentId = enrollViaApi(subjectId, policyId);

        mockMvc.perform(post("/api/enrollments")
                .header(TENANT_HEADER, tenantId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("subject_id", subjectId, "policy_id", policyId))))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/enrollments/{id}/missed-payments", enrollmentId)
                .header(TENANT_HEADER, tenantId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.payment_current").value(false))
            .andExpect(jsonPath("$.days_unpaid").value(1));

        mockMvc.perform(post("/api/enrollments/{id}/missed-payments", enrollmentId)
                .header(TENANT_HEADER, tenantId.toString()))
            .andExpect(jsonPath("$.status").value("SUSPENDED"));

        mockMvc.perform(post("/api/enrollments/{id}/payments", enrollmentId)
                .header(TENANT_HEADER, tenantId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.payment_current").value(true));

        mockMvc.perform(post("/api/enrollments/{id}/cancel", enrollmentId)
                .header(TENANT_HEADER, tenantId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post("/api/enrollments/{id}/payments", enrollmentId)
                .header(TENANT_HEADER, tenantId.toString()))
            .andExpect(status().isConflict());

        mockMvc.perform(get("/api/enrollments")
                .header(TENANT_HEADER, tenantId.toString())
                .param("subject_id", subjectId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));

        printSuccess("Lifecycle driven over HTTP");
    }

    @Test
    @DisplayName("Purchase without enough checking money is refused with 422")
    void testEnrollWithoutFunds() throws Exception {
        UUID subjectId = UUID.randomUUID();
        String policyId = createPolicyViaApi("TRIP-4");
        fund(subjectId, new BigDecimal("3.99"));

        mockMvc.perform(post("/api/enrollments")
                .header(TENANT_HEADER, tenantId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("subject_id", subjectId, "policy_id", policyId))))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"))
            .andExpect(jsonPath("$.retryable").value(false));

        mockMvc.perform(get("/api/enrollments")
                .header(TENANT_HEADER, tenantId.toString())
                .param("subject_id", subjectId.toString()))
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("Enrollment of another tenant is forbidden; unknown one is not found")
    void testCrossTenantAndMissing() throws Exception {
        String enrollmentId = enrollViaApi(UUID.randomUUID(), createPolicyViaApi("TRIP-3"));

        mockMvc.perform(get("/api/enrollments/{id}", enrollmentId)
                .header(TENANT_HEADER, UUID.randomUUID().toString()))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("CROSS_TENANT_VIOLATION"));

        mockMvc.perform(get("/api/enrollments/{id}", UUID.randomUUID())
                .header(TENANT_HEADER, tenantId.toString()))
            .andExpect(status().isNotFound());
    }
}
