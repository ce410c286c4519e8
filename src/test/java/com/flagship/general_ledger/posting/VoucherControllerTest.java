package com.flagship.general_ledger.posting;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.general_ledger.approval.ApprovalLevel;
import com.flagship.general_ledger.approval.ApprovalWorkflowService;
import com.flagship.general_ledger.numbering.DateFormatToken;
import com.flagship.general_ledger.numbering.NumberingSchemeService;
import com.flagship.general_ledger.numbering.ResetFrequency;
import com.flagship.general_ledger.numbering.dto.CreateNumberingSchemeRequest;
import com.flagship.general_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class VoucherControllerTest extends PostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private NumberingSchemeService schemeService;

    @Autowired
    private ApprovalWorkflowService workflowService;

    @BeforeEach
    void setUp() {
        schemeService.createScheme(CreateNumberingSchemeRequest.builder()
            .schemeName("Journal entries")
            .documentType("JE")
            .prefix("JE")
            .dateFormat(DateFormatToken.YYYY)
            .resetFrequency(ResetFrequency.NEVER)
            .build(), "admin");
        workflowService.defineWorkflow("Voucher approval", "voucher", List.of(
            ApprovalLevel.of(1, "supervisor", BigDecimal.ZERO, new BigDecimal("999999.99"), true)
        ), true, "admin");
    }

    private static String voucherJson(String debit, String credit) {
        return """
            {
              "voucher_type": "JE",
              "voucher_date": "2025-01-15",
              "narration": "Office rent",
              "entries": [
                {"account_code": "6100-RENT", "debit_amount": %s},
                {"account_code": "1100-BANK", "credit_amount": %s}
              ]
            }
            """.formatted(debit, credit);
    }

    private UUID createVoucher(String debit, String credit) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/vouchers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User", "clerk")
                .content(voucherJson(debit, credit)))
            .andExpect(status().isCreated())
            .andReturn();
        return UUID.fromString(read(result).get("id").asText());
    }

    private JsonNode read(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("POST /api/vouchers replays the same voucher for a repeated Idempotency-Key")
    void idempotentCreate() throws Exception {
        printTestHeader("Idempotent voucher creation");
        String key = "rent-jan-" + UUID.randomUUID();

        MvcResult first = mockMvc.perform(post("/api/vouchers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User", "clerk")
                .header("Idempotency-Key", key)
                .content(voucherJson("1500.00", "1500.00")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.voucher_number").value("JE-2025-0001"))
            .andExpect(jsonPath("$.status").value("DRAFT"))
            .andExpect(jsonPath("$.entries.length()").value(2))
            .andReturn();

        MvcResult second = mockMvc.perform(post("/api/vouchers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User", "clerk")
                .header("Idempotency-Key", key)
                .content(voucherJson("1500.00", "1500.00")))
            .andExpect(status().isOk())
            .andReturn();

        printOutput("First", read(first).get("id").asText());
        printOutput("Second", read(second).get("id").asText());
        assertEquals(read(first).get("id"), read(second).get("id"));
        printSuccess("Repeated key returned the original voucher");
    }

    @Test
    void missingUserHeaderIsRejected() throws Exception {
        mockMvc.perform(post("/api/vouchers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(voucherJson("10", "10")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
    }

    @Test
    void voucherWithoutLinesFailsValidation() throws Exception {
        mockMvc.perform(post("/api/vouchers")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-User", "clerk")
                .content("""
                    {"voucher_type": "JE", "voucher_date": "2025-01-15", "entries": []}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.entries").exists());
    }

    @Test
    @DisplayName("submitting an unbalanced voucher returns 422 with the business message")
    void unbalancedSubmit() throws Exception {
        UUID voucherId = createVoucher("100.00", "99.99");

        mockMvc.perform(post("/api/vouchers/{id}/submit", voucherId).header("X-User", "clerk"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error_code").value("INVARIANT_VIOLATION"))
            .andExpect(jsonPath("$.retryable").value(false));

        mockMvc.perform(get("/api/vouchers/{id}", voucherId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DRAFT"));
    }

    @Test
    @DisplayName("submit then approve over HTTP posts the voucher")
    void approveOverHttp() throws Exception {
        UUID voucherId = createVoucher("250.00", "250.00");

        mockMvc.perform(post("/api/vouchers/{id}/submit", voucherId).header("X-User", "clerk"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.current_approver").value("supervisor"))
            .andExpect(jsonPath("$.status").value("PENDING"));

        mockMvc.perform(post("/api/vouchers/{id}/approve", voucherId)
                .header("X-User", "supervisor")
                .header("X-Forwarded-For", "10.1.2.3")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"comments\": \"checked against lease\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.posted").value(true))
            .andExpect(jsonPath("$.voucher.status").value("POSTED"))
            .andExpect(jsonPath("$.voucher.approved_by").value("supervisor"));
    }

    @Test
    void requesterApprovingOwnVoucherIsForbidden() throws Exception {
        UUID voucherId = createVoucher("250.00", "250.00");
        mockMvc.perform(post("/api/vouchers/{id}/submit", voucherId).header("X-User", "supervisor"))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/vouchers/{id}/approve", voucherId).header("X-User", "supervisor"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error_code").value("AUTHORIZATION_ERROR"));
    }

    @Test
    void directPostingRequiresUngatedType() throws Exception {
        UUID voucherId = createVoucher("5.00", "5.00");

        mockMvc.perform(post("/api/vouchers/{id}/post", voucherId).header("X-User", "clerk"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value("INVALID_STATE"));
    }

    @Test
    void unknownVoucherIsNotFound() throws Exception {
        mockMvc.perform(get("/api/vouchers/{id}", UUID.randomUUID())
                .header("X-Correlation-Id", "corr-123"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"))
            .andExpect(header().string("X-Correlation-Id", "corr-123"));
    }
}
