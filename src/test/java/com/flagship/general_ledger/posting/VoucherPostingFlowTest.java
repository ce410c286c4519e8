package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.approval.ApprovalEngine;
import com.flagship.general_ledger.approval.ApprovalLevel;
import com.flagship.general_ledger.approval.ApprovalRequest;
import com.flagship.general_ledger.approval.ApprovalStatus;
import com.flagship.general_ledger.approval.ApprovalWorkflowService;
import com.flagship.general_ledger.exception.AuthorizationException;
import com.flagship.general_ledger.exception.DuplicateRequestException;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.InvariantViolationException;
import com.flagship.general_ledger.exception.LedgerException;
import com.flagship.general_ledger.ledger.LedgerService;
import com.flagship.general_ledger.ledger.NewEntry;
import com.flagship.general_ledger.ledger.Voucher;
import com.flagship.general_ledger.ledger.VoucherStatus;
import com.flagship.general_ledger.numbering.DateFormatToken;
import com.flagship.general_ledger.numbering.NumberingSchemeService;
import com.flagship.general_ledger.numbering.ResetFrequency;
import com.flagship.general_ledger.numbering.dto.CreateNumberingSchemeRequest;
import com.flagship.general_ledger.outbox.OutboxEvent;
import com.flagship.general_ledger.outbox.OutboxService;
import com.flagship.general_ledger.support.PostgresIntegrationTest;
import com.flagship.general_ledger.support.TestVouchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Voucher lifecycle from numbering to posting against PostgreSQL.
 */
class VoucherPostingFlowTest extends PostgresIntegrationTest {

    private static final String CLERK = "clerk";
    private static final String ORIGIN = "192.168.1.20";

    @Autowired
    private PostingOrchestrator orchestrator;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ApprovalEngine approvalEngine;

    @Autowired
    private ApprovalWorkflowService workflowService;

    @Autowired
    private NumberingSchemeService schemeService;

    @Autowired
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        schemeService.createScheme(CreateNumberingSchemeRequest.builder()
            .schemeName("Journal entries")
            .documentType("JE")
            .prefix("JE")
            .dateFormat(DateFormatToken.YYYY)
            .padding(4)
            .resetFrequency(ResetFrequency.NEVER)
            .build(), "admin");
        workflowService.defineWorkflow("Voucher approval", "voucher", List.of(
            ApprovalLevel.of(1, "supervisor", BigDecimal.ZERO, new BigDecimal("50000"), true),
            ApprovalLevel.of(2, "manager", new BigDecimal("10000.01"), new BigDecimal("999999.99"), true)
        ), true, "admin");
    }

    private Voucher createBalanced(String amount) {
        return orchestrator.createVoucher(TestVouchers.balanced(new BigDecimal(amount)), CLERK, null);
    }

    @Test
    @DisplayName("small voucher: one approval posts it")
    void singleApprovalPosts() {
        printTestHeader("Single-level approval and posting");
        Voucher voucher = createBalanced("5000.00");
        assertEquals("JE-2025-0001", voucher.getVoucherNumber());

        ApprovalRequest request = orchestrator.submitForApproval(voucher.getId(), CLERK);
        assertEquals("supervisor", request.getCurrentApprover());

        ApprovalPostingResult result = orchestrator.approveAndFinalize(voucher.getId(), "supervisor", "ok", ORIGIN);

        assertTrue(result.isPosted());
        Voucher posted = ledgerService.getVoucher(voucher.getId());
        assertEquals(VoucherStatus.POSTED, posted.getStatus());
        assertEquals("supervisor", posted.getApprovedBy());
        assertNotNull(posted.getPostedAt());
        assertEquals(request.getId(), posted.getApprovalRequestId());
        printSuccess("Voucher posted after single approval");
    }

    @Test
    @DisplayName("larger voucher needs both levels before it posts")
    void twoLevelApproval() {
        Voucher voucher = createBalanced("25000.00");
        ApprovalRequest request = orchestrator.submitForApproval(voucher.getId(), CLERK);

        ApprovalPostingResult first = orchestrator.approveAndFinalize(voucher.getId(), "supervisor", null, ORIGIN);
        assertFalse(first.isPosted());
        assertEquals(VoucherStatus.DRAFT, ledgerService.getVoucher(voucher.getId()).getStatus());
        assertEquals(2, approvalEngine.getRequest(request.getId()).getCurrentLevel());

        assertThrows(InvalidStateException.class, () -> orchestrator.finalizePosting(voucher.getId(), "manager"));

        ApprovalPostingResult second = orchestrator.approveAndFinalize(voucher.getId(), "manager", null, ORIGIN);
        assertTrue(second.isPosted());
        assertEquals(2, approvalEngine.getActionHistory(request.getId()).size());
    }

    @Test
    @DisplayName("approval through the engine, then explicit finalize")
    void finalizeAfterSeparateApproval() {
        Voucher voucher = createBalanced("100.00");
        ApprovalRequest request = orchestrator.submitForApproval(voucher.getId(), CLERK);
        approvalEngine.approve(request.getId(), "supervisor", null, ORIGIN);

        Voucher posted = orchestrator.finalizePosting(voucher.getId(), "supervisor");

        assertEquals(VoucherStatus.POSTED, posted.getStatus());
        assertThrows(InvalidStateException.class, () -> orchestrator.finalizePosting(voucher.getId(), "supervisor"));
    }

    @Test
    @DisplayName("unbalanced voucher cannot be posted and stays a draft")
    void unbalancedPostFails() {
        Voucher voucher = orchestrator.createVoucher(
            TestVouchers.unbalanced(new BigDecimal("100.00"), new BigDecimal("90.00")), CLERK, null);

        assertThrows(InvariantViolationException.class, () -> ledgerService.post(voucher.getId(), "supervisor"));
        assertThrows(InvariantViolationException.class, () -> orchestrator.submitForApproval(voucher.getId(), CLERK));

        assertEquals(VoucherStatus.DRAFT, ledgerService.getVoucher(voucher.getId()).getStatus());
    }

    @Test
    void requesterCannotApproveOwnVoucher() {
        Voucher voucher = createBalanced("100.00");
        orchestrator.submitForApproval(voucher.getId(), "supervisor");

        assertThrows(AuthorizationException.class,
            () -> orchestrator.approveAndFinalize(voucher.getId(), "supervisor", null, ORIGIN));
        assertEquals(VoucherStatus.DRAFT, ledgerService.getVoucher(voucher.getId()).getStatus());
    }

    @Test
    void voucherCannotBeSubmittedTwice() {
        Voucher voucher = createBalanced("100.00");
        orchestrator.submitForApproval(voucher.getId(), CLERK);

        assertThrows(DuplicateRequestException.class, () -> orchestrator.submitForApproval(voucher.getId(), CLERK));
    }

    @Test
    @DisplayName("returned voucher can be corrected and resubmitted")
    void returnedVoucherIsEditable() {
        Voucher voucher = createBalanced("100.00");
        ApprovalRequest request = orchestrator.submitForApproval(voucher.getId(), CLERK);
        List<NewEntry> corrected = List.of(
            NewEntry.debit("1100-BANK", new BigDecimal("120.00"), null),
            NewEntry.credit("4000-REVENUE", new BigDecimal("120.00"), null));

        assertThrows(InvalidStateException.class, () -> orchestrator.replaceEntries(voucher.getId(), corrected));

        approvalEngine.returnToRequester(request.getId(), "supervisor", "wrong bank account", ORIGIN);
        Voucher edited = orchestrator.replaceEntries(voucher.getId(), corrected);
        ApprovalRequest resubmitted = orchestrator.submitForApproval(voucher.getId(), CLERK);

        assertEquals(0, new BigDecimal("120.00").compareTo(edited.getTotalAmount()));
        assertEquals("1100-BANK", edited.getEntries().get(0).getAccountCode());
        assertEquals(ApprovalStatus.CANCELLED, approvalEngine.getRequest(request.getId()).getStatus());
        assertEquals(resubmitted.getId(), ledgerService.getVoucher(voucher.getId()).getApprovalRequestId());
    }

    @Test
    @DisplayName("reversal cancels the original and drafts an offsetting voucher")
    void reversal() {
        Voucher voucher = createBalanced("750.00");
        orchestrator.submitForApproval(voucher.getId(), CLERK);
        orchestrator.approveAndFinalize(voucher.getId(), "supervisor", null, ORIGIN);

        Voucher reversing = orchestrator.reverseVoucher(voucher.getId(), "controller", "posted twice");

        Voucher original = ledgerService.getVoucher(voucher.getId());
        assertEquals(VoucherStatus.CANCELLED, original.getStatus());
        assertEquals("controller", original.getCancelledBy());
        assertEquals(2, original.getEntries().size());

        assertEquals(VoucherStatus.DRAFT, reversing.getStatus());
        assertEquals(voucher.getId(), reversing.getReversalOfId());
        assertEquals(voucher.getVoucherNumber(), reversing.getReferenceNumber());
        assertNotEquals(voucher.getVoucherNumber(), reversing.getVoucherNumber());
        assertEquals(0, original.getEntries().get(0).getDebitAmount()
            .compareTo(reversing.getEntries().get(0).getCreditAmount()));
        assertTrue(reversing.isBalanced());

        assertThrows(InvalidStateException.class,
            () -> orchestrator.reverseVoucher(voucher.getId(), "controller", "again"));
    }

    @Test
    @DisplayName("reusing an idempotency key returns the first voucher")
    void idempotentCreation() {
        Voucher first = orchestrator.createVoucher(
            TestVouchers.balanced(new BigDecimal("10.00")).toBuilder().idempotencyKey("import-row-17").build(),
            CLERK, null);
        Voucher second = orchestrator.createVoucher(
            TestVouchers.balanced(new BigDecimal("10.00")).toBuilder().idempotencyKey("import-row-17").build(),
            CLERK, null);

        assertEquals(first.getId(), second.getId());
        assertEquals("JE-2025-0002", createBalanced("1.00").getVoucherNumber());
    }

    @Test
    @DisplayName("state changes write events to the outbox in order")
    void outboxRecordsLifecycle() {
        Voucher voucher = createBalanced("100.00");
        orchestrator.submitForApproval(voucher.getId(), CLERK);
        orchestrator.approveAndFinalize(voucher.getId(), "supervisor", null, ORIGIN);

        List<String> types = outboxService.getEventsForAggregate("Voucher", voucher.getId())
            .stream()
            .map(OutboxEvent::getEventType)
            .toList();

        assertEquals(List.of("VoucherCreated", "VoucherPosted"), types);
    }

    @Test
    @DisplayName("two approvers racing on the same request: exactly one wins")
    void concurrentApprovalsSerialize() throws Exception {
        printTestHeader("Concurrent approvals");
        Voucher voucher = createBalanced("100.00");
        ApprovalRequest request = orchestrator.submitForApproval(voucher.getId(), CLERK);

        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        List<Exception> failures = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    orchestrator.approveAndFinalize(voucher.getId(), "supervisor", null, ORIGIN);
                    succeeded.incrementAndGet();
                } catch (Exception e) {
                    failures.add(e);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Failed", failures.size());
        assertEquals(1, succeeded.get());
        assertTrue(failures.stream().allMatch(e -> e instanceof InvalidStateException
            || e instanceof LedgerException && ((LedgerException) e).isRetryable()));
        assertEquals(1, approvalEngine.getActionHistory(request.getId()).size());
        assertEquals(VoucherStatus.POSTED, ledgerService.getVoucher(voucher.getId()).getStatus());
        printSuccess("Row lock serialized the approvals");
    }

    @Nested
    @DisplayName("Database guards")
    class DatabaseGuards {

        @Test
        @DisplayName("lines of a posted voucher cannot be changed even with direct SQL")
        void postedEntriesAreFrozen() {
            Voucher voucher = createBalanced("100.00");
            orchestrator.submitForApproval(voucher.getId(), CLERK);
            orchestrator.approveAndFinalize(voucher.getId(), "supervisor", null, ORIGIN);

            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE voucher_entries SET debit_amount = 1 WHERE voucher_id = ? AND line_number = 1",
                voucher.getId()));
            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM voucher_entries WHERE voucher_id = ?", voucher.getId()));
        }

        @Test
        @DisplayName("approval actions cannot be altered or deleted")
        void approvalActionsAreAppendOnly() {
            Voucher voucher = createBalanced("100.00");
            ApprovalRequest request = orchestrator.submitForApproval(voucher.getId(), CLERK);
            approvalEngine.approve(request.getId(), "supervisor", "ok", ORIGIN);

            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE approval_actions SET approver = 'someone' WHERE request_id = ?", request.getId()));
            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM approval_actions WHERE request_id = ?", request.getId()));
        }

        @Test
        void lineWithBothSidesIsRejected() {
            Voucher voucher = createBalanced("100.00");

            assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE voucher_entries SET credit_amount = 5 WHERE voucher_id = ? AND line_number = 1",
                voucher.getId()));
        }
    }
}
