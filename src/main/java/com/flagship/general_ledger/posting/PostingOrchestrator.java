package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.approval.ApprovalEngine;
import com.flagship.general_ledger.approval.ApprovalRequest;
import com.flagship.general_ledger.approval.ApprovalResult;
import com.flagship.general_ledger.approval.ApprovalStatus;
import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.ledger.LedgerService;
import com.flagship.general_ledger.ledger.NewEntry;
import com.flagship.general_ledger.ledger.NewVoucher;
import com.flagship.general_ledger.ledger.Voucher;
import com.flagship.general_ledger.ledger.VoucherEntry;
import com.flagship.general_ledger.numbering.NumberGenerator;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Voucher flows that span numbering, the ledger and approval, each in one transaction.
 *
 * A gated voucher reaches POSTED only through {@link #finalizePosting} or
 * {@link #approveAndFinalize}, after its approval request is APPROVED. Lock order is
 * voucher row, then scheme or approval request row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostingOrchestrator {

    private final NumberGenerator numberGenerator;
    private final LedgerService ledgerService;
    private final ApprovalEngine approvalEngine;
    private final VoucherIdempotencyService idempotencyService;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Numbers and inserts a draft voucher. If the insert fails, the counter increment
     * rolls back with it, so failed creations leave no gap in the sequence.
     * With an idempotency key that was used before, returns the voucher created then.
     *
     * @param scope optional numbering scope (entity code)
     */
    @Transactional
    public Voucher createVoucher(NewVoucher newVoucher, String createdBy, String scope) {
        long startTime = System.currentTimeMillis();
        requireUser(createdBy);
        newVoucher.validate();

        Optional<Voucher> existing = idempotencyService.findExisting(newVoucher.getIdempotencyKey());
        if (existing.isPresent()) {
            log.info("Idempotency key already used, returning voucher {}", existing.get().getVoucherNumber());
            return existing.get();
        }

        String voucherNumber = numberGenerator.generateNumber(
            newVoucher.getVoucherType().getCode(), scope, newVoucher.getVoucherDate());
        Voucher voucher = ledgerService.createVoucher(voucherNumber, newVoucher, createdBy);
        idempotencyService.rememberAfterCommit(newVoucher.getIdempotencyKey(), voucher.getId());

        metrics.recordLatency("create_voucher", System.currentTimeMillis() - startTime);
        return voucher;
    }

    @Transactional(readOnly = true)
    public Optional<Voucher> findByIdempotencyKey(String idempotencyKey) {
        return idempotencyService.findExisting(idempotencyKey);
    }

    /**
     * Edits the lines of a draft that is not currently under approval.
     */
    @Transactional
    public Voucher replaceEntries(UUID voucherId, List<NewEntry> entries) {
        Voucher voucher = ledgerService.getVoucherForUpdate(voucherId);
        if (voucher.getApprovalRequestId() != null) {
            ApprovalRequest request = approvalEngine.getRequest(voucher.getApprovalRequestId());
            if (request.getStatus().isOpen()) {
                throw new InvalidStateException(String.format(
                    "Voucher %s is under approval (request %s is %s); return it before editing",
                    voucher.getVoucherNumber(), request.getId(), request.getStatus()));
            }
        }
        return ledgerService.replaceEntries(voucherId, entries);
    }

    /**
     * Submits a balanced draft for approval and links the request to it.
     *
     * @throws InvalidStateException unless the voucher is a draft
     * @throws com.flagship.general_ledger.exception.InvariantViolationException if it is not balanced
     */
    @Transactional
    public ApprovalRequest submitForApproval(UUID voucherId, String requester) {
        requireUser(requester);
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());
        try {
            Voucher voucher = ledgerService.getVoucherForUpdate(voucherId);
            if (!voucher.isDraft()) {
                throw new InvalidStateException(String.format(
                    "Voucher %s is %s, only DRAFT vouchers can be submitted for approval",
                    voucher.getVoucherNumber(), voucher.getStatus()));
            }
            voucher.validateDoubleEntry();

            ApprovalRequest request = approvalEngine.initiate(
                properties.getApproval().getVoucherDocumentType(), voucherId, voucher.getTotalAmount(), requester);
            ledgerService.linkApprovalRequest(voucherId, request.getId());

            log.info("Voucher {} submitted for approval: requestId={}, approver={}",
                voucher.getVoucherNumber(), request.getId(), request.getCurrentApprover());
            return request;
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    /**
     * Posts a voucher whose approval request is APPROVED.
     *
     * @throws NotFoundException if the voucher has no approval request
     * @throws InvalidStateException if the request is not APPROVED or the voucher is not a draft
     */
    @Transactional
    public Voucher finalizePosting(UUID voucherId, String approver) {
        requireUser(approver);
        Voucher voucher = ledgerService.getVoucherForUpdate(voucherId);
        if (voucher.getApprovalRequestId() == null) {
            throw new NotFoundException("Voucher " + voucher.getVoucherNumber() + " has no approval request");
        }
        ApprovalRequest request = approvalEngine.getRequest(voucher.getApprovalRequestId());
        if (request.getStatus() != ApprovalStatus.APPROVED) {
            throw new InvalidStateException(String.format(
                "Voucher %s cannot be posted: approval request %s is %s",
                voucher.getVoucherNumber(), request.getId(), request.getStatus()));
        }
        return ledgerService.post(voucherId, approver);
    }

    /**
     * Approves the voucher's current request and, if that was the final approval,
     * posts the voucher in the same transaction.
     */
    @Transactional
    public ApprovalPostingResult approveAndFinalize(UUID voucherId, String approver, String comments,
                                                    String originAddress) {
        requireUser(approver);
        Voucher voucher = ledgerService.getVoucherForUpdate(voucherId);
        if (voucher.getApprovalRequestId() == null) {
            throw new NotFoundException("Voucher " + voucher.getVoucherNumber() + " has no approval request");
        }

        ApprovalResult result = approvalEngine.approve(voucher.getApprovalRequestId(), approver, comments, originAddress);
        if (!result.isApproved()) {
            return new ApprovalPostingResult(result, voucher);
        }
        return new ApprovalPostingResult(result, ledgerService.post(voucherId, approver));
    }

    /**
     * Direct posting for voucher types configured in {@code ledger.posting.ungated-voucher-types}.
     *
     * @throws InvalidStateException for every other type
     */
    @Transactional
    public Voucher postUngated(UUID voucherId, String user) {
        requireUser(user);
        Voucher voucher = ledgerService.getVoucherForUpdate(voucherId);
        if (!properties.getPosting().getUngatedVoucherTypes().contains(voucher.getVoucherType())) {
            throw new InvalidStateException(String.format(
                "Voucher type %s requires approval before posting", voucher.getVoucherType()));
        }
        return ledgerService.post(voucherId, user);
    }

    /**
     * Cancels a posted voucher and creates the draft that offsets it: same accounts,
     * debits and credits swapped, dated today. The reversal goes through approval like
     * any other voucher.
     *
     * @return the reversing draft
     */
    @Transactional
    public Voucher reverseVoucher(UUID voucherId, String user, String reason) {
        requireUser(user);
        Voucher cancelled = ledgerService.cancel(voucherId, user);

        NewVoucher.NewVoucherBuilder reversal = NewVoucher.builder()
            .voucherType(cancelled.getVoucherType())
            .voucherDate(LocalDate.now(clock))
            .referenceNumber(cancelled.getVoucherNumber())
            .partyReference(cancelled.getPartyReference())
            .currency(cancelled.getCurrency())
            .exchangeRate(cancelled.getExchangeRate())
            .narration("Reversal of " + cancelled.getVoucherNumber()
                + (reason != null && !reason.isBlank() ? ": " + reason : ""))
            .reversalOfId(cancelled.getId());
        for (VoucherEntry entry : cancelled.getEntries()) {
            reversal.entry(entry.reversed());
        }

        Voucher reversing = createVoucher(reversal.build(), user, null);
        log.info("Voucher {} reversed by {}: reversing voucher {}",
            cancelled.getVoucherNumber(), user, reversing.getVoucherNumber());
        return reversing;
    }

    private static void requireUser(String user) {
        if (user == null || user.isBlank()) {
            throw new ValidationException("Acting user is required");
        }
    }
}
