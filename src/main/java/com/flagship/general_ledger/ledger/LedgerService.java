package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.event.VoucherCancelledEvent;
import com.flagship.general_ledger.event.VoucherCreatedEvent;
import com.flagship.general_ledger.event.VoucherPostedEvent;
import com.flagship.general_ledger.exception.ConcurrencyConflictException;
import com.flagship.general_ledger.exception.DuplicateRequestException;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.InvariantViolationException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Voucher persistence and lifecycle: DRAFT -> POSTED -> CANCELLED.
 *
 * Every state change locks the voucher row first and re-checks the status under
 * the lock. Posting re-validates the double-entry balance from the persisted lines.
 * Callers decide whether a voucher may be posted; the approval gate lives in
 * {@link com.flagship.general_ledger.posting.PostingOrchestrator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final VoucherRepository voucherRepository;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Inserts a draft voucher with its lines. Balance is not checked here.
     *
     * @throws ValidationException if the voucher or a line is malformed
     * @throws DuplicateRequestException if the number or idempotency key is already used
     */
    @Transactional
    public Voucher createVoucher(String voucherNumber, NewVoucher newVoucher, String createdBy) {
        if (voucherNumber == null || voucherNumber.isBlank()) {
            throw new ValidationException("Voucher number is required");
        }
        newVoucher.validate();

        UUID voucherId = UUID.randomUUID();
        List<VoucherEntry> entries = toEntries(voucherId, newVoucher.getEntries());
        Voucher voucher = new Voucher(
            voucherId,
            voucherNumber,
            newVoucher.getVoucherType(),
            newVoucher.getVoucherDate(),
            newVoucher.getReferenceNumber(),
            newVoucher.getPartyReference(),
            newVoucher.getTotalDebits(),
            newVoucher.getCurrency().toUpperCase(),
            newVoucher.getExchangeRate(),
            newVoucher.getNarration(),
            VoucherStatus.DRAFT,
            null,
            newVoucher.getReversalOfId(),
            newVoucher.getIdempotencyKey(),
            createdBy,
            null,
            null,
            null,
            null,
            Instant.now(clock),
            entries
        );

        try {
            voucherRepository.insert(voucher);
        } catch (DuplicateKeyException e) {
            metrics.recordVoucherCreated(voucher.getVoucherType().getCode(), "duplicate");
            throw new DuplicateRequestException(
                "A voucher with number " + voucherNumber + " or the same idempotency key already exists", e);
        }

        outboxService.saveEvent(VoucherCreatedEvent.fromVoucher(voucher));
        metrics.recordVoucherCreated(voucher.getVoucherType().getCode(), "success");
        log.info("Created draft voucher: number={}, type={}, lines={}, total={}",
            voucherNumber, voucher.getVoucherType(), entries.size(), voucher.getTotalAmount());
        return voucher;
    }

    /**
     * Recomputes the totals from the persisted lines.
     *
     * @throws InvariantViolationException if debits and credits differ
     */
    @Transactional(readOnly = true)
    public void validateDoubleEntry(UUID voucherId) {
        getVoucher(voucherId).validateDoubleEntry();
    }

    /**
     * Posts a draft voucher.
     *
     * @throws InvalidStateException unless the voucher is a draft
     * @throws InvariantViolationException if the voucher is not balanced
     */
    @Transactional
    public Voucher post(UUID voucherId, String approver) {
        requireUser(approver, "Approver");
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());

        try {
            Voucher voucher = lock(voucherId);
            if (voucher.getStatus() != VoucherStatus.DRAFT) {
                throw new InvalidStateException(String.format(
                    "Voucher %s is %s, only DRAFT vouchers can be posted",
                    voucher.getVoucherNumber(), voucher.getStatus()));
            }
            try {
                voucher.validateDoubleEntry();
            } catch (InvariantViolationException e) {
                metrics.recordVoucherPosted(voucher.getVoucherType().getCode(), "unbalanced");
                throw e;
            }

            voucherRepository.markPosted(voucherId, approver, Instant.now(clock));
            Voucher posted = reload(voucherId);

            outboxService.saveEvent(VoucherPostedEvent.fromVoucher(posted));
            metrics.recordVoucherPosted(posted.getVoucherType().getCode(), "success");
            metrics.recordLatency("post", System.currentTimeMillis() - startTime);
            log.info("Posted voucher: number={}, approvedBy={}, total={}",
                posted.getVoucherNumber(), approver, posted.getTotalAmount());
            return posted;
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    /**
     * Cancels a posted voucher. Its lines are left untouched.
     *
     * @throws InvalidStateException unless the voucher is posted
     */
    @Transactional
    public Voucher cancel(UUID voucherId, String user) {
        requireUser(user, "User");
        MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());

        try {
            Voucher voucher = lock(voucherId);
            if (voucher.getStatus() != VoucherStatus.POSTED) {
                throw new InvalidStateException(String.format(
                    "Voucher %s is %s, only POSTED vouchers can be cancelled",
                    voucher.getVoucherNumber(), voucher.getStatus()));
            }

            voucherRepository.markCancelled(voucherId, user, Instant.now(clock));
            Voucher cancelled = reload(voucherId);

            outboxService.saveEvent(VoucherCancelledEvent.fromVoucher(cancelled));
            metrics.recordVoucherCancelled(cancelled.getVoucherType().getCode());
            log.info("Cancelled voucher: number={}, cancelledBy={}", cancelled.getVoucherNumber(), user);
            return cancelled;
        } finally {
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    /**
     * Replaces every line of a draft and recomputes its total.
     *
     * @throws InvalidStateException unless the voucher is a draft
     */
    @Transactional
    public Voucher replaceEntries(UUID voucherId, List<NewEntry> newEntries) {
        NewVoucher.validateEntries(newEntries);

        Voucher voucher = lock(voucherId);
        if (!voucher.isDraft()) {
            throw new InvalidStateException(String.format(
                "Voucher %s is %s, only DRAFT vouchers can be edited",
                voucher.getVoucherNumber(), voucher.getStatus()));
        }

        List<VoucherEntry> entries = toEntries(voucherId, newEntries);
        BigDecimal total = entries.stream()
            .map(VoucherEntry::getDebitAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        voucherRepository.replaceEntries(voucherId, entries, total);

        log.info("Replaced lines of draft voucher {}: lines={}, total={}",
            voucher.getVoucherNumber(), entries.size(), total);
        return reload(voucherId);
    }

    /**
     * Records the approval request that gates a draft.
     *
     * @throws InvalidStateException unless the voucher is a draft
     */
    @Transactional
    public Voucher linkApprovalRequest(UUID voucherId, UUID approvalRequestId) {
        Voucher voucher = lock(voucherId);
        if (!voucher.isDraft()) {
            throw new InvalidStateException(String.format(
                "Voucher %s is %s, an approval request can only be linked to a DRAFT voucher",
                voucher.getVoucherNumber(), voucher.getStatus()));
        }
        voucherRepository.linkApprovalRequest(voucherId, approvalRequestId);
        return reload(voucherId);
    }

    /**
     * Reads the voucher under an exclusive row lock, for callers that check its state
     * before acting on it in the same transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Voucher getVoucherForUpdate(UUID voucherId) {
        return lock(voucherId);
    }

    @Transactional(readOnly = true)
    public Voucher getVoucher(UUID voucherId) {
        return voucherRepository.findById(voucherId)
            .orElseThrow(() -> NotFoundException.of("Voucher", voucherId));
    }

    @Transactional(readOnly = true)
    public Optional<Voucher> findByNumber(String voucherNumber) {
        return voucherRepository.findByNumber(voucherNumber);
    }

    @Transactional(readOnly = true)
    public Optional<Voucher> findByIdempotencyKey(String idempotencyKey) {
        return voucherRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Transactional(readOnly = true)
    public List<VoucherEntry> getEntries(UUID voucherId) {
        return getVoucher(voucherId).getEntries();
    }

    /**
     * Locks the voucher row for the rest of the transaction.
     */
    private Voucher lock(UUID voucherId) {
        try {
            return voucherRepository.findByIdForUpdate(voucherId)
                .orElseThrow(() -> NotFoundException.of("Voucher", voucherId));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Timed out waiting for the lock on voucher " + voucherId, e);
        }
    }

    private Voucher reload(UUID voucherId) {
        return voucherRepository.findById(voucherId)
            .orElseThrow(() -> NotFoundException.of("Voucher", voucherId));
    }

    private static List<VoucherEntry> toEntries(UUID voucherId, List<NewEntry> newEntries) {
        List<VoucherEntry> entries = new ArrayList<>(newEntries.size());
        int lineNumber = 1;
        for (NewEntry entry : newEntries) {
            entries.add(new VoucherEntry(
                UUID.randomUUID(),
                voucherId,
                lineNumber++,
                entry.getAccountCode().trim(),
                entry.getDebitAmount(),
                entry.getCreditAmount(),
                entry.getCostCenter(),
                entry.getDepartment(),
                entry.getDescription()));
        }
        return entries;
    }

    private static void requireUser(String user, String role) {
        if (user == null || user.isBlank()) {
            throw new ValidationException(role + " is required");
        }
    }
}
