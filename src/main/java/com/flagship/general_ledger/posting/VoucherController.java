package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.approval.ApprovalRequest;
import com.flagship.general_ledger.approval.dto.ApprovalDecisionRequest;
import com.flagship.general_ledger.approval.dto.ApprovalRequestResponse;
import com.flagship.general_ledger.ledger.LedgerService;
import com.flagship.general_ledger.ledger.Voucher;
import com.flagship.general_ledger.posting.dto.ApprovalPostingResponse;
import com.flagship.general_ledger.posting.dto.CreateVoucherRequest;
import com.flagship.general_ledger.posting.dto.EntryRequest;
import com.flagship.general_ledger.posting.dto.ReplaceEntriesRequest;
import com.flagship.general_ledger.posting.dto.ReverseVoucherRequest;
import com.flagship.general_ledger.posting.dto.VoucherResponse;
import com.flagship.general_ledger.web.RequestOrigin;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;

/**
 * Voucher lifecycle endpoints.
 *
 * Creation accepts an optional {@code Idempotency-Key}: a repeated key returns the
 * voucher created the first time with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/vouchers")
@RequiredArgsConstructor
@Slf4j
public class VoucherController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PostingOrchestrator orchestrator;
    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<VoucherResponse> createVoucher(
            @Valid @RequestBody CreateVoucherRequest request,
            @RequestHeader(RequestOrigin.USER_HEADER) String user,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received voucher creation request: type={}, date={}, lines={}, idempotencyKey={}",
            request.getVoucherType(), request.getVoucherDate(), request.getEntries().size(), idempotencyKey);

        Optional<Voucher> existing = orchestrator.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            return ResponseEntity.ok(VoucherResponse.from(existing.get()));
        }

        Voucher voucher = orchestrator.createVoucher(request.toNewVoucher(idempotencyKey), user, request.getScope());
        return ResponseEntity.status(HttpStatus.CREATED).body(VoucherResponse.from(voucher));
    }

    @GetMapping("/{id}")
    public VoucherResponse getVoucher(@PathVariable("id") UUID voucherId) {
        return VoucherResponse.from(ledgerService.getVoucher(voucherId));
    }

    @PutMapping("/{id}/entries")
    public VoucherResponse replaceEntries(@PathVariable("id") UUID voucherId,
                                          @Valid @RequestBody ReplaceEntriesRequest request,
                                          @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        log.info("Replacing lines of voucher {} on behalf of {}", voucherId, user);
        return VoucherResponse.from(orchestrator.replaceEntries(voucherId,
            request.getEntries().stream().map(EntryRequest::toNewEntry).toList()));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<ApprovalRequestResponse> submit(@PathVariable("id") UUID voucherId,
                                                          @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        ApprovalRequest request = orchestrator.submitForApproval(voucherId, user);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApprovalRequestResponse.from(request));
    }

    @PostMapping("/{id}/approve")
    public ApprovalPostingResponse approve(@PathVariable("id") UUID voucherId,
                                           @RequestHeader(RequestOrigin.USER_HEADER) String user,
                                           @Valid @RequestBody(required = false) ApprovalDecisionRequest body,
                                           HttpServletRequest servletRequest) {
        String comments = body != null ? body.getComments() : null;
        return ApprovalPostingResponse.from(orchestrator.approveAndFinalize(
            voucherId, user, comments, RequestOrigin.addressOf(servletRequest)));
    }

    @PostMapping("/{id}/finalize")
    public VoucherResponse finalizePosting(@PathVariable("id") UUID voucherId,
                                           @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        return VoucherResponse.from(orchestrator.finalizePosting(voucherId, user));
    }

    @PostMapping("/{id}/post")
    public VoucherResponse post(@PathVariable("id") UUID voucherId,
                                @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        return VoucherResponse.from(orchestrator.postUngated(voucherId, user));
    }

    @PostMapping("/{id}/reverse")
    public ResponseEntity<VoucherResponse> reverse(@PathVariable("id") UUID voucherId,
                                                   @RequestHeader(RequestOrigin.USER_HEADER) String user,
                                                   @Valid @RequestBody(required = false) ReverseVoucherRequest body) {
        String reason = body != null ? body.getReason() : null;
        Voucher reversing = orchestrator.reverseVoucher(voucherId, user, reason);
        return ResponseEntity.status(HttpStatus.CREATED).body(VoucherResponse.from(reversing));
    }
}
