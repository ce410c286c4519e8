package com.flagship.general_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to {@code vouchers} and {@code voucher_entries}.
 *
 * Entries are only ever inserted, or deleted and re-inserted for a draft; the
 * database trigger on {@code voucher_entries} rejects any change to the lines of
 * a voucher that is no longer a draft.
 */
@Repository
public class VoucherRepository {

    private static final String VOUCHER_COLUMNS =
        "id, voucher_number, voucher_type, voucher_date, reference_number, party_reference, " +
        "total_amount, currency, exchange_rate, narration, status, approval_request_id, reversal_of_id, " +
        "idempotency_key, created_by, approved_by, posted_at, cancelled_by, cancelled_at, created_at";

    private static final String ENTRY_COLUMNS =
        "id, voucher_id, line_number, account_code, debit_amount, credit_amount, cost_center, department, description";

    private final JdbcTemplate jdbcTemplate;

    public VoucherRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Voucher voucher) {
        jdbcTemplate.update(
            "INSERT INTO vouchers (" + VOUCHER_COLUMNS + ", updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getVoucherType().name(),
            voucher.getVoucherDate(),
            voucher.getReferenceNumber(),
            voucher.getPartyReference(),
            voucher.getTotalAmount(),
            voucher.getCurrency(),
            voucher.getExchangeRate(),
            voucher.getNarration(),
            voucher.getStatus().name(),
            voucher.getApprovalRequestId(),
            voucher.getReversalOfId(),
            voucher.getIdempotencyKey(),
            voucher.getCreatedBy(),
            voucher.getApprovedBy(),
            toTimestamp(voucher.getPostedAt()),
            voucher.getCancelledBy(),
            toTimestamp(voucher.getCancelledAt()),
            toTimestamp(voucher.getCreatedAt())
        );
        insertEntries(voucher.getEntries());
    }

    public Optional<Voucher> findById(UUID voucherId) {
        return findOne("SELECT " + VOUCHER_COLUMNS + " FROM vouchers WHERE id = ?", voucherId);
    }

    /**
     * Loads the voucher with an exclusive row lock held until the transaction ends.
     */
    public Optional<Voucher> findByIdForUpdate(UUID voucherId) {
        return findOne("SELECT " + VOUCHER_COLUMNS + " FROM vouchers WHERE id = ? FOR UPDATE", voucherId);
    }

    public Optional<Voucher> findByNumber(String voucherNumber) {
        return findOne("SELECT " + VOUCHER_COLUMNS + " FROM vouchers WHERE voucher_number = ?", voucherNumber);
    }

    public Optional<Voucher> findByIdempotencyKey(String idempotencyKey) {
        return findOne("SELECT " + VOUCHER_COLUMNS + " FROM vouchers WHERE idempotency_key = ?", idempotencyKey);
    }

    public List<VoucherEntry> findEntries(UUID voucherId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM voucher_entries WHERE voucher_id = ? ORDER BY line_number",
            entryRowMapper(),
            voucherId
        );
    }

    public void markPosted(UUID voucherId, String approvedBy, Instant postedAt) {
        jdbcTemplate.update(
            "UPDATE vouchers SET status = 'POSTED', approved_by = ?, posted_at = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'DRAFT'",
            approvedBy, toTimestamp(postedAt), voucherId
        );
    }

    public void markCancelled(UUID voucherId, String cancelledBy, Instant cancelledAt) {
        jdbcTemplate.update(
            "UPDATE vouchers SET status = 'CANCELLED', cancelled_by = ?, cancelled_at = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND status = 'POSTED'",
            cancelledBy, toTimestamp(cancelledAt), voucherId
        );
    }

    public void linkApprovalRequest(UUID voucherId, UUID approvalRequestId) {
        jdbcTemplate.update(
            "UPDATE vouchers SET approval_request_id = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            approvalRequestId, voucherId
        );
    }

    /**
     * Replaces the lines of a draft and updates its total.
     */
    public void replaceEntries(UUID voucherId, List<VoucherEntry> entries, BigDecimal totalAmount) {
        jdbcTemplate.update("DELETE FROM voucher_entries WHERE voucher_id = ?", voucherId);
        insertEntries(entries);
        jdbcTemplate.update(
            "UPDATE vouchers SET total_amount = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            totalAmount, voucherId
        );
    }

    private void insertEntries(List<VoucherEntry> entries) {
        List<Object[]> rows = new ArrayList<>(entries.size());
        for (VoucherEntry entry : entries) {
            rows.add(new Object[] {
                entry.getId(),
                entry.getVoucherId(),
                entry.getLineNumber(),
                entry.getAccountCode(),
                entry.getDebitAmount(),
                entry.getCreditAmount(),
                entry.getCostCenter(),
                entry.getDepartment(),
                entry.getDescription()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO voucher_entries (" + ENTRY_COLUMNS + ", created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            rows
        );
    }

    private Optional<Voucher> findOne(String sql, Object key) {
        List<Voucher> headers = jdbcTemplate.query(sql, (rs, rowNum) -> mapHeader(rs), key);
        if (headers.isEmpty()) {
            return Optional.empty();
        }
        Voucher header = headers.get(0);
        return Optional.of(withEntries(header, findEntries(header.getId())));
    }

    private static Voucher mapHeader(ResultSet rs) throws SQLException {
        return new Voucher(
            UUID.fromString(rs.getString("id")),
            rs.getString("voucher_number"),
            VoucherType.valueOf(rs.getString("voucher_type")),
            rs.getObject("voucher_date", LocalDate.class),
            rs.getString("reference_number"),
            rs.getString("party_reference"),
            rs.getBigDecimal("total_amount"),
            rs.getString("currency"),
            rs.getBigDecimal("exchange_rate"),
            rs.getString("narration"),
            VoucherStatus.valueOf(rs.getString("status")),
            toUuid(rs.getString("approval_request_id")),
            toUuid(rs.getString("reversal_of_id")),
            rs.getString("idempotency_key"),
            rs.getString("created_by"),
            rs.getString("approved_by"),
            toInstant(rs.getTimestamp("posted_at")),
            rs.getString("cancelled_by"),
            toInstant(rs.getTimestamp("cancelled_at")),
            toInstant(rs.getTimestamp("created_at")),
            List.of()
        );
    }

    private static Voucher withEntries(Voucher h, List<VoucherEntry> entries) {
        return new Voucher(h.getId(), h.getVoucherNumber(), h.getVoucherType(), h.getVoucherDate(),
            h.getReferenceNumber(), h.getPartyReference(), h.getTotalAmount(), h.getCurrency(),
            h.getExchangeRate(), h.getNarration(), h.getStatus(), h.getApprovalRequestId(),
            h.getReversalOfId(), h.getIdempotencyKey(), h.getCreatedBy(), h.getApprovedBy(),
            h.getPostedAt(), h.getCancelledBy(), h.getCancelledAt(), h.getCreatedAt(), List.copyOf(entries));
    }

    private RowMapper<VoucherEntry> entryRowMapper() {
        return (rs, rowNum) -> new VoucherEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("voucher_id")),
            rs.getInt("line_number"),
            rs.getString("account_code"),
            rs.getBigDecimal("debit_amount"),
            rs.getBigDecimal("credit_amount"),
            rs.getString("cost_center"),
            rs.getString("department"),
            rs.getString("description")
        );
    }

    private static UUID toUuid(String value) {
        return value != null ? UUID.fromString(value) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
