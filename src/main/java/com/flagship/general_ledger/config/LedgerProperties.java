package com.flagship.general_ledger.config;

import com.flagship.general_ledger.approval.BandGapPolicy;
import com.flagship.general_ledger.ledger.VoucherType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ledger settings bound from the {@code ledger.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private final Approval approval = new Approval();
    private final Posting posting = new Posting();
    private final Events events = new Events();

    @Data
    public static class Approval {
        private BandGapPolicy bandGapPolicy = BandGapPolicy.REQUIRE_COVERING_LEVEL;

        /**
         * Document type under which vouchers are submitted to the approval engine.
         */
        private String voucherDocumentType = "voucher";
    }

    @Data
    public static class Posting {
        /**
         * Voucher types that may be posted without going through approval.
         */
        private Set<VoucherType> ungatedVoucherTypes = EnumSet.noneOf(VoucherType.class);
    }

    @Data
    public static class Events {
        private String topic = "ledger-events";
    }
}
