package com.flagship.general_ledger.approval;

/**
 * What to do when no higher approval level covers an amount that lies above one of their bands.
 */
public enum BandGapPolicy {
    /**
     * The workflow must have a level covering the amount; otherwise initiation
     * and the affected approval fail with a validation error.
     */
    REQUIRE_COVERING_LEVEL,
    /**
     * Approval completes at the current level and a warning is logged.
     */
    AUTO_COMPLETE
}
