package com.di.retailstar.cleaning;

/** Metric names written by the cleaning pipeline into the run's quality stats. */
public final class CleaningMetrics {

    private CleaningMetrics() {
    }

    public static final String STAGE = "cleaning";

    public static final String INITIAL_ROWS             = "initial_rows";
    public static final String INVALID_INVOICE_DATES    = "invalid_invoice_dates";
    public static final String CANCELLED_TRANSACTIONS   = "cancelled_transactions";
    public static final String MISSING_CUSTOMER_IDS     = "missing_customer_ids";
    public static final String MISSING_DESCRIPTIONS     = "missing_descriptions";
    public static final String DUPLICATES_REMOVED       = "duplicates_removed";
    public static final String INVALID_PRICE_EXCLUSIONS = "invalid_price_exclusions";
    public static final String UNPARSABLE_QUANTITIES    = "unparsable_quantities";
    public static final String HIGH_QUANTITY_RECORDS    = "high_quantity_records";
}
