package com.di.retailstar.modeling;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One sales line. Foreign keys are null when the cleaned row had no matching dimension member.
 */
@Value
@Builder(toBuilder = true)
public class FactSales {
    long transactionKey;
    Integer dateKey;
    Long productKey;
    Long customerKey;
    Long quantity;
    Double unitPrice;
    Double lineTotal;
    Boolean isCancelled;
    Boolean highQuantityFlag;
    String invoiceNo;
    /** Build time shared by every row of the table. */
    Instant timestamp;
}
