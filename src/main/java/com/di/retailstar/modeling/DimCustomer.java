package com.di.retailstar.modeling;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
public class DimCustomer {
    long customerKey;
    Long customerId;
    /** Country of the first row carrying this customer id. */
    String country;
    LocalDateTime firstPurchaseDate;
    LocalDateTime lastPurchaseDate;
    Boolean isUnknownCustomer;
}
