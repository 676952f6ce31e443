package com.di.retailstar.modeling;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/** The fact table plus how many rows could not be joined to each dimension. */
@Value
public class FactBuildResult {
    List<FactSales> rows;
    long unmappedDates;
    long unmappedProducts;
    long unmappedCustomers;
    Instant buildTimestamp;
}
