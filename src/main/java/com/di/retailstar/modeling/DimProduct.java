package com.di.retailstar.modeling;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
public class DimProduct {
    long productKey;
    String stockCode;
    /** Description of the first row carrying this stock code. */
    String description;
    LocalDateTime firstSeenDate;
    LocalDateTime lastSeenDate;
    /** Always true until product lifecycle tracking exists. */
    Boolean isActive;
}
