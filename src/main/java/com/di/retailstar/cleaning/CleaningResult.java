package com.di.retailstar.cleaning;

import com.di.retailstar.rowset.RowSet;
import lombok.Value;

@Value
public class CleaningResult {
    RowSet rowSet;
    CleaningReport report;
}
