package com.di.retailstar.modeling;

import lombok.Value;

@Value
public class ModelingResult {
    StarSchema schema;
    ModelingReport report;
}
