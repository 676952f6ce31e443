package com.di.retailstar.modeling;

import lombok.Value;

import java.util.List;

/** The four assembled tables. */
@Value
public class StarSchema {
    DimensionTable<Integer, DimDate> dimDate;
    DimensionTable<String, DimProduct> dimProduct;
    DimensionTable<Long, DimCustomer> dimCustomer;
    List<FactSales> factSales;
}
