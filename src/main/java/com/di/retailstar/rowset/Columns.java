package com.di.retailstar.rowset;

import java.util.List;

/**
 * Column names of the raw retail extract and of the fields derived by the cleaning pipeline.
 */
public final class Columns {

    private Columns() {
    }

    // ---- raw extract -------------------------------------------------------
    public static final String INVOICE_NO   = "InvoiceNo";
    public static final String STOCK_CODE   = "StockCode";
    public static final String DESCRIPTION  = "Description";
    public static final String QUANTITY     = "Quantity";
    public static final String INVOICE_DATE = "InvoiceDate";
    public static final String UNIT_PRICE   = "UnitPrice";
    public static final String CUSTOMER_ID  = "CustomerID";
    public static final String COUNTRY      = "Country";

    // ---- derived -----------------------------------------------------------
    public static final String IS_CANCELLED        = "IsCancelled";
    public static final String LINE_TOTAL          = "LineTotal";
    public static final String HIGH_QUANTITY_FLAG  = "HighQuantityFlag";
    public static final String INVOICE_YEAR        = "InvoiceYear";
    public static final String INVOICE_MONTH       = "InvoiceMonth";
    public static final String INVOICE_DAY         = "InvoiceDay";
    public static final String INVOICE_DAY_OF_WEEK = "InvoiceDayOfWeek";
    public static final String INVOICE_QUARTER     = "InvoiceQuarter";

    /** Columns every raw extract is expected to carry, in extract order. */
    public static final List<String> RAW = List.of(
            INVOICE_NO, STOCK_CODE, DESCRIPTION, QUANTITY,
            INVOICE_DATE, UNIT_PRICE, CUSTOMER_ID, COUNTRY);
}
