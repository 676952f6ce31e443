package com.di.retailstar.cleaning.rules;

import com.di.retailstar.cleaning.CleaningMetrics;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static com.di.retailstar.RetailFixtures.raw;
import static com.di.retailstar.RetailFixtures.rowSet;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cleaning rule Tests")
class CleaningRulesTest {

    private final RunContext ctx = RunContext.create("rules");

    // ============================================================================
    // Datetime normalization
    // ============================================================================

    @Test
    @DisplayName("Should count impossible calendar dates as invalid and leave them missing")
    void testDatetimeNormalization_ImpossibleDates() {
        RowSet rows = rowSet(
                raw("1", "A1", "LAMP", 1L, "2011-02-30 10:00", 1.0, 1L, "UK"),
                raw("2", "A1", "LAMP", 1L, "2/31/2011 10:00", 1.0, 1L, "UK"),
                raw("3", "A1", "LAMP", 1L, "2/28/2011 10:00", 1.0, 1L, "UK"));
        new DatetimeNormalizationRule().apply(rows, ctx);
        assertNull(rows.get(0).get(Columns.INVOICE_DATE));
        assertNull(rows.get(1).get(Columns.INVOICE_DATE));
        assertEquals(LocalDateTime.of(2011, 2, 28, 10, 0), rows.get(2).get(Columns.INVOICE_DATE));
        assertEquals(2L, ctx.getQualityStats().getLong(CleaningMetrics.INVALID_INVOICE_DATES));
    }

    // ============================================================================
    // Cancellation flag
    // ============================================================================

    @ParameterizedTest
    @CsvSource({"C536366, true", "536366, false", "c536366, false", "A563185, false"})
    @DisplayName("Should flag invoices starting with an upper-case C")
    void testCancellationFlag(String invoiceNo, boolean expected) {
        Row row = raw(invoiceNo, "A1", "LAMP", 1L, "2010-12-01 08:26", 1.0, 1L, "UK");
        assertEquals(expected, CancellationFlagRule.isCancelled(row));
    }

    @Test
    @DisplayName("Should stringify numeric invoice numbers before checking the prefix")
    void testCancellationFlag_NumericInvoice() {
        Row row = raw(536366L, "A1", "LAMP", 1L, "2010-12-01 08:26", 1.0, 1L, "UK");
        assertFalse(CancellationFlagRule.isCancelled(row));
    }

    // ============================================================================
    // Imputation
    // ============================================================================

    @Test
    @DisplayName("Should not record missing descriptions when none are missing")
    void testDescriptionImputation_NothingMissing() {
        RowSet rows = rowSet(raw("1", "A1", "LAMP", 1L, "2010-12-01 08:26", 1.0, 1L, "UK"));
        new DescriptionImputationRule("Unknown Product").apply(rows, ctx);
        assertFalse(ctx.getQualityStats().contains(CleaningMetrics.MISSING_DESCRIPTIONS));
    }

    @Test
    @DisplayName("Should impute unparsable customer ids with the sentinel")
    void testCustomerIdImputation_Unparsable() {
        RowSet rows = rowSet(
                raw("1", "A1", "LAMP", 1L, "2010-12-01 08:26", 1.0, "abc", "UK"),
                raw("2", "A1", "LAMP", 1L, "2010-12-01 08:26", 1.0, "17850.0", "UK"));
        new CustomerIdImputationRule().apply(rows, ctx);
        assertEquals(0L, rows.get(0).get(Columns.CUSTOMER_ID));
        assertEquals(17850L, rows.get(1).get(Columns.CUSTOMER_ID));
        assertEquals(1L, ctx.getQualityStats().getLong(CleaningMetrics.MISSING_CUSTOMER_IDS));
    }

    // ============================================================================
    // Flags and derived fields
    // ============================================================================

    @Test
    @DisplayName("Should flag quantities strictly above the threshold in either direction")
    void testHighQuantityFlag() {
        RowSet rows = rowSet(
                raw("1", "A1", "LAMP", 10000L, "2010-12-01 08:26", 1.0, 1L, "UK"),
                raw("2", "A1", "LAMP", 10001L, "2010-12-01 08:26", 1.0, 1L, "UK"),
                raw("C3", "A1", "LAMP", -80995L, "2010-12-01 08:26", 1.0, 1L, "UK"));
        new HighQuantityFlagRule(10000).apply(rows, ctx);
        assertEquals(false, rows.get(0).get(Columns.HIGH_QUANTITY_FLAG));
        assertEquals(true, rows.get(1).get(Columns.HIGH_QUANTITY_FLAG));
        assertEquals(true, rows.get(2).get(Columns.HIGH_QUANTITY_FLAG));
        assertEquals(2L, ctx.getQualityStats().getLong(CleaningMetrics.HIGH_QUANTITY_RECORDS));
    }

    @Test
    @DisplayName("Should derive calendar components from the normalized timestamp")
    void testDateComponents() {
        RowSet rows = rowSet(raw("1", "A1", "LAMP", 1L, LocalDateTime.of(2011, 4, 3, 9, 0), 1.0, 1L, "UK"));
        new DateComponentRule().apply(rows, ctx);
        Row row = rows.get(0);
        assertEquals(2011, row.get(Columns.INVOICE_YEAR));
        assertEquals(4, row.get(Columns.INVOICE_MONTH));
        assertEquals(3, row.get(Columns.INVOICE_DAY));
        assertEquals(6, row.get(Columns.INVOICE_DAY_OF_WEEK));
        assertEquals(2, row.get(Columns.INVOICE_QUARTER));
    }

    @Test
    @DisplayName("Should leave date components missing when the timestamp is missing")
    void testDateComponents_NullTimestamp() {
        RowSet rows = rowSet(raw("1", "A1", "LAMP", 1L, null, 1.0, 1L, "UK"));
        new DateComponentRule().apply(rows, ctx);
        assertNull(rows.get(0).get(Columns.INVOICE_YEAR));
        assertTrue(rows.hasColumn(Columns.INVOICE_QUARTER));
    }

    @ParameterizedTest
    @CsvSource({
            "' uk ', Uk",
            "' united KINGDOM ', United Kingdom",
            "EIRE, Eire",
            "channel islands, Channel Islands",
            "rsa-south, Rsa-South"
    })
    @DisplayName("Should trim and title-case country names")
    void testCountryTitleCase(String input, String expected) {
        assertEquals(expected, CountryNormalizationRule.titleCase(input.trim()));
    }

    @Test
    @DisplayName("Should leave a missing line total when quantity cannot be parsed")
    void testLineTotal_UnparsableQuantity() {
        RowSet rows = rowSet(raw("1", "A1", "LAMP", "lots", "2010-12-01 08:26", 2.0, 1L, "UK"));
        new LineTotalRule().apply(rows, ctx);
        assertNull(rows.get(0).get(Columns.LINE_TOTAL));
        assertEquals("lots", rows.get(0).get(Columns.QUANTITY));
        assertEquals(1L, ctx.getQualityStats().getLong(CleaningMetrics.UNPARSABLE_QUANTITIES));
    }

    @Test
    @DisplayName("Should treat rows as duplicates when they differ only in forms later rules normalize")
    void testDuplicateRemoval_NormalizedComparison() {
        RowSet rows = rowSet(
                raw("1", "A1", "LAMP", 6L, LocalDateTime.of(2010, 12, 1, 8, 26), 2.55, 1L, " uk "),
                raw("1", "A1", "LAMP", "6", LocalDateTime.of(2010, 12, 1, 8, 26), "2.55", 1L, "UK"),
                raw("1", "a1", "LAMP", 6L, LocalDateTime.of(2010, 12, 1, 8, 26), 2.55, 1L, "UK"));
        new DuplicateRemovalRule().apply(rows, ctx);
        assertEquals(2, rows.size());
        assertEquals(" uk ", rows.get(0).get(Columns.COUNTRY));
        assertEquals("a1", rows.get(1).get(Columns.STOCK_CODE));
        assertEquals(1L, ctx.getQualityStats().getLong(CleaningMetrics.DUPLICATES_REMOVED));
    }
}
