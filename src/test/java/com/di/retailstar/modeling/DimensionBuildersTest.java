package com.di.retailstar.modeling;

import com.di.retailstar.RetailFixtures;
import com.di.retailstar.cleaning.CleaningPipeline;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.exception.SchemaValidationException;
import com.di.retailstar.rowset.RowSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static com.di.retailstar.RetailFixtures.raw;
import static com.di.retailstar.RetailFixtures.rowSet;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dimension builder Tests")
class DimensionBuildersTest {

    private RunContext ctx;
    private RowSet cleaned;

    @BeforeEach
    void setUp() {
        ctx = RunContext.create("dims");
        cleaned = CleaningPipeline.withDefaults().clean(RetailFixtures.threeDays(), ctx).getRowSet();
    }

    // ============================================================================
    // Date dimension
    // ============================================================================

    @Test
    @DisplayName("Should span every calendar day between the first and last invoice")
    void testDateSpine_Complete() {
        DimensionTable<Integer, DimDate> dim =
                new DateDimensionBuilder(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY)).build(cleaned, ctx);

        assertEquals(3, dim.size());
        assertEquals(List.of(20110101, 20110102, 20110103),
                dim.getRows().stream().map(DimDate::getDateKey).collect(Collectors.toList()));
        DimDate gap = dim.getRows().get(1);
        assertEquals(LocalDate.of(2011, 1, 2), gap.getFullDate());
        assertEquals("Sunday", gap.getDayName());
        assertEquals(6, gap.getDayOfWeek());
        assertTrue(gap.getIsWeekend());
        assertEquals("January", gap.getMonthName());
        assertEquals(1, gap.getQuarter());
        assertFalse(dim.getRows().get(2).getIsWeekend());
        assertEquals(20110102L, dim.lookup(20110102).orElseThrow());
    }

    @Test
    @DisplayName("Should honour a configured weekend")
    void testDateSpine_CustomWeekend() {
        DimensionTable<Integer, DimDate> dim =
                new DateDimensionBuilder(EnumSet.of(DayOfWeek.FRIDAY)).build(cleaned, ctx);
        // 2011-01-01 is a Saturday
        assertFalse(dim.getRows().get(0).getIsWeekend());
    }

    @Test
    @DisplayName("Should ignore rows without a timestamp when computing the range")
    void testDateSpine_IgnoresMissingDates() {
        RowSet rows = rowSet(
                raw("1", "A1", "LAMP", 1L, LocalDateTime.of(2011, 5, 1, 9, 0), 1.0, 1L, "UK"),
                raw("2", "A1", "LAMP", 1L, null, 1.0, 1L, "UK"));
        DimensionTable<Integer, DimDate> dim = new DateDimensionBuilder(EnumSet.noneOf(DayOfWeek.class)).build(rows, ctx);
        assertEquals(1, dim.size());
    }

    @Test
    @DisplayName("Should fail when no row carries a timestamp")
    void testDateSpine_NoDatedRows() {
        RowSet rows = rowSet(raw("1", "A1", "LAMP", 1L, null, 1.0, 1L, "UK"));
        SchemaValidationException ex = assertThrows(SchemaValidationException.class,
                () -> new DateDimensionBuilder(null).build(rows, ctx));
        assertEquals("NO_DATED_ROWS", ex.getCondition());
        assertEquals("dim_date", ex.getStage());
    }

    // ============================================================================
    // Product dimension
    // ============================================================================

    @Test
    @DisplayName("Should key products densely in first-seen order with the first description")
    void testProductDimension() {
        DimensionTable<String, DimProduct> dim = new ProductDimensionBuilder().build(cleaned, ctx);

        assertEquals(3, dim.size());
        for (int i = 0; i < dim.size(); i++) {
            assertEquals(i + 1, dim.getRows().get(i).getProductKey());
        }
        DimProduct heart = dim.getRows().get(0);
        assertEquals("85123A", heart.getStockCode());
        assertEquals("WHITE HANGING HEART", heart.getDescription());
        assertEquals(LocalDateTime.of(2011, 1, 1, 9, 0), heart.getFirstSeenDate());
        assertEquals(LocalDateTime.of(2011, 1, 3, 12, 30), heart.getLastSeenDate());
        assertTrue(heart.getIsActive());
        assertEquals(1L, dim.lookup("85123A").orElseThrow());
        assertTrue(dim.lookup("85123a").isEmpty());
    }

    @Test
    @DisplayName("Stock codes differing only in case should form separate products")
    void testProductDimension_CaseSensitiveCodes() {
        RowSet rows = rowSet(
                raw("1", "a1", "small lamp", 1L, LocalDateTime.of(2011, 5, 1, 9, 0), 1.0, 1L, "UK"),
                raw("2", "A1", "LAMP", 1L, LocalDateTime.of(2011, 5, 2, 9, 0), 1.0, 1L, "UK"));
        DimensionTable<String, DimProduct> dim = new ProductDimensionBuilder().build(rows, ctx);
        assertEquals(2, dim.size());
        assertEquals(1L, dim.lookup("a1").orElseThrow());
        assertEquals(2L, dim.lookup("A1").orElseThrow());
        assertEquals("LAMP", dim.getRows().get(1).getDescription());
    }

    @Test
    @DisplayName("Should compare stock codes as text across numeric and string values")
    void testProductDimension_NumericCodes() {
        RowSet rows = rowSet(
                raw("1", 22423L, "CAKESTAND", 1L, LocalDateTime.of(2011, 5, 1, 9, 0), 1.0, 1L, "UK"),
                raw("2", "22423", "CAKE STAND", 1L, LocalDateTime.of(2011, 5, 2, 9, 0), 1.0, 1L, "UK"));
        DimensionTable<String, DimProduct> dim = new ProductDimensionBuilder().build(rows, ctx);
        assertEquals(1, dim.size());
        assertEquals("CAKESTAND", dim.getRows().get(0).getDescription());
    }

    // ============================================================================
    // Customer dimension
    // ============================================================================

    @Test
    @DisplayName("Should keep exactly one unknown customer for the sentinel id")
    void testCustomerDimension_Sentinel() {
        DimensionTable<Long, DimCustomer> dim = new CustomerDimensionBuilder().build(cleaned, ctx);

        assertEquals(3, dim.size());
        List<DimCustomer> unknown = dim.getRows().stream()
                .filter(c -> c.getCustomerId() == 0L)
                .collect(Collectors.toList());
        assertEquals(1, unknown.size());
        assertTrue(unknown.get(0).getIsUnknownCustomer());
        assertEquals("Germany", unknown.get(0).getCountry());
        assertEquals(2, dim.getRows().stream().filter(c -> !c.getIsUnknownCustomer()).count());
    }

    @Test
    @DisplayName("Should take the first-seen country and the purchase range per customer")
    void testCustomerDimension_FirstSeen() {
        DimensionTable<Long, DimCustomer> dim = new CustomerDimensionBuilder().build(cleaned, ctx);
        DimCustomer first = dim.getRows().get(0);
        assertEquals(1L, first.getCustomerKey());
        assertEquals(17850L, first.getCustomerId());
        assertEquals("United Kingdom", first.getCountry());
        assertEquals(LocalDateTime.of(2011, 1, 1, 9, 0), first.getFirstPurchaseDate());
        assertEquals(LocalDateTime.of(2011, 1, 3, 12, 30), first.getLastPurchaseDate());
    }
}
