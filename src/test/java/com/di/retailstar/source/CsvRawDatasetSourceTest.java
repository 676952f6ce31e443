package com.di.retailstar.source;

import com.di.retailstar.exception.RawDatasetException;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvRawDatasetSource Tests")
class CsvRawDatasetSourceTest {

    private static final String HEADER = "InvoiceNo,StockCode,Description,Quantity,InvoiceDate,UnitPrice,CustomerID,Country\n";

    @TempDir
    Path tempDir;

    private final CsvRawDatasetSource source = new CsvRawDatasetSource();

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("online_retail.csv");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    @DisplayName("Should read the header and every row in order")
    void testRead_RowsAndColumns() throws IOException {
        RowSet rows = source.read(write(HEADER
                + "536365,85123A,WHITE HANGING HEART,6,2010-12-01 08:26,2.55,17850,United Kingdom\n"
                + "C536366,22633,\"HAND WARMER, UNION JACK\",-6,2010-12-01 08:28,1.85,17850,United Kingdom\n"));

        assertEquals(Columns.RAW, rows.getColumns());
        assertEquals(2, rows.size());
        assertEquals("536365", rows.get(0).get(Columns.INVOICE_NO));
        assertEquals("HAND WARMER, UNION JACK", rows.get(1).get(Columns.DESCRIPTION));
        assertEquals("2010-12-01 08:26", rows.get(0).get(Columns.INVOICE_DATE));
    }

    @Test
    @DisplayName("Should read empty cells as null")
    void testRead_EmptyCellsAreNull() throws IOException {
        RowSet rows = source.read(write(HEADER
                + "536414,22139,,56,2010-12-01 11:52,0,,United Kingdom\n"));

        Row row = rows.get(0);
        assertNull(row.get(Columns.DESCRIPTION));
        assertNull(row.get(Columns.CUSTOMER_ID));
        assertTrue(row.isMissing(Columns.DESCRIPTION));
    }

    @Test
    @DisplayName("Should type numeric columns column-wide")
    void testRead_NumericInference() throws IOException {
        RowSet rows = source.read(write(HEADER
                + "536365,85123A,HEART,6,2010-12-01 08:26,2.55,17850,UK\n"
                + "536366,85123A,HEART,-6,2010-12-01 08:28,3,,UK\n"));

        assertEquals(6L, rows.get(0).get(Columns.QUANTITY));
        assertEquals(-6L, rows.get(1).get(Columns.QUANTITY));
        assertEquals(2.55, rows.get(0).get(Columns.UNIT_PRICE));
        assertEquals(3.0, rows.get(1).get(Columns.UNIT_PRICE));
        assertEquals(17850L, rows.get(0).get(Columns.CUSTOMER_ID));
        assertEquals("85123A", rows.get(0).get(Columns.STOCK_CODE));
    }

    @Test
    @DisplayName("Should keep a numeric column as text when any value is not numeric")
    void testRead_NonNumericColumnStaysText() throws IOException {
        RowSet rows = source.read(write(HEADER
                + "536365,85123A,HEART,6,2010-12-01 08:26,2.55,17850,UK\n"
                + "536366,85123A,HEART,six,2010-12-01 08:28,2.55,17850,UK\n"));

        assertEquals("6", rows.get(0).get(Columns.QUANTITY));
        assertEquals("six", rows.get(1).get(Columns.QUANTITY));
    }

    @Test
    @DisplayName("Should strip a byte order mark from the first header")
    void testRead_ByteOrderMark() throws IOException {
        RowSet rows = source.read(write("\uFEFF" + HEADER + "536365,A1,LAMP,1,2010-12-01 08:26,1,1,UK\n"));
        assertTrue(rows.hasColumn(Columns.INVOICE_NO));
    }

    // ============================================================================
    // Failures
    // ============================================================================

    @Test
    @DisplayName("Should fail for a missing file")
    void testRead_MissingFile() {
        assertThrows(RawDatasetException.class, () -> source.read(tempDir.resolve("absent.csv")));
    }

    @Test
    @DisplayName("Should fail for an empty file")
    void testRead_EmptyFile() throws IOException {
        Path file = write("");
        assertThrows(RawDatasetException.class, () -> source.read(file));
    }

    @Test
    @DisplayName("Should fail for a row with the wrong number of fields")
    void testRead_RaggedRow() throws IOException {
        Path file = write(HEADER + "536365,A1,LAMP\n");
        RawDatasetException ex = assertThrows(RawDatasetException.class, () -> source.read(file));
        assertTrue(ex.getMessage().contains("expected 8 fields"));
    }
}
