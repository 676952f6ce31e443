package com.di.retailstar.util;

import com.di.retailstar.exception.SchemaValidationException;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.RowSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InputValidator utility class.
 */
@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // Schema contract
    // ============================================================================

    @Test
    @DisplayName("Should list every missing column in one error")
    void testRequireColumns_AllMissingReported() {
        RowSet rowSet = new RowSet(List.of(Columns.INVOICE_NO, Columns.STOCK_CODE));
        SchemaValidationException ex = assertThrows(SchemaValidationException.class,
                () -> InputValidator.requireColumns(rowSet, Columns.RAW, "cleaning"));
        assertEquals("cleaning", ex.getStage());
        assertEquals(List.of(Columns.DESCRIPTION, Columns.QUANTITY, Columns.INVOICE_DATE,
                Columns.UNIT_PRICE, Columns.CUSTOMER_ID, Columns.COUNTRY), ex.getColumns());
        assertTrue(ex.getMessage().contains("UnitPrice"));
    }

    @Test
    @DisplayName("Should accept a row set carrying all required columns")
    void testRequireColumns_Present() {
        RowSet rowSet = new RowSet(Columns.RAW);
        assertDoesNotThrow(() -> InputValidator.requireColumns(rowSet, Columns.RAW, "cleaning"));
    }

    @Test
    @DisplayName("Should reject an empty dataset")
    void testRequireRows_Empty() {
        RowSet rowSet = new RowSet(Columns.RAW);
        SchemaValidationException ex = assertThrows(SchemaValidationException.class,
                () -> InputValidator.requireRows(rowSet, "cleaning"));
        assertEquals("EMPTY_DATASET", ex.getCondition());
    }

    @Test
    @DisplayName("Should reject a null row set")
    void testRequireColumns_Null() {
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.requireColumns(null, Columns.RAW, "cleaning"));
    }

    // ============================================================================
    // Job id validation
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"a1b2c3d4", "job_2011-01", "X"})
    @DisplayName("Should accept safe job ids")
    void testValidateJobId_Valid(String jobId) {
        assertEquals(jobId, InputValidator.validateJobId(jobId));
    }

    @Test
    @DisplayName("Should reject null job ids")
    void testValidateJobId_Null() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateJobId(null));
        assertTrue(ex.getMessage().contains("cannot be null"));
    }

    @Test
    @DisplayName("Should reject empty job ids")
    void testValidateJobId_Empty() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateJobId("   "));
        assertTrue(ex.getMessage().contains("cannot be empty"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"../etc", "job id", "job/1", "job;rm"})
    @DisplayName("Should reject job ids that are unsafe as directory names")
    void testValidateJobId_Unsafe(String jobId) {
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateJobId(jobId));
    }

    @Test
    @DisplayName("Should reject job ids over the maximum length")
    void testValidateJobId_TooLong() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateJobId("a".repeat(65)));
        assertTrue(ex.getMessage().contains("exceeds maximum length"));
    }

    @Test
    @DisplayName("Should reject a negative high-quantity threshold")
    void testValidateHighQuantityThreshold() {
        assertEquals(10000L, InputValidator.validateHighQuantityThreshold(10000));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateHighQuantityThreshold(-1));
    }
}
