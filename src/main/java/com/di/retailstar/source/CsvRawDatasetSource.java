package com.di.retailstar.source;

import com.di.retailstar.exception.RawDatasetException;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a header-first CSV extract. Empty cells become null. The numeric columns
 * (Quantity, UnitPrice, CustomerID) are typed column-wide: Long when every value is a whole
 * number, Double when every value is numeric, otherwise left as text for the cleaning
 * rules to handle.
 */
@Slf4j
@Component
public class CsvRawDatasetSource implements RawDatasetSource {

    static final Set<String> NUMERIC_COLUMNS = Set.of(Columns.QUANTITY, Columns.UNIT_PRICE, Columns.CUSTOMER_ID);

    private final char separator;

    public CsvRawDatasetSource() {
        this(',');
    }

    public CsvRawDatasetSource(char separator) {
        this.separator = separator;
    }

    @Override
    public RowSet read(Path location) {
        if (location == null || !Files.isRegularFile(location)) {
            throw new RawDatasetException("Raw dataset not found: " + location);
        }
        log.info("[SOURCE] Loading raw dataset from {}", location);

        List<String> header;
        List<String[]> records = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(location, StandardCharsets.UTF_8);
             CSVReader csv = open(reader)) {
            String[] first = csv.readNext();
            if (first == null) {
                throw new RawDatasetException("Raw dataset has no header row: " + location);
            }
            header = header(first);
            String[] record;
            while ((record = csv.readNext()) != null) {
                if (record.length == 1 && record[0].isEmpty()) {
                    continue;
                }
                if (record.length != header.size()) {
                    throw new RawDatasetException(String.format(
                            "Malformed CSV %s at line %d: expected %d fields, found %d",
                            location, csv.getLinesRead(), header.size(), record.length));
                }
                records.add(record);
            }
        } catch (IOException | CsvValidationException e) {
            throw new RawDatasetException("Error reading raw dataset " + location, e);
        }

        RowSet rowSet = toRowSet(header, records);
        log.info("[SOURCE] Loaded {} rows, {} columns", rowSet.size(), rowSet.getColumns().size());
        return rowSet;
    }

    private CSVReader open(Reader reader) {
        return new CSVReaderBuilder(reader)
                .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
                .build();
    }

    private static List<String> header(String[] first) {
        List<String> header = new ArrayList<>(first.length);
        for (int i = 0; i < first.length; i++) {
            String name = first[i].trim();
            // UTF-8 byte order mark on the first header cell
            if (i == 0 && !name.isEmpty() && name.charAt(0) == '\uFEFF') {
                name = name.substring(1);
            }
            header.add(name);
        }
        return header;
    }

    private static RowSet toRowSet(List<String> header, List<String[]> records) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (int c = 0; c < header.size(); c++) {
            if (NUMERIC_COLUMNS.contains(header.get(c))) {
                types.put(header.get(c), inferType(records, c));
            }
        }

        RowSet rowSet = new RowSet(header);
        for (String[] record : records) {
            Row row = new Row();
            for (int c = 0; c < header.size(); c++) {
                String column = header.get(c);
                String cell = record[c].isEmpty() ? null : record[c];
                row.set(column, convert(cell, types.getOrDefault(column, ColumnType.TEXT)));
            }
            rowSet.add(row);
        }
        types.forEach((column, type) -> log.debug("[SOURCE] Column {} typed as {}", column, type));
        return rowSet;
    }

    enum ColumnType { LONG, DOUBLE, TEXT }

    static ColumnType inferType(List<String[]> records, int column) {
        ColumnType type = ColumnType.LONG;
        for (String[] record : records) {
            String cell = record[column].trim();
            if (cell.isEmpty()) {
                continue;
            }
            BigDecimal number;
            try {
                number = new BigDecimal(cell);
            } catch (NumberFormatException e) {
                return ColumnType.TEXT;
            }
            if (type == ColumnType.LONG && !isWhole(cell, number)) {
                type = ColumnType.DOUBLE;
            }
        }
        return type;
    }

    /** A decimal point makes the column floating-point even for 17850.0. */
    private static boolean isWhole(String cell, BigDecimal number) {
        if (cell.indexOf('.') >= 0 || cell.indexOf('e') >= 0 || cell.indexOf('E') >= 0) {
            return false;
        }
        try {
            number.longValueExact();
            return true;
        } catch (ArithmeticException e) {
            return false;
        }
    }

    private static Object convert(String cell, ColumnType type) {
        if (cell == null) {
            return null;
        }
        switch (type) {
            case LONG:
                return Long.parseLong(cell.trim());
            case DOUBLE:
                return Double.parseDouble(cell.trim());
            default:
                return cell;
        }
    }
}
