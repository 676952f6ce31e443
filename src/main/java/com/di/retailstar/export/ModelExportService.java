package com.di.retailstar.export;

import com.di.retailstar.cleaning.CleaningResult;
import com.di.retailstar.config.RetailStarProperties;
import com.di.retailstar.modeling.DimCustomer;
import com.di.retailstar.modeling.DimDate;
import com.di.retailstar.modeling.DimProduct;
import com.di.retailstar.modeling.FactSales;
import com.di.retailstar.modeling.ModelingResult;
import com.di.retailstar.modeling.StarSchema;
import com.di.retailstar.profiling.QualitySummary;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Persists one run under {@code <output-dir>/<job-id>/}: the cleaned rows and the four
 * star-schema tables as CSV, the reports as JSON.
 */
@Slf4j
@Service
public class ModelExportService {

    public static final String CLEANED_DATA = "cleaned_data.csv";
    public static final String DIM_DATE = "dim_date.csv";
    public static final String DIM_PRODUCT = "dim_product.csv";
    public static final String DIM_CUSTOMER = "dim_customer.csv";
    public static final String FACT_SALES = "fact_sales.csv";
    public static final String CLEANING_REPORT = "cleaning_report.json";
    public static final String MODELING_REPORT = "modeling_report.json";
    public static final String PROFILE_REPORT = "profile_report.json";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path outputRoot;
    private final ObjectMapper objectMapper;

    @Autowired
    public ModelExportService(RetailStarProperties properties) {
        this(Paths.get(properties.getOutputDir()));
    }

    public ModelExportService(Path outputRoot) {
        this.outputRoot = outputRoot;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes every artifact of a run. The profile is optional.
     *
     * @return artifact file name to written path, in write order
     * @throws UncheckedIOException when a file cannot be written
     */
    public Map<String, Path> export(String jobId, CleaningResult cleaning, ModelingResult modeling,
                                    QualitySummary profile) {
        Path runDir = outputRoot.resolve(jobId);
        log.info("[EXPORT] Saving model outputs to {}", runDir);
        Map<String, Path> written = new LinkedHashMap<>();
        try {
            Files.createDirectories(runDir);

            written.put(CLEANED_DATA, writeRowSet(runDir.resolve(CLEANED_DATA), cleaning.getRowSet()));

            StarSchema schema = modeling.getSchema();
            written.put(DIM_DATE, writeTable(runDir.resolve(DIM_DATE), schema.getDimDate().getRows(), DATE_COLUMNS));
            written.put(DIM_PRODUCT, writeTable(runDir.resolve(DIM_PRODUCT), schema.getDimProduct().getRows(), PRODUCT_COLUMNS));
            written.put(DIM_CUSTOMER, writeTable(runDir.resolve(DIM_CUSTOMER), schema.getDimCustomer().getRows(), CUSTOMER_COLUMNS));
            written.put(FACT_SALES, writeTable(runDir.resolve(FACT_SALES), schema.getFactSales(), FACT_COLUMNS));

            written.put(CLEANING_REPORT, writeJson(runDir.resolve(CLEANING_REPORT), cleaning.getReport()));
            written.put(MODELING_REPORT, writeJson(runDir.resolve(MODELING_REPORT), modeling.getReport()));
            if (profile != null) {
                written.put(PROFILE_REPORT, writeJson(runDir.resolve(PROFILE_REPORT), profile));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export run " + jobId + " to " + runDir, e);
        }
        written.forEach((name, path) -> log.info("[EXPORT]   {} -> {}", name, path));
        return written;
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    // ============================================================================
    // Writers
    // ============================================================================

    private Path writeRowSet(Path file, RowSet rowSet) throws IOException {
        List<String> columns = rowSet.getColumns();
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             ICSVWriter csv = new CSVWriter(out)) {
            csv.writeNext(columns.toArray(new String[0]), false);
            for (Row row : rowSet) {
                String[] cells = new String[columns.size()];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = cell(row.get(columns.get(i)));
                }
                csv.writeNext(cells, false);
            }
        }
        return file;
    }

    private <R> Path writeTable(Path file, List<R> rows, Map<String, Function<R, Object>> columns) throws IOException {
        List<Function<R, Object>> getters = new ArrayList<>(columns.values());
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             ICSVWriter csv = new CSVWriter(out)) {
            csv.writeNext(columns.keySet().toArray(new String[0]), false);
            for (R row : rows) {
                String[] cells = new String[getters.size()];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = cell(getters.get(i).apply(row));
                }
                csv.writeNext(cells, false);
            }
        }
        return file;
    }

    private Path writeJson(Path file, Object report) throws IOException {
        Files.write(file, objectMapper.writeValueAsBytes(report));
        return file;
    }

    /** Empty for null; timestamps as {@code yyyy-MM-dd HH:mm:ss}. */
    static String cell(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(TIMESTAMP);
        }
        return value.toString();
    }

    // ============================================================================
    // Table layouts
    // ============================================================================

    private static final Map<String, Function<DimDate, Object>> DATE_COLUMNS = new LinkedHashMap<>();
    private static final Map<String, Function<DimProduct, Object>> PRODUCT_COLUMNS = new LinkedHashMap<>();
    private static final Map<String, Function<DimCustomer, Object>> CUSTOMER_COLUMNS = new LinkedHashMap<>();
    private static final Map<String, Function<FactSales, Object>> FACT_COLUMNS = new LinkedHashMap<>();

    static {
        DATE_COLUMNS.put("date_key", DimDate::getDateKey);
        DATE_COLUMNS.put("full_date", DimDate::getFullDate);
        DATE_COLUMNS.put("year", DimDate::getYear);
        DATE_COLUMNS.put("quarter", DimDate::getQuarter);
        DATE_COLUMNS.put("month", DimDate::getMonth);
        DATE_COLUMNS.put("month_name", DimDate::getMonthName);
        DATE_COLUMNS.put("day", DimDate::getDay);
        DATE_COLUMNS.put("day_of_week", DimDate::getDayOfWeek);
        DATE_COLUMNS.put("day_name", DimDate::getDayName);
        DATE_COLUMNS.put("is_weekend", DimDate::getIsWeekend);

        PRODUCT_COLUMNS.put("product_key", DimProduct::getProductKey);
        PRODUCT_COLUMNS.put("stock_code", DimProduct::getStockCode);
        PRODUCT_COLUMNS.put("description", DimProduct::getDescription);
        PRODUCT_COLUMNS.put("first_seen_date", DimProduct::getFirstSeenDate);
        PRODUCT_COLUMNS.put("last_seen_date", DimProduct::getLastSeenDate);
        PRODUCT_COLUMNS.put("is_active", DimProduct::getIsActive);

        CUSTOMER_COLUMNS.put("customer_key", DimCustomer::getCustomerKey);
        CUSTOMER_COLUMNS.put("customer_id", DimCustomer::getCustomerId);
        CUSTOMER_COLUMNS.put("country", DimCustomer::getCountry);
        CUSTOMER_COLUMNS.put("first_purchase_date", DimCustomer::getFirstPurchaseDate);
        CUSTOMER_COLUMNS.put("last_purchase_date", DimCustomer::getLastPurchaseDate);
        CUSTOMER_COLUMNS.put("is_unknown_customer", DimCustomer::getIsUnknownCustomer);

        FACT_COLUMNS.put("transaction_key", FactSales::getTransactionKey);
        FACT_COLUMNS.put("date_key", FactSales::getDateKey);
        FACT_COLUMNS.put("product_key", FactSales::getProductKey);
        FACT_COLUMNS.put("customer_key", FactSales::getCustomerKey);
        FACT_COLUMNS.put("quantity", FactSales::getQuantity);
        FACT_COLUMNS.put("unit_price", FactSales::getUnitPrice);
        FACT_COLUMNS.put("line_total", FactSales::getLineTotal);
        FACT_COLUMNS.put("is_cancelled", FactSales::getIsCancelled);
        FACT_COLUMNS.put("high_quantity_flag", FactSales::getHighQuantityFlag);
        FACT_COLUMNS.put("invoice_no", FactSales::getInvoiceNo);
        FACT_COLUMNS.put("timestamp", FactSales::getTimestamp);
    }
}
