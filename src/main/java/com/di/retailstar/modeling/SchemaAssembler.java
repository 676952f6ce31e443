package com.di.retailstar.modeling;

import com.di.retailstar.exception.SchemaIntegrityException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToLongFunction;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Last modeling step, run after every join: fills defaults for null attributes, checks the
 * key invariants of each table and produces the modeling report.
 * <p>
 * Defaults are applied here and not earlier so that no upstream lookup ever sees a
 * substituted natural key.
 */
@Slf4j
public class SchemaAssembler {

    private final String unknownProductPlaceholder;
    private final String unknownCountry;

    public SchemaAssembler(String unknownProductPlaceholder, String unknownCountry) {
        this.unknownProductPlaceholder = unknownProductPlaceholder;
        this.unknownCountry = unknownCountry;
    }

    /**
     * @throws SchemaIntegrityException when a surrogate key is duplicated, not dense, or a
     *         non-null foreign key does not resolve to exactly one dimension row
     */
    public ModelingResult assemble(DimensionTable<Integer, DimDate> dimDate,
                                   DimensionTable<String, DimProduct> dimProduct,
                                   DimensionTable<Long, DimCustomer> dimCustomer,
                                   FactBuildResult facts) {
        log.info("[MODEL] Assembling star schema...");

        DimensionTable<String, DimProduct> products = withDefaults(dimProduct, this::fillProduct);
        DimensionTable<Long, DimCustomer> customers = withDefaults(dimCustomer, this::fillCustomer);
        List<FactSales> factRows = facts.getRows().stream().map(SchemaAssembler::fillFact).collect(Collectors.toList());

        checkDateSpine(dimDate);
        checkDense(products.getName(), products.getRows(), DimProduct::getProductKey);
        checkDense(customers.getName(), customers.getRows(), DimCustomer::getCustomerKey);
        checkDense(FactBuilder.TABLE, factRows, FactSales::getTransactionKey);
        checkForeignKeys(factRows, dimDate, products, customers);

        StarSchema schema = new StarSchema(dimDate, products, customers, factRows);
        ModelingReport report = report(schema, facts);
        log.info("[MODEL] Star schema assembled: {}", report.getTablesCreated());
        return new ModelingResult(schema, report);
    }

    // ============================================================================
    // Defaults
    // ============================================================================

    private DimProduct fillProduct(DimProduct p) {
        if (p.getDescription() != null && p.getIsActive() != null) {
            return p;
        }
        return p.toBuilder()
                .description(p.getDescription() == null ? unknownProductPlaceholder : p.getDescription())
                .isActive(p.getIsActive() == null ? Boolean.TRUE : p.getIsActive())
                .build();
    }

    private DimCustomer fillCustomer(DimCustomer c) {
        if (c.getCountry() != null && c.getIsUnknownCustomer() != null) {
            return c;
        }
        return c.toBuilder()
                .country(c.getCountry() == null ? unknownCountry : c.getCountry())
                .isUnknownCustomer(c.getIsUnknownCustomer() == null
                        ? Long.valueOf(0L).equals(c.getCustomerId())
                        : c.getIsUnknownCustomer())
                .build();
    }

    private static FactSales fillFact(FactSales f) {
        if (f.getIsCancelled() != null && f.getHighQuantityFlag() != null) {
            return f;
        }
        return f.toBuilder()
                .isCancelled(f.getIsCancelled() != null && f.getIsCancelled())
                .highQuantityFlag(f.getHighQuantityFlag() != null && f.getHighQuantityFlag())
                .build();
    }

    private static <K, R> DimensionTable<K, R> withDefaults(DimensionTable<K, R> table,
                                                           UnaryOperator<R> fill) {
        List<R> rows = new ArrayList<>(table.size());
        table.getRows().forEach(r -> rows.add(fill.apply(r)));
        return new DimensionTable<>(table.getName(), rows, table.getKeyIndex());
    }

    // ============================================================================
    // Key checks
    // ============================================================================

    /** Keys must be exactly 1..N in row order. */
    static <R> void checkDense(String table, List<R> rows, ToLongFunction<R> key) {
        long expected = 1;
        for (R row : rows) {
            long actual = key.applyAsLong(row);
            if (actual != expected) {
                throw new SchemaIntegrityException(String.format(
                        "%s: surrogate keys must be contiguous from 1, found %d at position %d",
                        table, actual, expected));
            }
            expected++;
        }
    }

    /** Date keys are calendar-derived: unique, and one per day without gaps. */
    static void checkDateSpine(DimensionTable<Integer, DimDate> dimDate) {
        Set<Integer> seen = new HashSet<>();
        LocalDate previous = null;
        for (DimDate d : dimDate.getRows()) {
            if (!seen.add(d.getDateKey())) {
                throw new SchemaIntegrityException(
                        dimDate.getName() + ": duplicate date_key " + d.getDateKey());
            }
            if (previous != null && !d.getFullDate().equals(previous.plusDays(1))) {
                throw new SchemaIntegrityException(String.format(
                        "%s: date spine has a gap between %s and %s", dimDate.getName(), previous, d.getFullDate()));
            }
            previous = d.getFullDate();
        }
    }

    static void checkForeignKeys(List<FactSales> facts,
                                 DimensionTable<Integer, DimDate> dimDate,
                                 DimensionTable<String, DimProduct> dimProduct,
                                 DimensionTable<Long, DimCustomer> dimCustomer) {
        Map<Long, Integer> dateRefs = countKeys(dimDate.getRows(), d -> d.getDateKey());
        Map<Long, Integer> productRefs = countKeys(dimProduct.getRows(), DimProduct::getProductKey);
        Map<Long, Integer> customerRefs = countKeys(dimCustomer.getRows(), DimCustomer::getCustomerKey);

        for (FactSales f : facts) {
            resolve(dimDate.getName(), f, f.getDateKey() == null ? null : f.getDateKey().longValue(), dateRefs);
            resolve(dimProduct.getName(), f, f.getProductKey(), productRefs);
            resolve(dimCustomer.getName(), f, f.getCustomerKey(), customerRefs);
        }
    }

    private static <R> Map<Long, Integer> countKeys(List<R> rows, ToLongFunction<R> key) {
        Map<Long, Integer> counts = new HashMap<>();
        rows.forEach(r -> counts.merge(key.applyAsLong(r), 1, Integer::sum));
        return counts;
    }

    private static void resolve(String table, FactSales fact, Long key, Map<Long, Integer> refs) {
        if (key == null) {
            return;
        }
        int matches = refs.getOrDefault(key, 0);
        if (matches != 1) {
            throw new SchemaIntegrityException(String.format(
                    "fact_sales transaction %d references %s key %d which resolves to %d rows",
                    fact.getTransactionKey(), table, key, matches));
        }
    }

    // ============================================================================
    // Report
    // ============================================================================

    private static ModelingReport report(StarSchema schema, FactBuildResult facts) {
        Map<String, Integer> tables = new LinkedHashMap<>();
        tables.put(schema.getDimDate().getName(), schema.getDimDate().size());
        tables.put(schema.getDimProduct().getName(), schema.getDimProduct().size());
        tables.put(schema.getDimCustomer().getName(), schema.getDimCustomer().size());
        tables.put(FactBuilder.TABLE, schema.getFactSales().size());

        List<DimDate> days = schema.getDimDate().getRows();
        ModelingReport.DateRange range = days.isEmpty()
                ? null
                : new ModelingReport.DateRange(days.get(0).getFullDate(), days.get(days.size() - 1).getFullDate());

        long unknownCustomers = schema.getDimCustomer().getRows().stream()
                .filter(c -> Boolean.TRUE.equals(c.getIsUnknownCustomer()))
                .count();

        return ModelingReport.builder()
                .tablesCreated(tables)
                .schemaSummary(ModelingReport.SchemaSummary.builder()
                        .dateRange(range)
                        .uniqueProducts(schema.getDimProduct().size())
                        .uniqueCustomers(schema.getDimCustomer().size())
                        .unknownCustomers(unknownCustomers)
                        .build())
                .integrity(ModelingReport.Integrity.builder()
                        .unmappedDates(facts.getUnmappedDates())
                        .unmappedProducts(facts.getUnmappedProducts())
                        .unmappedCustomers(facts.getUnmappedCustomers())
                        .build())
                .buildTimestamp(facts.getBuildTimestamp())
                .build();
    }
}
