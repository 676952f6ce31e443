package com.di.retailstar.modeling;

import com.di.retailstar.config.RetailStarProperties;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.InputValidator;
import com.di.retailstar.util.MdcPropagation;
import com.di.retailstar.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns a cleaned row set into the star schema.
 *
 * <pre>
 *   dim_date ─┐
 *   dim_product ├─► fact_sales ─► assembler
 *   dim_customer ┘
 * </pre>
 *
 * The three dimensions are independent and may be built concurrently; the fact table
 * waits for all of them.
 */
@Slf4j
@Service
public class StarSchemaService {

    public static final String STAGE = "modeling";

    private static final long DIMENSION_TIMEOUT_MINUTES = 30;

    /** Raw columns plus the derived fields the fact table carries. */
    static final List<String> REQUIRED_COLUMNS = Stream.concat(
            Columns.RAW.stream(),
            Stream.of(Columns.IS_CANCELLED, Columns.LINE_TOTAL, Columns.HIGH_QUANTITY_FLAG))
            .collect(Collectors.toUnmodifiableList());

    private final DateDimensionBuilder dateBuilder;
    private final ProductDimensionBuilder productBuilder;
    private final CustomerDimensionBuilder customerBuilder;
    private final FactBuilder factBuilder;
    private final SchemaAssembler assembler;
    private final boolean parallelDimensions;
    private final PipelineMetrics metrics;

    @Autowired
    public StarSchemaService(RetailStarProperties properties, PipelineMetrics metrics) {
        this(new DateDimensionBuilder(properties.getWeekendDays()),
                new ProductDimensionBuilder(),
                new CustomerDimensionBuilder(),
                new FactBuilder(),
                new SchemaAssembler(properties.getUnknownProductPlaceholder(), properties.getUnknownCountry()),
                properties.isParallelDimensions(),
                metrics);
    }

    StarSchemaService(DateDimensionBuilder dateBuilder,
                      ProductDimensionBuilder productBuilder,
                      CustomerDimensionBuilder customerBuilder,
                      FactBuilder factBuilder,
                      SchemaAssembler assembler,
                      boolean parallelDimensions,
                      PipelineMetrics metrics) {
        this.dateBuilder = dateBuilder;
        this.productBuilder = productBuilder;
        this.customerBuilder = customerBuilder;
        this.factBuilder = factBuilder;
        this.assembler = assembler;
        this.parallelDimensions = parallelDimensions;
        this.metrics = metrics;
    }

    /** Defaults from a fresh {@link RetailStarProperties}, optionally building dimensions in parallel. */
    public static StarSchemaService withDefaults(boolean parallelDimensions) {
        RetailStarProperties properties = new RetailStarProperties();
        properties.setParallelDimensions(parallelDimensions);
        return new StarSchemaService(properties, PipelineMetrics.noop());
    }

    /**
     * @throws com.di.retailstar.exception.SchemaValidationException when the cleaned set is
     *         empty, lacks a column the builders read, or carries no dated row
     * @throws com.di.retailstar.exception.SchemaIntegrityException when the assembled tables
     *         break a key invariant
     */
    public ModelingResult build(RowSet cleaned, RunContext ctx) {
        long started = System.currentTimeMillis();
        log.info("[MODEL] Creating star schema from {} cleaned rows (parallelDimensions={})",
                cleaned == null ? 0 : cleaned.size(), parallelDimensions);

        InputValidator.requireColumns(cleaned, REQUIRED_COLUMNS, STAGE);
        InputValidator.requireRows(cleaned, STAGE);

        Dimensions dims = parallelDimensions ? buildParallel(cleaned, ctx) : buildSequential(cleaned, ctx);

        FactBuildResult facts = factBuilder.build(cleaned, dims.date, dims.product, dims.customer, ctx);
        ModelingResult result = assembler.assemble(dims.date, dims.product, dims.customer, facts);

        long unmapped = facts.getRows().stream()
                .filter(f -> f.getDateKey() == null || f.getProductKey() == null || f.getCustomerKey() == null)
                .count();
        metrics.recordModeling(facts.getRows().size(), unmapped, System.currentTimeMillis() - started);
        log.info("[MODEL] Star schema created successfully");
        return result;
    }

    private Dimensions buildSequential(RowSet cleaned, RunContext ctx) {
        return new Dimensions(
                dateBuilder.build(cleaned, ctx),
                productBuilder.build(cleaned, ctx),
                customerBuilder.build(cleaned, ctx));
    }

    /**
     * Builders only read the cleaned set, so they share it without locking. The first
     * builder failure is rethrown unchanged once all three have settled.
     */
    private Dimensions buildParallel(RowSet cleaned, RunContext ctx) {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "dimension-builder");
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(3, tf));
        try {
            CompletableFuture<DimensionTable<Integer, DimDate>> date =
                    CompletableFuture.supplyAsync(() -> dateBuilder.build(cleaned, ctx), executor);
            CompletableFuture<DimensionTable<String, DimProduct>> product =
                    CompletableFuture.supplyAsync(() -> productBuilder.build(cleaned, ctx), executor);
            CompletableFuture<DimensionTable<Long, DimCustomer>> customer =
                    CompletableFuture.supplyAsync(() -> customerBuilder.build(cleaned, ctx), executor);

            List<CompletableFuture<?>> all = List.of(date, product, customer);
            try {
                CompletableFuture.allOf(all.toArray(CompletableFuture[]::new))
                        .get(DIMENSION_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            } catch (ExecutionException e) {
                throw unwrap(e.getCause());
            } catch (TimeoutException e) {
                throw new IllegalStateException(
                        "Dimension builders timed out after " + DIMENSION_TIMEOUT_MINUTES + " minutes", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Dimension builders interrupted", e);
            }
            return new Dimensions(date.join(), product.join(), customer.join());
        } finally {
            executor.shutdown();
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IllegalStateException("Dimension builder failed", cause);
    }

    private static final class Dimensions {
        final DimensionTable<Integer, DimDate> date;
        final DimensionTable<String, DimProduct> product;
        final DimensionTable<Long, DimCustomer> customer;

        Dimensions(DimensionTable<Integer, DimDate> date,
                   DimensionTable<String, DimProduct> product,
                   DimensionTable<Long, DimCustomer> customer) {
            this.date = date;
            this.product = product;
            this.customer = customer;
        }
    }
}
