package com.di.retailstar.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

/**
 * Single binding for the pipeline configuration.
 *
 * <pre>
 * retailstar:
 *   pipeline:
 *     input-file: data/raw/online_retail.csv
 *     output-dir: data/model
 *     run-on-startup: true
 *     export-enabled: true
 *     parallel-dimensions: false
 *     high-quantity-threshold: 10000
 *     unknown-product-placeholder: Unknown Product
 *     unknown-country: Unknown
 *     weekend-days: SATURDAY,SUNDAY
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "retailstar.pipeline")
public class RetailStarProperties {

    /** Raw extract (CSV with header). Blank = nothing to run on startup. */
    private String inputFile = "";

    /** Root directory for exported tables and reports; one sub-directory per job id. */
    @NotBlank
    private String outputDir = "data/model";

    /** Run the pipeline once when the application starts (requires {@link #inputFile}). */
    private boolean runOnStartup = true;

    /** Write the cleaned rows, four tables and reports after a successful run. */
    private boolean exportEnabled = true;

    /** Build the three dimensions concurrently; the fact table always waits for all three. */
    private boolean parallelDimensions = false;

    /** Rows with {@code abs(Quantity)} above this value get {@code HighQuantityFlag = true}. */
    @Min(0)
    private long highQuantityThreshold = 10_000L;

    /** Placeholder written into missing product descriptions. */
    @NotBlank
    private String unknownProductPlaceholder = "Unknown Product";

    /** Default for missing natural-key text (countries) applied by the schema assembler. */
    @NotBlank
    private String unknownCountry = "Unknown";

    /** Days flagged {@code is_weekend} in the date dimension. */
    private Set<DayOfWeek> weekendDays = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    public boolean hasInputFile() {
        return inputFile != null && !inputFile.isBlank();
    }
}
