package com.di.retailstar.export;

import com.di.retailstar.RetailFixtures;
import com.di.retailstar.cleaning.CleaningPipeline;
import com.di.retailstar.cleaning.CleaningResult;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.modeling.ModelingResult;
import com.di.retailstar.modeling.StarSchemaService;
import com.di.retailstar.profiling.DataProfiler;
import com.di.retailstar.profiling.QualitySummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ModelExportService Tests")
class ModelExportServiceTest {

    @TempDir
    Path outputRoot;

    private RunContext ctx;
    private QualitySummary profile;
    private CleaningResult cleaning;
    private ModelingResult modeling;

    @BeforeEach
    void setUp() {
        ctx = RunContext.create("exp12345");
        profile = new DataProfiler(10000, "Unknown Product").profile(RetailFixtures.saleAndCancellation(), ctx);
        cleaning = CleaningPipeline.withDefaults().clean(RetailFixtures.saleAndCancellation(), ctx);
        modeling = StarSchemaService.withDefaults(false).build(cleaning.getRowSet(), ctx);
    }

    @Test
    @DisplayName("Should write every artifact under the job directory")
    void testExport_AllArtifacts() {
        Map<String, Path> written = new ModelExportService(outputRoot).export("exp12345", cleaning, modeling, profile);

        assertEquals(8, written.size());
        for (Path path : written.values()) {
            assertTrue(Files.isRegularFile(path), path.toString());
            assertEquals(outputRoot.resolve("exp12345"), path.getParent());
        }
        assertTrue(written.containsKey(ModelExportService.FACT_SALES));
        assertTrue(written.containsKey(ModelExportService.PROFILE_REPORT));
    }

    @Test
    @DisplayName("Should skip the profile report when there is no profile")
    void testExport_WithoutProfile() {
        Map<String, Path> written = new ModelExportService(outputRoot).export("exp12345", cleaning, modeling, null);
        assertEquals(7, written.size());
        assertFalse(written.containsKey(ModelExportService.PROFILE_REPORT));
    }

    @Test
    @DisplayName("Should write tables with snake_case headers and one line per row")
    void testExport_TableContent() throws IOException {
        Map<String, Path> written = new ModelExportService(outputRoot).export("exp12345", cleaning, modeling, profile);

        List<String> facts = Files.readAllLines(written.get(ModelExportService.FACT_SALES));
        assertEquals(3, facts.size());
        assertTrue(facts.get(0).startsWith("transaction_key,date_key,product_key,customer_key,quantity"));
        assertTrue(facts.get(2).contains("C536366"));

        List<String> customers = Files.readAllLines(written.get(ModelExportService.DIM_CUSTOMER));
        assertEquals("customer_key,customer_id,country,first_purchase_date,last_purchase_date,is_unknown_customer",
                customers.get(0));
        assertTrue(customers.get(2).startsWith("2,0,Uk,2010-12-01 08:28:00"));
        assertTrue(customers.get(2).endsWith(",true"));

        List<String> cleaned = Files.readAllLines(written.get(ModelExportService.CLEANED_DATA));
        assertTrue(cleaned.get(0).contains("LineTotal"));
        assertEquals(3, cleaned.size());
    }

    @Test
    @DisplayName("Should write reports as snake_case JSON with ISO dates")
    void testExport_JsonReports() throws IOException {
        Map<String, Path> written = new ModelExportService(outputRoot).export("exp12345", cleaning, modeling, profile);
        ObjectMapper mapper = new ObjectMapper();

        JsonNode cleaningJson = mapper.readTree(written.get(ModelExportService.CLEANING_REPORT).toFile());
        assertEquals(2, cleaningJson.get("initial_rows").asInt());
        assertEquals(1, cleaningJson.get("cleaning_metrics").get("cancelled_transactions").asInt());

        JsonNode modelingJson = mapper.readTree(written.get(ModelExportService.MODELING_REPORT).toFile());
        assertEquals(2, modelingJson.get("tables_created").get("fact_sales").asInt());
        assertEquals("2010-12-01", modelingJson.get("schema_summary").get("date_range").get("start").asText());
        assertEquals(0, modelingJson.get("integrity").get("unmapped_products").asInt());
        assertTrue(modelingJson.get("build_timestamp").isTextual());

        JsonNode profileJson = mapper.readTree(written.get(ModelExportService.PROFILE_REPORT).toFile());
        assertEquals(2, profileJson.get("dataset_overview").get("row_count").asInt());
        assertTrue(profileJson.get("business_logic_constraints").get(0).has("action_needed"));
    }

    @Test
    @DisplayName("Should render cells: empty for null, timestamps without T")
    void testCell() {
        assertEquals("", ModelExportService.cell(null));
        assertEquals("2010-12-01 08:26:00", ModelExportService.cell(LocalDateTime.of(2010, 12, 1, 8, 26)));
        assertEquals("true", ModelExportService.cell(Boolean.TRUE));
    }
}
