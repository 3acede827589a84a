package com.payroll.taxengine.config;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.payroll.taxengine.TestFixtures;
import com.payroll.taxengine.error.ConfigInvalidException;
import com.payroll.taxengine.error.ConfigNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Breaks a copy of the flat 2024 tables one way at a time and checks the gate reports
 * the offending field.
 */
class ValidationGateTest {

    @TempDir
    Path dataDir;

    private TaxYearConfigRepository repository;

    @BeforeEach
    void setUp() {
        repository = new TaxYearConfigRepository(TestFixtures.copyFlatData(dataDir));
    }

    private Path file(String relative) {
        return dataDir.resolve(relative);
    }

    @Test
    void testIntactCopyPasses() {
        ConfigResolution resolution = repository.resolve(2024, "monthly");
        assertTrue(resolution.isPassed(), resolution.getValidation().toString());
        assertEquals("PASS", resolution.getValidation().getStatus());
        assertEquals("monthly", resolution.getValidation().getDetails().get("pay_frequency"));
    }

    @Test
    void testMetadataYearMismatchFails() {
        TestFixtures.editJson(file("2024/metadata.json"), root -> root.put("tax_year", 2023));

        ConfigResolution resolution = repository.resolve(2024, "monthly");
        assertFalse(resolution.isPassed());
        assertTrue(resolution.getValidation().hasFailureFor("metadata.tax_year"));
        assertThrows(ConfigInvalidException.class, resolution::requirePassed);
    }

    @Test
    void testBlankMetadataFieldFails() {
        TestFixtures.editJson(file("2024/metadata.json"), root -> root.put("version", " "));

        assertTrue(repository.resolve(2024, "monthly").getValidation().hasFailureFor("metadata.version"));
    }

    @Test
    void testWrongYearStandardDeductionFails() {
        TestFixtures.editJson(file("2024/validation.json"),
            root -> ((ObjectNode) root.get("standard_deduction")).put("single", 14600));

        ValidationResult result = repository.resolve(2024, "monthly").getValidation();
        assertTrue(result.hasFailureFor("fit.monthly.single.standard_deduction"));
        assertTrue(result.getFailures().get(0).getMessage().contains("different year"));
        assertFalse(result.hasFailureFor("fit.monthly.head_of_household.standard_deduction"));
    }

    @Test
    void testTopBracketCheckpointFails() {
        TestFixtures.editJson(file("2024/validation.json"),
            root -> ((ObjectNode) root.get("top_bracket_threshold")).put("married_filing_jointly", 731200));

        assertTrue(repository.resolve(2024, "monthly").getValidation()
            .hasFailureFor("fit.monthly.married_filing_jointly.brackets[0].over"));
    }

    @Test
    void testNonIncreasingBracketsFail() {
        TestFixtures.editJson(file("2024/fit/monthly/percentage_method.json"), root -> {
            ArrayNode brackets = (ArrayNode) root.get("single").get("brackets");
            brackets.addObject().put("over", 0).put("rate", 0.2).put("base_tax", 0);
        });

        ValidationResult result = repository.resolve(2024, "monthly").getValidation();
        assertTrue(result.hasFailureFor("fit.monthly.single.brackets[1].over"));
    }

    @Test
    void testFirstBracketMustStartAtZero() {
        TestFixtures.editJson(file("2024/fit/weekly/percentage_method.json"),
            root -> ((ObjectNode) root.get("single").get("brackets").get(0)).put("over", 100));

        assertTrue(repository.resolve(2024, "weekly").getValidation()
            .hasFailureFor("fit.weekly.single.brackets[0].over"));
    }

    @Test
    void testDiscontinuousBaseTaxFails() {
        TestFixtures.editJson(file("2024/fit/monthly/percentage_method.json"), root -> {
            ArrayNode brackets = (ArrayNode) root.get("single").get("brackets");
            brackets.addObject().put("over", 10000).put("rate", 0.2).put("base_tax", 999);
        });

        ValidationResult result = repository.resolve(2024, "monthly").getValidation();
        assertTrue(result.hasFailureFor("fit.monthly.single.brackets[1].base_tax"));
    }

    @Test
    void testRateOutsideUnitIntervalFails() {
        TestFixtures.editJson(file("2024/rates.json"),
            root -> ((ObjectNode) root.get("social_security")).put("employee_rate", 6.2));

        assertTrue(repository.resolve(2024, "monthly").getValidation()
            .hasFailureFor("rates.social_security.employee_rate"));
    }

    @Test
    void testZeroWageBaseOnlyWarns() {
        TestFixtures.editJson(file("2024/rates.json"), root -> ((ObjectNode) root.get("suta")).put("wage_base", 0));

        ValidationResult result = repository.resolve(2024, "monthly").getValidation();
        assertTrue(result.isPassed());
        assertTrue(result.getWarnings().contains("rates.suta.wage_base is zero"));
    }

    @Test
    void testMissingValidationFileFails() throws IOException {
        Files.delete(file("2024/validation.json"));

        ValidationResult result = repository.resolve(2024, "monthly").getValidation();
        assertTrue(result.hasFailureFor("validation.json"));
    }

    @Test
    void testMissingKeyIsConfigInvalid() {
        TestFixtures.editJson(file("2024/rates.json"), root -> ((ObjectNode) root.get("social_security")).remove("wage_base"));

        ConfigInvalidException e = assertThrows(ConfigInvalidException.class,
            () -> repository.resolve(2024, "monthly"));
        assertTrue(e.getFailures().stream().anyMatch(f -> f.getField().contains("wage_base")), e.describe());
    }

    @Test
    void testMalformedJsonIsConfigInvalid() throws IOException {
        Files.writeString(file("2024/rates.json"), "{ \"social_security\": ");

        assertThrows(ConfigInvalidException.class, () -> repository.resolve(2024, "monthly"));
    }

    @Test
    void testMissingMetadataIsConfigNotFound() throws IOException {
        Files.delete(file("2024/metadata.json"));

        ConfigNotFoundException e = assertThrows(ConfigNotFoundException.class,
            () -> repository.resolve(2024, "monthly"));
        assertEquals(2024, e.getYear());
        assertNull(e.getPayFrequency());
    }
}
