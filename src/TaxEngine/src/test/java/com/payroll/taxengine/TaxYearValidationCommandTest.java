package com.payroll.taxengine;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TaxYearValidationCommandTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return TaxYearValidationCommand.run(args, TestFixtures.shippedRepository(),
            new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private JsonNode report() throws Exception {
        return PayrollJson.mapper().readTree(out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testWholeYearPasses() throws Exception {
        assertEquals(TaxYearValidationCommand.EXIT_PASS, run("2025"));
        JsonNode report = report();
        assertEquals("PASS", report.get("status").asText());
        assertEquals("PASS", report.get("details").get("pay_frequencies").get("weekly").asText());
    }

    @Test
    void testSingleFrequency() throws Exception {
        assertEquals(TaxYearValidationCommand.EXIT_PASS, run("2024", "biweekly"));
        assertEquals("biweekly", report().get("details").get("pay_frequency").asText());
    }

    @Test
    void testMissingYearFails() throws Exception {
        assertEquals(TaxYearValidationCommand.EXIT_FAIL, run("2099"));
        JsonNode report = report();
        assertEquals("FAIL", report.get("status").asText());
        assertEquals("CONFIG_NOT_FOUND", report.get("details").get("error").asText());
        assertTrue(report.get("failures").size() > 0);
    }

    @Test
    void testUsageErrors() {
        assertEquals(TaxYearValidationCommand.EXIT_USAGE, run());
        assertEquals(TaxYearValidationCommand.EXIT_USAGE, run("twenty"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("usage"));
    }
}
