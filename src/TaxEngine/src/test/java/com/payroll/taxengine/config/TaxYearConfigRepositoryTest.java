package com.payroll.taxengine.config;

import com.payroll.taxengine.TestFixtures;
import com.payroll.taxengine.error.ConfigNotFoundException;
import com.payroll.taxengine.error.UnsupportedFrequencyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Resolution, caching and whole-year validation against the shipped tables.
 */
class TaxYearConfigRepositoryTest {

    private final TaxYearConfigRepository shipped = TestFixtures.shippedRepository();

    @ParameterizedTest
    @ValueSource(ints = {2024, 2025})
    void testShippedYearsPassValidation(int year) {
        ValidationResult result = shipped.validateYear(year);
        assertTrue(result.isPassed(), result.toString());
        @SuppressWarnings("unchecked")
        Map<String, Object> frequencies = (Map<String, Object>) result.getDetails().get("pay_frequencies");
        assertEquals(5, frequencies.size());
        assertEquals("PASS", frequencies.get("monthly"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"daily", "weekly", "biweekly", "semimonthly", "monthly"})
    void testEveryFrequencyResolves(String frequency) {
        TaxYearConfig config = shipped.resolve(2025, frequency).requirePassed();
        assertEquals(frequency, config.getPayFrequency());
        assertEquals(3, config.getFilingStatuses().size());
        assertEquals(0, new BigDecimal("176100").compareTo(config.getRates().getSocialSecurityWageBase()));
    }

    @Test
    void testPeriodsPerYear() {
        assertEquals(260, shipped.resolve(2024, "daily").getConfig().getPeriodsPerYear());
        assertEquals(52, shipped.resolve(2024, "weekly").getConfig().getPeriodsPerYear());
        assertEquals(26, shipped.resolve(2024, "biweekly").getConfig().getPeriodsPerYear());
        assertEquals(24, shipped.resolve(2024, "semimonthly").getConfig().getPeriodsPerYear());
        assertEquals(12, shipped.resolve(2024, "monthly").getConfig().getPeriodsPerYear());
    }

    @Test
    void testResolutionIsCached() {
        assertSame(shipped.resolve(2024, "monthly"), shipped.resolve(2024, "monthly"));
    }

    @Test
    void testStampCarriesSource() {
        ConfigStamp stamp = shipped.resolve(2024, "biweekly").requirePassed().stamp();
        assertEquals(2024, stamp.getTaxYear());
        assertEquals("biweekly", stamp.getPayFrequency());
        assertNotNull(stamp.getVersion());
        assertNotNull(stamp.getEffectiveDate());
    }

    @Test
    void testMissingYearIsConfigNotFound() {
        ConfigNotFoundException e = assertThrows(ConfigNotFoundException.class, () -> shipped.resolve(2099, "monthly"));
        assertEquals(2099, e.getYear());
    }

    @Test
    void testUndeclaredFrequencyIsUnsupported() {
        assertThrows(UnsupportedFrequencyException.class, () -> shipped.resolve(2024, "quarterly"));
    }

    @Test
    void testMissingFrequencyFileIsConfigNotFound(@TempDir Path dir) throws IOException {
        TaxYearConfigRepository repository = new TaxYearConfigRepository(TestFixtures.copyFlatData(dir));
        Files.delete(dir.resolve("2024/fit/weekly/percentage_method.json"));

        ConfigNotFoundException e = assertThrows(ConfigNotFoundException.class,
            () -> repository.resolve(2024, "weekly"));
        assertEquals("weekly", e.getPayFrequency());

        ValidationResult year = repository.validateYear(2024);
        assertFalse(year.isPassed());
        @SuppressWarnings("unchecked")
        Map<String, Object> frequencies = (Map<String, Object>) year.getDetails().get("pay_frequencies");
        assertEquals("CONFIG_NOT_FOUND", frequencies.get("weekly"));
        assertEquals("PASS", frequencies.get("monthly"));
    }
}
