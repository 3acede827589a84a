package com.payroll.taxengine.model;

import com.payroll.taxengine.error.InvalidInputException;
import com.payroll.taxengine.error.NegativeInputRejectedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class RateParserTest {

    @ParameterizedTest
    @CsvSource({
        "2.7, 0.027",
        "2.7%, 0.027",
        "' 2.7 % ', 0.027",
        "0.027, 0.027",
        "3, 0.03",
        "1, 1",
        "0.5%, 0.005",
        "0, 0"
    })
    void testParseRateToDecimal(String text, String expected) {
        assertEquals(0, new BigDecimal(expected).compareTo(RateParser.parseRateToDecimal(text)));
    }

    @Test
    void testParseDecimalValue() {
        assertEquals(0, new BigDecimal("0.054").compareTo(RateParser.parseRateToDecimal(new BigDecimal("5.4"))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "abc", "2.7%%"})
    void testRejectsNonNumbers(String text) {
        assertThrows(InvalidInputException.class, () -> RateParser.parseRateToDecimal(text));
    }

    @Test
    void testRejectsNegative() {
        assertThrows(NegativeInputRejectedException.class, () -> RateParser.parseRateToDecimal("-1"));
    }

    @Test
    void testFormatPercent() {
        assertEquals("2.7%", RateParser.formatPercent(new BigDecimal("0.027")));
        assertEquals("3.15%", RateParser.formatPercent(new BigDecimal("0.0315")));
    }

    @Test
    void testCompanyProfileAcceptsRateText() {
        CompanyTaxProfile company = new CompanyTaxProfile();
        company.setSutaRateText("2.7%");
        assertEquals(0, new BigDecimal("0.027").compareTo(company.getSutaRate()));
    }
}
