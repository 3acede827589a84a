package com.payroll.ledger;

import com.payroll.taxengine.PayrollJson;
import com.payroll.taxengine.calc.PayrollTaxEngine;
import com.payroll.taxengine.config.ClasspathTaxDataSource;
import com.payroll.taxengine.config.TaxYearConfigRepository;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.model.CompanyTaxProfile;
import com.payroll.taxengine.model.EmployeePayProfile;
import com.payroll.taxengine.model.PayType;
import com.payroll.taxengine.model.PayrollRunInput;
import com.payroll.taxengine.model.YearToDateWages;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pre-scan handling of ledger-topic records.
 */
class LedgerHistoryTest {

    private final PayrollTaxEngine engine =
        new PayrollTaxEngine(new TaxYearConfigRepository(new ClasspathTaxDataSource("tax")));

    @Test
    void testApplyRowThenTombstone() throws Exception {
        LedgerHistory history = new LedgerHistory();
        PayrollLedgerRow row = row("e1", LocalDate.of(2024, 2, 29));

        assertTrue(LedgerProcessorApp.applyLedgerRecord(history, "k",
            PayrollJson.mapper().writeValueAsString(row)));
        assertEquals(1, history.size());
        assertEquals(row, history.rowsFor("acme-fl", "e1").get(0));

        String key = "{\"companyId\":\"acme-fl\",\"employeeId\":\"e1\",\"payDate\":\"2024-02-29\"}";
        assertTrue(LedgerProcessorApp.applyLedgerRecord(history, key, null));
        assertEquals(0, history.size());
    }

    @Test
    void testUnreadableRecordsSkipped() {
        LedgerHistory history = new LedgerHistory();

        assertFalse(LedgerProcessorApp.applyLedgerRecord(history, "k", "{broken"));
        assertFalse(LedgerProcessorApp.applyLedgerRecord(history, null, null));
        assertFalse(LedgerProcessorApp.applyLedgerRecord(history, "not-json", null));
        assertEquals(0, history.size());
    }

    @Test
    void testRowsForFiltersByCompanyAndEmployee() {
        LedgerHistory history = new LedgerHistory();
        history.record(row("e1", LocalDate.of(2024, 1, 31)));
        history.record(row("e1", LocalDate.of(2024, 2, 29)));
        history.record(row("e2", LocalDate.of(2024, 1, 31)));

        assertEquals(2, history.rowsFor("acme-fl", "e1").size());
        assertEquals(1, history.rowsFor("acme-fl", "e2").size());
        assertTrue(history.rowsFor("other-co", "e1").isEmpty());
    }

    private PayrollLedgerRow row(String employeeId, LocalDate payDate) {
        return engine.compute(new CompanyTaxProfile("acme-fl", new BigDecimal("0.027")),
            new EmployeePayProfile(employeeId, PayType.SALARY, new BigDecimal("4000"), "single", "monthly"),
            new PayrollRunInput(payDate), YearToDateWages.none());
    }
}
