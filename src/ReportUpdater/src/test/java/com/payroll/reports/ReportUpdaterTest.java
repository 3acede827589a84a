package com.payroll.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.payroll.taxengine.PayrollJson;
import com.payroll.taxengine.calc.PayrollTaxEngine;
import com.payroll.taxengine.config.ClasspathTaxDataSource;
import com.payroll.taxengine.config.TaxYearConfigRepository;
import com.payroll.taxengine.error.ErrorKind;
import com.payroll.taxengine.error.PayrollTaxException;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.model.CompanyTaxProfile;
import com.payroll.taxengine.model.EmployeePayProfile;
import com.payroll.taxengine.model.PayType;
import com.payroll.taxengine.model.PayrollRunInput;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportUpdaterTest {

    private static final ObjectMapper mapper = PayrollJson.mapper();
    private static final String TOPIC = "payroll-reports";
    private static final CompanyTaxProfile COMPANY = new CompanyTaxProfile("acme-fl", new BigDecimal("0.027"));

    private final PayrollTaxEngine engine =
        new PayrollTaxEngine(new TaxYearConfigRepository(new ClasspathTaxDataSource("tax")));
    private final List<PayrollLedgerRow> ledger = new ArrayList<>();
    private ReportUpdater updater;

    @BeforeEach
    void setUp() {
        updater = new ReportUpdater(new LedgerSnapshot(), new ReportBuilder(), TOPIC);
    }

    @Test
    void testFirstRowPublishesQuarterReport() throws Exception {
        List<ProducerRecord<String, String>> out = feed(run(COMPANY, "e1", "4000", 1));

        assertEquals(1, out.size());
        ProducerRecord<String, String> report = out.get(0);
        assertEquals(TOPIC, report.topic());
        JsonNode key = mapper.readTree(report.key());
        assertEquals("acme-fl", key.get("companyId").asText());
        assertEquals(2024, key.get("year").asInt());
        assertEquals(1, key.get("quarter").asInt());

        JsonNode doc = mapper.readTree(report.value());
        assertEquals(1, doc.get("row_count").asInt());
        assertMoney("4000.00", doc.at("/form_941/wages"));
        assertMoney("108.00", doc.at("/rt6/tax_due"));
        assertMoney("24.00", doc.at("/form_940/futa_tax"));
    }

    @Test
    void testQuarterTotalsAfterFullQuarter() throws Exception {
        ProducerRecord<String, String> last = null;
        for (int month = 1; month <= 3; month++) {
            feed(run(COMPANY, "e1", "4000", month));
            last = feed(run(COMPANY, "e2", "3000", month)).get(0);
        }

        JsonNode doc = mapper.readTree(last.value());
        assertEquals(6, doc.get("row_count").asInt());
        assertEquals(2, doc.at("/form_941/employee_count").asInt());
        assertMoney("21000.00", doc.at("/form_941/wages"));
        assertMoney("2604.00", doc.at("/form_941/social_security_tax"));
        assertMoney("609.00", doc.at("/form_941/medicare_tax"));
        // both employees reach the 7000 Florida wage base inside the quarter
        assertMoney("14000.00", doc.at("/rt6/taxable_wages"));
        assertMoney("378.00", doc.at("/rt6/tax_due"));
        assertMoney("378.00", doc.at("/rt6/ledger_contributions"));
        assertMoney("84.00", doc.at("/form_940/futa_tax"));
    }

    @Test
    void testSecondQuarterReportCarriesYearToDate940() throws Exception {
        for (int month = 1; month <= 4; month++) {
            feed(run(COMPANY, "e1", "4000", month));
        }
        ProducerRecord<String, String> q2 = feed(run(COMPANY, "e1", "4000", 5)).get(0);

        JsonNode key = mapper.readTree(q2.key());
        assertEquals(2, key.get("quarter").asInt());
        JsonNode doc = mapper.readTree(q2.value());
        assertEquals(2, doc.get("row_count").asInt());
        assertMoney("8000.00", doc.at("/form_941/wages"));
        assertMoney("0.00", doc.at("/rt6/taxable_wages"));
        assertMoney("20000.00", doc.at("/form_940/total_payments"));
        assertMoney("7000.00", doc.at("/form_940/futa_taxable_wages"));
    }

    @Test
    void testRecomputedRowReplacesEarlierOne() throws Exception {
        feed(run(COMPANY, "e1", "4000", 1));
        ProducerRecord<String, String> report = feed(run(COMPANY, "e1", "4500", 1)).get(0);

        JsonNode doc = mapper.readTree(report.value());
        assertEquals(1, doc.get("row_count").asInt());
        assertMoney("4500.00", doc.at("/form_941/wages"));
        assertEquals(1, updater.getSnapshot().size());
    }

    @Test
    void testTombstoneOfLastRowTombstonesReport() throws Exception {
        PayrollLedgerRow row = run(COMPANY, "e1", "4000", 2);
        feed(row);

        List<ProducerRecord<String, String>> out = updater.onLedgerRecord(ledgerKey(row), null);
        assertEquals(1, out.size());
        assertNull(out.get(0).value());
        assertEquals(0, updater.getSnapshot().size());
    }

    @Test
    void testTombstoneForUnknownKeyPublishesNothing() throws Exception {
        String key = "{\"companyId\":\"acme-fl\",\"employeeId\":\"ghost\",\"payDate\":\"2024-01-28\"}";
        assertTrue(updater.onLedgerRecord(key, null).isEmpty());
    }

    @Test
    void testMixedFloridaRateInQuarterNotPublished() throws Exception {
        feed(run(COMPANY, "e1", "4000", 1));
        PayrollLedgerRow changed = run(new CompanyTaxProfile("acme-fl", new BigDecimal("0.03")), "e2", "3000", 2);

        assertTrue(feed(changed).isEmpty());
        assertEquals(2, updater.getSnapshot().size());
        PayrollTaxException e = assertThrows(PayrollTaxException.class,
            () -> new ReportBuilder().build(updater.getSnapshot().rowsFor("acme-fl", 2024),
                new ReportPeriod("acme-fl", 2024, 1)));
        assertEquals(ErrorKind.INCONSISTENT_RATE_ACROSS_PERIOD, e.getKind());
    }

    @Test
    void testUnreportableQuarterDoesNotHoldBackTheOther() throws Exception {
        PayrollLedgerRow january = run(COMPANY, "e1", "4000", 1);
        feed(january);
        feed(run(new CompanyTaxProfile("acme-fl", new BigDecimal("0.03")), "e2", "3000", 4));

        // same key, stored under April: Q1 empties while Q2 now mixes 2.7% and 3%
        ObjectNode moved = (ObjectNode) mapper.valueToTree(january);
        moved.put("month", 4);
        List<ProducerRecord<String, String>> out =
            updater.onLedgerRecord(ledgerKey(january), mapper.writeValueAsString(moved));

        assertEquals(1, out.size());
        JsonNode key = mapper.readTree(out.get(0).key());
        assertEquals(1, key.get("quarter").asInt());
        assertNull(out.get(0).value());
    }

    @Test
    void testLoadDoesNotPublish() throws Exception {
        PayrollLedgerRow row = run(COMPANY, "e1", "4000", 1);
        updater.load(ledgerKey(row), mapper.writeValueAsString(row));

        assertEquals(1, updater.getSnapshot().size());
        assertEquals(1, updater.getSnapshot().rowsFor("acme-fl", 2024).size());
    }

    private List<ProducerRecord<String, String>> feed(PayrollLedgerRow row) throws Exception {
        return updater.onLedgerRecord(ledgerKey(row), mapper.writeValueAsString(row));
    }

    private PayrollLedgerRow run(CompanyTaxProfile company, String employeeId, String salary, int month) {
        EmployeePayProfile profile =
            new EmployeePayProfile(employeeId, PayType.SALARY, new BigDecimal(salary), "single", "monthly");
        PayrollLedgerRow row = engine.computeFromLedger(company, profile,
            new PayrollRunInput(LocalDate.of(2024, month, 28)), ledger);
        ledger.removeIf(r -> r.key().equals(row.key()));
        ledger.add(row);
        return row;
    }

    private static String ledgerKey(PayrollLedgerRow row) throws Exception {
        return mapper.writeValueAsString(mapper.createObjectNode()
            .put("companyId", row.getCompanyId())
            .put("employeeId", row.getEmployeeId())
            .put("payDate", row.getPayDate().toString()));
    }

    private static void assertMoney(String expected, JsonNode actual) {
        assertFalse(actual.isMissingNode(), "missing " + expected);
        assertEquals(0, new BigDecimal(expected).compareTo(actual.decimalValue()),
            () -> "expected " + expected + " but was " + actual);
    }
}
