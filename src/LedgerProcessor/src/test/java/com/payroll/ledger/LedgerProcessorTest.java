package com.payroll.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.ledger.model.PayrollRunRejection;
import com.payroll.ledger.model.PayrollRunRequest;
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
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.TestInputTopic;
import org.apache.kafka.streams.TestOutputTopic;
import org.apache.kafka.streams.TopologyTestDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class LedgerProcessorTest {

    private static final ObjectMapper mapper = PayrollJson.mapper();

    private TopologyTestDriver driver;
    private TestInputTopic<String, String> runs;
    private TestOutputTopic<String, String> ledger;
    private TestOutputTopic<String, String> rejections;
    private LedgerHistory history;

    @BeforeEach
    void setUp() {
        history = new LedgerHistory();
        PayrollTaxEngine engine = new PayrollTaxEngine(
            new TaxYearConfigRepository(new ClasspathTaxDataSource("tax")));

        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG, "ledger-processor-test");
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG, "dummy:9092");
        driver = new TopologyTestDriver(LedgerProcessorApp.buildTopology(engine, history), props);

        runs = driver.createInputTopic(LedgerProcessorApp.RUNS_TOPIC,
            new StringSerializer(), new StringSerializer());
        ledger = driver.createOutputTopic(LedgerProcessorApp.LEDGER_TOPIC,
            new StringDeserializer(), new StringDeserializer());
        rejections = driver.createOutputTopic(LedgerProcessorApp.REJECTIONS_TOPIC,
            new StringDeserializer(), new StringDeserializer());
    }

    @AfterEach
    void tearDown() {
        driver.close();
    }

    @Test
    void testRunProducesLedgerRow() throws Exception {
        runs.pipeInput("e1", request("e1", "4000", "single", LocalDate.of(2024, 1, 31)));

        assertTrue(rejections.isEmpty());
        KeyValue<String, String> out = ledger.readKeyValue();
        JsonNode key = mapper.readTree(out.key);
        assertEquals("acme-fl", key.get("companyId").asText());
        assertEquals("e1", key.get("employeeId").asText());
        assertEquals("2024-01-31", key.get("payDate").asText());

        PayrollLedgerRow row = mapper.readValue(out.value, PayrollLedgerRow.class);
        assertEquals(0, new BigDecimal("314.67").compareTo(row.getEmployeeTaxes().getFederalIncomeTax()));
        assertEquals(0, new BigDecimal("3379.33").compareTo(row.getNetPay()));
        assertEquals(1, history.size());
    }

    @Test
    void testYearToDateDerivedFromEmittedRows() throws Exception {
        runs.pipeInput("e1", request("e1", "4000", "single", LocalDate.of(2024, 1, 31)));
        runs.pipeInput("e1", request("e1", "4000", "single", LocalDate.of(2024, 2, 29)));
        runs.pipeInput("e1", request("e1", "4000", "single", LocalDate.of(2024, 3, 29)));

        List<String> values = ledger.readValuesToList();
        assertEquals(3, values.size());
        PayrollLedgerRow feb = mapper.readValue(values.get(1), PayrollLedgerRow.class);
        PayrollLedgerRow mar = mapper.readValue(values.get(2), PayrollLedgerRow.class);

        // 7000 FUTA and Florida wage bases: 4000 in January leaves 3000
        assertEquals(0, new BigDecimal("3000.00").compareTo(feb.getTaxableWages().getFuta()));
        assertEquals(0, new BigDecimal("3000.00").compareTo(feb.getTaxableWages().getSuta()));
        assertEquals(0, BigDecimal.ZERO.compareTo(mar.getTaxableWages().getFuta()));
        assertEquals(0, BigDecimal.ZERO.compareTo(mar.getEmployerTaxes().getSuta()));
    }

    @Test
    void testExplicitPriorYearToDateWins() throws Exception {
        PayrollRunRequest request = requestObject("e2", "4000", "single", LocalDate.of(2024, 1, 31));
        request.setPriorYtd(YearToDateWages.uniform(new BigDecimal("7000")));
        runs.pipeInput("e2", mapper.writeValueAsString(request));

        PayrollLedgerRow row = mapper.readValue(ledger.readValue(), PayrollLedgerRow.class);
        assertEquals(0, BigDecimal.ZERO.compareTo(row.getTaxableWages().getFuta()));
        assertEquals(0, new BigDecimal("4000.00").compareTo(row.getTaxableWages().getSocialSecurity()));
    }

    @Test
    void testRecomputationReplacesHistoryEntry() {
        runs.pipeInput("e1", request("e1", "4000", "single", LocalDate.of(2024, 1, 31)));
        runs.pipeInput("e1", request("e1", "4500", "single", LocalDate.of(2024, 1, 31)));

        assertEquals(2, ledger.readValuesToList().size());
        assertEquals(1, history.size());
        assertEquals(0, new BigDecimal("4500.00").compareTo(
            history.rowsFor("acme-fl", "e1").get(0).grossPay()));
    }

    @Test
    void testUnsupportedFilingStatusRejected() throws Exception {
        runs.pipeInput("e3", request("e3", "4000", "married_separately", LocalDate.of(2024, 1, 31)));

        assertTrue(ledger.isEmpty());
        PayrollRunRejection rejection = mapper.readValue(rejections.readValue(), PayrollRunRejection.class);
        assertEquals("UNSUPPORTED_FILING_STATUS", rejection.getErrorKind());
        assertEquals("acme-fl", rejection.getCompanyId());
        assertEquals("e3", rejection.getEmployeeId());
        assertEquals("2024-01-31", rejection.getPayDate());
        assertEquals(0, history.size());
    }

    @Test
    void testMissingTaxYearRejected() throws Exception {
        runs.pipeInput("e1", request("e1", "4000", "single", LocalDate.of(2099, 1, 31)));

        PayrollRunRejection rejection = mapper.readValue(rejections.readValue(), PayrollRunRejection.class);
        assertEquals("CONFIG_NOT_FOUND", rejection.getErrorKind());
        assertTrue(ledger.isEmpty());
    }

    @Test
    void testNegativeBonusRejectedWithField() throws Exception {
        PayrollRunRequest request = requestObject("e1", "4000", "single", LocalDate.of(2024, 1, 31));
        request.getRun().setBonus(new BigDecimal("-1"));
        runs.pipeInput("e1", mapper.writeValueAsString(request));

        PayrollRunRejection rejection = mapper.readValue(rejections.readValue(), PayrollRunRejection.class);
        assertEquals("NEGATIVE_INPUT_REJECTED", rejection.getErrorKind());
        assertFalse(rejection.getFailures().isEmpty());
        assertEquals("bonus", rejection.getFailures().get(0).getField());
    }

    @Test
    void testUnknownPayTypeRejectedAsInvalidInput() throws Exception {
        String json = "{\"company\":{\"company_id\":\"acme-fl\",\"suta_rate\":0.027},"
            + "\"employee\":{\"employee_id\":\"e9\",\"pay_type\":\"commission\",\"base_rate\":100,"
            + "\"filing_status\":\"single\",\"pay_frequency\":\"monthly\"},"
            + "\"run\":{\"pay_date\":\"2024-01-31\"}}";
        runs.pipeInput("e9", json);

        PayrollRunRejection rejection = mapper.readValue(rejections.readValue(), PayrollRunRejection.class);
        assertEquals("INVALID_INPUT", rejection.getErrorKind());
    }

    @Test
    void testMalformedRequestRejected() throws Exception {
        runs.pipeInput("bad", "{not json");

        PayrollRunRejection rejection = mapper.readValue(rejections.readValue(), PayrollRunRejection.class);
        assertEquals(PayrollRunRejection.MALFORMED_REQUEST, rejection.getErrorKind());
        assertNull(rejection.getCompanyId());
        assertTrue(ledger.isEmpty());
    }

    @Test
    void testIncompleteRequestRejected() throws Exception {
        runs.pipeInput("e1", "{\"company\":{\"company_id\":\"acme-fl\",\"suta_rate\":0.027}}");

        PayrollRunRejection rejection = mapper.readValue(rejections.readValue(), PayrollRunRejection.class);
        assertEquals("INVALID_INPUT", rejection.getErrorKind());
        assertEquals("acme-fl", rejection.getCompanyId());
    }

    @Test
    void testMissingCompanyIdRejected() throws Exception {
        String json = "{\"company\":{\"suta_rate\":0.027},"
            + "\"employee\":{\"employee_id\":\"e1\",\"pay_type\":\"salary\",\"base_rate\":4000,"
            + "\"filing_status\":\"single\",\"pay_frequency\":\"monthly\"},"
            + "\"run\":{\"pay_date\":\"2024-01-31\"}}";
        runs.pipeInput("e1", json);

        assertTrue(ledger.isEmpty());
        PayrollRunRejection rejection = mapper.readValue(rejections.readValue(), PayrollRunRejection.class);
        assertEquals("INVALID_INPUT", rejection.getErrorKind());
        assertEquals("company_id", rejection.getFailures().get(0).getField());
        assertEquals("e1", rejection.getEmployeeId());
    }

    @Test
    void testUnexpectedFailureBecomesRejection() throws Exception {
        LedgerHistory failing = new LedgerHistory() {
            @Override
            public void record(PayrollLedgerRow row) {
                throw new IllegalStateException("history unavailable");
            }
        };
        PayrollTaxEngine engine = new PayrollTaxEngine(
            new TaxYearConfigRepository(new ClasspathTaxDataSource("tax")));
        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG, "ledger-processor-failure-test");
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG, "dummy:9092");

        try (TopologyTestDriver failingDriver =
                 new TopologyTestDriver(LedgerProcessorApp.buildTopology(engine, failing), props)) {
            TestInputTopic<String, String> in = failingDriver.createInputTopic(LedgerProcessorApp.RUNS_TOPIC,
                new StringSerializer(), new StringSerializer());
            TestOutputTopic<String, String> out = failingDriver.createOutputTopic(
                LedgerProcessorApp.REJECTIONS_TOPIC, new StringDeserializer(), new StringDeserializer());

            in.pipeInput("e1", request("e1", "4000", "single", LocalDate.of(2024, 1, 31)));
            in.pipeInput("e2", request("e2", "3000", "single", LocalDate.of(2024, 1, 31)));

            List<String> values = out.readValuesToList();
            assertEquals(2, values.size());
            PayrollRunRejection rejection = mapper.readValue(values.get(0), PayrollRunRejection.class);
            assertEquals(PayrollRunRejection.PROCESSING_ERROR, rejection.getErrorKind());
            assertEquals("history unavailable", rejection.getMessage());
            assertEquals("e1", rejection.getEmployeeId());
        }
    }

    @Test
    void testTombstoneIgnored() {
        runs.pipeInput("e1", (String) null);

        assertTrue(ledger.isEmpty());
        assertTrue(rejections.isEmpty());
    }

    private static String request(String employeeId, String salary, String filingStatus, LocalDate payDate) {
        try {
            return mapper.writeValueAsString(requestObject(employeeId, salary, filingStatus, payDate));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static PayrollRunRequest requestObject(String employeeId, String salary, String filingStatus,
                                                   LocalDate payDate) {
        return new PayrollRunRequest(
            new CompanyTaxProfile("acme-fl", new BigDecimal("0.027")),
            new EmployeePayProfile(employeeId, PayType.SALARY, new BigDecimal(salary), filingStatus, "monthly"),
            new PayrollRunInput(payDate));
    }
}
