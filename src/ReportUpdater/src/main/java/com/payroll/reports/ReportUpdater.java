package com.payroll.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.taxengine.PayrollJson;
import com.payroll.taxengine.error.PayrollTaxException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Applies ledger records to the snapshot and returns the report records to publish: one
 * document per affected company quarter, or a tombstone when a quarter has no rows left.
 * A quarter whose rows cannot be reported (mixed Florida rates) is logged and left out
 * without holding back the other affected quarter.
 */
public class ReportUpdater {

    private static final Logger log = LoggerFactory.getLogger(ReportUpdater.class);
    private static final ObjectMapper mapper = PayrollJson.mapper();

    private final LedgerSnapshot snapshot;
    private final ReportBuilder builder;
    private final String reportsTopic;

    public ReportUpdater(LedgerSnapshot snapshot, ReportBuilder builder, String reportsTopic) {
        this.snapshot = snapshot;
        this.builder = builder;
        this.reportsTopic = reportsTopic;
    }

    /** Pre-scan path: updates the snapshot without producing reports. */
    public void load(String key, String value) throws IOException {
        snapshot.apply(key, value);
    }

    public List<ProducerRecord<String, String>> onLedgerRecord(String key, String value) throws IOException {
        Set<ReportPeriod> affected = snapshot.apply(key, value);
        List<ProducerRecord<String, String>> out = new ArrayList<>();
        for (ReportPeriod period : affected) {
            String reportKey = period.toKey(mapper);
            ReportDocument doc;
            try {
                doc = builder.build(snapshot.rowsFor(period.getCompanyId(), period.getYear()), period);
            } catch (PayrollTaxException e) {
                log.error("Report for {} not published: {}", period, e.describe());
                continue;
            }
            if (doc == null) {
                log.info("No ledger rows left for {}, tombstoning report", period);
                out.add(new ProducerRecord<>(reportsTopic, reportKey, null));
                continue;
            }
            out.add(new ProducerRecord<>(reportsTopic, reportKey, mapper.writeValueAsString(doc)));
            log.info("Report for {}: rows={}, 941 total tax={}, RT-6 due={}", period, doc.getRowCount(),
                doc.getForm941().getTotalTax().toPlainString(), doc.getRt6().getTaxDue().toPlainString());
        }
        return out;
    }

    public LedgerSnapshot getSnapshot() {
        return snapshot;
    }
}
