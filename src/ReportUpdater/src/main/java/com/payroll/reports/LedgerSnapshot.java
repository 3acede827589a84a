package com.payroll.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.taxengine.PayrollJson;
import com.payroll.taxengine.ledger.PayrollLedgerRow;

import java.io.IOException;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Latest ledger row per (company, employee, pay date), in the order records were received.
 * A recomputed row replaces the one it supersedes; a tombstone removes the key.
 */
public class LedgerSnapshot {

    private static final ObjectMapper mapper = PayrollJson.mapper();

    private final ConcurrentHashMap<String, PayrollLedgerRow> rows = new ConcurrentHashMap<>();

    /**
     * Applies one ledger-topic record.
     *
     * @return the periods whose reports changed; both the old and the new period when a
     *         recomputation moved a row between quarters
     */
    public Set<ReportPeriod> apply(String key, String value) throws IOException {
        Set<ReportPeriod> affected = new LinkedHashSet<>();
        if (value == null) {
            if (key == null) return affected;
            JsonNode keyNode = mapper.readTree(key);
            String rowKey = PayrollLedgerRow.key(
                keyNode.path("companyId").asText(),
                keyNode.path("employeeId").asText(),
                LocalDate.parse(keyNode.path("payDate").asText()));
            PayrollLedgerRow removed = rows.remove(rowKey);
            if (removed != null) affected.add(ReportPeriod.of(removed));
            return affected;
        }

        PayrollLedgerRow row = mapper.readValue(value, PayrollLedgerRow.class);
        PayrollLedgerRow previous = rows.put(row.key(), row);
        if (previous != null) affected.add(ReportPeriod.of(previous));
        affected.add(ReportPeriod.of(row));
        return affected;
    }

    public List<PayrollLedgerRow> rowsFor(String companyId, int year) {
        return rows.values().stream()
            .filter(r -> r.getCompanyId().equals(companyId) && r.getYear() == year)
            .collect(Collectors.toList());
    }

    public int size() {
        return rows.size();
    }
}
