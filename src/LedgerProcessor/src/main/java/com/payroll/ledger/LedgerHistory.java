package com.payroll.ledger;

import com.payroll.taxengine.ledger.PayrollLedgerRow;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory view of the ledger rows this processor has emitted or pre-scanned, one per
 * (company, employee, pay date). A later row for the same key replaces the earlier one.
 *
 * Runs for the same employee can arrive on different tasks, so the map is shared across
 * processor instances rather than kept in a partitioned state store.
 */
public class LedgerHistory {

    private final ConcurrentHashMap<String, PayrollLedgerRow> rows = new ConcurrentHashMap<>();

    public void record(PayrollLedgerRow row) {
        rows.put(row.key(), row);
    }

    public void remove(String key) {
        rows.remove(key);
    }

    public List<PayrollLedgerRow> rowsFor(String companyId, String employeeId) {
        return rows.values().stream()
            .filter(r -> r.getCompanyId().equals(companyId) && r.getEmployeeId().equals(employeeId))
            .collect(Collectors.toList());
    }

    public int size() {
        return rows.size();
    }
}
