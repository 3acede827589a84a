package com.payroll.reports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.taxengine.ledger.PayrollLedgerRow;

import java.util.Objects;

/**
 * One company's calendar quarter: the unit a report document is published for.
 */
public final class ReportPeriod {

    private final String companyId;
    private final int year;
    private final int quarter;

    public ReportPeriod(String companyId, int year, int quarter) {
        this.companyId = Objects.requireNonNull(companyId, "companyId");
        this.year = year;
        this.quarter = quarter;
    }

    public static ReportPeriod of(PayrollLedgerRow row) {
        return new ReportPeriod(row.getCompanyId(), row.getYear(), row.quarter());
    }

    public String getCompanyId() { return companyId; }
    public int getYear() { return year; }
    public int getQuarter() { return quarter; }

    public boolean contains(PayrollLedgerRow row) {
        return row.getCompanyId().equals(companyId) && row.getYear() == year && row.quarter() == quarter;
    }

    /** Record key on the reports topic. */
    public String toKey(ObjectMapper mapper) throws JsonProcessingException {
        return mapper.writeValueAsString(mapper.createObjectNode()
            .put("companyId", companyId)
            .put("year", year)
            .put("quarter", quarter));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReportPeriod)) return false;
        ReportPeriod that = (ReportPeriod) o;
        return year == that.year && quarter == that.quarter && companyId.equals(that.companyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(companyId, year, quarter);
    }

    @Override
    public String toString() {
        return companyId + " " + year + "Q" + quarter;
    }
}
