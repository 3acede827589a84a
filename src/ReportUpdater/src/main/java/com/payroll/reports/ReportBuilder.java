package com.payroll.reports;

import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.model.CompanyTaxProfile;
import com.payroll.taxengine.report.QuarterlyReports;
import com.payroll.taxengine.report.RateConsistency;
import com.payroll.taxengine.report.RollupAggregator;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a company quarter's filings from ledger rows alone. The Florida rate is the one
 * stamped on the quarter's rows, so a rate change inside a quarter is rejected rather than
 * averaged.
 */
public class ReportBuilder {

    private final RollupAggregator aggregator;

    public ReportBuilder() {
        this(new RollupAggregator());
    }

    public ReportBuilder(RollupAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /** Returns null when the period has no rows left. */
    public ReportDocument build(Collection<PayrollLedgerRow> rows, ReportPeriod period) {
        List<PayrollLedgerRow> quarterRows = rows.stream()
            .filter(period::contains)
            .collect(Collectors.toList());
        if (quarterRows.isEmpty()) {
            return null;
        }

        BigDecimal sutaRate = RateConsistency.single("suta_rate", quarterRows, PayrollLedgerRow::getSutaRate);
        CompanyTaxProfile company = new CompanyTaxProfile(period.getCompanyId(), sutaRate);
        QuarterlyReports quarterly = aggregator.aggregateQuarter(quarterRows, company,
            period.getYear(), period.getQuarter());

        List<PayrollLedgerRow> yearThroughQuarter = rows.stream()
            .filter(r -> r.getCompanyId().equals(period.getCompanyId()) && r.getYear() == period.getYear()
                && r.quarter() <= period.getQuarter())
            .collect(Collectors.toList());

        ReportDocument doc = new ReportDocument();
        doc.setCompanyId(period.getCompanyId());
        doc.setYear(period.getYear());
        doc.setQuarter(period.getQuarter());
        doc.setRowCount(quarterRows.size());
        doc.setForm941(quarterly.getForm941());
        doc.setRt6(quarterly.getRt6());
        doc.setForm940(aggregator.aggregateYear(yearThroughQuarter, company, period.getYear()));
        return doc;
    }
}
