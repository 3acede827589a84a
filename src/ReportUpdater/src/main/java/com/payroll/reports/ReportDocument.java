package com.payroll.reports;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.payroll.taxengine.report.Form940Summary;
import com.payroll.taxengine.report.Form941Summary;
import com.payroll.taxengine.report.Rt6Summary;

/**
 * Value published to the payroll-reports topic for one company quarter. The 940 figures
 * cover the calendar year through the end of that quarter.
 */
@JsonPropertyOrder({"company_id", "year", "quarter", "row_count", "form_941", "rt6", "form_940"})
public class ReportDocument {

    @JsonProperty("company_id")
    private String companyId;

    @JsonProperty("year")
    private int year;

    @JsonProperty("quarter")
    private int quarter;

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("form_941")
    private Form941Summary form941;

    @JsonProperty("rt6")
    private Rt6Summary rt6;

    @JsonProperty("form_940")
    private Form940Summary form940;

    public ReportDocument() {}

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public int getYear() { return year; }
    public void setYear(int year) { this.year = year; }

    public int getQuarter() { return quarter; }
    public void setQuarter(int quarter) { this.quarter = quarter; }

    public int getRowCount() { return rowCount; }
    public void setRowCount(int rowCount) { this.rowCount = rowCount; }

    public Form941Summary getForm941() { return form941; }
    public void setForm941(Form941Summary form941) { this.form941 = form941; }

    public Rt6Summary getRt6() { return rt6; }
    public void setRt6(Rt6Summary rt6) { this.rt6 = rt6; }

    public Form940Summary getForm940() { return form940; }
    public void setForm940(Form940Summary form940) { this.form940 = form940; }
}
