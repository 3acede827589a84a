package com.payroll.taxengine.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The two quarterly filings produced from the same row set.
 */
public final class QuarterlyReports {

    @JsonProperty("form_941")
    private final Form941Summary form941;

    @JsonProperty("rt6")
    private final Rt6Summary rt6;

    public QuarterlyReports(Form941Summary form941, Rt6Summary rt6) {
        this.form941 = form941;
        this.rt6 = rt6;
    }

    public Form941Summary getForm941() { return form941; }
    public Rt6Summary getRt6() { return rt6; }
}
