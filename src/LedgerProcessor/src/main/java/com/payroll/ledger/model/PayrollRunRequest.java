package com.payroll.ledger.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.taxengine.model.CompanyTaxProfile;
import com.payroll.taxengine.model.EmployeePayProfile;
import com.payroll.taxengine.model.PayrollRunInput;
import com.payroll.taxengine.model.YearToDateWages;

/**
 * Message on the payroll-runs topic. When {@code prior_ytd} is absent the processor
 * derives year-to-date wages from the ledger rows it has already emitted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PayrollRunRequest {

    @JsonProperty("company")
    private CompanyTaxProfile company;

    @JsonProperty("employee")
    private EmployeePayProfile employee;

    @JsonProperty("run")
    private PayrollRunInput run;

    @JsonProperty("prior_ytd")
    private YearToDateWages priorYtd;

    public PayrollRunRequest() {}

    public PayrollRunRequest(CompanyTaxProfile company, EmployeePayProfile employee, PayrollRunInput run) {
        this.company = company;
        this.employee = employee;
        this.run = run;
    }

    public CompanyTaxProfile getCompany() { return company; }
    public void setCompany(CompanyTaxProfile company) { this.company = company; }

    public EmployeePayProfile getEmployee() { return employee; }
    public void setEmployee(EmployeePayProfile employee) { this.employee = employee; }

    public PayrollRunInput getRun() { return run; }
    public void setRun(PayrollRunInput run) { this.run = run; }

    public YearToDateWages getPriorYtd() { return priorYtd; }
    public void setPriorYtd(YearToDateWages priorYtd) { this.priorYtd = priorYtd; }
}
