package com.payroll.ledger.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.taxengine.error.ValidationFailure;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured rejection written to the payroll-rejections topic in place of a ledger row.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PayrollRunRejection {

    public static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    public static final String PROCESSING_ERROR = "PROCESSING_ERROR";

    @JsonProperty("company_id")
    private String companyId;

    @JsonProperty("employee_id")
    private String employeeId;

    @JsonProperty("pay_date")
    private String payDate;

    @JsonProperty("error_kind")
    private String errorKind;

    @JsonProperty("message")
    private String message;

    @JsonProperty("failures")
    private List<ValidationFailure> failures = new ArrayList<>();

    public PayrollRunRejection() {}

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getEmployeeId() { return employeeId; }
    public void setEmployeeId(String employeeId) { this.employeeId = employeeId; }

    public String getPayDate() { return payDate; }
    public void setPayDate(String payDate) { this.payDate = payDate; }

    public String getErrorKind() { return errorKind; }
    public void setErrorKind(String errorKind) { this.errorKind = errorKind; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public List<ValidationFailure> getFailures() { return failures; }
    public void setFailures(List<ValidationFailure> failures) { this.failures = failures; }
}
