package com.payroll.taxengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Employer identity and its Florida reemployment tax rate (a decimal, e.g. 0.027).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompanyTaxProfile {

    @JsonProperty("company_id")
    private String companyId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("fein")
    private String fein;

    @JsonProperty("florida_account_number")
    private String floridaAccountNumber;

    @JsonProperty("suta_rate")
    private BigDecimal sutaRate;

    public CompanyTaxProfile() {}

    public CompanyTaxProfile(String companyId, BigDecimal sutaRate) {
        this.companyId = companyId;
        this.sutaRate = sutaRate;
    }

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getFein() { return fein; }
    public void setFein(String fein) { this.fein = fein; }

    public String getFloridaAccountNumber() { return floridaAccountNumber; }
    public void setFloridaAccountNumber(String floridaAccountNumber) { this.floridaAccountNumber = floridaAccountNumber; }

    public BigDecimal getSutaRate() { return sutaRate; }
    public void setSutaRate(BigDecimal sutaRate) { this.sutaRate = sutaRate; }

    /** Accepts "2.7", "2.7%", "0.027" and normalizes to a decimal rate. */
    @JsonIgnore
    public void setSutaRateText(String rate) {
        this.sutaRate = RateParser.parseRateToDecimal(rate);
    }
}
