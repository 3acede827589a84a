package com.payroll.taxengine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Year-end wage statement boxes for one employee. Boxes 3 and 5 are back-derived from the
 * tax withheld; the recorded wage figures summed from the ledger are carried alongside for
 * reconciliation.
 */
@JsonPropertyOrder({"company_id", "employee_id", "year", "box1_wages", "box2_federal_income_tax",
    "box3_social_security_wages", "box4_social_security_tax", "box5_medicare_wages", "box6_medicare_tax",
    "social_security_employee_rate", "medicare_employee_rate",
    "recorded_social_security_wages", "recorded_medicare_wages"})
public final class W2Boxes {

    @JsonProperty("company_id")
    private final String companyId;

    @JsonProperty("employee_id")
    private final String employeeId;

    @JsonProperty("year")
    private final int year;

    @JsonProperty("box1_wages")
    private final BigDecimal box1Wages;

    @JsonProperty("box2_federal_income_tax")
    private final BigDecimal box2FederalIncomeTax;

    @JsonProperty("box3_social_security_wages")
    private final BigDecimal box3SocialSecurityWages;

    @JsonProperty("box4_social_security_tax")
    private final BigDecimal box4SocialSecurityTax;

    @JsonProperty("box5_medicare_wages")
    private final BigDecimal box5MedicareWages;

    @JsonProperty("box6_medicare_tax")
    private final BigDecimal box6MedicareTax;

    @JsonProperty("social_security_employee_rate")
    private final BigDecimal socialSecurityEmployeeRate;

    @JsonProperty("medicare_employee_rate")
    private final BigDecimal medicareEmployeeRate;

    @JsonProperty("recorded_social_security_wages")
    private final BigDecimal recordedSocialSecurityWages;

    @JsonProperty("recorded_medicare_wages")
    private final BigDecimal recordedMedicareWages;

    W2Boxes(String companyId, String employeeId, int year, BigDecimal box1Wages, BigDecimal box2FederalIncomeTax,
            BigDecimal box3SocialSecurityWages, BigDecimal box4SocialSecurityTax, BigDecimal box5MedicareWages,
            BigDecimal box6MedicareTax, BigDecimal socialSecurityEmployeeRate, BigDecimal medicareEmployeeRate,
            BigDecimal recordedSocialSecurityWages, BigDecimal recordedMedicareWages) {
        this.companyId = companyId;
        this.employeeId = employeeId;
        this.year = year;
        this.box1Wages = box1Wages;
        this.box2FederalIncomeTax = box2FederalIncomeTax;
        this.box3SocialSecurityWages = box3SocialSecurityWages;
        this.box4SocialSecurityTax = box4SocialSecurityTax;
        this.box5MedicareWages = box5MedicareWages;
        this.box6MedicareTax = box6MedicareTax;
        this.socialSecurityEmployeeRate = socialSecurityEmployeeRate;
        this.medicareEmployeeRate = medicareEmployeeRate;
        this.recordedSocialSecurityWages = recordedSocialSecurityWages;
        this.recordedMedicareWages = recordedMedicareWages;
    }

    public String getCompanyId() { return companyId; }
    public String getEmployeeId() { return employeeId; }
    public int getYear() { return year; }
    public BigDecimal getBox1Wages() { return box1Wages; }
    public BigDecimal getBox2FederalIncomeTax() { return box2FederalIncomeTax; }
    public BigDecimal getBox3SocialSecurityWages() { return box3SocialSecurityWages; }
    public BigDecimal getBox4SocialSecurityTax() { return box4SocialSecurityTax; }
    public BigDecimal getBox5MedicareWages() { return box5MedicareWages; }
    public BigDecimal getBox6MedicareTax() { return box6MedicareTax; }
    public BigDecimal getSocialSecurityEmployeeRate() { return socialSecurityEmployeeRate; }
    public BigDecimal getMedicareEmployeeRate() { return medicareEmployeeRate; }
    public BigDecimal getRecordedSocialSecurityWages() { return recordedSocialSecurityWages; }
    public BigDecimal getRecordedMedicareWages() { return recordedMedicareWages; }
}
