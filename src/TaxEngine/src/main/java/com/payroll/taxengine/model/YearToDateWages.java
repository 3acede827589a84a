package com.payroll.taxengine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.ledger.TaxableWages;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;

/**
 * Calendar-year-to-date taxable wages before the period being computed. Drives the
 * Social Security, FUTA and SUTA wage-base caps and the Additional Medicare threshold.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class YearToDateWages {

    @JsonProperty("social_security_taxable_wages")
    private BigDecimal socialSecurityTaxableWages = BigDecimal.ZERO;

    @JsonProperty("medicare_wages")
    private BigDecimal medicareWages = BigDecimal.ZERO;

    @JsonProperty("futa_taxable_wages")
    private BigDecimal futaTaxableWages = BigDecimal.ZERO;

    @JsonProperty("suta_taxable_wages")
    private BigDecimal sutaTaxableWages = BigDecimal.ZERO;

    public YearToDateWages() {}

    public YearToDateWages(BigDecimal socialSecurityTaxableWages, BigDecimal medicareWages,
                           BigDecimal futaTaxableWages, BigDecimal sutaTaxableWages) {
        this.socialSecurityTaxableWages = socialSecurityTaxableWages;
        this.medicareWages = medicareWages;
        this.futaTaxableWages = futaTaxableWages;
        this.sutaTaxableWages = sutaTaxableWages;
    }

    public static YearToDateWages none() {
        return new YearToDateWages();
    }

    /** The same prior figure for every cap; convenient when wages never exceeded any base. */
    public static YearToDateWages uniform(BigDecimal wages) {
        return new YearToDateWages(wages, wages, wages, wages);
    }

    /**
     * Sums the persisted rows of {@code companyId}/{@code employeeId} paid earlier in the
     * same calendar year as {@code payDate}. Rows for other employees, companies, years, or
     * on/after the pay date are ignored.
     */
    public static YearToDateWages fromLedger(Collection<PayrollLedgerRow> rows, String companyId,
                                             String employeeId, LocalDate payDate) {
        YearToDateWages ytd = new YearToDateWages();
        for (PayrollLedgerRow row : rows) {
            if (!row.getCompanyId().equals(companyId) || !row.getEmployeeId().equals(employeeId)) continue;
            if (row.getYear() != payDate.getYear() || !row.getPayDate().isBefore(payDate)) continue;
            TaxableWages wages = row.getTaxableWages();
            ytd.socialSecurityTaxableWages = ytd.socialSecurityTaxableWages.add(wages.getSocialSecurity());
            ytd.medicareWages = ytd.medicareWages.add(wages.getMedicare());
            ytd.futaTaxableWages = ytd.futaTaxableWages.add(wages.getFuta());
            ytd.sutaTaxableWages = ytd.sutaTaxableWages.add(wages.getSuta());
        }
        return ytd;
    }

    public BigDecimal getSocialSecurityTaxableWages() { return socialSecurityTaxableWages; }
    public void setSocialSecurityTaxableWages(BigDecimal v) { this.socialSecurityTaxableWages = v; }

    public BigDecimal getMedicareWages() { return medicareWages; }
    public void setMedicareWages(BigDecimal medicareWages) { this.medicareWages = medicareWages; }

    public BigDecimal getFutaTaxableWages() { return futaTaxableWages; }
    public void setFutaTaxableWages(BigDecimal futaTaxableWages) { this.futaTaxableWages = futaTaxableWages; }

    public BigDecimal getSutaTaxableWages() { return sutaTaxableWages; }
    public void setSutaTaxableWages(BigDecimal sutaTaxableWages) { this.sutaTaxableWages = sutaTaxableWages; }
}
