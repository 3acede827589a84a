package com.payroll.taxengine.calc;

import com.payroll.taxengine.TestFixtures;
import com.payroll.taxengine.config.DirectoryTaxDataSource;
import com.payroll.taxengine.config.TaxYearConfigRepository;
import com.payroll.taxengine.error.ConfigInvalidException;
import com.payroll.taxengine.error.ConfigNotFoundException;
import com.payroll.taxengine.error.ErrorKind;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.model.EmployeePayProfile;
import com.payroll.taxengine.model.YearToDateWages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.payroll.taxengine.TestFixtures.company;
import static com.payroll.taxengine.TestFixtures.run;
import static com.payroll.taxengine.TestFixtures.salaried;
import static org.junit.jupiter.api.Assertions.*;

class PayrollTaxEngineTest {

    @Test
    void testComputeResolvesTheRunYear() {
        PayrollLedgerRow row = TestFixtures.flatEngine()
            .compute(company(), salaried("e1", "4000", "single"), run(2024, 2), YearToDateWages.none());
        assertEquals(2024, row.getConfig().getTaxYear());
        assertEquals("monthly", row.getConfig().getPayFrequency());
    }

    @Test
    void testMissingYearNeverFallsBack() {
        ConfigNotFoundException e = assertThrows(ConfigNotFoundException.class, () -> TestFixtures.flatEngine()
            .compute(company(), salaried("e1", "4000", "single"), run(2099, 1), YearToDateWages.none()));
        assertEquals(ErrorKind.CONFIG_NOT_FOUND, e.getKind());
    }

    /**
     * A configuration that fails the gate must block the computation.
     */
    @Test
    void testFailedValidationBlocksComputation(@TempDir Path dir) {
        TestFixtures.copyFlatData(dir);
        TestFixtures.editJson(dir.resolve("2024/metadata.json"), root -> root.put("tax_year", 2023));
        PayrollTaxEngine engine = new PayrollTaxEngine(
            new TaxYearConfigRepository(new DirectoryTaxDataSource(dir)));

        ConfigInvalidException e = assertThrows(ConfigInvalidException.class,
            () -> engine.compute(company(), salaried("e1", "4000", "single"), run(2024, 1), YearToDateWages.none()));
        assertTrue(e.getFailures().stream().anyMatch(f -> f.getField().equals("metadata.tax_year")));
    }

    @Test
    void testComputeFromLedgerDerivesPriorWages() {
        PayrollTaxEngine engine = TestFixtures.flatEngine();
        EmployeePayProfile profile = salaried("e1", "3000", "single");
        List<PayrollLedgerRow> history = new ArrayList<>();
        history.add(engine.compute(company(), profile, run(2024, 1), YearToDateWages.none()));
        history.add(engine.computeFromLedger(company(), profile, run(2024, 2), history));
        PayrollLedgerRow march = engine.computeFromLedger(company(), profile, run(2024, 3), history);

        // 6000 of the 7000 FUTA base used by January and February
        assertEquals(new BigDecimal("1000.00"), march.getTaxableWages().getFuta());
        assertEquals(new BigDecimal("1000.00"), march.getTaxableWages().getSuta());
    }
}
