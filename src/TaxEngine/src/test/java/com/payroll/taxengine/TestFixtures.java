package com.payroll.taxengine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.payroll.taxengine.calc.PayrollTaxEngine;
import com.payroll.taxengine.config.ClasspathTaxDataSource;
import com.payroll.taxengine.config.DirectoryTaxDataSource;
import com.payroll.taxengine.config.TaxYearConfig;
import com.payroll.taxengine.config.TaxYearConfigRepository;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import com.payroll.taxengine.model.CompanyTaxProfile;
import com.payroll.taxengine.model.EmployeePayProfile;
import com.payroll.taxengine.model.PayType;
import com.payroll.taxengine.model.PayrollRunInput;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Shared builders for engine tests. "Flat" data is the 2024 fixture with a single 10%
 * bracket and no standard deduction; "shipped" data is the production tables.
 */
public final class TestFixtures {

    public static final String COMPANY_ID = "acme-fl";
    public static final BigDecimal SUTA_RATE = new BigDecimal("0.027");

    private TestFixtures() {}

    public static TaxYearConfigRepository flatRepository() {
        return new TaxYearConfigRepository(new ClasspathTaxDataSource("flat-tax"));
    }

    public static TaxYearConfigRepository shippedRepository() {
        return new TaxYearConfigRepository(new ClasspathTaxDataSource("tax"));
    }

    public static TaxYearConfig flatMonthly() {
        return flatRepository().resolve(2024, "monthly").requirePassed();
    }

    public static PayrollTaxEngine flatEngine() {
        return new PayrollTaxEngine(flatRepository());
    }

    public static CompanyTaxProfile company() {
        return new CompanyTaxProfile(COMPANY_ID, SUTA_RATE);
    }

    public static EmployeePayProfile salaried(String employeeId, String amount, String filingStatus) {
        return new EmployeePayProfile(employeeId, PayType.SALARY, new BigDecimal(amount), filingStatus, "monthly");
    }

    public static EmployeePayProfile hourly(String employeeId, String rate, String standardHours) {
        EmployeePayProfile profile = new EmployeePayProfile(employeeId, PayType.HOURLY, new BigDecimal(rate),
            "single", "monthly");
        profile.setStandardHours(standardHours == null ? null : new BigDecimal(standardHours));
        return profile;
    }

    public static PayrollRunInput run(int year, int month) {
        return new PayrollRunInput(LocalDate.of(year, month, 28));
    }

    /**
     * Monthly runs for one employee, each with prior wages summed from the rows
     * already computed; the rows are appended to {@code ledger}.
     */
    public static List<PayrollLedgerRow> monthlyRuns(PayrollTaxEngine engine, CompanyTaxProfile company,
                                                     EmployeePayProfile profile, int year,
                                                     int fromMonth, int toMonth, List<PayrollLedgerRow> ledger) {
        List<PayrollLedgerRow> produced = new ArrayList<>();
        for (int month = fromMonth; month <= toMonth; month++) {
            PayrollLedgerRow row = engine.computeFromLedger(company, profile, run(year, month), ledger);
            ledger.add(row);
            produced.add(row);
        }
        return produced;
    }

    /** Copies the flat 2024 fixture into {@code target} so a test can break it. */
    public static DirectoryTaxDataSource copyFlatData(Path target) {
        Path source = resourcePath("flat-tax");
        try (Stream<Path> files = Files.walk(source)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Path destination = target.resolve(source.relativize(file).toString());
                if (Files.isDirectory(file)) {
                    Files.createDirectories(destination);
                } else {
                    Files.copy(file, destination);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new DirectoryTaxDataSource(target);
    }

    public static void replaceIn(Path file, String from, String to) {
        try {
            String content = Files.readString(file);
            if (!content.contains(from)) {
                throw new IllegalArgumentException(file + " does not contain '" + from + "'");
            }
            Files.writeString(file, content.replace(from, to));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Rewrites a JSON data file in place. */
    public static void editJson(Path file, Consumer<ObjectNode> edit) {
        try {
            ObjectNode root = (ObjectNode) PayrollJson.mapper().readTree(file.toFile());
            edit.accept(root);
            PayrollJson.mapper().writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Path resourcePath(String name) {
        URL url = TestFixtures.class.getClassLoader().getResource(name);
        if (url == null) {
            throw new IllegalStateException("test resource " + name + " not found");
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
