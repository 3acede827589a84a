package com.payroll.taxengine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.payroll.taxengine.config.TaxYearConfigRepository;
import com.payroll.taxengine.config.ValidationResult;
import com.payroll.taxengine.error.PayrollTaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Operator check run before a new tax year is enabled:
 * <pre>
 *   TaxYearValidationCommand &lt;year&gt; [pay_frequency]
 * </pre>
 * Prints the validation report as JSON. Exit status 0 on PASS, 1 on FAIL, 2 on bad usage.
 */
public class TaxYearValidationCommand {

    private static final Logger log = LoggerFactory.getLogger(TaxYearValidationCommand.class);

    static final int EXIT_PASS = 0;
    static final int EXIT_FAIL = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, TaxYearConfigRepository.fromEnvironment(), System.out, System.err));
    }

    static int run(String[] args, TaxYearConfigRepository repository, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("usage: TaxYearValidationCommand <year> [pay_frequency]");
            return EXIT_USAGE;
        }
        int year;
        try {
            year = Integer.parseInt(args[0].trim());
        } catch (NumberFormatException e) {
            err.println("year must be a number: " + args[0]);
            return EXIT_USAGE;
        }

        ValidationResult result;
        try {
            result = args.length == 2
                ? repository.resolve(year, args[1].trim()).getValidation()
                : repository.validateYear(year);
        } catch (PayrollTaxException e) {
            log.warn("Validation of {} could not run: {}", year, e.getMessage());
            ValidationResult.Builder failed = ValidationResult.builder()
                .detail("year", year)
                .detail("error", e.getKind().name());
            e.getFailures().forEach(f -> failed.fail(f.getField(), f.getMessage()));
            if (e.getFailures().isEmpty()) {
                failed.fail("year", e.getMessage());
            }
            result = failed.build();
        }

        try {
            out.println(PayrollJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render validation report", e);
        }
        return result.isPassed() ? EXIT_PASS : EXIT_FAIL;
    }
}
