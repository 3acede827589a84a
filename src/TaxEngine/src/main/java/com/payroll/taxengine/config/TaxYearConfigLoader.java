package com.payroll.taxengine.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.taxengine.PayrollJson;
import com.payroll.taxengine.error.ConfigInvalidException;
import com.payroll.taxengine.error.ConfigNotFoundException;
import com.payroll.taxengine.error.UnsupportedFrequencyException;
import com.payroll.taxengine.error.ValidationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the tax-year file set:
 * <pre>
 *   {year}/metadata.json
 *   {year}/rates.json
 *   {year}/validation.json
 *   {year}/fit/{frequency}/percentage_method.json
 * </pre>
 * Absent year or frequency files raise {@link ConfigNotFoundException}; unparseable JSON or
 * missing keys raise {@link ConfigInvalidException} listing every offending key. Semantic
 * checks (ranges, bracket ordering, year checkpoints) belong to {@link ValidationGate}.
 */
public class TaxYearConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(TaxYearConfigLoader.class);

    static final String METADATA_FILE = "metadata.json";
    static final String RATES_FILE = "rates.json";
    static final String VALIDATION_FILE = "validation.json";

    private final TaxDataSource dataSource;
    private final ObjectMapper mapper;

    public TaxYearConfigLoader(TaxDataSource dataSource) {
        this(dataSource, PayrollJson.mapper());
    }

    public TaxYearConfigLoader(TaxDataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    static String fitPath(int year, String payFrequency) {
        return year + "/fit/" + payFrequency + "/percentage_method.json";
    }

    /** Reads only {@code metadata.json}; used to enumerate a year's frequencies. */
    public ConfigSource loadSource(int year) {
        String metadataPath = year + "/" + METADATA_FILE;
        JsonNode metadata = readRequired(year, null, metadataPath);
        List<ValidationFailure> problems = new ArrayList<>();
        ConfigSource source = parseSource(metadata, metadataPath, problems);
        if (!problems.isEmpty()) {
            throw new ConfigInvalidException(year, null, problems);
        }
        return source;
    }

    public LoadedTaxYear load(int year, String payFrequency) {
        String metadataPath = year + "/" + METADATA_FILE;
        String ratesPath = year + "/" + RATES_FILE;
        String validationPath = year + "/" + VALIDATION_FILE;
        String fitPath = fitPath(year, payFrequency);

        ConfigSource source = loadSource(year);
        if (!source.getPayFrequencies().contains(payFrequency)) {
            throw new UnsupportedFrequencyException(payFrequency, year, source.getPayFrequencies());
        }

        JsonNode rates = readRequired(year, null, ratesPath);
        JsonNode fit = readRequired(year, payFrequency, fitPath);
        Optional<JsonNode> validation = readOptional(year, payFrequency, validationPath);

        List<ValidationFailure> problems = new ArrayList<>();
        StatutoryRates statutory = parseRates(rates, ratesPath, problems);
        Integer periodsPerYear = requireInt(fit, "periods_per_year", fitPath, problems);
        Map<String, FitTable> tables = parseFitTables(fit, fitPath, source.getFilingStatuses(), problems);
        ValidationExpectations expectations = validation
            .map(node -> parseExpectations(node, validationPath, problems))
            .orElse(null);

        if (!problems.isEmpty()) {
            log.warn("Tax configuration {}/{} is malformed: {}", year, payFrequency, problems);
            throw new ConfigInvalidException(year, payFrequency, problems);
        }

        List<String> checked = new ArrayList<>(List.of(
            dataSource.describe(metadataPath), dataSource.describe(ratesPath), dataSource.describe(fitPath)));
        validation.ifPresent(v -> checked.add(dataSource.describe(validationPath)));

        TaxYearConfig config = new TaxYearConfig(year, payFrequency, periodsPerYear, source, statutory, tables);
        log.info("Loaded tax configuration {}/{} version={} source='{}'",
            year, payFrequency, source.getVersion(), source.getPublication());
        return new LoadedTaxYear(config, expectations, checked);
    }

    // ---- file access ----

    private JsonNode readRequired(int year, String payFrequency, String path) {
        return readOptional(year, payFrequency, path)
            .orElseThrow(() -> new ConfigNotFoundException(year, payFrequency, dataSource.describe(path)));
    }

    private Optional<JsonNode> readOptional(int year, String payFrequency, String path) {
        try {
            Optional<InputStream> stream = dataSource.open(path);
            if (stream.isEmpty()) {
                return Optional.empty();
            }
            try (InputStream in = stream.get()) {
                JsonNode node = mapper.readTree(in);
                if (node == null || !node.isObject()) {
                    throw new ConfigInvalidException(year, payFrequency,
                        List.of(new ValidationFailure(path, "must contain a JSON object")));
                }
                return Optional.of(node);
            }
        } catch (JsonProcessingException e) {
            throw new ConfigInvalidException(year, payFrequency,
                List.of(new ValidationFailure(path, "invalid JSON: " + e.getOriginalMessage())));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + dataSource.describe(path), e);
        }
    }

    // ---- parsing ----

    private ConfigSource parseSource(JsonNode metadata, String path, List<ValidationFailure> problems) {
        Integer taxYear = requireInt(metadata, "tax_year", path, problems);
        String publication = requireText(metadata, "source", path, problems);
        String version = requireText(metadata, "version", path, problems);
        String lastUpdated = requireText(metadata, "last_updated", path, problems);
        String notes = requireText(metadata, "notes", path, problems);
        String method = requireText(metadata, "method", path, problems);
        List<String> frequencies = requireTextList(metadata, "pay_frequencies", path, problems);
        List<String> statuses = requireTextList(metadata, "filing_statuses", path, problems);

        LocalDate effectiveDate = null;
        if (lastUpdated != null) {
            try {
                effectiveDate = LocalDate.parse(lastUpdated);
            } catch (DateTimeParseException e) {
                problems.add(new ValidationFailure(path + ":last_updated", "must be an ISO date (yyyy-MM-dd)"));
            }
        }
        if (!problems.isEmpty()) {
            return null;
        }
        return new ConfigSource(taxYear, publication, version, effectiveDate, notes, method, frequencies, statuses);
    }

    private StatutoryRates parseRates(JsonNode rates, String path, List<ValidationFailure> problems) {
        JsonNode ss = requireObject(rates, "social_security", path, problems);
        JsonNode medicare = requireObject(rates, "medicare", path, problems);
        JsonNode futa = requireObject(rates, "futa", path, problems);
        JsonNode suta = requireObject(rates, "suta", path, problems);
        if (ss == null || medicare == null || futa == null || suta == null) {
            return null;
        }
        int before = problems.size();
        BigDecimal ssEmployee = requireDecimal(ss, "employee_rate", path + ":social_security", problems);
        BigDecimal ssEmployer = requireDecimal(ss, "employer_rate", path + ":social_security", problems);
        BigDecimal ssWageBase = requireDecimal(ss, "wage_base", path + ":social_security", problems);
        BigDecimal medEmployee = requireDecimal(medicare, "employee_rate", path + ":medicare", problems);
        BigDecimal medEmployer = requireDecimal(medicare, "employer_rate", path + ":medicare", problems);
        BigDecimal addlRate = requireDecimal(medicare, "additional_employee_rate", path + ":medicare", problems);
        BigDecimal addlThreshold = requireDecimal(medicare, "additional_threshold", path + ":medicare", problems);
        BigDecimal futaRate = requireDecimal(futa, "employer_rate", path + ":futa", problems);
        BigDecimal futaWageBase = requireDecimal(futa, "wage_base", path + ":futa", problems);
        BigDecimal sutaWageBase = requireDecimal(suta, "wage_base", path + ":suta", problems);
        if (problems.size() > before) {
            return null;
        }
        return new StatutoryRates(ssEmployee, ssEmployer, ssWageBase, medEmployee, medEmployer,
            addlRate, addlThreshold, futaRate, futaWageBase, sutaWageBase);
    }

    private Map<String, FitTable> parseFitTables(JsonNode fit, String path, List<String> filingStatuses,
                                                 List<ValidationFailure> problems) {
        Map<String, FitTable> tables = new LinkedHashMap<>();
        if (filingStatuses == null) {
            return tables;
        }
        for (String status : filingStatuses) {
            JsonNode table = requireObject(fit, status, path, problems);
            if (table == null) continue;
            String tablePath = path + ":" + status;
            BigDecimal standardDeduction = requireDecimal(table, "standard_deduction", tablePath, problems);
            JsonNode bracketNodes = table.get("brackets");
            if (bracketNodes == null || !bracketNodes.isArray() || bracketNodes.isEmpty()) {
                problems.add(new ValidationFailure(tablePath + ".brackets", "missing required non-empty array"));
                continue;
            }
            List<FitBracket> brackets = new ArrayList<>();
            for (int i = 0; i < bracketNodes.size(); i++) {
                JsonNode bracket = bracketNodes.get(i);
                String bracketPath = tablePath + ".brackets[" + i + "]";
                BigDecimal over = requireDecimal(bracket, "over", bracketPath, problems);
                BigDecimal rate = requireDecimal(bracket, "rate", bracketPath, problems);
                BigDecimal baseTax = requireDecimal(bracket, "base_tax", bracketPath, problems);
                if (over != null && rate != null && baseTax != null) {
                    brackets.add(new FitBracket(over, rate, baseTax));
                }
            }
            if (standardDeduction != null && brackets.size() == bracketNodes.size()) {
                tables.put(status, new FitTable(status, standardDeduction, brackets));
            }
        }
        return tables;
    }

    private ValidationExpectations parseExpectations(JsonNode validation, String path,
                                                     List<ValidationFailure> problems) {
        Integer taxYear = requireInt(validation, "tax_year", path, problems);
        Map<String, BigDecimal> deductions = new LinkedHashMap<>();
        Map<String, List<BigDecimal>> thresholds = new LinkedHashMap<>();
        Map<String, BigDecimal> topThresholds = new LinkedHashMap<>();

        validation.path("standard_deduction").fields().forEachRemaining(e ->
            deductions.put(e.getKey(), decimal(e.getValue())));
        validation.path("bracket_thresholds").fields().forEachRemaining(e -> {
            List<BigDecimal> values = new ArrayList<>();
            e.getValue().forEach(v -> values.add(decimal(v)));
            thresholds.put(e.getKey(), values);
        });
        validation.path("top_bracket_threshold").fields().forEachRemaining(e ->
            topThresholds.put(e.getKey(), decimal(e.getValue())));

        if (taxYear == null) {
            return null;
        }
        return new ValidationExpectations(taxYear, deductions, thresholds, topThresholds);
    }

    // ---- field helpers ----

    private static JsonNode requireObject(JsonNode parent, String field, String path,
                                          List<ValidationFailure> problems) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            problems.add(new ValidationFailure(path + ":" + field, "missing required object"));
            return null;
        }
        return node;
    }

    private static String requireText(JsonNode parent, String field, String path, List<ValidationFailure> problems) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            problems.add(new ValidationFailure(path + ":" + field, "missing required key"));
            return null;
        }
        if (!node.isTextual()) {
            problems.add(new ValidationFailure(path + ":" + field, "must be a string"));
            return null;
        }
        return node.asText();
    }

    private static Integer requireInt(JsonNode parent, String field, String path, List<ValidationFailure> problems) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            problems.add(new ValidationFailure(path + ":" + field, "missing required key"));
            return null;
        }
        if (!node.canConvertToExactIntegral() || !node.canConvertToInt()) {
            problems.add(new ValidationFailure(path + ":" + field, "must be an integer"));
            return null;
        }
        return node.asInt();
    }

    private static BigDecimal requireDecimal(JsonNode parent, String field, String path,
                                             List<ValidationFailure> problems) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            problems.add(new ValidationFailure(path + ":" + field, "missing required key"));
            return null;
        }
        if (!node.isNumber()) {
            problems.add(new ValidationFailure(path + ":" + field, "must be a number"));
            return null;
        }
        return decimal(node);
    }

    private static List<String> requireTextList(JsonNode parent, String field, String path,
                                                List<ValidationFailure> problems) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray() || node.isEmpty()) {
            problems.add(new ValidationFailure(path + ":" + field, "missing required non-empty array"));
            return null;
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                problems.add(new ValidationFailure(path + ":" + field, "entries must be non-blank strings"));
                return null;
            }
            values.add(item.asText());
        }
        return values;
    }

    private static BigDecimal decimal(JsonNode node) {
        BigDecimal value = node.decimalValue();
        // tree nodes may strip trailing zeros into exponent form (7E+3)
        return value.scale() < 0 ? value.setScale(0) : value;
    }
}
