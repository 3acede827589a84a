package com.payroll.taxengine.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Where tax-year files live. Paths are relative, e.g. {@code 2025/fit/monthly/percentage_method.json}.
 */
public interface TaxDataSource {

    /** Opens the file, or returns empty when it does not exist. */
    Optional<InputStream> open(String relativePath) throws IOException;

    /** Human-readable location for error messages. */
    String describe(String relativePath);
}
