package com.payroll.taxengine.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public class DirectoryTaxDataSource implements TaxDataSource {

    private final Path root;

    public DirectoryTaxDataSource(Path root) {
        this.root = root;
    }

    @Override
    public Optional<InputStream> open(String relativePath) throws IOException {
        Path file = root.resolve(relativePath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.newInputStream(file));
    }

    @Override
    public String describe(String relativePath) {
        return root.resolve(relativePath).toString();
    }
}
