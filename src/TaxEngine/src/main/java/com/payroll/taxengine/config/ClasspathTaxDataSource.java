package com.payroll.taxengine.config;

import java.io.InputStream;
import java.util.Optional;

public class ClasspathTaxDataSource implements TaxDataSource {

    private final String root;
    private final ClassLoader classLoader;

    public ClasspathTaxDataSource(String root) {
        this(root, ClasspathTaxDataSource.class.getClassLoader());
    }

    public ClasspathTaxDataSource(String root, ClassLoader classLoader) {
        this.root = root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
        this.classLoader = classLoader;
    }

    @Override
    public Optional<InputStream> open(String relativePath) {
        return Optional.ofNullable(classLoader.getResourceAsStream(root + "/" + relativePath));
    }

    @Override
    public String describe(String relativePath) {
        return "classpath:" + root + "/" + relativePath;
    }
}
