package com.jointcalc.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@link CalculationConfig} documents with Jackson.
 *
 * Every call returns a fresh instance, so callers may adjust the result
 * without affecting anyone else.
 */
public final class CalculationConfigLoader {
    private static final Logger log = LogManager.getLogger(CalculationConfigLoader.class);

    /** Classpath resource holding the shipped defaults. */
    public static final String DEFAULTS_RESOURCE = "jointcalc-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CalculationConfigLoader() {
    }

    /**
     * Loads the shipped defaults. Falls back to the compiled-in values when the
     * resource is absent.
     */
    public static CalculationConfig defaults() {
        try (InputStream in = CalculationConfigLoader.class.getClassLoader()
                .getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.debug("{} not on classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return new CalculationConfig();
            }
            return MAPPER.readValue(in, CalculationConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    public static CalculationConfig load(Path path) throws IOException {
        log.info("Loading calculation config from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, CalculationConfig.class).validate();
        }
    }

    public static CalculationConfig parse(String json) throws IOException {
        return MAPPER.readValue(json, CalculationConfig.class).validate();
    }

    public static String toJson(CalculationConfig config) throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    }
}
