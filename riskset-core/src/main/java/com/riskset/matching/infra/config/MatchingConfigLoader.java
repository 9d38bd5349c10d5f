/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.infra.config;

import com.riskset.matching.api.config.MatchingConfig;
import com.riskset.matching.api.exceptions.ConfigurationException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Loads a {@link MatchingConfig} from a properties file with environment overrides.
 *
 * <h2>Sources</h2>
 * <p>The properties file is searched for on the classpath first, then on the file system.
 * Every key can be overridden by an environment variable named after it: upper case,
 * dots replaced by underscores ({@code matching.n_controls} becomes
 * {@code MATCHING_N_CONTROLS}).
 *
 * <h2>Keys</h2>
 * <pre>
 * matching.n_controls=2
 * matching.match_vars=sex,site
 * matching.extra_vars=age
 * matching.extra_conditions=abs(age - case.age) &lt;= 5
 * matching.method=incidence_density
 * matching.index_date_field=idx_date
 * matching.control_date_field=evt_date
 * matching.cores=4
 * matching.track=true
 * matching.seed=42
 * matching.id_field=id
 * matching.date_fields=birth_date
 * matching.date_origin=1970-01-01
 * </pre>
 *
 * <p>List values are comma separated. A value that cannot be parsed, like a
 * configuration that fails validation, raises {@link ConfigurationException}.
 */
public final class MatchingConfigLoader {
    private static final Logger logger = Logger.getLogger(MatchingConfigLoader.class.getName());

    public static final String DEFAULT_PROPERTIES = "matching.properties";
    public static final String PREFIX = "matching.";

    public static final String N_CONTROLS = "n_controls";
    public static final String MATCH_VARS = "match_vars";
    public static final String EXTRA_VARS = "extra_vars";
    public static final String EXTRA_CONDITIONS = "extra_conditions";
    public static final String METHOD = "method";
    public static final String INDEX_DATE_FIELD = "index_date_field";
    public static final String CONTROL_DATE_FIELD = "control_date_field";
    public static final String CORES = "cores";
    public static final String TRACK = "track";
    public static final String SEED = "seed";
    public static final String ID_FIELD = "id_field";
    public static final String DATE_FIELDS = "date_fields";
    public static final String DATE_ORIGIN = "date_origin";

    private final Map<String, String> environment;

    public MatchingConfigLoader() {
        this(System.getenv());
    }

    /**
     * @param environment variables consulted for overrides
     */
    public MatchingConfigLoader(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
    }

    public MatchingConfig loadDefault() {
        return load(DEFAULT_PROPERTIES);
    }

    /**
     * Loads the properties at the given classpath resource or file path.
     */
    public MatchingConfig load(String propertiesPath) {
        return builderFrom(readProperties(propertiesPath)).build();
    }

    /**
     * Builds a configuration from already loaded properties; environment overrides apply.
     */
    public MatchingConfig fromProperties(Properties props) {
        return builderFrom(props).build();
    }

    /**
     * Returns a builder seeded from the properties and environment, for callers that
     * still need to set programmatic options such as the progress tracker.
     */
    public MatchingConfig.Builder builderFrom(Properties props) {
        MatchingConfig.Builder builder = MatchingConfig.builder();

        lookup(props, N_CONTROLS).ifPresent(v -> builder.nControls(parseInt(N_CONTROLS, v)));
        lookup(props, MATCH_VARS).ifPresent(v -> builder.matchVars(parseList(v)));
        lookup(props, EXTRA_VARS).ifPresent(v -> builder.extraVars(parseList(v)));
        lookup(props, EXTRA_CONDITIONS).ifPresent(builder::extraConditions);
        lookup(props, METHOD).ifPresent(builder::method);
        lookup(props, INDEX_DATE_FIELD).ifPresent(builder::indexDateField);
        lookup(props, CONTROL_DATE_FIELD).ifPresent(builder::controlDateField);
        lookup(props, CORES).ifPresent(v -> builder.cores(parseInt(CORES, v)));
        lookup(props, TRACK).ifPresent(v -> builder.track(parseBoolean(TRACK, v)));
        lookup(props, SEED).ifPresent(v -> builder.seed(parseLong(SEED, v)));
        lookup(props, ID_FIELD).ifPresent(builder::idField);
        lookup(props, DATE_FIELDS).ifPresent(v -> builder.dateFields(parseList(v)));
        lookup(props, DATE_ORIGIN).ifPresent(v -> builder.dateOrigin(parseDate(DATE_ORIGIN, v)));

        return builder;
    }

    /**
     * Reads a properties file from the classpath or, failing that, the file system.
     * A missing file yields empty properties.
     */
    public Properties readProperties(String propertiesPath) {
        logger.info("Loading matching configuration from: " + propertiesPath);
        Properties props = new Properties();

        try (InputStream is = MatchingConfigLoader.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
                return props;
            }
        } catch (IOException e) {
            throw new ConfigurationException("Could not read classpath resource: " + propertiesPath, e);
        }

        try (InputStream is = new FileInputStream(propertiesPath)) {
            props.load(is);
            logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
        } catch (java.io.FileNotFoundException e) {
            logger.warning("Properties file not found: " + propertiesPath + ". Using defaults and environment.");
        } catch (IOException e) {
            throw new ConfigurationException("Could not read properties file: " + propertiesPath, e);
        }
        return props;
    }

    // ====================================================================
    // LOOKUP AND PARSING
    // ====================================================================

    static String environmentKey(String key) {
        return (PREFIX + key).toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private Optional<String> lookup(Properties props, String key) {
        String envKey = environmentKey(key);
        String value = environment.get(envKey);
        if (value != null && !value.isBlank()) {
            logger.fine("Using environment override " + envKey);
            return Optional.of(value.trim());
        }
        value = props.getProperty(PREFIX + key);
        if (value != null && !value.isBlank()) {
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    private static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw invalid(key, "an integer", value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw invalid(key, "an integer", value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw invalid(key, "a boolean", value, null);
        };
    }

    private static LocalDate parseDate(String key, String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw invalid(key, "an ISO date", value, e);
        }
    }

    private static ConfigurationException invalid(String key, String expected, String value, Exception cause) {
        return new ConfigurationException(PREFIX + key + " must be " + expected + ", got: " + value, cause);
    }
}
