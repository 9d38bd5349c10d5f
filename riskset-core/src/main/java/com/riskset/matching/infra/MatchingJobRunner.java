/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.infra;

import com.riskset.matching.api.IControlMatchingEngine;
import com.riskset.matching.api.config.MatchingConfig;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.exceptions.MatchingTaskException;
import com.riskset.matching.api.model.CohortTable;
import com.riskset.matching.api.model.MatchingResult;
import com.riskset.matching.infra.config.MatchingConfigLoader;
import com.riskset.matching.infra.io.CohortTableReader;
import com.riskset.matching.runtime.evaluation.ControlMatchingEngine;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a matching job described by a properties file and two JSON tables.
 *
 * <pre>
 * java com.riskset.matching.infra.MatchingJobRunner matching.properties cases.json controls.json
 * </pre>
 *
 * <p>Both tables are keyed by the configured {@code matching.id_field}. When
 * {@code matching.track} is on and no tracker was supplied, progress is logged.
 */
public class MatchingJobRunner {
    private static final Logger logger = Logger.getLogger(MatchingJobRunner.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final MatchingConfigLoader configLoader;
    private final CohortTableReader tableReader;
    private final Function<MatchingConfig, IControlMatchingEngine> engineFactory;

    public MatchingJobRunner(MatchingConfigLoader configLoader,
                             CohortTableReader tableReader,
                             Function<MatchingConfig, IControlMatchingEngine> engineFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader must not be null");
        this.tableReader = Objects.requireNonNull(tableReader, "tableReader must not be null");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory must not be null");
    }

    public MatchingJobRunner(Tracer tracer) {
        this(new MatchingConfigLoader(), new CohortTableReader(), config -> new ControlMatchingEngine(config, tracer));
    }

    public MatchingJobRunner() {
        this(OpenTelemetry.noop().getTracer("riskset-core"));
    }

    /**
     * Loads the job's inputs and runs the engine.
     *
     * @throws IOException            if an input file cannot be read
     * @throws ConfigurationException if the configuration or an input table is invalid
     * @throws MatchingTaskException  if matching a case fails
     */
    public MatchingResult run(Path propertiesPath, Path casesPath, Path controlsPath) throws IOException {
        MatchingConfig config = configLoader.load(propertiesPath.toString());

        CohortTable cases = tableReader.read(casesPath, "cases", config.getIdField());
        CohortTable controls = tableReader.read(controlsPath, "controls", config.getIdField());

        if (config.isTrack() && config.getTracker() == null) {
            config = config.toBuilder().tracker(LoggingProgressTracker.forCases(cases.size())).build();
        }

        logger.info("Running " + config.getMethod().key() + " matching: " + cases.size() + " cases, "
                + controls.size() + " candidate controls");
        return engineFactory.apply(config).match(cases, controls);
    }

    public static void main(String[] args) {
        System.exit(execute(args, new MatchingJobRunner()));
    }

    static int execute(String[] args, MatchingJobRunner runner) {
        if (args.length != 3) {
            logger.severe("Usage: MatchingJobRunner <matching.properties> <cases.json> <controls.json>");
            return EXIT_USAGE;
        }
        try {
            MatchingResult result = runner.run(Paths.get(args[0]), Paths.get(args[1]), Paths.get(args[2]));
            logger.info("Matching complete: " + result.stats().cases() + " matched sets, "
                    + result.stats().controlsAssigned() + " controls, "
                    + result.stats().shortfallCases() + " shortfalls");
            return EXIT_OK;
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Matching job failed: " + e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
