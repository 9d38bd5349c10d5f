/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.riskset.matching.api.exceptions.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Sampling discipline used to assign controls.
 */
public enum MatchMethod {

    /**
     * Risk-set sampling: every case samples from the same initial pool. A control may
     * serve several cases provided it was still at risk at each case's index date.
     */
    INCIDENCE_DENSITY("incidence_density"),

    /**
     * Sampling without reuse: a control assigned to one case is removed from the pool
     * for every case processed after it.
     */
    EXACT("exact");

    private final String key;

    MatchMethod(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Whether cases can be matched independently of each other.
     */
    public boolean allowsConcurrentCases() {
        return this == INCIDENCE_DENSITY;
    }

    /**
     * Parses a method name, accepting both the configuration key and the enum name.
     *
     * @throws ConfigurationException for an unknown or missing method
     */
    public static MatchMethod fromString(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("method must be one of " + knownKeys() + ", got: " + text);
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (MatchMethod method : values()) {
            if (method.key.equals(normalized)) {
                return method;
            }
        }
        throw new ConfigurationException("method must be one of " + knownKeys() + ", got: " + text);
    }

    private static String knownKeys() {
        return Arrays.stream(values()).map(MatchMethod::key).collect(Collectors.joining(", ", "[", "]"));
    }
}
