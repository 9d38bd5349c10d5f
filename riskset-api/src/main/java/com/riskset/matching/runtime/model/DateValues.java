/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.model;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Conversions from raw column values to {@link LocalDate}.
 *
 * <p>Accepted inputs: {@link LocalDate}, {@link LocalDateTime}, {@link OffsetDateTime},
 * ISO {@code yyyy-MM-dd} strings (optionally with a time part) and integral day offsets
 * from an origin date. Null, blank strings and the missing-value markers
 * {@code NA}, {@code NaN} and {@code null} map to null.
 */
public final class DateValues {

    private static final Set<String> MISSING_MARKERS = Set.of("na", "nan", "null", "");

    private DateValues() {
        throw new AssertionError("No instances");
    }

    /**
     * Converts a value using the Unix epoch as origin for day offsets.
     */
    public static LocalDate toLocalDate(Object value) {
        return toLocalDate(value, LocalDate.EPOCH);
    }

    /**
     * Converts a value to a date.
     *
     * @param value  raw column value
     * @param origin date that integral day offsets count from
     * @return the date, or null for a missing value
     * @throws IllegalArgumentException if the value cannot be read as a date
     */
    public static LocalDate toLocalDate(Object value, LocalDate origin) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return null;
            }
            if (d != Math.rint(d)) {
                throw new IllegalArgumentException("Not a whole number of days: " + value);
            }
            try {
                return origin.plusDays(number.longValue());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Day offset out of range: " + value, e);
            }
        }
        if (value instanceof CharSequence text) {
            String s = text.toString().trim();
            if (MISSING_MARKERS.contains(s.toLowerCase(Locale.ROOT))) {
                return null;
            }
            try {
                return s.length() > 10 && (s.charAt(10) == 'T' || s.charAt(10) == ' ')
                        ? LocalDate.parse(s.substring(0, 10))
                        : LocalDate.parse(s);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Not an ISO date: '" + s + "'", e);
            }
        }
        throw new IllegalArgumentException("Unsupported date value of type " + value.getClass().getName());
    }
}
