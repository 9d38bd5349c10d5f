/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.config;

import com.riskset.matching.api.MatchProgressTracker;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.model.MatchMethod;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration of a matching run.
 *
 * <p>Every convention the engine relies on (identifier column, date columns, seed) is
 * carried here rather than in process-wide state, so runs with different conventions
 * can execute side by side.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * MatchingConfig config = MatchingConfig.builder()
 *     .nControls(4)
 *     .matchVars(List.of("sex", "practice"))
 *     .extraVars(List.of("yob"))
 *     .extraConditions("yob >= case.yob - 2 && yob <= case.yob + 2")
 *     .method("incidence_density")
 *     .indexDateField("eventdate")
 *     .cores(8)
 *     .seed(2024L)
 *     .build();
 * }</pre>
 */
public final class MatchingConfig {

    public static final String DEFAULT_ID_FIELD = "id";
    public static final long DEFAULT_SEED = 42L;
    public static final LocalDate DEFAULT_DATE_ORIGIN = LocalDate.of(1970, 1, 1);

    private final int nControls;
    private final List<String> matchVars;
    private final List<String> extraVars;
    private final String extraConditions;
    private final MatchMethod method;
    private final String indexDateField;
    private final String controlDateField;
    private final int cores;
    private final boolean track;
    private final MatchProgressTracker tracker;
    private final long seed;
    private final String idField;
    private final Set<String> dateFields;
    private final LocalDate dateOrigin;

    private MatchingConfig(Builder builder) {
        this.nControls = builder.nControls;
        this.matchVars = List.copyOf(builder.matchVars);
        this.extraVars = List.copyOf(builder.extraVars);
        this.extraConditions = blankToNull(builder.extraConditions);
        this.method = builder.method;
        this.indexDateField = blankToNull(builder.indexDateField);
        this.controlDateField = blankToNull(builder.controlDateField);
        this.cores = builder.cores;
        this.track = builder.track;
        this.tracker = builder.tracker;
        this.seed = builder.seed;
        this.idField = builder.idField;
        this.dateFields = Set.copyOf(builder.dateFields);
        this.dateOrigin = builder.dateOrigin;

        validate();
    }

    private void validate() {
        if (nControls <= 0) {
            throw new ConfigurationException("n_controls must be positive, got: " + nControls);
        }
        if (matchVars.isEmpty()) {
            throw new ConfigurationException("match_vars must name at least one column");
        }
        if (new LinkedHashSet<>(matchVars).size() != matchVars.size()) {
            throw new ConfigurationException("match_vars contains duplicate columns: " + matchVars);
        }
        if (method == null) {
            throw new ConfigurationException("method must be set");
        }
        if (cores <= 0) {
            throw new ConfigurationException("cores must be positive, got: " + cores);
        }
        if (idField == null || idField.isBlank()) {
            throw new ConfigurationException("id_field must not be blank");
        }
        if (controlDateField != null && indexDateField == null) {
            throw new ConfigurationException("control_date_field requires index_date_field to be set");
        }
        Objects.requireNonNull(dateOrigin, "dateOrigin must not be null");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    // ========================================================================
    // DERIVED VALUES
    // ========================================================================

    /**
     * Column of the control pool compared against the case's index date.
     * Defaults to the index date column itself.
     */
    public String getEffectiveControlDateField() {
        return controlDateField != null ? controlDateField : indexDateField;
    }

    /**
     * Whether the at-risk test applies: only incidence-density runs with an index date column.
     */
    public boolean usesAtRiskConstraint() {
        return method == MatchMethod.INCIDENCE_DENSITY && indexDateField != null;
    }

    /**
     * Number of workers actually used. Exact matching is always single-threaded.
     */
    public int getEffectiveCores() {
        return method.allowsConcurrentCases() ? cores : 1;
    }

    /**
     * Whether the configured worker count exceeds what the method allows.
     */
    public boolean isParallelismDowngraded() {
        return cores > getEffectiveCores();
    }

    /**
     * Tracker to notify, or {@link MatchProgressTracker#NONE} when tracking is off.
     */
    public MatchProgressTracker getActiveTracker() {
        return track && tracker != null ? tracker : MatchProgressTracker.NONE;
    }

    /**
     * All columns to convert to dates before matching: the configured date fields
     * plus the index and control date columns.
     */
    public Set<String> getAllDateFields() {
        Set<String> all = new LinkedHashSet<>(dateFields);
        if (indexDateField != null) {
            all.add(indexDateField);
            all.add(getEffectiveControlDateField());
        }
        return all;
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with this configuration's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.nControls = this.nControls;
        builder.matchVars = new ArrayList<>(this.matchVars);
        builder.extraVars = new ArrayList<>(this.extraVars);
        builder.extraConditions = this.extraConditions;
        builder.method = this.method;
        builder.indexDateField = this.indexDateField;
        builder.controlDateField = this.controlDateField;
        builder.cores = this.cores;
        builder.track = this.track;
        builder.tracker = this.tracker;
        builder.seed = this.seed;
        builder.idField = this.idField;
        builder.dateFields = new LinkedHashSet<>(this.dateFields);
        builder.dateOrigin = this.dateOrigin;
        return builder;
    }

    public static class Builder {

        private int nControls = 1;
        private List<String> matchVars = new ArrayList<>();
        private List<String> extraVars = new ArrayList<>();
        private String extraConditions;
        private MatchMethod method = MatchMethod.INCIDENCE_DENSITY;
        private String indexDateField;
        private String controlDateField;
        private int cores = 1;
        private boolean track = false;
        private MatchProgressTracker tracker;
        private long seed = DEFAULT_SEED;
        private String idField = DEFAULT_ID_FIELD;
        private Set<String> dateFields = new LinkedHashSet<>();
        private LocalDate dateOrigin = DEFAULT_DATE_ORIGIN;

        private Builder() {
        }

        public Builder nControls(int nControls) {
            this.nControls = nControls;
            return this;
        }

        public Builder matchVars(Collection<String> matchVars) {
            this.matchVars = new ArrayList<>(Objects.requireNonNull(matchVars, "matchVars"));
            return this;
        }

        public Builder extraVars(Collection<String> extraVars) {
            this.extraVars = new ArrayList<>(Objects.requireNonNull(extraVars, "extraVars"));
            return this;
        }

        public Builder extraConditions(String extraConditions) {
            this.extraConditions = extraConditions;
            return this;
        }

        public Builder method(MatchMethod method) {
            this.method = method;
            return this;
        }

        /**
         * Sets the method by name ({@code incidence_density} or {@code exact}).
         *
         * @throws ConfigurationException for an unknown name
         */
        public Builder method(String method) {
            this.method = MatchMethod.fromString(method);
            return this;
        }

        public Builder indexDateField(String indexDateField) {
            this.indexDateField = indexDateField;
            return this;
        }

        public Builder controlDateField(String controlDateField) {
            this.controlDateField = controlDateField;
            return this;
        }

        public Builder cores(int cores) {
            this.cores = cores;
            return this;
        }

        public Builder track(boolean track) {
            this.track = track;
            return this;
        }

        public Builder tracker(MatchProgressTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder idField(String idField) {
            this.idField = idField;
            return this;
        }

        public Builder dateFields(Collection<String> dateFields) {
            this.dateFields = new LinkedHashSet<>(Objects.requireNonNull(dateFields, "dateFields"));
            return this;
        }

        public Builder dateOrigin(LocalDate dateOrigin) {
            this.dateOrigin = dateOrigin;
            return this;
        }

        /**
         * Builds and validates the configuration.
         *
         * @throws ConfigurationException if any option is invalid
         */
        public MatchingConfig build() {
            return new MatchingConfig(this);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public int getNControls() { return nControls; }
    public List<String> getMatchVars() { return matchVars; }
    public List<String> getExtraVars() { return extraVars; }
    public String getExtraConditions() { return extraConditions; }
    public MatchMethod getMethod() { return method; }
    public String getIndexDateField() { return indexDateField; }
    public String getControlDateField() { return controlDateField; }
    public int getCores() { return cores; }
    public boolean isTrack() { return track; }
    public MatchProgressTracker getTracker() { return tracker; }
    public long getSeed() { return seed; }
    public String getIdField() { return idField; }
    public Set<String> getDateFields() { return dateFields; }
    public LocalDate getDateOrigin() { return dateOrigin; }

    @Override
    public String toString() {
        return "MatchingConfig{" +
                "nControls=" + nControls +
                ", matchVars=" + matchVars +
                ", extraVars=" + extraVars +
                ", extraConditions='" + extraConditions + '\'' +
                ", method=" + method.key() +
                ", indexDateField='" + indexDateField + '\'' +
                ", controlDateField='" + controlDateField + '\'' +
                ", cores=" + cores +
                ", track=" + track +
                ", seed=" + seed +
                ", idField='" + idField + '\'' +
                '}';
    }
}
