/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.config;

import com.riskset.matching.api.MatchProgressTracker;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.model.MatchMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchingConfigTest {

    private static MatchingConfig.Builder minimal() {
        return MatchingConfig.builder().matchVars(List.of("sex"));
    }

    @Test
    @DisplayName("Should apply defaults for optional options")
    void shouldApplyDefaults() {
        MatchingConfig config = minimal().build();

        assertThat(config.getNControls()).isEqualTo(1);
        assertThat(config.getMethod()).isEqualTo(MatchMethod.INCIDENCE_DENSITY);
        assertThat(config.getCores()).isEqualTo(1);
        assertThat(config.isTrack()).isFalse();
        assertThat(config.getSeed()).isEqualTo(MatchingConfig.DEFAULT_SEED);
        assertThat(config.getIdField()).isEqualTo("id");
        assertThat(config.getDateOrigin()).isEqualTo(LocalDate.of(1970, 1, 1));
        assertThat(config.getExtraConditions()).isNull();
        assertThat(config.usesAtRiskConstraint()).isFalse();
    }

    @Test
    @DisplayName("Should reject non-positive n_controls")
    void shouldRejectNonPositiveNControls() {
        assertThatThrownBy(() -> minimal().nControls(0).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("n_controls must be positive");
    }

    @Test
    @DisplayName("Should reject empty and duplicate match_vars")
    void shouldRejectBadMatchVars() {
        assertThatThrownBy(() -> MatchingConfig.builder().build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("match_vars");
        assertThatThrownBy(() -> MatchingConfig.builder().matchVars(List.of("sex", "sex")).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    @DisplayName("Should reject unknown method names")
    void shouldRejectUnknownMethod() {
        assertThatThrownBy(() -> minimal().method("nearest_neighbour"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("method must be one of");
    }

    @Test
    @DisplayName("Should accept method names regardless of case and separator")
    void shouldParseMethodLeniently() {
        assertThat(minimal().method("Incidence-Density").build().getMethod()).isEqualTo(MatchMethod.INCIDENCE_DENSITY);
        assertThat(minimal().method("EXACT").build().getMethod()).isEqualTo(MatchMethod.EXACT);
    }

    @Test
    @DisplayName("Should reject non-positive cores")
    void shouldRejectNonPositiveCores() {
        assertThatThrownBy(() -> minimal().cores(0).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("cores must be positive");
    }

    @Test
    @DisplayName("Should require index_date_field when control_date_field is set")
    void shouldRequireIndexDateForControlDate() {
        assertThatThrownBy(() -> minimal().controlDateField("evt_date").build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("control_date_field requires index_date_field");
    }

    @Test
    @DisplayName("Should downgrade cores to one for exact matching")
    void shouldDowngradeCoresForExact() {
        MatchingConfig exact = minimal().method(MatchMethod.EXACT).cores(8).build();
        MatchingConfig density = minimal().cores(8).build();

        assertThat(exact.getEffectiveCores()).isEqualTo(1);
        assertThat(exact.isParallelismDowngraded()).isTrue();
        assertThat(density.getEffectiveCores()).isEqualTo(8);
        assertThat(density.isParallelismDowngraded()).isFalse();
    }

    @Test
    @DisplayName("Should apply the at-risk test only for incidence density with an index date")
    void shouldDeriveAtRiskConstraint() {
        assertThat(minimal().indexDateField("idx").build().usesAtRiskConstraint()).isTrue();
        assertThat(minimal().indexDateField("idx").method(MatchMethod.EXACT).build().usesAtRiskConstraint()).isFalse();
    }

    @Test
    @DisplayName("Should default the control date column to the index date column")
    void shouldDefaultControlDateField() {
        MatchingConfig same = minimal().indexDateField("idx").build();
        MatchingConfig separate = minimal().indexDateField("idx").controlDateField("evt").build();

        assertThat(same.getEffectiveControlDateField()).isEqualTo("idx");
        assertThat(separate.getEffectiveControlDateField()).isEqualTo("evt");
        assertThat(separate.getAllDateFields()).containsExactlyInAnyOrder("idx", "evt");
    }

    @Test
    @DisplayName("Should include configured date fields in the date columns to convert")
    void shouldCollectDateFields() {
        MatchingConfig config = minimal().dateFields(Set.of("birth")).indexDateField("idx").build();

        assertThat(config.getAllDateFields()).containsExactlyInAnyOrder("birth", "idx");
    }

    @Test
    @DisplayName("Should only expose the tracker when tracking is on")
    void shouldGateTrackerOnTrackFlag() {
        MatchProgressTracker tracker = (position, caseId) -> { };

        assertThat(minimal().tracker(tracker).build().getActiveTracker()).isSameAs(MatchProgressTracker.NONE);
        assertThat(minimal().tracker(tracker).track(true).build().getActiveTracker()).isSameAs(tracker);
        assertThat(minimal().track(true).build().getActiveTracker()).isSameAs(MatchProgressTracker.NONE);
    }

    @Test
    @DisplayName("Should treat a blank extra condition as absent")
    void shouldNormalizeBlankCondition() {
        assertThat(minimal().extraConditions("   ").build().getExtraConditions()).isNull();
    }

    @Test
    @DisplayName("toBuilder should produce an equivalent configuration")
    void shouldRoundTripThroughBuilder() {
        MatchingConfig original = minimal().nControls(3).extraVars(List.of("age")).seed(7L).cores(2).build();
        MatchingConfig copy = original.toBuilder().build();

        assertThat(copy.getNControls()).isEqualTo(3);
        assertThat(copy.getExtraVars()).containsExactly("age");
        assertThat(copy.getSeed()).isEqualTo(7L);
        assertThat(copy.getCores()).isEqualTo(2);
    }
}
