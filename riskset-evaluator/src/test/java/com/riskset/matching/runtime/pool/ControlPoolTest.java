/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.pool;

import com.riskset.matching.api.model.CohortTable;
import com.riskset.matching.api.model.MatchMethod;
import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.AtRiskRule;
import com.riskset.matching.runtime.model.EligibilityModel;
import com.riskset.matching.runtime.model.EligibilityPredicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ControlPoolTest {

    private CohortTable controls;
    private EligibilityModel exactModel;

    private static Map<String, Object> row(String id, String sex, Object site, LocalDate evt) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("sex", sex);
        row.put("site", site);
        row.put("evt_date", evt);
        return row;
    }

    private static SubjectRecord caseOf(String sex, Object site, LocalDate idx) {
        Map<String, Object> values = new HashMap<>();
        values.put("sex", sex);
        values.put("site", site);
        values.put("idx_date", idx);
        return new SubjectRecord("case", values);
    }

    @BeforeEach
    void setUp() {
        controls = CohortTable.fromRows("controls", "id", List.of(
                row("k1", "F", 1, null),
                row("k2", "M", 1, null),
                row("k3", "F", 1L, LocalDate.of(2005, 1, 1)),
                row("k4", "F", 2, null),
                row("k5", null, 1, null),
                row("k6", "F", 1, LocalDate.of(2015, 1, 1))));
        exactModel = new EligibilityModel(MatchMethod.EXACT, List.of("sex", "site"), List.of(), null, null);
    }

    private static List<String> ids(List<SubjectRecord> records) {
        return records.stream().map(SubjectRecord::id).toList();
    }

    @Test
    @DisplayName("Should return only members sharing the case's match key, in pool order")
    void shouldFilterByMatchKey() {
        ControlPool pool = ControlPool.exclusive(controls, exactModel);

        EligibilityPredicate predicate = exactModel.forCase(caseOf("F", 1, null));

        assertThat(ids(pool.eligible(predicate))).containsExactly("k1", "k3", "k6");
        assertThat(pool.eligibleIndices(predicate).toIntArray()).containsExactly(0, 2, 5);
    }

    @Test
    @DisplayName("Should never index members with a missing match value")
    void shouldSkipIncompleteKeys() {
        ControlPool pool = ControlPool.shared(controls,
                new EligibilityModel(MatchMethod.INCIDENCE_DENSITY, List.of("sex"), List.of(), null, null));

        assertThat(pool.blockCount()).isEqualTo(2);
        assertThat(pool.eligible(exactModel.forCase(caseOf(null, 1, null)))).isEmpty();
    }

    @Test
    @DisplayName("Should apply the at-risk rule inside the block")
    void shouldApplyAtRiskRule() {
        EligibilityModel model = new EligibilityModel(MatchMethod.INCIDENCE_DENSITY, List.of("sex", "site"),
                List.of(), null, new AtRiskRule("idx_date", "evt_date"));
        ControlPool pool = ControlPool.shared(controls, model);

        EligibilityPredicate predicate = model.forCase(caseOf("F", 1, LocalDate.of(2010, 1, 1)));

        assertThat(ids(pool.eligible(predicate))).containsExactly("k1", "k6");
    }

    @Test
    @DisplayName("Removed members should no longer be eligible")
    void shouldRemoveFromExclusivePool() {
        ControlPool pool = ControlPool.exclusive(controls, exactModel);
        EligibilityPredicate predicate = exactModel.forCase(caseOf("F", 1, null));

        pool.remove(List.of("k1", "k6"));

        assertThat(ids(pool.eligible(predicate))).containsExactly("k3");
        assertThat(pool.contains("k1")).isFalse();
        assertThat(pool.contains("k3")).isTrue();
        assertThat(pool.availableCount()).isEqualTo(4);
        assertThat(pool.size()).isEqualTo(6);
    }

    @Test
    @DisplayName("A shared pool should refuse removals")
    void shouldRejectRemovalFromSharedPool() {
        ControlPool pool = ControlPool.shared(controls, exactModel);

        assertThatThrownBy(() -> pool.remove(List.of("k1")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(pool.availableCount()).isEqualTo(6);
    }

    @Test
    @DisplayName("Removing an unknown control should fail")
    void shouldRejectUnknownId() {
        ControlPool pool = ControlPool.exclusive(controls, exactModel);

        assertThatThrownBy(() -> pool.remove(List.of("nope")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }
}
