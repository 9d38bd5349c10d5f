/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.assembly;

import com.riskset.matching.api.model.MatchedRow;
import com.riskset.matching.api.model.MatchedSet;
import com.riskset.matching.api.model.MatchingResult;
import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.api.model.SubjectRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAssemblerTest {

    private final ResultAssembler assembler = new ResultAssembler(List.of("sex"), List.of("age", "smoker"));

    private static SubjectRecord subject(String id, int age) {
        return new SubjectRecord(id, Map.of("sex", "F", "age", age));
    }

    @Test
    @DisplayName("Should flatten sets with the case row first and controls in draw order")
    void shouldFlattenSets() {
        List<MatchedSet> sets = List.of(
                new MatchedSet(1, 0, subject("c1", 50), List.of(subject("k2", 51), subject("k1", 49)), 2),
                new MatchedSet(2, 1, subject("c2", 60), List.of(), 2));

        List<MatchedRow> rows = assembler.toRows(sets);

        assertThat(rows).extracting(MatchedRow::subjectId).containsExactly("c1", "k2", "k1", "c2");
        assertThat(rows).extracting(MatchedRow::role)
                .containsExactly(SubjectRole.CASE, SubjectRole.CONTROL, SubjectRole.CONTROL, SubjectRole.CASE);
        assertThat(rows).extracting(MatchedRow::matchedSetId).containsExactly(1, 1, 1, 2);
        assertThat(rows.get(1).caseId()).isEqualTo("c1");
    }

    @Test
    @DisplayName("Should carry missing extra variables as null")
    void shouldCarryMissingValues() {
        MatchedRow row = assembler.toRows(List.of(new MatchedSet(1, 0, subject("c1", 50), List.of(), 1))).get(0);

        assertThat(row.matchValues()).containsExactly(Map.entry("sex", "F"));
        assertThat(row.extraValues()).containsEntry("age", 50).containsEntry("smoker", null);
    }

    @Test
    @DisplayName("Should summarize shortfalls and counts")
    void shouldBuildStats() {
        List<MatchedSet> sets = List.of(
                new MatchedSet(1, 0, subject("c1", 50), List.of(subject("k1", 51), subject("k2", 52)), 2),
                new MatchedSet(2, 1, subject("c2", 60), List.of(subject("k3", 61)), 2));

        MatchingResult result = assembler.assemble(sets, 4, false, 1_000_000L);

        assertThat(result.stats().cases()).isEqualTo(2);
        assertThat(result.stats().controlsAssigned()).isEqualTo(3);
        assertThat(result.stats().shortfallCases()).isEqualTo(1);
        assertThat(result.stats().workers()).isEqualTo(4);
        assertThat(result.stats().durationMillis()).isEqualTo(1L);
        assertThat(result.shortfalls()).singleElement()
                .satisfies(s -> {
                    assertThat(s.caseId()).isEqualTo("c2");
                    assertThat(s.missing()).isEqualTo(1);
                });
    }
}
