/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.assembly;

import com.riskset.matching.api.model.MatchedRow;
import com.riskset.matching.api.model.MatchedSet;
import com.riskset.matching.api.model.MatchingResult;
import com.riskset.matching.api.model.MatchingStats;
import com.riskset.matching.api.model.Shortfall;
import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.api.model.SubjectRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flattens matched sets into the matched-set table.
 *
 * <p>Each set contributes its case row first, followed by one row per control in draw
 * order. A case with no eligible controls still contributes its own row. Values of
 * variables missing from a subject are carried as null.
 */
public final class ResultAssembler {

    private final List<String> matchVars;
    private final List<String> extraVars;

    public ResultAssembler(List<String> matchVars, List<String> extraVars) {
        this.matchVars = List.copyOf(matchVars);
        this.extraVars = List.copyOf(extraVars);
    }

    public List<MatchedRow> toRows(List<MatchedSet> sets) {
        List<MatchedRow> rows = new ArrayList<>();
        for (MatchedSet set : sets) {
            rows.add(row(set, set.caseRecord(), SubjectRole.CASE));
            for (SubjectRecord control : set.controls()) {
                rows.add(row(set, control, SubjectRole.CONTROL));
            }
        }
        return rows;
    }

    /**
     * Builds the complete result of a run.
     */
    public MatchingResult assemble(List<MatchedSet> sets, int workers, boolean parallelismDowngraded,
                                   long durationNanos) {
        List<Shortfall> shortfalls = sets.stream()
                .map(MatchedSet::shortfall)
                .flatMap(Optional::stream)
                .toList();
        int assigned = sets.stream().mapToInt(MatchedSet::size).sum();
        MatchingStats stats = new MatchingStats(sets.size(), assigned, shortfalls.size(), workers,
                parallelismDowngraded, durationNanos);
        return new MatchingResult(toRows(sets), sets, shortfalls, stats);
    }

    private MatchedRow row(MatchedSet set, SubjectRecord subject, SubjectRole role) {
        return new MatchedRow(set.caseId(), set.matchedSetId(), subject.id(), role,
                project(subject, matchVars), project(subject, extraVars));
    }

    private static Map<String, Object> project(SubjectRecord subject, List<String> columns) {
        if (columns.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (String column : columns) {
            values.put(column, subject.value(column));
        }
        return Collections.unmodifiableMap(values);
    }
}
