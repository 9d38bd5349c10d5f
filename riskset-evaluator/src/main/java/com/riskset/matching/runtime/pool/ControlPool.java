/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.pool;

import com.riskset.matching.api.model.CohortTable;
import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.EligibilityModel;
import com.riskset.matching.runtime.model.EligibilityPredicate;
import com.riskset.matching.runtime.model.MatchKey;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The set of candidate controls of a run.
 *
 * <h2>Indexing</h2>
 * <p>Members are numbered by their position in the control table. At construction the
 * pool groups members by {@link MatchKey} into one {@link RoaringBitmap} per key, so an
 * eligibility scan only visits controls that already share the case's match values.
 * Members with an incomplete key are never indexed; they can match no case.
 *
 * <h2>Modes</h2>
 * <ul>
 * <li><b>Exclusive</b> (exact matching): a second bitmap tracks members still available,
 * and {@link #remove(Collection)} clears them. Not thread-safe; one case at a time.</li>
 * <li><b>Shared</b> (incidence density): membership never changes after construction and
 * the pool may be scanned from any number of threads.</li>
 * </ul>
 *
 * <p>Eligible members are always returned in ascending member order, which keeps seeded
 * draws independent of hash ordering.
 */
public final class ControlPool {

    private static final int NOT_FOUND = -1;

    private final SubjectRecord[] members;
    private final Object2IntMap<String> indexById;
    private final Map<MatchKey, RoaringBitmap> blocks;
    private final RoaringBitmap available;
    private final boolean exclusive;

    private ControlPool(CohortTable controls, EligibilityModel model, boolean exclusive) {
        List<SubjectRecord> rows = controls.rows();
        this.members = rows.toArray(new SubjectRecord[0]);
        this.indexById = new Object2IntOpenHashMap<>(members.length);
        this.indexById.defaultReturnValue(NOT_FOUND);
        this.blocks = new HashMap<>();
        for (int i = 0; i < members.length; i++) {
            indexById.put(members[i].id(), i);
            MatchKey key = model.keyOf(members[i]);
            if (key.isComplete()) {
                blocks.computeIfAbsent(key, k -> new RoaringBitmap()).add(i);
            }
        }
        blocks.values().forEach(RoaringBitmap::runOptimize);
        this.exclusive = exclusive;
        this.available = exclusive ? RoaringBitmap.bitmapOfRange(0, members.length) : null;
    }

    /**
     * Builds a pool whose members are removed once assigned.
     */
    public static ControlPool exclusive(CohortTable controls, EligibilityModel model) {
        return new ControlPool(controls, model, true);
    }

    /**
     * Builds a pool whose membership is fixed for the whole run.
     */
    public static ControlPool shared(CohortTable controls, EligibilityModel model) {
        return new ControlPool(controls, model, false);
    }

    /**
     * Returns the member indices eligible for the predicate's case, in ascending order.
     */
    public IntList eligibleIndices(EligibilityPredicate predicate) {
        MatchKey key = predicate.matchKey();
        if (!key.isComplete()) {
            return IntList.of();
        }
        RoaringBitmap block = blocks.get(key);
        if (block == null) {
            return IntList.of();
        }
        RoaringBitmap candidates = exclusive ? RoaringBitmap.and(block, available) : block;
        IntArrayList eligible = new IntArrayList(candidates.getCardinality());
        IntIterator it = candidates.getIntIterator();
        while (it.hasNext()) {
            int index = it.next();
            if (predicate.testResidual(members[index])) {
                eligible.add(index);
            }
        }
        return eligible;
    }

    /**
     * Returns the members eligible for the predicate's case, in pool order.
     */
    public List<SubjectRecord> eligible(EligibilityPredicate predicate) {
        IntList indices = eligibleIndices(predicate);
        List<SubjectRecord> result = new ArrayList<>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            result.add(members[indices.getInt(i)]);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Removes the given controls from an exclusive pool.
     *
     * @throws IllegalStateException    if the pool is shared
     * @throws IllegalArgumentException if an identifier is not a member
     */
    public void remove(Collection<String> ids) {
        requireExclusive();
        for (String id : ids) {
            int index = indexById.getInt(id);
            if (index == NOT_FOUND) {
                throw new IllegalArgumentException("Control '" + id + "' is not a member of the pool");
            }
            available.remove(index);
        }
    }

    /**
     * Removes the members at the given indices from an exclusive pool.
     */
    public void removeIndices(IntList indices) {
        requireExclusive();
        for (int i = 0; i < indices.size(); i++) {
            available.remove(indices.getInt(i));
        }
    }

    public SubjectRecord member(int index) {
        return members[index];
    }

    public boolean contains(String id) {
        int index = indexById.getInt(id);
        return index != NOT_FOUND && (!exclusive || available.contains(index));
    }

    public int size() {
        return members.length;
    }

    /**
     * Members not yet assigned; equal to {@link #size()} for a shared pool.
     */
    public int availableCount() {
        return exclusive ? available.getCardinality() : members.length;
    }

    /**
     * Number of distinct complete match keys among the members.
     */
    public int blockCount() {
        return blocks.size();
    }

    public boolean isExclusive() {
        return exclusive;
    }

    private void requireExclusive() {
        if (!exclusive) {
            throw new IllegalStateException("Controls cannot be removed from a shared pool");
        }
    }
}
