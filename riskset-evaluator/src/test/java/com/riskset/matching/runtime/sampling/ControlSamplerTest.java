/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.sampling;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ControlSamplerTest {

    private final ControlSampler sampler = new ControlSampler();

    private static IntList range(int n) {
        return IntArrayList.wrap(IntStream.range(0, n).toArray());
    }

    @Test
    @DisplayName("Should take every eligible control when there are too few")
    void shouldTakeAllWhenShort() {
        SampleOutcome outcome = sampler.sample(IntList.of(3, 7), 5, new SplittableRandom(1));

        assertThat(outcome.selected().toIntArray()).containsExactly(3, 7);
        assertThat(outcome.isShortfall()).isTrue();
        assertThat(outcome.eligibleCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return an empty draw when nothing is eligible")
    void shouldHandleEmpty() {
        SampleOutcome outcome = sampler.sample(IntList.of(), 2, new SplittableRandom(1));

        assertThat(outcome.selected().toIntArray()).isEmpty();
        assertThat(outcome.isShortfall()).isTrue();
    }

    @Test
    @DisplayName("Should draw the requested number of distinct eligible controls")
    void shouldDrawWithoutReplacement() {
        IntList eligible = range(50);

        SampleOutcome outcome = sampler.sample(eligible, 10, new SplittableRandom(99));

        Set<Integer> distinct = new HashSet<>(outcome.selected());
        assertThat(outcome.selected().toIntArray()).hasSize(10);
        assertThat(distinct).hasSize(10);
        assertThat(eligible.toIntArray()).contains(distinct.stream().mapToInt(Integer::intValue).toArray());
        assertThat(outcome.isShortfall()).isFalse();
    }

    @Test
    @DisplayName("Equal seeds should yield equal draws")
    void shouldBeReproducible() {
        IntList eligible = range(100);

        SampleOutcome first = sampler.sample(eligible, 5, CaseSeeds.randomFor(42L, 3));
        SampleOutcome second = sampler.sample(eligible, 5, CaseSeeds.randomFor(42L, 3));

        assertThat(first.selected().toIntArray()).containsExactly(second.selected().toIntArray());
    }

    @Test
    @DisplayName("Every eligible control should be drawn with roughly equal frequency")
    void shouldSampleUniformly() {
        int[] counts = new int[10];
        SplittableRandom random = new SplittableRandom(7);
        int draws = 20_000;
        for (int i = 0; i < draws; i++) {
            counts[sampler.sample(range(10), 1, random).selected().getInt(0)]++;
        }

        for (int count : counts) {
            assertThat(count).isBetween(1_700, 2_300);
        }
    }

    @Test
    @DisplayName("Should reject a non-positive request")
    void shouldRejectNonPositiveRequest() {
        assertThatThrownBy(() -> sampler.sample(range(3), 0, new SplittableRandom(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Case seeds should differ by position and by run seed")
    void shouldDeriveDistinctSeeds() {
        assertThat(CaseSeeds.seedFor(42L, 0)).isNotEqualTo(CaseSeeds.seedFor(42L, 1));
        assertThat(CaseSeeds.seedFor(42L, 0)).isNotEqualTo(CaseSeeds.seedFor(43L, 0));
        assertThat(CaseSeeds.seedFor(42L, 5)).isEqualTo(CaseSeeds.seedFor(42L, 5));
    }
}
