/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.matching;

import com.riskset.matching.api.MatchProgressTracker;
import com.riskset.matching.api.exceptions.MatchingTaskException;
import com.riskset.matching.api.model.MatchedSet;
import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.evaluation.MatchingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a {@link CaseMatchingStrategy} over all cases.
 *
 * <h2>Execution</h2>
 * <p>With one worker, or a strategy that does not allow concurrent cases, cases are
 * matched in input order on the calling thread. Otherwise they are submitted to a fixed
 * pool of {@code workers} threads that lives for the duration of {@link #run(List)}.
 *
 * <h2>Failure</h2>
 * <p>The first failing case aborts the run: cases not yet started are skipped, running
 * workers are interrupted, and the failure is rethrown as a {@link MatchingTaskException}
 * naming the case. No partial result is returned.
 *
 * <h2>Ordering</h2>
 * <p>The returned list follows case input order regardless of completion order. The
 * progress tracker is notified once per completed case; in parallel runs the order of
 * notifications is unspecified, and cases still finishing after an abort are not reported.
 */
public final class MatchOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(MatchOrchestrator.class);

    private final CaseMatchingStrategy strategy;
    private final int workers;
    private final MatchProgressTracker tracker;
    private final MatchingMetrics metrics;

    public MatchOrchestrator(CaseMatchingStrategy strategy, int workers,
                             MatchProgressTracker tracker, MatchingMetrics metrics) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.tracker = tracker != null ? tracker : MatchProgressTracker.NONE;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
        this.workers = workers;
    }

    /**
     * Number of threads that will actually run cases.
     */
    public int effectiveWorkers() {
        return strategy.supportsConcurrentCases() ? workers : 1;
    }

    /**
     * Matches every case and returns one set per case, in input order.
     *
     * @throws MatchingTaskException if matching any case fails
     */
    public List<MatchedSet> run(List<SubjectRecord> cases) {
        Objects.requireNonNull(cases, "cases must not be null");
        if (cases.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(effectiveWorkers(), cases.size());
        logger.debug("Matching {} cases with method {} on {} worker(s)", cases.size(), strategy.method(), threads);
        return threads == 1 ? runSequential(cases) : runParallel(cases, threads);
    }

    private List<MatchedSet> runSequential(List<SubjectRecord> cases) {
        List<MatchedSet> sets = new ArrayList<>(cases.size());
        for (int position = 0; position < cases.size(); position++) {
            sets.add(matchOne(position, cases.get(position)));
        }
        return sets;
    }

    private List<MatchedSet> runParallel(List<SubjectRecord> cases, int threads) {
        ExecutorService executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        AtomicBoolean aborted = new AtomicBoolean(false);
        try {
            CompletionService<MatchedSet> completion = new ExecutorCompletionService<>(executor);
            for (int i = 0; i < cases.size(); i++) {
                final int position = i;
                final SubjectRecord caseRecord = cases.get(i);
                completion.submit(() -> matchConcurrently(position, caseRecord, aborted));
            }

            MatchedSet[] sets = new MatchedSet[cases.size()];
            for (int done = 0; done < cases.size(); done++) {
                Future<MatchedSet> future = completion.take();
                try {
                    MatchedSet set = future.get();
                    if (set != null) {
                        sets[set.position()] = set;
                    }
                } catch (ExecutionException e) {
                    aborted.set(true);
                    throw asTaskFailure(e.getCause());
                }
            }
            return Arrays.asList(sets);
        } catch (InterruptedException e) {
            aborted.set(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for matching workers", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private MatchedSet matchOne(int position, SubjectRecord caseRecord) {
        MatchedSet set = matchCase(position, caseRecord);
        notifyTracker(position, caseRecord.id());
        return set;
    }

    /**
     * Runs one case on a worker. Returns null for a case skipped after an abort; a case
     * that finishes after an abort is not reported to the tracker.
     */
    private MatchedSet matchConcurrently(int position, SubjectRecord caseRecord, AtomicBoolean aborted) {
        if (aborted.get()) {
            return null;
        }
        MatchedSet set;
        try {
            set = matchCase(position, caseRecord);
        } catch (RuntimeException e) {
            aborted.set(true);
            throw e;
        }
        if (!aborted.get()) {
            notifyTracker(position, caseRecord.id());
        }
        return set;
    }

    private MatchedSet matchCase(int position, SubjectRecord caseRecord) {
        try {
            return strategy.matchCase(position, caseRecord);
        } catch (RuntimeException e) {
            throw new MatchingTaskException(caseRecord.id(), position, e);
        }
    }

    private void notifyTracker(int position, String caseId) {
        try {
            tracker.onCaseProcessed(position, caseId);
        } catch (RuntimeException e) {
            metrics.recordTrackerFailure();
            logger.warn("Progress tracker failed for case '{}' at position {}", caseId, position, e);
        }
    }

    private static RuntimeException asTaskFailure(Throwable cause) {
        if (cause instanceof MatchingTaskException mte) {
            return mte;
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Matching worker failed", cause);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "riskset-matcher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
