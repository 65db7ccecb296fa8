package io.sansred.pipeline.batch;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.sansred.pipeline.bundle.ReducedSlice;
import io.sansred.pipeline.core.ReductionCore;
import io.sansred.pipeline.engine.ReductionEngine;
import io.sansred.pipeline.workspace.ResultRegistry;
import io.sansred.pipeline.workspace.WorkspaceLoader;
import io.sansred.pipeline.workspace.WorkspaceSaver;
import io.sansred.state.BatchStates;
import io.sansred.state.CompositeState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the rows of a batch through the reduction and publishes their outputs.
 *
 * <p>Each row is one task on a fixed pool of worker threads. Rows are isolated from each
 * other: every exception a row raises is caught at the task boundary and reported as that
 * row's failure signal, and every submitted row gets exactly one terminal signal. Rows that
 * could not be configured fail without being dispatched.
 *
 * <h2>Optimizations</h2>
 * <p>With {@code useOptimizations} on, rows share loaded runs through a {@link LoadCache} and
 * can reductions through a {@link OnceCache}. Both caches live as long as the orchestrator and
 * are dropped by {@link #clearCaches()}. They never change numeric results.
 *
 * <h2>Cancellation</h2>
 * <p>{@link #cancel()} stops rows that have not started; running rows finish.
 */
public class BatchOrchestrator {

    private static final Logger logger = LogManager.getLogger(BatchOrchestrator.class);
    private static final AtomicInteger batchCounter = new AtomicInteger();

    private final ReductionCore core;
    private final WorkspaceLoader loader;
    private final LoadCache loadCache;
    private final OnceCache<String, ReducedSlice> canCache = new OnceCache<>();
    private final OutputPublisher publisher;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public BatchOrchestrator(ReductionEngine engine, WorkspaceLoader loader, ResultRegistry registry,
                             WorkspaceSaver saver) {
        this.core = new ReductionCore(engine, registry);
        this.loader = Objects.requireNonNull(loader, "loader");
        this.loadCache = new LoadCache(loader);
        this.publisher = new OutputPublisher(registry, saver);
    }

    /**
     * Runs the given states one row at a time.
     *
     * @param states          row index to state
     * @param useOptimizations share loaded runs and can reductions between rows
     * @param outputMode      where outputs go
     * @param listener        receives one terminal signal per row
     * @return the outcome of every row
     */
    public BatchReport processStates(Map<Integer, CompositeState> states, boolean useOptimizations,
                                     OutputMode outputMode, RowStatusListener listener) {
        BatchOptions options = BatchOptions.defaults()
            .withUseOptimizations(useOptimizations)
            .withOutputMode(outputMode);
        return processStates(BatchStates.of(states), options, listener);
    }

    public BatchReport processStates(BatchStates states, BatchOptions options, RowStatusListener listener) {
        Objects.requireNonNull(listener, "listener");
        cancelled.set(false);
        BatchStatistics statistics = new BatchStatistics();
        Map<Integer, RowOutcome> outcomes = new ConcurrentHashMap<>();

        states.errors().forEach((row, message) -> {
            statistics.incrementSubmitted();
            statistics.incrementFailed();
            outcomes.put(row, RowOutcome.failed(row, message));
            signal(() -> listener.rowFailed(row, message));
        });

        Map<Integer, String> baseNames = OutputNamer.uniqueBaseNames(states.states());
        RowReducer reducer = options.useOptimizations()
            ? new RowReducer(core, loadCache, canCache)
            : new RowReducer(core, loader, null);
        logger.info("processing {} row(s) on {} thread(s), {} skipped, {} not configured",
            states.states().size(), options.threads(), states.skipped().size(), states.errors().size());

        ExecutorService pool = Executors.newFixedThreadPool(options.threads(), threadFactory());
        try {
            states.states().forEach((row, state) -> {
                statistics.incrementSubmitted();
                pool.execute(() -> runRow(row, state, baseNames.get(row), reducer, options, listener, statistics, outcomes));
            });
        } finally {
            pool.shutdown();
        }
        awaitRows(pool);

        for (Integer row : states.states().keySet()) {
            if (outcomes.putIfAbsent(row, RowOutcome.cancelled(row)) == null) {
                statistics.incrementCancelled();
                signal(() -> listener.rowCancelled(row));
            }
        }
        BatchReport report = new BatchReport(outcomes, states.skipped(), statistics);
        logger.info("batch finished: {}", statistics);
        signal(() -> listener.batchFinished(report));
        return report;
    }

    private void runRow(int row, CompositeState state, String baseName, RowReducer reducer, BatchOptions options,
                        RowStatusListener listener, BatchStatistics statistics, Map<Integer, RowOutcome> outcomes) {
        if (cancelled.get()) {
            if (outcomes.putIfAbsent(row, RowOutcome.cancelled(row)) == null) {
                statistics.incrementCancelled();
                signal(() -> listener.rowCancelled(row));
            }
            return;
        }
        signal(() -> listener.rowStarted(row));
        RowOutcome outcome;
        try {
            RowResult result = reducer.reduce(row, state);
            outcome = RowOutcome.success(row, publisher.publish(state, baseName, result, options),
                result.scales(), result.shifts());
        } catch (Exception e) {
            logger.debug("row {} failed", row, e);
            outcome = RowOutcome.failed(row, describe(e));
        }
        if (outcomes.putIfAbsent(row, outcome) != null) {
            logger.debug("row {} finished after the batch stopped waiting for it", row);
            return;
        }
        if (outcome.isSuccess()) {
            statistics.incrementCompleted();
            signal(() -> listener.rowProcessed(row));
        } else {
            statistics.incrementFailed();
            String message = outcome.message();
            signal(() -> listener.rowFailed(row, message));
        }
    }

    private static void awaitRows(ExecutorService pool) {
        try {
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.trace("waiting for rows to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("interrupted while waiting for rows; unfinished rows are reported as cancelled");
            pool.shutdownNow();
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static void signal(Runnable signal) {
        try {
            signal.run();
        } catch (RuntimeException e) {
            logger.warn("row status listener failed", e);
        }
    }

    private static ThreadFactory threadFactory() {
        int batch = batchCounter.incrementAndGet();
        AtomicInteger threads = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sansred-batch" + batch + "-row-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Prevents rows that have not started from running. They are reported as cancelled.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void clearCaches() {
        loadCache.clear();
        canCache.clear();
    }
}
