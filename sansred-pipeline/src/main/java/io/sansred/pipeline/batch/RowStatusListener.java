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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.function.Consumer;

/**
 * Receives per-row lifecycle signals from a {@link BatchOrchestrator}.
 *
 * <p>Every submitted row produces exactly one terminal signal: {@link #rowProcessed},
 * {@link #rowFailed} or {@link #rowCancelled}. A row may be preceded by one
 * {@link #rowStarted}. Rows run in parallel complete in any order, so every signal carries
 * the row index.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe; signals arrive on worker threads. Exceptions thrown
 * by a listener are logged and do not affect the row or the batch.
 */
public interface RowStatusListener {

    /**
     * Called on the worker thread when a row begins.
     *
     * @param row the row index
     */
    default void rowStarted(int row) {
    }

    void rowProcessed(int row);

    void rowFailed(int row, String message);

    /**
     * Called for rows that had not started when the batch was cancelled. Defaults to a
     * failure signal so two-signal listeners still see one terminal signal per row.
     *
     * @param row the row index
     */
    default void rowCancelled(int row) {
        rowFailed(row, "cancelled before start");
    }

    /**
     * Called once after every row has its terminal signal.
     *
     * @param report the outcome of the batch
     */
    default void batchFinished(BatchReport report) {
    }

    static RowStatusListener noop() {
        return new RowStatusListener() {
            @Override
            public void rowProcessed(int row) {
            }

            @Override
            public void rowFailed(int row, String message) {
            }

            @Override
            public void rowCancelled(int row) {
            }
        };
    }

    /**
     * Fans signals out to several listeners. A listener that throws does not keep the others
     * from being called.
     */
    static RowStatusListener composite(RowStatusListener... listeners) {
        List<RowStatusListener> all = List.of(listeners);
        Logger logger = LogManager.getLogger(RowStatusListener.class);
        return new RowStatusListener() {
            private void each(Consumer<RowStatusListener> signal) {
                for (RowStatusListener listener : all) {
                    try {
                        signal.accept(listener);
                    } catch (RuntimeException e) {
                        logger.warn("row status listener {} failed", listener, e);
                    }
                }
            }

            @Override
            public void rowStarted(int row) {
                each(l -> l.rowStarted(row));
            }

            @Override
            public void rowProcessed(int row) {
                each(l -> l.rowProcessed(row));
            }

            @Override
            public void rowFailed(int row, String message) {
                each(l -> l.rowFailed(row, message));
            }

            @Override
            public void rowCancelled(int row) {
                each(l -> l.rowCancelled(row));
            }

            @Override
            public void batchFinished(BatchReport report) {
                each(l -> l.batchFinished(report));
            }
        };
    }
}
