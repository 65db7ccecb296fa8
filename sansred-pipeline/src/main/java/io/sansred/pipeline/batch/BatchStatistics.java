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

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Row counts of one batch run, kept per terminal {@link RowRunState}. Rows that could not be
 * configured are submitted and failed in one step. Skipped blank rows never reach the
 * statistics.
 *
 * <p>Safe to read while the batch is running.
 */
public final class BatchStatistics {

    private final LongAdder submitted = new LongAdder();
    private final Map<RowRunState, LongAdder> finished = new EnumMap<>(RowRunState.class);

    public BatchStatistics() {
        for (RowRunState state : RowRunState.values()) {
            if (state.isTerminal()) {
                finished.put(state, new LongAdder());
            }
        }
    }

    void incrementSubmitted() {
        submitted.increment();
    }

    void incrementCompleted() {
        finish(RowRunState.SUCCESS);
    }

    void incrementFailed() {
        finish(RowRunState.FAILED);
    }

    void incrementCancelled() {
        finish(RowRunState.CANCELLED);
    }

    private void finish(RowRunState state) {
        finished.get(state).increment();
    }

    public long getSubmitted() {
        return submitted.sum();
    }

    public long getCompleted() {
        return count(RowRunState.SUCCESS);
    }

    public long getFailed() {
        return count(RowRunState.FAILED);
    }

    public long getCancelled() {
        return count(RowRunState.CANCELLED);
    }

    /// @param state a terminal state
    /// @return rows that ended in {@code state}, or 0 for a non-terminal one
    public long count(RowRunState state) {
        LongAdder adder = finished.get(state);
        return adder == null ? 0 : adder.sum();
    }

    /// Rows dispatched that have not reached a terminal state yet.
    public long getPending() {
        long done = 0;
        for (LongAdder adder : finished.values()) {
            done += adder.sum();
        }
        return submitted.sum() - done;
    }

    public boolean isComplete() {
        return getPending() == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("rows: ").append(getSubmitted()).append(" submitted");
        finished.forEach((state, adder) ->
            sb.append(", ").append(adder.sum()).append(' ').append(state.name().toLowerCase()));
        long pending = getPending();
        if (pending > 0) {
            sb.append(", ").append(pending).append(" pending");
        }
        return sb.toString();
    }
}
