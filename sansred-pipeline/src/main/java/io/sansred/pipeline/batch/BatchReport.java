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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome of a batch run: one {@link RowOutcome} per submitted row, the rows skipped as blank,
 * and the run's {@link BatchStatistics}.
 */
public final class BatchReport {

    private final Map<Integer, RowOutcome> outcomes;
    private final Set<Integer> skipped;
    private final BatchStatistics statistics;

    public BatchReport(Map<Integer, RowOutcome> outcomes, Set<Integer> skipped, BatchStatistics statistics) {
        this.outcomes = Collections.unmodifiableMap(new TreeMap<>(outcomes));
        this.skipped = Collections.unmodifiableSet(new TreeSet<>(skipped));
        this.statistics = statistics;
    }

    /**
     * @return row index to outcome, ordered by row index
     */
    public Map<Integer, RowOutcome> outcomes() {
        return outcomes;
    }

    public Optional<RowOutcome> outcome(int row) {
        return Optional.ofNullable(outcomes.get(row));
    }

    public Set<Integer> skipped() {
        return skipped;
    }

    public BatchStatistics statistics() {
        return statistics;
    }

    public List<Integer> succeededRows() {
        return rowsIn(RowRunState.SUCCESS);
    }

    public List<Integer> failedRows() {
        return rowsIn(RowRunState.FAILED);
    }

    public List<Integer> cancelledRows() {
        return rowsIn(RowRunState.CANCELLED);
    }

    /**
     * @return true when every submitted row succeeded
     */
    public boolean isSuccess() {
        return outcomes.values().stream().allMatch(RowOutcome::isSuccess);
    }

    private List<Integer> rowsIn(RowRunState state) {
        return outcomes.values().stream().filter(o -> o.state() == state).map(RowOutcome::rowIndex).toList();
    }

    @Override
    public String toString() {
        return "BatchReport[succeeded=" + succeededRows().size() + ", failed=" + failedRows().size()
            + ", cancelled=" + cancelledRows().size() + ", skipped=" + skipped.size() + "]";
    }
}
