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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/// Collects row signals from any thread.
class RecordingListener implements RowStatusListener {

    private final List<String> events = Collections.synchronizedList(new ArrayList<>());
    private final Map<Integer, String> failures = new ConcurrentHashMap<>();
    private final AtomicReference<BatchReport> finished = new AtomicReference<>();

    @Override
    public void rowStarted(int row) {
        events.add("started:" + row);
    }

    @Override
    public void rowProcessed(int row) {
        events.add("processed:" + row);
    }

    @Override
    public void rowFailed(int row, String message) {
        events.add("failed:" + row);
        failures.put(row, message);
    }

    @Override
    public void rowCancelled(int row) {
        events.add("cancelled:" + row);
    }

    @Override
    public void batchFinished(BatchReport report) {
        finished.set(report);
    }

    List<String> events() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    /// @return terminal signals only
    List<String> terminal() {
        return events().stream().filter(e -> !e.startsWith("started:")).toList();
    }

    Map<Integer, String> failures() {
        return failures;
    }

    BatchReport finished() {
        return finished.get();
    }
}
