package io.sansred.pipeline.workspace;

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

import java.util.List;

/// The workspaces loaded from one run file: a scatter and a monitor workspace per period.
/// Periods are numbered from 1.
public record LoadedRun(String file, List<Workspace> scatter, List<Workspace> monitors) {

    public LoadedRun {
        scatter = List.copyOf(scatter);
        monitors = List.copyOf(monitors);
        if (scatter.isEmpty() || scatter.size() != monitors.size()) {
            throw new IllegalArgumentException(file + ": needs one scatter and one monitor workspace per period, got "
                + scatter.size() + " and " + monitors.size());
        }
    }

    public int periodCount() {
        return scatter.size();
    }

    public boolean isMultiPeriod() {
        return scatter.size() > 1;
    }

    public Workspace scatter(int period) {
        return scatter.get(checkPeriod(period) - 1);
    }

    public Workspace monitor(int period) {
        return monitors.get(checkPeriod(period) - 1);
    }

    private int checkPeriod(int period) {
        if (period < 1 || period > scatter.size()) {
            throw new IllegalArgumentException(file + " has " + scatter.size() + " period(s), period " + period + " requested");
        }
        return period;
    }
}
