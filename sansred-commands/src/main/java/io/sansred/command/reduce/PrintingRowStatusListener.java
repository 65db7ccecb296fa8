package io.sansred.command.reduce;

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

import io.sansred.pipeline.batch.BatchReport;
import io.sansred.pipeline.batch.RowRunState;
import io.sansred.pipeline.batch.RowStatusListener;

import java.io.PrintWriter;

/// Prints row signals as they arrive, prefixed with the glyph of the row's state.
class PrintingRowStatusListener implements RowStatusListener {

    private final PrintWriter out;

    PrintingRowStatusListener(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void rowStarted(int row) {
        print(RowRunState.RUNNING, row, "started");
    }

    @Override
    public void rowProcessed(int row) {
        print(RowRunState.SUCCESS, row, "processed");
    }

    @Override
    public void rowFailed(int row, String message) {
        print(RowRunState.FAILED, row, "failed: " + message);
    }

    @Override
    public void rowCancelled(int row) {
        print(RowRunState.CANCELLED, row, "cancelled");
    }

    @Override
    public void batchFinished(BatchReport report) {
        synchronized (out) {
            out.println(report);
            out.flush();
        }
    }

    private void print(RowRunState state, int row, String text) {
        synchronized (out) {
            out.println(state.getGlyph() + " row " + row + " " + text);
            out.flush();
        }
    }
}
