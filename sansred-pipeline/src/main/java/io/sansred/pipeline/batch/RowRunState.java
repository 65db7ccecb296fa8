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

/**
 * Execution state of one batch row.
 *
 * <p>State Transitions:
 * <ul>
 *   <li><strong>PENDING → RUNNING:</strong> a worker picked the row up</li>
 *   <li><strong>RUNNING → SUCCESS:</strong> the row was reduced and its outputs published</li>
 *   <li><strong>RUNNING → FAILED:</strong> loading, a pipeline stage, the merge or publication failed</li>
 *   <li><strong>PENDING → FAILED:</strong> the row could not be configured</li>
 *   <li><strong>PENDING → CANCELLED:</strong> the batch was cancelled before the row started</li>
 * </ul>
 *
 * <p>{@link #SUCCESS}, {@link #FAILED} and {@link #CANCELLED} are terminal.
 */
public enum RowRunState {
    PENDING("⏳", false),
    RUNNING("🔄", false),
    SUCCESS("✅", true),
    FAILED("❌", true),
    CANCELLED("🚫", true);

    private final String glyph;
    private final boolean terminal;

    RowRunState(String glyph, boolean terminal) {
        this.glyph = glyph;
        this.terminal = terminal;
    }

    /// Emoji printed in front of row status lines.
    public String getGlyph() {
        return glyph;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
