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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A {@link RowStatusListener} that records row lifecycle signals through Log4j 2.
 *
 * <p>Successful rows log at the configured level, failures at WARN and row starts at DEBUG:
 * <ul>
 *   <li>"Row started: 3"</li>
 *   <li>"Row processed: 3"</li>
 *   <li>"Row failed: 4 - Stage MASK failed for row 4 SAMPLE/LAB: ..."</li>
 *   <li>"Row cancelled: 5"</li>
 * </ul>
 */
public class LoggingRowStatusListener implements RowStatusListener {

    private final Logger logger;
    private final Level level;

    public LoggingRowStatusListener() {
        this(LogManager.getLogger(LoggingRowStatusListener.class));
    }

    public LoggingRowStatusListener(Logger logger) {
        this(logger, Level.INFO);
    }

    public LoggingRowStatusListener(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    @Override
    public void rowStarted(int row) {
        logger.debug("Row started: {}", row);
    }

    @Override
    public void rowProcessed(int row) {
        logger.log(level, "Row processed: {}", row);
    }

    @Override
    public void rowFailed(int row, String message) {
        logger.warn("Row failed: {} - {}", row, message);
    }

    @Override
    public void rowCancelled(int row) {
        logger.log(level, "Row cancelled: {}", row);
    }

    @Override
    public void batchFinished(BatchReport report) {
        logger.log(level, "Batch finished: {}", report.statistics());
    }
}
