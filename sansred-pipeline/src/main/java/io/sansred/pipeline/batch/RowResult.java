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

import io.sansred.pipeline.bundle.MergeBundle;

import java.util.List;

/// Everything one row produced, before publication.
public record RowResult(int row, List<ReducedOutput> outputs, List<MergeBundle> merges) {

    public RowResult {
        outputs = List.copyOf(outputs);
        merges = List.copyOf(merges);
    }

    public List<Double> scales() {
        return merges.stream().map(MergeBundle::scale).toList();
    }

    public List<Double> shifts() {
        return merges.stream().map(MergeBundle::shift).toList();
    }
}
