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

import io.sansred.state.CompositeState;
import io.sansred.state.types.DataType;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/// Deterministic names for published and saved outputs.
///
/// Reduced curves are named {@code <base>_<lab|hab|merged>_1D_<low>_<high>}, followed by
/// {@code _t<start>_T<end>} for a time slice, {@code _p<period>} for multi-period data, the
/// state's output name suffix, and {@code _can} for can outputs. Transmissions are named
/// {@code <base>_trans_<sample|can>_<low>_<high>}, with {@code _unfitted} for the measured
/// ratio.
public final class OutputNamer {

    private OutputNamer() {
    }

    /// @return the state's output name, else the file stem of the sample scatter run
    public static String baseName(CompositeState state) {
        String explicit = state.save().outputName();
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        String file = Path.of(state.data().sampleScatter()).getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    /// Base names for each row, with {@code _row<index>} appended to every base name that more
    /// than one row would use.
    public static Map<Integer, String> uniqueBaseNames(Map<Integer, CompositeState> states) {
        Map<Integer, String> bases = new LinkedHashMap<>();
        Map<String, Integer> uses = new HashMap<>();
        states.forEach((row, state) -> {
            String base = baseName(state);
            bases.put(row, base);
            uses.merge(base, 1, Integer::sum);
        });
        bases.replaceAll((row, base) -> uses.get(base) > 1 ? base + "_row" + row : base);
        return bases;
    }

    public static String name(String base, CompositeState state, ReducedOutput output) {
        StringBuilder sb = new StringBuilder(base);
        String range = "_" + number(output.range().low()) + "_" + number(output.range().high());
        String period = output.period() > 0 ? "_p" + output.period() : "";
        if (output.kind().isTransmission()) {
            sb.append("_trans_").append(output.dataType() == DataType.CAN ? "can" : "sample")
                .append(range).append(period);
            if (output.kind() == OutputKind.TRANSMISSION_UNFITTED) {
                sb.append("_unfitted");
            }
            return sb.toString();
        }
        sb.append('_').append(output.kind() == OutputKind.SCALED_HAB ? "hab_scaled" : output.mode().token());
        sb.append(state.convertToQ().isOneDimensional() ? "_1D" : "_2D");
        sb.append(range);
        if (output.slice() != null) {
            sb.append(String.format(Locale.ROOT, "_t%.2f_T%.2f", output.slice().start(), output.slice().end()));
        }
        sb.append(period);
        String suffix = state.save().outputNameSuffix();
        if (suffix != null) {
            sb.append(suffix.trim());
        }
        if (output.dataType() == DataType.CAN) {
            sb.append("_can");
        }
        return sb.toString();
    }

    static String number(double value) {
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }
}
