package io.sansred.state.fragment;

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

import io.sansred.state.Concern;
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragment;
import io.sansred.state.types.DataType;

import java.util.List;

/// Which runs a row reduces. Periods are 1-based; {@link #ALL_PERIODS} selects every period of
/// a multi-period file.
public record DataState(
    String sampleScatter,
    int sampleScatterPeriod,
    String sampleTransmission,
    int sampleTransmissionPeriod,
    String sampleDirect,
    int sampleDirectPeriod,
    String canScatter,
    int canScatterPeriod,
    String canTransmission,
    int canTransmissionPeriod,
    String canDirect,
    int canDirectPeriod,
    String userFile,
    String instrument
) implements StateFragment {

    public static final int ALL_PERIODS = 0;

    public static final String SAMPLE_SCATTER = "sample_scatter";
    public static final String SAMPLE_SCATTER_PERIOD = "sample_scatter_period";
    public static final String SAMPLE_TRANSMISSION = "sample_transmission";
    public static final String SAMPLE_TRANSMISSION_PERIOD = "sample_transmission_period";
    public static final String SAMPLE_DIRECT = "sample_direct";
    public static final String SAMPLE_DIRECT_PERIOD = "sample_direct_period";
    public static final String CAN_SCATTER = "can_scatter";
    public static final String CAN_SCATTER_PERIOD = "can_scatter_period";
    public static final String CAN_TRANSMISSION = "can_transmission";
    public static final String CAN_TRANSMISSION_PERIOD = "can_transmission_period";
    public static final String CAN_DIRECT = "can_direct";
    public static final String CAN_DIRECT_PERIOD = "can_direct_period";
    public static final String USER_FILE = "user_file";
    public static final String INSTRUMENT = "instrument";

    public static final List<String> KEYS = List.of(
        SAMPLE_SCATTER, SAMPLE_SCATTER_PERIOD, SAMPLE_TRANSMISSION, SAMPLE_TRANSMISSION_PERIOD,
        SAMPLE_DIRECT, SAMPLE_DIRECT_PERIOD, CAN_SCATTER, CAN_SCATTER_PERIOD, CAN_TRANSMISSION,
        CAN_TRANSMISSION_PERIOD, CAN_DIRECT, CAN_DIRECT_PERIOD, USER_FILE, INSTRUMENT);

    @Override
    public Concern concern() {
        return Concern.DATA;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.DATA);
        v.require(sampleScatter, SAMPLE_SCATTER);
        v.bothOrNeither(sampleTransmission, SAMPLE_TRANSMISSION, sampleDirect, SAMPLE_DIRECT);
        v.bothOrNeither(canTransmission, CAN_TRANSMISSION, canDirect, CAN_DIRECT);
        v.check(canTransmission == null || canScatter != null, CAN_TRANSMISSION, "requires " + CAN_SCATTER);
        v.nonNegative(sampleScatterPeriod, SAMPLE_SCATTER_PERIOD);
        v.nonNegative(sampleTransmissionPeriod, SAMPLE_TRANSMISSION_PERIOD);
        v.nonNegative(sampleDirectPeriod, SAMPLE_DIRECT_PERIOD);
        v.nonNegative(canScatterPeriod, CAN_SCATTER_PERIOD);
        v.nonNegative(canTransmissionPeriod, CAN_TRANSMISSION_PERIOD);
        v.nonNegative(canDirectPeriod, CAN_DIRECT_PERIOD);
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return sampleScatter == null;
    }

    public boolean hasCan() {
        return canScatter != null;
    }

    public String scatter(DataType type) {
        return type == DataType.SAMPLE ? sampleScatter : canScatter;
    }

    public int scatterPeriod(DataType type) {
        return type == DataType.SAMPLE ? sampleScatterPeriod : canScatterPeriod;
    }

    public String transmission(DataType type) {
        return type == DataType.SAMPLE ? sampleTransmission : canTransmission;
    }

    public int transmissionPeriod(DataType type) {
        return type == DataType.SAMPLE ? sampleTransmissionPeriod : canTransmissionPeriod;
    }

    public String direct(DataType type) {
        return type == DataType.SAMPLE ? sampleDirect : canDirect;
    }

    public int directPeriod(DataType type) {
        return type == DataType.SAMPLE ? sampleDirectPeriod : canDirectPeriod;
    }

    public boolean hasTransmission(DataType type) {
        return transmission(type) != null && direct(type) != null;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(
            SAMPLE_SCATTER, sampleScatter, SAMPLE_SCATTER_PERIOD, sampleScatterPeriod,
            SAMPLE_TRANSMISSION, sampleTransmission, SAMPLE_TRANSMISSION_PERIOD, sampleTransmissionPeriod,
            SAMPLE_DIRECT, sampleDirect, SAMPLE_DIRECT_PERIOD, sampleDirectPeriod,
            CAN_SCATTER, canScatter, CAN_SCATTER_PERIOD, canScatterPeriod,
            CAN_TRANSMISSION, canTransmission, CAN_TRANSMISSION_PERIOD, canTransmissionPeriod,
            CAN_DIRECT, canDirect, CAN_DIRECT_PERIOD, canDirectPeriod,
            USER_FILE, userFile, INSTRUMENT, instrument);
    }
}
