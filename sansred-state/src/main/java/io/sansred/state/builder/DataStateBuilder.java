package io.sansred.state.builder;

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
import io.sansred.state.StateFragmentBuilder;
import io.sansred.state.fragment.DataState;

import static io.sansred.state.fragment.DataState.*;

public class DataStateBuilder extends StateFragmentBuilder<DataState> {

    private String sampleScatter;
    private Integer sampleScatterPeriod;
    private String sampleTransmission;
    private Integer sampleTransmissionPeriod;
    private String sampleDirect;
    private Integer sampleDirectPeriod;
    private String canScatter;
    private Integer canScatterPeriod;
    private String canTransmission;
    private Integer canTransmissionPeriod;
    private String canDirect;
    private Integer canDirectPeriod;
    private String userFile;
    private String instrument;

    public DataStateBuilder() {
        super(Concern.DATA, DataState.KEYS);
    }

    public DataStateBuilder sampleScatter(String file) {
        this.sampleScatter = file;
        return this;
    }

    public DataStateBuilder sampleScatterPeriod(Integer period) {
        this.sampleScatterPeriod = period;
        return this;
    }

    public DataStateBuilder sampleTransmission(String file) {
        this.sampleTransmission = file;
        return this;
    }

    public DataStateBuilder sampleTransmissionPeriod(Integer period) {
        this.sampleTransmissionPeriod = period;
        return this;
    }

    public DataStateBuilder sampleDirect(String file) {
        this.sampleDirect = file;
        return this;
    }

    public DataStateBuilder sampleDirectPeriod(Integer period) {
        this.sampleDirectPeriod = period;
        return this;
    }

    public DataStateBuilder canScatter(String file) {
        this.canScatter = file;
        return this;
    }

    public DataStateBuilder canScatterPeriod(Integer period) {
        this.canScatterPeriod = period;
        return this;
    }

    public DataStateBuilder canTransmission(String file) {
        this.canTransmission = file;
        return this;
    }

    public DataStateBuilder canTransmissionPeriod(Integer period) {
        this.canTransmissionPeriod = period;
        return this;
    }

    public DataStateBuilder canDirect(String file) {
        this.canDirect = file;
        return this;
    }

    public DataStateBuilder canDirectPeriod(Integer period) {
        this.canDirectPeriod = period;
        return this;
    }

    public DataStateBuilder userFile(String userFile) {
        this.userFile = userFile;
        return this;
    }

    public DataStateBuilder instrument(String instrument) {
        this.instrument = instrument;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case SAMPLE_SCATTER -> sampleScatter(settings.getString(key));
            case SAMPLE_SCATTER_PERIOD -> sampleScatterPeriod(settings.getInteger(key));
            case SAMPLE_TRANSMISSION -> sampleTransmission(settings.getString(key));
            case SAMPLE_TRANSMISSION_PERIOD -> sampleTransmissionPeriod(settings.getInteger(key));
            case SAMPLE_DIRECT -> sampleDirect(settings.getString(key));
            case SAMPLE_DIRECT_PERIOD -> sampleDirectPeriod(settings.getInteger(key));
            case CAN_SCATTER -> canScatter(settings.getString(key));
            case CAN_SCATTER_PERIOD -> canScatterPeriod(settings.getInteger(key));
            case CAN_TRANSMISSION -> canTransmission(settings.getString(key));
            case CAN_TRANSMISSION_PERIOD -> canTransmissionPeriod(settings.getInteger(key));
            case CAN_DIRECT -> canDirect(settings.getString(key));
            case CAN_DIRECT_PERIOD -> canDirectPeriod(settings.getInteger(key));
            case USER_FILE -> userFile(settings.getString(key));
            case INSTRUMENT -> instrument(settings.getString(key));
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected DataState create() {
        return new DataState(
            sampleScatter, period(sampleScatterPeriod),
            sampleTransmission, period(sampleTransmissionPeriod),
            sampleDirect, period(sampleDirectPeriod),
            canScatter, period(canScatterPeriod),
            canTransmission, period(canTransmissionPeriod),
            canDirect, period(canDirectPeriod),
            userFile, instrument);
    }

    private static int period(Integer period) {
        return period == null ? DataState.ALL_PERIODS : period;
    }
}
