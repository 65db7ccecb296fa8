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
import io.sansred.state.InstrumentMetadata;
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragmentBuilder;
import io.sansred.state.fragment.TransmissionState;
import io.sansred.state.types.TransmissionFitType;

import static io.sansred.state.fragment.TransmissionState.*;

public class TransmissionStateBuilder extends StateFragmentBuilder<TransmissionState> {

    private Integer transmissionMonitor;
    private TransmissionFitType fitType;
    private Integer polynomialOrder;
    private Double fitWavelengthLow;
    private Double fitWavelengthHigh;

    public TransmissionStateBuilder() {
        super(Concern.TRANSMISSION, TransmissionState.KEYS);
    }

    public TransmissionStateBuilder transmissionMonitor(Integer spectrum) {
        this.transmissionMonitor = spectrum;
        return this;
    }

    public TransmissionStateBuilder fitType(TransmissionFitType type) {
        this.fitType = type;
        return this;
    }

    public TransmissionStateBuilder polynomialOrder(Integer order) {
        this.polynomialOrder = order;
        return this;
    }

    public TransmissionStateBuilder fitWavelengthRange(Double low, Double high) {
        this.fitWavelengthLow = low;
        this.fitWavelengthHigh = high;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case TRANSMISSION_MONITOR -> transmissionMonitor(settings.getInteger(key));
            case FIT_TYPE -> fitType(settings.getEnum(key, TransmissionFitType.class));
            case POLYNOMIAL_ORDER -> polynomialOrder(settings.getInteger(key));
            case FIT_WAVELENGTH_LOW -> fitWavelengthLow = settings.getDouble(key);
            case FIT_WAVELENGTH_HIGH -> fitWavelengthHigh = settings.getDouble(key);
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    public TransmissionStateBuilder applyInstrumentDefaults(InstrumentMetadata instrument) {
        if (transmissionMonitor == null) {
            transmissionMonitor = instrument.getInteger(InstrumentMetadata.DEFAULT_TRANSMISSION_MONITOR);
        }
        return this;
    }

    @Override
    protected TransmissionState create() {
        return new TransmissionState(transmissionMonitor, fitType == null ? TransmissionFitType.LOG : fitType,
            polynomialOrder, fitWavelengthLow, fitWavelengthHigh);
    }
}
