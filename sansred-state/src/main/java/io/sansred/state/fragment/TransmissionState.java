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
import io.sansred.state.types.TransmissionFitType;

import java.util.List;

/// Transmission calculation: which monitor measures the transmitted beam and what curve is
/// fitted to the measured ratio.
public record TransmissionState(
    Integer transmissionMonitor,
    TransmissionFitType fitType,
    Integer polynomialOrder,
    Double fitWavelengthLow,
    Double fitWavelengthHigh
) implements StateFragment {

    public static final String TRANSMISSION_MONITOR = "transmission_monitor";
    public static final String FIT_TYPE = "transmission_fit_type";
    public static final String POLYNOMIAL_ORDER = "transmission_polynomial_order";
    public static final String FIT_WAVELENGTH_LOW = "transmission_fit_wavelength_low";
    public static final String FIT_WAVELENGTH_HIGH = "transmission_fit_wavelength_high";

    public static final List<String> KEYS = List.of(TRANSMISSION_MONITOR, FIT_TYPE, POLYNOMIAL_ORDER,
        FIT_WAVELENGTH_LOW, FIT_WAVELENGTH_HIGH);

    @Override
    public Concern concern() {
        return Concern.TRANSMISSION;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.TRANSMISSION);
        v.require(fitType, FIT_TYPE);
        v.positive(transmissionMonitor, TRANSMISSION_MONITOR);
        if (fitType == TransmissionFitType.POLYNOMIAL) {
            v.require(polynomialOrder, POLYNOMIAL_ORDER);
            v.check(polynomialOrder == null || polynomialOrder >= 2, POLYNOMIAL_ORDER,
                "must be at least 2 for a polynomial fit");
        }
        v.bothOrNeither(fitWavelengthLow, FIT_WAVELENGTH_LOW, fitWavelengthHigh, FIT_WAVELENGTH_HIGH);
        v.ordered(fitWavelengthLow, FIT_WAVELENGTH_LOW, fitWavelengthHigh, FIT_WAVELENGTH_HIGH);
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return transmissionMonitor == null;
    }

    public boolean hasFitWindow() {
        return fitWavelengthLow != null && fitWavelengthHigh != null;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(
            TRANSMISSION_MONITOR, transmissionMonitor, FIT_TYPE, fitType, POLYNOMIAL_ORDER, polynomialOrder,
            FIT_WAVELENGTH_LOW, fitWavelengthLow, FIT_WAVELENGTH_HIGH, fitWavelengthHigh);
    }
}
