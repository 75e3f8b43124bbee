package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.topology.OpticalModule;

import java.util.Random;

/**
 * Draws transceiver readings around a module's nominal values.
 *
 * Normal readings stay inside the alarm thresholds. Faults push channels out:
 *   HIGH_TEMPERATURE  temperature above the high alarm, bias current rises
 *   LOW_RX_POWER      rx power below the low alarm
 *   LINK_FLAP         rx power collapses towards loss of signal
 *   HIGH_ERROR_RATE   rx power degrades but stays above the alarm
 * Magnitudes scale with severity.
 *
 * Used by both the gNMI and the DDM synthesizers so the two tables agree on
 * what a faulty optic looks like.
 */
public class OpticalReadingSampler {

    public OpticalReading sample(OpticalModule module, FaultState fault, Random random) {
        double severity = fault.getSeverity();

        double temperature = module.getNominalTemperature() + random.nextGaussian() * 1.0;
        double voltage = module.getNominalVoltage() + random.nextGaussian() * 0.01;
        double bias = module.getNominalBiasCurrent() + random.nextGaussian() * 1.5;
        double tx = module.getNominalTxPower() + random.nextGaussian() * 0.15;
        double rx = module.getNominalRxPower() + random.nextGaussian() * 0.2;

        switch (fault.getKind()) {
            case HIGH_TEMPERATURE -> {
                temperature = OpticalModule.TEMPERATURE_HIGH_ALARM + 2.0 + 18.0 * severity + random.nextDouble();
                bias = Math.min(bias * (1.2 + 0.5 * severity), 120.0);
            }
            case LOW_RX_POWER -> rx = OpticalModule.RX_POWER_LOW_ALARM - 0.5 - 6.0 * severity - random.nextDouble() * 0.5;
            case LINK_FLAP -> rx = -20.0 - 15.0 * severity;
            case HIGH_ERROR_RATE -> rx = rx - 1.5 * severity;
            default -> {
                // electrical faults leave the optic alone
            }
        }

        return new OpticalReading(r2(temperature), r2(voltage), r2(bias), r2(tx), r2(rx));
    }

    private static double r2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
