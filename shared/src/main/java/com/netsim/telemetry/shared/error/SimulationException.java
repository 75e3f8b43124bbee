package com.netsim.telemetry.shared.error;

/**
 * Root of the simulator's error taxonomy. All failures raised by the
 * generation pipeline are unchecked and extend this class.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
