package com.z254.sentinel.guardian.telemetry;

/**
 * Telemetry could not be read or written.
 */
public class TelemetryException extends RuntimeException {

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
