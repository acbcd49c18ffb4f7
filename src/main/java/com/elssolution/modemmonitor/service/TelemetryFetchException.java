package com.elssolution.modemmonitor.service;

import lombok.Getter;

/** A telemetry source could not deliver this tick. Always recoverable. */
@Getter
public class TelemetryFetchException extends Exception {

    public enum Reason { NETWORK, TIMEOUT, HTTP_STATUS, PARSE }

    private final Reason reason;
    private final String endpoint;

    public TelemetryFetchException(Reason reason, String endpoint, String message) {
        super(message);
        this.reason = reason;
        this.endpoint = endpoint;
    }

    public TelemetryFetchException(Reason reason, String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.endpoint = endpoint;
    }
}
