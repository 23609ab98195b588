package com.skyqa.locus.exception;

/** Base class for failures raised while computing locus and statistics diagnostics. */
public class LocusDiagnosticsException extends RuntimeException {

    public LocusDiagnosticsException(String message) {
        super(message);
    }

    public LocusDiagnosticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
