package com.skyqa.locus.exception;

/** Thrown when a fit region or its bounding lines are malformed. */
public class InvalidRegionException extends LocusDiagnosticsException {

    public InvalidRegionException(String message) {
        super(message);
    }

    public InvalidRegionException(String message, Throwable cause) {
        super(message, cause);
    }
}
