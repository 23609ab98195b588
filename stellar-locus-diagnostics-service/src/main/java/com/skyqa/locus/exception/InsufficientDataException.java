package com.skyqa.locus.exception;

/**
 * Thrown when a polynomial fit is left with fewer usable points than its degree. Fatal to the fit
 * call that raised it only; other loci in the same run are unaffected.
 */
public class InsufficientDataException extends LocusDiagnosticsException {

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
