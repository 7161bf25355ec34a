package com.phillippitts.freefleet.exception;

/**
 * Base exception for all free-fleet errors.
 * Domain exceptions extend this class so the REST boundary can handle them in one place.
 */
public class FreeFleetException extends RuntimeException {

    public FreeFleetException(String message) {
        super(message);
    }

    public FreeFleetException(String message, Throwable cause) {
        super(message, cause);
    }

    public FreeFleetException(Throwable cause) {
        super(cause);
    }
}
