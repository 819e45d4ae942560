package com.phillippitts.aibakeoff.exception;

/**
 * Base exception for all bakeoff application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class BakeoffException extends RuntimeException {

    public BakeoffException(String message) {
        super(message);
    }

    public BakeoffException(String message, Throwable cause) {
        super(message, cause);
    }

    public BakeoffException(Throwable cause) {
        super(cause);
    }
}
