package com.phillippitts.callqa.exception;

/**
 * Base exception for all call-QA aggregation errors.
 * Domain exceptions extend this class so callers can handle them in one place.
 */
public class CallQaException extends RuntimeException {

    public CallQaException(String message) {
        super(message);
    }

    public CallQaException(String message, Throwable cause) {
        super(message, cause);
    }

    public CallQaException(Throwable cause) {
        super(cause);
    }
}
