package com.payshield.gleaner.exception;

/**
 * Thrown when a detection run cannot complete, for example because a worker failed on one group.
 */
public class GleanDetectionException extends RuntimeException {

    public GleanDetectionException(String message) {
        super(message);
    }

    public GleanDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
