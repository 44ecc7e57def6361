package com.codeprint.code;

/** A single name or attribute lookup failed while walking a callable. */
public class ResolutionFailureException extends RuntimeException {
    public ResolutionFailureException(String message) {
        super(message);
    }

    public ResolutionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
