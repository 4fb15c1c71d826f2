package com.raditha.typebench.consistency;

/**
 * The type checker produced no usable result for a variant: it timed out,
 * crashed, could not be started or its environment is missing.
 */
public class CheckerUnavailableException extends Exception {

    public CheckerUnavailableException(String message) {
        super(message);
    }

    public CheckerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
