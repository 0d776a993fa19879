package com.evertz.featured.core.exception;

/**
 * Domain exception thrown when a selection request cannot be satisfied by the given pool.
 */
public class InvalidSelectionException extends RuntimeException {

    public InvalidSelectionException(String message) {
        super(message);
    }
}
