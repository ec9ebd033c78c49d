package com.authmap.core.store;

/**
 * A lookup missed. Expected in normal operation, so no stack trace is captured.
 */
public class MappingNotFoundException extends RuntimeException {

    public MappingNotFoundException(String message) {
        super(message, null, false, false);
    }
}
