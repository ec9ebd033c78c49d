package com.authmap.core.sync;

/** The sync loop gave up; the store must not be treated as synchronized. */
public class SyncFatalException extends RuntimeException {

    public SyncFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
